package org.leafline.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.leafline.exception.ApiError;
import org.leafline.service.storage.BlobStore;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.HandlerMapping;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/blobs")
@Tag(name = "Blobs", description = "Serves stored covers and re-hosted chapter assets")
public class BlobController {

    private static final String PREFIX = "/api/v1/blobs/";

    private final BlobStore blobStore;

    @Operation(summary = "Get a stored object")
    @ApiResponse(responseCode = "200", description = "Object returned")
    @ApiResponse(responseCode = "404", description = "Object not found")
    @GetMapping("/**")
    public ResponseEntity<byte[]> getBlob(HttpServletRequest request) {
        String path = (String) request.getAttribute(HandlerMapping.PATH_WITHIN_HANDLER_MAPPING_ATTRIBUTE);
        if (path == null || !path.startsWith(PREFIX) || path.length() == PREFIX.length()) {
            throw ApiError.FILE_NOT_FOUND.createException(path);
        }
        String key = URLDecoder.decode(path.substring(PREFIX.length()), StandardCharsets.UTF_8);
        if (!blobStore.exists(key)) {
            throw ApiError.FILE_NOT_FOUND.createException(key);
        }

        MediaType contentType = MediaTypeFactory.getMediaType(key).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok()
                .contentType(contentType)
                .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS).cachePublic())
                .body(blobStore.get(key));
    }
}
