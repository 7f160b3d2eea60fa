package org.leafline.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.leafline.model.dto.Book;
import org.leafline.model.dto.request.ConfirmUploadRequest;
import org.leafline.model.dto.response.CoverExtractionResponse;
import org.leafline.service.upload.BookUploadService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/library")
@Tag(name = "Library Upload", description = "Endpoints for adding books to the library")
public class LibraryUploadController {

    private final BookUploadService bookUploadService;

    @Operation(summary = "Upload a book", description = "Store a book file and register it in the caller's library.")
    @ApiResponse(responseCode = "201", description = "Book uploaded")
    @ApiResponse(responseCode = "400", description = "Missing file or unsupported format")
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Book> uploadBook(
            @Parameter(description = "Book file") @RequestParam("file") MultipartFile file) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookUploadService.uploadFile(file));
    }

    @Operation(summary = "Confirm an upload", description = "Register an object already present in storage as a book. EPUB metadata and cover are extracted when available.")
    @ApiResponse(responseCode = "201", description = "Book registered")
    @ApiResponse(responseCode = "404", description = "Object not found in storage")
    @PostMapping("/upload/confirm")
    public ResponseEntity<Book> confirmUpload(
            @Parameter(description = "Upload confirmation") @Valid @RequestBody ConfirmUploadRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookUploadService.confirmUpload(request));
    }

    @Operation(summary = "Extract missing covers", description = "Retry cover extraction for the caller's EPUBs that have no cover.")
    @ApiResponse(responseCode = "200", description = "Extraction finished")
    @PostMapping("/extract-covers")
    public CoverExtractionResponse extractCovers() {
        return bookUploadService.extractMissingCovers();
    }
}
