package org.leafline.service.storage;

import lombok.extern.slf4j.Slf4j;
import org.leafline.config.AppProperties;
import org.leafline.exception.ApiError;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.stream.Collectors;

@Slf4j
@Service
public class LocalBlobStore implements BlobStore {

    private final Path root;
    private final String publicBaseUrl;

    public LocalBlobStore(AppProperties appProperties) {
        this.root = Paths.get(appProperties.getStorage().getRoot()).toAbsolutePath().normalize();
        String base = appProperties.getStorage().getPublicBaseUrl();
        this.publicBaseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public byte[] get(String key) {
        Path path = resolve(key);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw ApiError.FILE_NOT_FOUND.createException(key);
        } catch (IOException e) {
            log.error("Failed to read blob '{}'", key, e);
            throw ApiError.FILE_READ_ERROR.createException(e.getMessage());
        }
    }

    @Override
    public void put(String key, byte[] data, String contentType) {
        Path path = resolve(key);
        try {
            Files.createDirectories(path.getParent());
            Path temp = Files.createTempFile(path.getParent(), ".blob-", ".tmp");
            Files.write(temp, data);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored blob '{}' ({} bytes, {})", key, data.length, contentType);
        } catch (IOException e) {
            log.error("Failed to write blob '{}'", key, e);
            throw ApiError.FILE_READ_ERROR.createException(e.getMessage());
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    @Override
    public String publicUrl(String key) {
        String encoded = Arrays.stream(key.split("/"))
                .map(segment -> URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"))
                .collect(Collectors.joining("/"));
        return publicBaseUrl + "/" + encoded;
    }

    public Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw ApiError.GENERIC_BAD_REQUEST.createException("Blob key must not be empty");
        }
        Path path = root.resolve(key.startsWith("/") ? key.substring(1) : key).normalize();
        if (!path.startsWith(root)) {
            throw ApiError.PERMISSION_DENIED.createException("blob key escapes storage root");
        }
        return path;
    }
}
