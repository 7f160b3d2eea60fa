package org.leafline.service.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.leafline.config.AppProperties;
import org.leafline.exception.APIException;
import org.springframework.http.HttpStatus;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalBlobStoreTest {

    @TempDir
    Path root;

    private LocalBlobStore store;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getStorage().setRoot(root.toString());
        properties.getStorage().setPublicBaseUrl("/api/v1/blobs/");
        store = new LocalBlobStore(properties);
    }

    @Test
    void put_thenGetReturnsSameBytes() {
        store.put("books/1/assets/OEBPS/a.png", new byte[]{1, 2, 3}, "image/png");

        assertThat(store.exists("books/1/assets/OEBPS/a.png")).isTrue();
        assertThat(store.get("books/1/assets/OEBPS/a.png")).containsExactly(1, 2, 3);
        assertThat(root.resolve("books/1/assets/OEBPS/a.png")).exists();
    }

    @Test
    void put_overwritesAndLeavesNoTempFiles() throws Exception {
        store.put("k/file.bin", new byte[]{1}, "application/octet-stream");
        store.put("k/file.bin", new byte[]{2, 2}, "application/octet-stream");

        assertThat(store.get("k/file.bin")).containsExactly(2, 2);
        try (var files = Files.list(root.resolve("k"))) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    void get_missingKeyIsNotFound() {
        assertThatThrownBy(() -> store.get("nope/missing.epub"))
                .isInstanceOf(APIException.class)
                .satisfies(e -> assertThat(((APIException) e).getStatus()).isEqualTo(HttpStatus.NOT_FOUND));
        assertThat(store.exists("nope/missing.epub")).isFalse();
    }

    @Test
    void resolve_rejectsKeysEscapingRoot() {
        assertThatThrownBy(() -> store.get("../outside.txt"))
                .isInstanceOf(APIException.class)
                .satisfies(e -> assertThat(((APIException) e).getStatus()).isEqualTo(HttpStatus.FORBIDDEN));
    }

    @Test
    void resolve_leadingSlashStaysInsideRoot() {
        assertThat(store.resolve("/a/b.txt")).isEqualTo(root.toAbsolutePath().normalize().resolve("a/b.txt"));
    }

    @Test
    void publicUrl_encodesEachSegment() {
        assertThat(store.publicUrl("books/1/assets/OEBPS/my image+1.png"))
                .isEqualTo("/api/v1/blobs/books/1/assets/OEBPS/my%20image%2B1.png");
    }
}
