package org.leafline.service.reader;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.leafline.service.storage.BlobStore;
import org.leafline.util.epub.EpubAssetSink;
import org.leafline.util.epub.EpubContainer;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Re-hosts archive entries referenced by chapter markup in the blob store, so the reader
 * can load them without access to the original container.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EpubResourcePublisher {

    private final BlobStore blobStore;

    /**
     * A sink for one parse run. Each archive key is uploaded at most once; later references
     * reuse the first URL.
     */
    public EpubAssetSink sinkFor(Long bookId, EpubContainer container) {
        Map<String, String> published = new HashMap<>();
        return archiveKey -> published.computeIfAbsent(archiveKey, key -> publish(bookId, container, key));
    }

    static String assetKey(Long bookId, String archiveKey) {
        return "books/" + bookId + "/assets/" + archiveKey;
    }

    private String publish(Long bookId, EpubContainer container, String archiveKey) {
        byte[] data = container.get(archiveKey);
        if (data == null) {
            return null;
        }
        String blobKey = assetKey(bookId, archiveKey);
        try {
            blobStore.put(blobKey, data, contentTypeOf(archiveKey));
            return blobStore.publicUrl(blobKey);
        } catch (RuntimeException e) {
            log.warn("Failed to publish asset '{}' of book {}: {}", archiveKey, bookId, e.getMessage());
            return null;
        }
    }

    static String contentTypeOf(String archiveKey) {
        return MediaTypeFactory.getMediaType(archiveKey)
                .map(MediaType::toString)
                .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE);
    }
}
