package org.leafline.service.storage;

/**
 * Opaque key/value storage for uploaded books, extracted covers and re-hosted chapter assets.
 * Keys are slash-separated and never start with {@code /}.
 */
public interface BlobStore {

    byte[] get(String key);

    void put(String key, byte[] data, String contentType);

    boolean exists(String key);

    String publicUrl(String key);
}
