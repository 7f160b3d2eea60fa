package org.leafline.util.epub;

/**
 * Cover image bytes with the content type and file extension derived from its name.
 */
public record EpubCover(byte[] bytes, String contentType, String ext) {
}
