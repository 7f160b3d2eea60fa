package org.leafline.util.epub;

/**
 * One spine item after segmentation. {@code html} is the body markup with asset
 * references already rewritten; {@code charLength} is the length of its rendered text.
 */
public record SegmentedChapter(String href, String html, int charLength) {
}
