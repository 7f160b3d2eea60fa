package org.leafline.util.epub;

import java.util.List;

public record SegmentationResult(List<SegmentedChapter> chapters, String styles) {

    public int totalCharacters() {
        return chapters.stream().mapToInt(SegmentedChapter::charLength).sum();
    }

    public boolean isEmpty() {
        return chapters.isEmpty();
    }
}
