package org.leafline.util.epub;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decompressed entries of an EPUB archive, keyed by their archive-internal path.
 * Iteration order follows the central directory.
 */
public final class EpubContainer {

    private static final EpubContainer EMPTY = new EpubContainer(Collections.emptyMap());

    private final Map<String, byte[]> entries;

    EpubContainer(Map<String, byte[]> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static EpubContainer empty() {
        return EMPTY;
    }

    public static EpubContainer of(Map<String, byte[]> entries) {
        return entries.isEmpty() ? EMPTY : new EpubContainer(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(String path) {
        return path != null && entries.containsKey(path);
    }

    public byte[] get(String path) {
        return path == null ? null : entries.get(path);
    }

    public Optional<String> readText(String path) {
        byte[] data = get(path);
        return data == null ? Optional.empty() : Optional.of(new String(data, StandardCharsets.UTF_8));
    }

    public Set<String> paths() {
        return entries.keySet();
    }
}
