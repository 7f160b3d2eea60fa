package org.leafline.util.epub;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a reference found inside a chapter document (an {@code img src}, a stylesheet
 * {@code href}) to an archive key. Lookups are tried from most to least specific and a
 * miss is reported as empty, never as an unrelated entry.
 */
public class EpubResourceResolver {

    private final EpubContainer container;
    private final Map<String, String> uniqueByFileName = new HashMap<>();

    public EpubResourceResolver(EpubContainer container) {
        this.container = container;
        Map<String, Integer> counts = new HashMap<>();
        for (String path : container.paths()) {
            String name = EpubPaths.fileName(path);
            counts.merge(name, 1, Integer::sum);
            uniqueByFileName.put(name, path);
        }
        counts.forEach((name, count) -> {
            if (count > 1) {
                uniqueByFileName.remove(name);
            }
        });
    }

    public Optional<String> resolve(String path, String referencingHref) {
        if (path == null || path.isBlank() || EpubPaths.isExternal(path)) {
            return Optional.empty();
        }
        String raw = EpubPaths.stripFragment(path.trim());
        if (raw.isEmpty()) {
            return Optional.empty();
        }

        String resolved = EpubPaths.resolve(EpubPaths.directoryOf(referencingHref), raw);
        if (container.contains(resolved)) {
            return Optional.of(resolved);
        }
        if (container.contains(raw)) {
            return Optional.of(raw);
        }
        if (raw.startsWith("./") && container.contains(raw.substring(2))) {
            return Optional.of(raw.substring(2));
        }
        String decoded = EpubPaths.percentDecode(resolved);
        if (container.contains(decoded)) {
            return Optional.of(decoded);
        }
        return Optional.ofNullable(uniqueByFileName.get(EpubPaths.fileName(EpubPaths.percentDecode(raw))));
    }

    public EpubContainer getContainer() {
        return container;
    }
}
