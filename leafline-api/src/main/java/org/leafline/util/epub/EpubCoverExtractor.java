package org.leafline.util.epub;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Optional;

@Slf4j
public final class EpubCoverExtractor {

    private EpubCoverExtractor() {
    }

    /**
     * Runs the full container, package and cover chain over a raw EPUB. Never throws; any
     * failure is logged and reported as no cover.
     */
    public static Optional<EpubCover> extract(byte[] epub) {
        try {
            EpubContainer container = EpubContainerReader.read(epub);
            return EpubPackageResolver.resolve(container).flatMap(pkg -> extract(container, pkg));
        } catch (RuntimeException e) {
            log.warn("Cover extraction failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public static Optional<EpubCover> extract(EpubContainer container, EpubPackage pkg) {
        String coverHref = pkg.getCoverHref();
        if (coverHref == null || coverHref.isBlank()) {
            return Optional.empty();
        }

        String decodedHref = EpubPaths.percentDecode(coverHref);
        String coverPath = decodedHref.startsWith("/")
                ? decodedHref.substring(1)
                : pkg.getOpfDir() + decodedHref;

        byte[] data = container.get(coverPath);
        if (data == null) {
            data = container.get(decodedHref);
        }
        if (data == null || data.length == 0) {
            log.debug("Cover '{}' not found in archive", coverHref);
            return Optional.empty();
        }

        return Optional.of(forName(decodedHref, data));
    }

    static EpubCover forName(String name, byte[] data) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".png")) {
            return new EpubCover(data, "image/png", "png");
        }
        if (lower.endsWith(".gif")) {
            return new EpubCover(data, "image/gif", "gif");
        }
        if (lower.endsWith(".webp")) {
            return new EpubCover(data, "image/webp", "webp");
        }
        if (lower.endsWith(".svg")) {
            return new EpubCover(data, "image/svg+xml", "svg");
        }
        return new EpubCover(data, "image/jpeg", "jpg");
    }
}
