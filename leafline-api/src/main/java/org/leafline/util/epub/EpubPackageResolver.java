package org.leafline.util.epub;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Locates the OPF through {@code META-INF/container.xml} and reads spine order, title,
 * author and the cover reference from it.
 */
@Slf4j
public final class EpubPackageResolver {

    public static final String CONTAINER_PATH = "META-INF/container.xml";

    static final List<String> CONVENTIONAL_COVER_NAMES = List.of(
            "cover.jpg", "cover.jpeg", "cover.png", "cover.gif", "Cover.jpg", "Cover.jpeg", "Cover.png");

    private static final List<String> CONVENTIONAL_COVER_DIRS = List.of("images/", "Images/");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String BOM = "\uFEFF";

    private EpubPackageResolver() {
    }

    public static Optional<EpubPackage> resolve(EpubContainer container) {
        if (container == null || container.isEmpty()) {
            return Optional.empty();
        }

        Optional<String> opfPath = container.readText(CONTAINER_PATH)
                .flatMap(xml -> OpfTagScanner.findFirstTag(stripBom(xml), "rootfile"))
                .map(tag -> tag.attr("full-path"))
                .filter(path -> !path.isBlank())
                .map(String::trim);
        if (opfPath.isEmpty()) {
            log.debug("No rootfile declared in {}", CONTAINER_PATH);
            return Optional.empty();
        }

        String path = opfPath.get();
        if (!container.contains(path)) {
            String decoded = EpubPaths.percentDecode(path);
            if (!container.contains(decoded)) {
                log.debug("OPF '{}' declared in {} is missing from the archive", path, CONTAINER_PATH);
                return Optional.empty();
            }
            path = decoded;
        }

        String opf = stripBom(container.readText(path).orElse(""));
        String opfDir = EpubPaths.directoryOf(path);
        Map<String, EpubManifestItem> manifest = parseManifest(opf, opfDir);

        EpubPackage.EpubPackageBuilder builder = EpubPackage.builder()
                .opfPath(path)
                .opfDir(opfDir)
                .manifest(Collections.unmodifiableMap(manifest))
                .title(OpfTagScanner.firstElementText(opf, "dc:title").orElse(null))
                .author(OpfTagScanner.firstElementText(opf, "dc:creator").orElse(null))
                .coverHref(findCoverHref(opf, manifest, container, opfDir));

        for (OpfTagScanner.Tag itemref : OpfTagScanner.findTags(opf, "itemref")) {
            EpubManifestItem item = manifest.get(itemref.attr("idref"));
            if (item == null) {
                log.debug("Spine itemref '{}' has no manifest entry", itemref.attr("idref"));
                continue;
            }
            builder.spineItem(item.href());
        }

        return Optional.of(builder.build());
    }

    private static Map<String, EpubManifestItem> parseManifest(String opf, String opfDir) {
        Map<String, EpubManifestItem> manifest = new LinkedHashMap<>();
        for (OpfTagScanner.Tag item : OpfTagScanner.findTags(opf, "item")) {
            String id = item.attr("id");
            String href = item.attr("href");
            if (id == null || href == null || href.isBlank()) {
                continue;
            }
            String properties = item.attr("properties");
            List<String> propList = properties == null || properties.isBlank()
                    ? Collections.emptyList()
                    : Arrays.asList(WHITESPACE.split(properties.trim()));
            manifest.putIfAbsent(id, new EpubManifestItem(
                    id,
                    EpubPaths.resolve(opfDir, EpubPaths.stripFragment(href)),
                    href,
                    item.attr("media-type"),
                    propList));
        }
        return manifest;
    }

    static String findCoverHref(String opf, Map<String, EpubManifestItem> manifest, EpubContainer container, String opfDir) {
        for (EpubManifestItem item : manifest.values()) {
            if (item.hasProperty("cover-image")) {
                return item.rawHref();
            }
        }

        for (OpfTagScanner.Tag meta : OpfTagScanner.findTags(opf, "meta")) {
            if (!"cover".equals(meta.attr("name")) || !meta.hasAttr("content")) {
                continue;
            }
            EpubManifestItem item = manifest.get(meta.attr("content"));
            if (item != null) {
                return item.rawHref();
            }
        }

        for (String name : CONVENTIONAL_COVER_NAMES) {
            for (String candidate : conventionalLocations(name, opfDir)) {
                if (container.contains(candidate)) {
                    return "/" + candidate;
                }
            }
        }
        return null;
    }

    private static List<String> conventionalLocations(String name, String opfDir) {
        List<String> candidates = new ArrayList<>();
        candidates.add(name);
        if (!opfDir.isEmpty()) {
            candidates.add(opfDir + name);
        }
        for (String dir : CONVENTIONAL_COVER_DIRS) {
            candidates.add(dir + name);
            if (!opfDir.isEmpty()) {
                candidates.add(opfDir + dir + name);
            }
        }
        return candidates;
    }

    private static String stripBom(String text) {
        return text.startsWith(BOM) ? text.substring(1) : text;
    }
}
