package org.leafline.util.epub;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits an EPUB into one chapter per spine item. Each chapter keeps only its body markup,
 * with image references rewritten through an {@link EpubAssetSink}; stylesheets from every
 * chapter are collected once, in first-seen order.
 */
@Slf4j
public final class EpubChapterSegmenter {

    private static final String[] IMAGE_REFERENCE_ATTRIBUTES = {"src", "href", "xlink:href"};

    private EpubChapterSegmenter() {
    }

    public static SegmentationResult segment(EpubContainer container, EpubPackage pkg, EpubAssetSink assetSink) {
        EpubResourceResolver resolver = new EpubResourceResolver(container);
        Set<String> styles = new LinkedHashSet<>();
        List<SegmentedChapter> chapters = new ArrayList<>();

        for (String href : pkg.getSpine()) {
            byte[] data = container.get(href);
            if (data == null) {
                log.warn("Spine item '{}' is missing from the archive, skipping", href);
                continue;
            }
            try {
                SegmentedChapter chapter = segmentChapter(href, new String(data, StandardCharsets.UTF_8), resolver, assetSink, styles);
                if (chapter.html().isBlank()) {
                    log.debug("Spine item '{}' has no body content, skipping", href);
                    continue;
                }
                chapters.add(chapter);
            } catch (RuntimeException e) {
                log.warn("Failed to segment spine item '{}': {}", href, e.getMessage());
            }
        }

        return new SegmentationResult(List.copyOf(chapters), String.join("\n", styles));
    }

    static SegmentedChapter segmentChapter(String href, String markup, EpubResourceResolver resolver,
                                           EpubAssetSink assetSink, Set<String> styles) {
        Document doc = Jsoup.parse(markup);

        for (Element style : doc.select("style")) {
            addStyle(styles, style.data());
        }
        for (Element link : doc.select("link[rel~=(?i)stylesheet][href]")) {
            resolver.resolve(link.attr("href"), href)
                    .flatMap(key -> resolver.getContainer().readText(key))
                    .ifPresentOrElse(
                            css -> addStyle(styles, css),
                            () -> log.debug("Stylesheet '{}' referenced by '{}' not found", link.attr("href"), href));
        }

        Element root = doc.body() != null ? doc.body() : doc;
        for (Element image : root.select("img, image")) {
            rewriteImage(image, href, resolver, assetSink);
        }

        return new SegmentedChapter(href, root.html(), root.wholeText().length());
    }

    private static void rewriteImage(Element image, String chapterHref, EpubResourceResolver resolver, EpubAssetSink assetSink) {
        for (String attribute : IMAGE_REFERENCE_ATTRIBUTES) {
            if (!image.hasAttr(attribute)) {
                continue;
            }
            String reference = image.attr(attribute);
            if (EpubPaths.isExternal(reference)) {
                continue;
            }
            String url = resolver.resolve(reference, chapterHref).map(assetSink::publish).orElse(null);
            if (url != null) {
                image.attr(attribute, url);
            } else {
                log.debug("Dropping unresolved image reference '{}' in '{}'", reference, chapterHref);
                image.removeAttr(attribute);
                if ("img".equals(image.normalName())) {
                    image.attr("alt", "");
                }
            }
        }
    }

    private static void addStyle(Set<String> styles, String css) {
        if (css != null && !css.isBlank()) {
            styles.add(css.trim());
        }
    }
}
