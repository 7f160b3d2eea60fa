package org.leafline.util.epub;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EpubPackageResolverTest {

    private static EpubContainer containerOf(String... pathsAndContents) {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            entries.put(pathsAndContents[i], pathsAndContents[i + 1].getBytes(StandardCharsets.UTF_8));
        }
        return EpubContainer.of(entries);
    }

    @Test
    void resolve_readsSpineTitleAuthorAndCoverFromFixtureBook() {
        EpubContainer container = EpubContainerReader.read(EpubFixtures.book("A Tale", "Some Author", 3));

        EpubPackage pkg = EpubPackageResolver.resolve(container).orElseThrow();

        assertThat(pkg.getOpfPath()).isEqualTo("OEBPS/content.opf");
        assertThat(pkg.getOpfDir()).isEqualTo("OEBPS/");
        assertThat(pkg.getTitle()).isEqualTo("A Tale");
        assertThat(pkg.getAuthor()).isEqualTo("Some Author");
        assertThat(pkg.getCoverHref()).isEqualTo("cover.jpg");
        assertThat(pkg.getSpine()).containsExactly(
                "OEBPS/text/chapter1.xhtml", "OEBPS/text/chapter2.xhtml", "OEBPS/text/chapter3.xhtml");
    }

    @Test
    void resolve_toleratesAttributeOrderQuotingAndPrefixes() {
        EpubContainer container = containerOf(
                "META-INF/container.xml",
                "<container><rootfiles><rootfile media-type='application/oebps-package+xml' full-path='content.opf'/></rootfiles></container>",
                "content.opf",
                "<opf:package><opf:metadata><dc:title> Spaced &amp; Escaped </dc:title></opf:metadata>"
                        + "<opf:manifest><opf:item href='b.xhtml' id='b' media-type='application/xhtml+xml'/>"
                        + "<opf:item media-type=\"application/xhtml+xml\" id=\"a\" href=\"a.xhtml\"/></opf:manifest>"
                        + "<opf:spine><opf:itemref idref='b'/><opf:itemref idref=\"a\"/></opf:spine></opf:package>");

        EpubPackage pkg = EpubPackageResolver.resolve(container).orElseThrow();

        assertThat(pkg.getOpfDir()).isEmpty();
        assertThat(pkg.getTitle()).isEqualTo("Spaced & Escaped");
        assertThat(pkg.getAuthor()).isNull();
        assertThat(pkg.getSpine()).containsExactly("b.xhtml", "a.xhtml");
    }

    @Test
    void resolve_skipsItemrefsMissingFromManifest() {
        EpubContainer container = containerOf(
                "META-INF/container.xml", "<rootfile full-path=\"book/package.opf\"/>",
                "book/package.opf",
                "<package><manifest><item id=\"one\" href=\"one.html\"/></manifest>"
                        + "<spine><itemref idref=\"ghost\"/><itemref idref=\"one\"/></spine></package>");

        EpubPackage pkg = EpubPackageResolver.resolve(container).orElseThrow();

        assertThat(pkg.getSpine()).containsExactly("book/one.html");
    }

    @Test
    void resolve_usesMetaCoverWhenNoCoverImageProperty() {
        EpubContainer container = containerOf(
                "META-INF/container.xml", "<rootfile full-path=\"OPS/book.opf\"/>",
                "OPS/book.opf",
                "<package><metadata><meta content=\"img-cover\" name=\"cover\"/></metadata>"
                        + "<manifest><item id=\"img-cover\" href=\"images/front.png\" media-type=\"image/png\"/></manifest>"
                        + "<spine/></package>",
                "OPS/images/front.png", "png");

        EpubPackage pkg = EpubPackageResolver.resolve(container).orElseThrow();

        assertThat(pkg.getCoverHref()).isEqualTo("images/front.png");
    }

    @Test
    void resolve_coverImagePropertyWinsOverMetaCover() {
        EpubContainer container = containerOf(
                "META-INF/container.xml", "<rootfile full-path=\"book.opf\"/>",
                "book.opf",
                "<package><metadata><meta name=\"cover\" content=\"old\"/></metadata><manifest>"
                        + "<item id=\"old\" href=\"old.jpg\"/>"
                        + "<item properties=\"nav cover-image\" id=\"new\" href=\"new.jpg\"/>"
                        + "</manifest></package>");

        EpubPackage pkg = EpubPackageResolver.resolve(container).orElseThrow();

        assertThat(pkg.getCoverHref()).isEqualTo("new.jpg");
    }

    @Test
    void resolve_fallsBackToConventionalCoverName() {
        EpubContainer container = containerOf(
                "META-INF/container.xml", "<rootfile full-path=\"OEBPS/content.opf\"/>",
                "OEBPS/content.opf", "<package><manifest/></package>",
                "OEBPS/Images/Cover.png", "png");

        EpubPackage pkg = EpubPackageResolver.resolve(container).orElseThrow();

        assertThat(pkg.getCoverHref()).isEqualTo("/OEBPS/Images/Cover.png");
    }

    @Test
    void resolve_returnsEmptyWithoutContainerOrPackage() {
        assertThat(EpubPackageResolver.resolve(EpubContainer.empty())).isEqualTo(Optional.empty());
        assertThat(EpubPackageResolver.resolve(containerOf("mimetype", "application/epub+zip"))).isEmpty();
        assertThat(EpubPackageResolver.resolve(containerOf(
                "META-INF/container.xml", "<rootfile full-path=\"missing.opf\"/>"))).isEmpty();
    }
}
