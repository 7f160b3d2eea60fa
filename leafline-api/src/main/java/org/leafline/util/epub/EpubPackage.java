package org.leafline.util.epub;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What the OPF package document says about a book: reading order, metadata and where the
 * cover lives.
 */
@Value
@Builder
public class EpubPackage {

    String opfPath;
    /** Directory of the OPF, ending in {@code /}, or empty for a root-level OPF. */
    String opfDir;
    /** Archive-absolute hrefs of the spine items, in declared order. */
    @Singular("spineItem")
    List<String> spine;
    String title;
    String author;
    /**
     * Cover reference as found: relative to {@link #opfDir} unless it starts with
     * {@code /}, in which case it is archive-absolute.
     */
    String coverHref;
    Map<String, EpubManifestItem> manifest;
}
