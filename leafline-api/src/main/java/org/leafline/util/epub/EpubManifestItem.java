package org.leafline.util.epub;

import java.util.List;

/**
 * One OPF manifest entry. {@code href} is archive-absolute; {@code rawHref} is the value
 * as written in the OPF.
 */
public record EpubManifestItem(String id, String href, String rawHref, String mediaType, List<String> properties) {

    public boolean hasProperty(String property) {
        return properties != null && properties.contains(property);
    }
}
