package org.leafline.util.epub;

/**
 * Receives an archive key that a chapter references and returns the URL the rewritten
 * markup should point at, or {@code null} when the asset cannot be published.
 */
@FunctionalInterface
public interface EpubAssetSink {

    String publish(String archiveKey);
}
