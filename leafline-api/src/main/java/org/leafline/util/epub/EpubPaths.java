package org.leafline.util.epub;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Path arithmetic for archive-internal hrefs. Archive paths never start with {@code /}.
 */
public final class EpubPaths {

    private EpubPaths() {
    }

    /** Everything up to and including the last {@code /}, or an empty string. */
    public static String directoryOf(String href) {
        if (href == null) {
            return "";
        }
        int slash = href.lastIndexOf('/');
        return slash < 0 ? "" : href.substring(0, slash + 1);
    }

    public static String fileName(String path) {
        if (path == null) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    /**
     * Resolves {@code relative} against {@code baseDir}. A leading {@code /} makes the
     * reference archive-absolute; {@code .} and {@code ..} segments are collapsed, and a
     * {@code ..} above the archive root is dropped.
     */
    public static String resolve(String baseDir, String relative) {
        if (relative == null) {
            return null;
        }
        String combined = relative.startsWith("/") ? relative.substring(1) : (baseDir == null ? "" : baseDir) + relative;
        return normalize(combined);
    }

    public static String normalize(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }

    public static String stripFragment(String href) {
        if (href == null) {
            return null;
        }
        int cut = href.length();
        int hash = href.indexOf('#');
        if (hash >= 0) {
            cut = hash;
        }
        int query = href.indexOf('?');
        if (query >= 0 && query < cut) {
            cut = query;
        }
        return href.substring(0, cut);
    }

    /**
     * Decodes {@code %XX} escapes as UTF-8. Unlike form decoding, {@code +} is kept. A
     * malformed escape leaves the input unchanged.
     */
    public static String percentDecode(String value) {
        if (value == null || value.indexOf('%') < 0) {
            return value;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(value.length());
        StringBuilder out = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '%') {
                if (i + 2 >= value.length()) {
                    return value;
                }
                int hi = Character.digit(value.charAt(i + 1), 16);
                int lo = Character.digit(value.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) {
                    return value;
                }
                bytes.write((hi << 4) | lo);
                i += 3;
            } else {
                flush(bytes, out);
                out.append(c);
                i++;
            }
        }
        flush(bytes, out);
        return out.toString();
    }

    private static void flush(ByteArrayOutputStream bytes, StringBuilder out) {
        if (bytes.size() > 0) {
            out.append(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
            bytes.reset();
        }
    }

    public static boolean isExternal(String href) {
        if (href == null) {
            return false;
        }
        String lower = href.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("data:") || lower.startsWith("blob:")
                || lower.startsWith("http:") || lower.startsWith("https:") || lower.startsWith("//");
    }
}
