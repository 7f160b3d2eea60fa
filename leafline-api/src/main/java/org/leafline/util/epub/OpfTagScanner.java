package org.leafline.util.epub;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural scanner for the small, fixed-shape XML documents of an EPUB package
 * (container.xml and the OPF). Matches start tags and their attributes without building a
 * DOM; attribute order and quoting style do not matter, and an optional namespace prefix
 * on the element name is accepted.
 */
final class OpfTagScanner {

    private static final Pattern ATTRIBUTE = Pattern.compile("([\\w:.-]+)\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)')");
    private static final Pattern MARKUP = Pattern.compile("<[^>]*>");
    private static final Pattern CDATA = Pattern.compile("<!\\[CDATA\\[(.*?)]]>", Pattern.DOTALL);
    private static final Pattern ENTITY = Pattern.compile("&(#x[0-9a-fA-F]+|#[0-9]+|amp|lt|gt|quot|apos);");

    private OpfTagScanner() {
    }

    record Tag(String name, Map<String, String> attributes) {

        String attr(String key) {
            return attributes.get(key.toLowerCase(Locale.ROOT));
        }

        boolean hasAttr(String key) {
            String value = attr(key);
            return value != null && !value.isBlank();
        }
    }

    static List<Tag> findTags(String xml, String localName) {
        if (xml == null || xml.isEmpty()) {
            return Collections.emptyList();
        }
        Pattern pattern = Pattern.compile("<(?:[\\w.-]+:)?" + Pattern.quote(localName) + "(?=[\\s/>])([^>]*)>",
                Pattern.CASE_INSENSITIVE);
        Matcher matcher = pattern.matcher(xml);
        List<Tag> tags = new ArrayList<>();
        while (matcher.find()) {
            tags.add(new Tag(localName, parseAttributes(matcher.group(1))));
        }
        return tags;
    }

    static Optional<Tag> findFirstTag(String xml, String localName) {
        List<Tag> tags = findTags(xml, localName);
        return tags.isEmpty() ? Optional.empty() : Optional.of(tags.get(0));
    }

    /**
     * Text content of the first element with the given qualified name (for example
     * {@code dc:title}). Nested markup is dropped and entities are decoded.
     */
    static Optional<String> firstElementText(String xml, String qualifiedName) {
        if (xml == null || xml.isEmpty()) {
            return Optional.empty();
        }
        String quoted = Pattern.quote(qualifiedName);
        Pattern pattern = Pattern.compile("<" + quoted + "(?=[\\s>])[^>]*>(.*?)</" + quoted + "\\s*>",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
        Matcher matcher = pattern.matcher(xml);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String raw = CDATA.matcher(matcher.group(1)).replaceAll("$1");
        String text = decodeEntities(MARKUP.matcher(raw).replaceAll("")).trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    static Map<String, String> parseAttributes(String raw) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (raw == null) {
            return attributes;
        }
        Matcher matcher = ATTRIBUTE.matcher(raw);
        while (matcher.find()) {
            String value = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
            attributes.putIfAbsent(matcher.group(1).toLowerCase(Locale.ROOT), decodeEntities(value));
        }
        return attributes;
    }

    static String decodeEntities(String value) {
        if (value == null || value.indexOf('&') < 0) {
            return value;
        }
        Matcher matcher = ENTITY.matcher(value);
        StringBuilder out = new StringBuilder(value.length());
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(resolveEntity(matcher.group(1))));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String resolveEntity(String entity) {
        switch (entity) {
            case "amp":
                return "&";
            case "lt":
                return "<";
            case "gt":
                return ">";
            case "quot":
                return "\"";
            case "apos":
                return "'";
            default:
                try {
                    int codePoint = entity.startsWith("#x")
                            ? Integer.parseInt(entity.substring(2), 16)
                            : Integer.parseInt(entity.substring(1));
                    return new String(Character.toChars(codePoint));
                } catch (IllegalArgumentException e) {
                    return "&" + entity + ";";
                }
        }
    }
}
