package com.example.comicshelf.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical tag keys. {@link #normalize(Object)} is idempotent; {@link #display(Object)} keeps the
 * original casing for presentation.
 */
public final class TagNormalizer {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Final tokens that look plural but must not be singularized.
     */
    private static final Set<String> SINGULAR_EXCEPTIONS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "series", "species", "news", "anime", "manga", "physics", "mathematics", "politics", "economics",
            "gymnastics", "athletics", "ethics", "aerobics", "electronics", "graphics", "comics", "lens",
            "chaos", "gas", "bus", "this", "yes", "thus", "kudos", "boss", "kids", "boys", "girls")));

    private static final int MAX_UNWRAP_DEPTH = 8;

    private TagNormalizer() {
    }

    public static String normalize(Object raw) {
        String value = unwrap(raw, 0);
        if (value == null) {
            return "";
        }
        List<String> tokens = new ArrayList<>(tokenize(value));
        if (tokens.isEmpty()) {
            return "";
        }
        while (tokens.size() > 1 && "s".equals(tokens.get(tokens.size() - 1))) {
            tokens.remove(tokens.size() - 1);
        }
        int last = tokens.size() - 1;
        tokens.set(last, singularize(tokens.get(last)));
        return String.join(" ", tokens);
    }

    /**
     * Sanitized original-case form: unwrapped, whitespace collapsed.
     */
    public static String display(Object raw) {
        String value = unwrap(raw, 0);
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    /**
     * Lowercased, diacritic-free word tokens of free text, without singularization.
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
        String lowered = COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
        String spaced = NON_ALNUM.matcher(lowered).replaceAll(" ").trim();
        if (spaced.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(WHITESPACE.split(spaced));
    }

    /**
     * Strips one plural ending. Only {@code sses}, {@code xes}, {@code ches} and {@code shes} lose
     * {@code es}; any other trailing {@code ses} only loses its {@code s} ("houses" to "house"),
     * so singularizing a result again leaves it unchanged.
     */
    public static String singularize(String token) {
        if (token.length() <= 3 || SINGULAR_EXCEPTIONS.contains(token)) {
            return token;
        }
        if (token.endsWith("ies") && token.length() > 4) {
            return token.substring(0, token.length() - 3) + "y";
        }
        if (token.endsWith("sses") || token.endsWith("xes") || token.endsWith("ches") || token.endsWith("shes")) {
            return token.substring(0, token.length() - 2);
        }
        if (token.endsWith("s") && !token.endsWith("ss") && !token.endsWith("us") && !token.endsWith("is")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }

    /**
     * Flattens a stored tag column into individual tag strings. Accepts JSON arrays, JSON arrays
     * encoded a second time as a string, nested arrays, or a bare comma separated string.
     */
    public static List<String> extractTags(Object raw) {
        List<String> result = new ArrayList<>();
        collect(raw, result, 0);
        return result;
    }

    private static void collect(Object raw, List<String> out, int depth) {
        if (raw == null || depth > MAX_UNWRAP_DEPTH) {
            return;
        }
        if (raw instanceof Collection) {
            for (Object item : (Collection<?>) raw) {
                collect(item, out, depth + 1);
            }
            return;
        }
        if (raw instanceof JsonNode) {
            collectNode((JsonNode) raw, out, depth);
            return;
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return;
        }
        JsonNode parsed = looksLikeJson(text) ? parse(text) : null;
        if (parsed != null) {
            collectNode(parsed, out, depth + 1);
            return;
        }
        for (String part : text.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
    }

    private static void collectNode(JsonNode node, List<String> out, int depth) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collectNode(item, out, depth + 1);
            }
        } else if (node.isTextual()) {
            String text = node.asText().trim();
            if (looksLikeJson(text)) {
                collect(text, out, depth + 1);
            } else if (!text.isEmpty()) {
                out.add(text);
            }
        } else if (node.isValueNode()) {
            out.add(node.asText());
        }
    }

    /**
     * Reduces a JSON-array-looking value (or nested list) to its first scalar.
     */
    private static String unwrap(Object raw, int depth) {
        if (raw == null || depth > MAX_UNWRAP_DEPTH) {
            return null;
        }
        if (raw instanceof Collection) {
            for (Object item : (Collection<?>) raw) {
                String value = unwrap(item, depth + 1);
                if (value != null) {
                    return value;
                }
            }
            return null;
        }
        if (raw instanceof JsonNode) {
            JsonNode node = (JsonNode) raw;
            if (node.isArray()) {
                for (JsonNode item : node) {
                    String value = unwrap(item, depth + 1);
                    if (value != null) {
                        return value;
                    }
                }
                return null;
            }
            if (node.isNull() || node.isContainerNode()) {
                return null;
            }
            return unwrap(node.asText(), depth + 1);
        }
        String text = raw.toString().trim();
        if (text.startsWith("[") || text.startsWith("\"")) {
            JsonNode parsed = parse(text);
            if (parsed != null && (parsed.isArray() || parsed.isTextual())) {
                return unwrap(parsed, depth + 1);
            }
        }
        return text;
    }

    private static boolean looksLikeJson(String text) {
        return text.startsWith("[") || (text.startsWith("\"") && text.endsWith("\""));
    }

    private static JsonNode parse(String text) {
        try {
            return OBJECT_MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            // not JSON, callers treat the value as plain text
            return null;
        }
    }
}
