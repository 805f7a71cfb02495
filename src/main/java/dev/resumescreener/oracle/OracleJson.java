package dev.resumescreener.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient reading of JSON embedded in model output.
 */
final class OracleJson {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(\\{[\\s\\S]*?\\})\\s*```");
    private static final Pattern BRACED = Pattern.compile("\\{[\\s\\S]*\\}");

    private OracleJson() {
    }

    /**
     * Tries the raw text, then a fenced code block, then the outermost braces.
     */
    static Optional<JsonNode> readObject(ObjectMapper objectMapper, String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<JsonNode> direct = tryRead(objectMapper, text.strip());
        if (direct.isPresent()) {
            return direct;
        }
        Matcher fenced = FENCED.matcher(text);
        if (fenced.find()) {
            Optional<JsonNode> node = tryRead(objectMapper, fenced.group(1));
            if (node.isPresent()) {
                return node;
            }
        }
        Matcher braced = BRACED.matcher(text);
        if (braced.find()) {
            return tryRead(objectMapper, braced.group());
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> tryRead(ObjectMapper objectMapper, String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * First present field among the names.
     */
    static JsonNode field(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Array of strings, or a single comma-separated string; anything else yields an empty set.
     */
    static Set<String> stringSet(JsonNode node) {
        return new LinkedHashSet<>(stringList(node));
    }

    /**
     * Same inputs as {@link #stringSet}, keeping order and repeated entries.
     */
    static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null) {
            return values;
        }
        if (node.isArray()) {
            node.forEach(item -> {
                if (item.isValueNode() && !item.asText().isBlank()) {
                    values.add(item.asText().strip());
                }
            });
        } else if (node.isTextual()) {
            for (String part : node.asText().split(",")) {
                if (!part.isBlank()) {
                    values.add(part.strip());
                }
            }
        }
        return values;
    }

    static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isArray()) {
            return String.join(" / ", stringSet(node));
        }
        return node.isValueNode() ? node.asText().strip() : "";
    }

    static double number(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            Matcher digits = Pattern.compile("\\d+(\\.\\d+)?").matcher(node.asText());
            if (digits.find()) {
                return Double.parseDouble(digits.group());
            }
        }
        return 0;
    }
}
