package com.unitutor.courseware.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.unitutor.courseware.model.PageArtifact;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort recovery of JSON returned by the generator: code fences, chatter around the
 * payload and output cut off by the token budget. Never throws; input that cannot be salvaged
 * comes back wrapped as a free-text object.
 */
@Slf4j
public final class StructuredOutputRepair {

    public static final String RAW_TEXT_FIELD = "raw_text";
    public static final String PAGE_TYPE_FIELD = "page_type";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final Pattern CLOSED_FENCE_PATTERN = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");
    private static final Pattern OPEN_FENCE_PATTERN = Pattern.compile("^```(?:json)?\\s*");

    private StructuredOutputRepair() {
    }

    public static JsonNode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return freeText(raw == null ? "" : raw);
        }

        String cleaned = stripCodeFence(raw.trim());

        Optional<JsonNode> direct = tryParse(cleaned);
        if (direct.isPresent()) {
            return direct.get();
        }

        int start = firstOpening(cleaned);
        if (start < 0) {
            log.debug("No JSON delimiter found in generator output, keeping it as free text");
            return freeText(raw);
        }

        int end = lastClosing(cleaned);
        if (end > start) {
            Optional<JsonNode> sliced = tryParse(cleaned.substring(start, end + 1));
            if (sliced.isPresent()) {
                return sliced.get();
            }
        }

        Optional<JsonNode> repaired = tryParse(repairTruncated(cleaned.substring(start)));
        if (repaired.isPresent()) {
            log.debug("Recovered truncated JSON output");
            return repaired.get();
        }

        log.debug("JSON repair failed, keeping generator output as free text");
        return freeText(raw);
    }

    static String stripCodeFence(String text) {
        Matcher closed = CLOSED_FENCE_PATTERN.matcher(text);
        if (closed.find()) {
            return closed.group(1).trim();
        }
        // truncated output keeps the opening fence only
        return OPEN_FENCE_PATTERN.matcher(text).replaceFirst("").trim();
    }

    static String repairTruncated(String text) {
        String repaired = text.stripTrailing();

        if (repaired.endsWith(",")) {
            repaired = repaired.substring(0, repaired.length() - 1).stripTrailing();
        }

        if (countUnescapedQuotes(repaired) % 2 != 0) {
            repaired = repaired + "\"";
        } else if (repaired.endsWith(":")) {
            repaired = repaired + "null";
        }

        return repaired + missingClosers(repaired);
    }

    static Optional<JsonNode> tryParse(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        char first = candidate.charAt(0);
        if (first != '{' && first != '[') {
            return Optional.empty();
        }
        try {
            return Optional.of(OBJECT_MAPPER.readTree(candidate));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static int countUnescapedQuotes(String text) {
        int count = 0;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                count++;
            }
        }
        return count;
    }

    private static String missingClosers(String text) {
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{' -> open.push('}');
                case '[' -> open.push(']');
                case '}', ']' -> {
                    if (!open.isEmpty() && open.peek() == c) {
                        open.pop();
                    }
                }
                default -> {
                }
            }
        }

        StringBuilder closers = new StringBuilder();
        while (!open.isEmpty()) {
            closers.append(open.pop());
        }
        return closers.toString();
    }

    private static int firstOpening(String text) {
        int brace = text.indexOf('{');
        int bracket = text.indexOf('[');
        if (brace < 0) {
            return bracket;
        }
        if (bracket < 0) {
            return brace;
        }
        return Math.min(brace, bracket);
    }

    private static int lastClosing(String text) {
        return Math.max(text.lastIndexOf('}'), text.lastIndexOf(']'));
    }

    private static JsonNode freeText(String raw) {
        ObjectNode node = OBJECT_MAPPER.createObjectNode();
        node.put(PAGE_TYPE_FIELD, PageArtifact.DEFAULT_PAGE_TYPE);
        node.put(RAW_TEXT_FIELD, raw);
        return node;
    }
}
