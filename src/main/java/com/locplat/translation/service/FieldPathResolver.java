package com.locplat.translation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes values addressed by field paths such as {@code content.items[2].title}.
 * <p>
 * Both directions fail softly: a segment that does not resolve yields {@code null} on
 * read and a no-op on write. Writes create missing intermediate objects for dotted
 * segments, never arrays.
 */
@Component
public class FieldPathResolver {

    private static final Pattern SEGMENT_PATTERN = Pattern.compile("([^\\[\\].]+)|\\[(\\d+)]");

    /**
     * Resolves {@code path} against {@code document}.
     *
     * @return the node found, or {@code null} when any segment is missing
     */
    public JsonNode get(JsonNode document, String path) {
        if (document == null || path == null || path.isBlank()) {
            return null;
        }
        JsonNode current = document;
        for (Segment segment : parse(path)) {
            current = step(current, segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Writes {@code value} at {@code path}.
     *
     * @return whether the value was written
     */
    public boolean set(JsonNode document, String path, JsonNode value) {
        if (document == null || path == null || path.isBlank()) {
            return false;
        }
        List<Segment> segments = parse(path);
        if (segments.isEmpty()) {
            return false;
        }
        JsonNode current = document;
        for (int i = 0; i < segments.size() - 1; i++) {
            Segment segment = segments.get(i);
            JsonNode next = step(current, segment);
            if (next == null || next.isNull()) {
                if (segment.isIndex() || !(current instanceof ObjectNode objectNode)
                        || segments.get(i + 1).isIndex()) {
                    return false;
                }
                next = objectNode.putObject(segment.key());
            }
            current = next;
        }
        return write(current, segments.get(segments.size() - 1), value);
    }

    /**
     * Last dotted segment of a path with any index suffix removed: {@code a.b[1].title} gives {@code title}.
     */
    public String leafName(String path) {
        if (path == null) {
            return null;
        }
        List<Segment> segments = parse(path);
        for (int i = segments.size() - 1; i >= 0; i--) {
            if (!segments.get(i).isIndex()) {
                return segments.get(i).key();
            }
        }
        return path;
    }

    List<Segment> parse(String path) {
        List<Segment> segments = new ArrayList<>();
        Matcher matcher = SEGMENT_PATTERN.matcher(path);
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                segments.add(new Segment(matcher.group(1), -1));
            } else {
                segments.add(new Segment(null, Integer.parseInt(matcher.group(2))));
            }
        }
        return segments;
    }

    private JsonNode step(JsonNode current, Segment segment) {
        if (segment.isIndex()) {
            if (current instanceof ArrayNode array && segment.index() < array.size()) {
                return array.get(segment.index());
            }
            return null;
        }
        if (current instanceof ObjectNode object) {
            return object.get(segment.key());
        }
        return null;
    }

    private boolean write(JsonNode parent, Segment last, JsonNode value) {
        if (last.isIndex()) {
            if (parent instanceof ArrayNode array && last.index() < array.size()) {
                array.set(last.index(), value);
                return true;
            }
            return false;
        }
        if (parent instanceof ObjectNode object) {
            object.set(last.key(), value);
            return true;
        }
        return false;
    }

    record Segment(String key, int index) {
        boolean isIndex() {
            return key == null;
        }
    }
}
