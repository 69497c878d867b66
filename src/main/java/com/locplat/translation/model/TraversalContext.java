package com.locplat.translation.model;

import lombok.Getter;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * State threaded through one relationship-aware translation call.
 * <p>
 * The visited set is shared between a context and the child contexts derived from
 * it. Entries are pushed when an item is entered and popped when it is left, so
 * membership always reflects the ancestors of the current item and nothing else.
 */
@Getter
public class TraversalContext {

    private final Set<List<Object>> visited;
    private final int currentDepth;
    private final int maxDepth;
    private final String clientId;
    private final String sourceLang;
    private final String targetLang;
    private final String provider;
    private final String model;

    private TraversalContext(Set<List<Object>> visited, int currentDepth, int maxDepth, String clientId,
                             String sourceLang, String targetLang, String provider, String model) {
        this.visited = visited;
        this.currentDepth = currentDepth;
        this.maxDepth = maxDepth;
        this.clientId = clientId;
        this.sourceLang = sourceLang;
        this.targetLang = targetLang;
        this.provider = provider;
        this.model = model;
    }

    public static TraversalContext root(int maxDepth, String clientId, String sourceLang, String targetLang,
                                        String provider, String model) {
        return new TraversalContext(new HashSet<>(), 0, maxDepth, clientId, sourceLang, targetLang, provider, model);
    }

    public TraversalContext child() {
        return new TraversalContext(visited, currentDepth + 1, maxDepth, clientId, sourceLang, targetLang, provider, model);
    }

    public boolean isVisited(String collection, Object itemId) {
        return visited.contains(key(collection, itemId));
    }

    public void enter(String collection, Object itemId) {
        visited.add(key(collection, itemId));
    }

    public void leave(String collection, Object itemId) {
        visited.remove(key(collection, itemId));
    }

    public boolean isDepthExceeded() {
        return currentDepth >= maxDepth;
    }

    private static List<Object> key(String collection, Object itemId) {
        return List.of(Objects.requireNonNullElse(collection, ""), Objects.requireNonNullElse(itemId, "unknown"));
    }
}
