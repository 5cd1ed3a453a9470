package com.mainframe.hlasm.resolver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.mainframe.hlasm.model.Chunk;

import lombok.Value;

/**
 * Directed DEPENDS_ON graph between chunk labels and the symbols they call.
 */
public class DependencyMap {

    @Value
    public static class Edge {
        String source;
        String target;
    }

    private final Map<String, Set<String>> edges = new LinkedHashMap<>();

    public void addCallDependency(String source, String target) {
        edges.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(target);
        edges.computeIfAbsent(target, k -> new LinkedHashSet<>());
    }

    public void addChunks(List<Chunk> chunks) {
        for (Chunk chunk : chunks) {
            edges.computeIfAbsent(chunk.getLabel(), k -> new LinkedHashSet<>());
            for (String dep : chunk.getDependencies()) {
                addCallDependency(chunk.getLabel(), dep);
            }
        }
    }

    public Set<String> getDirectDependencies(String symbol) {
        return Collections.unmodifiableSet(edges.getOrDefault(symbol, Set.of()));
    }

    /**
     * Every symbol reachable from {@code symbol}, breadth first, excluding the symbol itself
     * unless it lies on a cycle.
     */
    public Set<String> getAllDependencies(String symbol) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(edges.getOrDefault(symbol, Set.of()));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (visited.add(next)) {
                queue.addAll(edges.getOrDefault(next, Set.of()));
            }
        }
        return visited;
    }

    public Set<String> vertices() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    public List<Edge> edges() {
        List<Edge> result = new ArrayList<>();
        edges.forEach((source, targets) -> targets.forEach(target -> result.add(new Edge(source, target))));
        return result;
    }
}
