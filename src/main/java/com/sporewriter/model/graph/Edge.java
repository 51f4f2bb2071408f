package com.sporewriter.model.graph;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Undirected edge stored as a normalized pair with {@code source < target}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Edge implements Comparable<Edge> {
    int source;
    int target;

    public static Edge of(int a, int b) {
        if (a == b) {
            throw new IllegalArgumentException("Self-loop on node " + a);
        }
        return a < b ? new Edge(a, b) : new Edge(b, a);
    }

    @Override
    public int compareTo(Edge other) {
        int bySource = Integer.compare(source, other.source);
        return bySource != 0 ? bySource : Integer.compare(target, other.target);
    }
}
