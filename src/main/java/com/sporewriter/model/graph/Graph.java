package com.sporewriter.model.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Simple undirected graph with integer node ids.
 *
 * Ids are allocated from 1 upwards and never reused, even after the node is
 * removed: ids of removed nodes are retired and cannot be added back, and
 * once {@link Integer#MAX_VALUE} has been used no further ids are handed out.
 * At most one edge exists per unordered pair and self-loops are
 * never stored. Every operation on existing or absent ids is total: absent
 * ids are treated as already removed, so nothing here throws for unknown nodes.
 */
@Slf4j
public class Graph {

    private final TreeMap<Integer, Node> nodes = new TreeMap<>();
    private final Map<Integer, SortedSet<Integer>> adjacency = new TreeMap<>();
    private final Set<Integer> retiredIds = new HashSet<>();
    private long nextId = 1;

    /**
     * Add a node at the given position.
     *
     * @return the freshly allocated id
     * @throws IllegalStateException if every positive int id has been handed out
     */
    public int addNode(double x, double y) {
        if (nextId > Integer.MAX_VALUE) {
            throw new IllegalStateException("Node id space exhausted");
        }
        int id = (int) nextId++;
        putNode(new Node(id, x, y));
        return id;
    }

    /**
     * Add a node with a caller-chosen id, as when importing an existing graph.
     * The allocator is advanced past {@code id} so later allocations stay unique.
     *
     * @return true if the node was added, false if the id is present or was
     *         used by a node removed earlier
     */
    public boolean addNode(int id, double x, double y) {
        if (id <= 0) {
            throw new IllegalArgumentException("Node ids must be positive, got " + id);
        }
        if (nodes.containsKey(id) || retiredIds.contains(id)) {
            return false;
        }
        putNode(new Node(id, x, y));
        nextId = Math.max(nextId, (long) id + 1);
        return true;
    }

    private void putNode(Node node) {
        nodes.put(node.getId(), node);
        adjacency.put(node.getId(), new TreeSet<>());
    }

    /**
     * Remove a node and every edge incident to it. No-op for unknown ids.
     */
    public void removeNode(int id) {
        SortedSet<Integer> incident = adjacency.remove(id);
        if (incident == null) {
            return;
        }
        for (int other : incident) {
            adjacency.get(other).remove(id);
        }
        nodes.remove(id);
        retiredIds.add(id);
        log.debug("Removed node {} and {} incident edge(s)", id, incident.size());
    }

    /**
     * Insert the edge if absent, otherwise remove it. Ignored for {@code a == b}
     * and for endpoints that are not in the graph.
     */
    public void toggleEdge(int a, int b) {
        if (a == b || !hasNode(a) || !hasNode(b)) {
            return;
        }
        if (hasEdge(a, b)) {
            removeEdge(a, b);
            log.debug("Toggled edge {} -- {} off", a, b);
        } else {
            addEdge(a, b);
            log.debug("Toggled edge {} -- {} on", a, b);
        }
    }

    /**
     * Insert the edge if it is absent.
     *
     * @return true if the edge set changed
     */
    public boolean addEdge(int a, int b) {
        if (a == b || !hasNode(a) || !hasNode(b)) {
            return false;
        }
        boolean added = adjacency.get(a).add(b);
        adjacency.get(b).add(a);
        return added;
    }

    /**
     * @return true if the edge set changed
     */
    public boolean removeEdge(int a, int b) {
        if (!hasEdge(a, b)) {
            return false;
        }
        adjacency.get(a).remove(b);
        adjacency.get(b).remove(a);
        return true;
    }

    public boolean hasNode(int id) {
        return nodes.containsKey(id);
    }

    public boolean hasEdge(int a, int b) {
        SortedSet<Integer> incident = adjacency.get(a);
        return incident != null && incident.contains(b);
    }

    public Optional<Node> node(int id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * Neighbors of a node in ascending order; empty for unknown ids.
     */
    public SortedSet<Integer> neighbors(int id) {
        SortedSet<Integer> incident = adjacency.get(id);
        return incident == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(incident);
    }

    /**
     * Node ids in ascending order.
     */
    public List<Integer> nodeIds() {
        return List.copyOf(nodes.keySet());
    }

    public List<Node> nodes() {
        return List.copyOf(nodes.values());
    }

    /**
     * Edges in ascending order of their normalized endpoint pair.
     */
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        adjacency.forEach((source, targets) -> {
            for (int target : targets.tailSet(source + 1)) {
                edges.add(Edge.of(source, target));
            }
        });
        return edges;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        int degreeSum = 0;
        for (SortedSet<Integer> incident : adjacency.values()) {
            degreeSum += incident.size();
        }
        return degreeSum / 2;
    }

    /**
     * Largest id currently present, or 0 for an empty graph.
     */
    public int maxNodeId() {
        return nodes.isEmpty() ? 0 : nodes.lastKey();
    }

    /**
     * Next id {@link #addNode(double, double)} would hand out; above
     * {@link Integer#MAX_VALUE} once the id space is used up.
     */
    public long nextNodeId() {
        return nextId;
    }

    /**
     * Deep copy including the id allocator and retired ids.
     */
    public Graph copy() {
        Graph copy = new Graph();
        nodes.values().forEach(copy::putNode);
        adjacency.forEach((id, incident) -> copy.adjacency.get(id).addAll(incident));
        copy.retiredIds.addAll(retiredIds);
        copy.nextId = nextId;
        return copy;
    }

    @Override
    public String toString() {
        return "Graph{nodes=" + nodes.keySet() + ", edges=" + edges() + "}";
    }
}
