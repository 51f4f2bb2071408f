package com.sporewriter.util;

import com.sporewriter.exception.InvalidGraphException;
import com.sporewriter.model.dto.LinkDto;
import com.sporewriter.model.dto.NodeDto;
import com.sporewriter.model.dto.NodeLinkGraph;
import com.sporewriter.model.graph.Edge;
import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.graph.Node;
import com.sporewriter.model.mapping.Correspondence;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Utility class for converting between node-link documents and graphs.
 */
@Slf4j
public class NodeLinkConverter {

    private NodeLinkConverter() {
    }

    /**
     * Build a graph from a node-link document.
     *
     * @param name  Graph name used in error messages (e.g. "lhs")
     * @param graph Node-link document
     * @return Graph holding the same nodes and links
     * @throws InvalidGraphException on duplicate or non-positive ids, or links to unknown nodes
     */
    public static Graph toGraph(String name, NodeLinkGraph graph) {
        Graph result = new Graph();
        for (NodeDto node : nullSafe(graph.getNodes())) {
            Integer id = node.getId();
            if (id == null || id <= 0) {
                throw new InvalidGraphException(name, "node id must be a positive integer, got " + id);
            }
            if (!result.addNode(id, coordinate(node.getX()), coordinate(node.getY()))) {
                throw new InvalidGraphException(name, "duplicate node id " + id);
            }
        }
        for (LinkDto link : nullSafe(graph.getLinks())) {
            Integer source = link.getSource();
            Integer target = link.getTarget();
            if (source == null || target == null || !result.hasNode(source) || !result.hasNode(target)) {
                throw new InvalidGraphException(name,
                        String.format("link %s -- %s references a missing node", source, target));
            }
            if (source.equals(target)) {
                log.warn("Dropping self-loop on node {} in graph '{}'", source, name);
                continue;
            }
            result.addEdge(source, target);
        }
        return result;
    }

    /**
     * Render a graph as a node-link document, nodes and links in ascending id order.
     */
    public static NodeLinkGraph fromGraph(Graph graph) {
        List<NodeDto> nodes = graph.nodes().stream()
                .map(NodeLinkConverter::toDto)
                .collect(Collectors.toList());
        List<LinkDto> links = graph.edges().stream()
                .map(NodeLinkConverter::toDto)
                .collect(Collectors.toList());
        return NodeLinkGraph.builder()
                .nodes(nodes)
                .links(links)
                .build();
    }

    /**
     * Wrap a decoded id mapping. Entries with a null value count as unmapped.
     */
    public static Correspondence toCorrespondence(Map<Integer, Integer> mapping) {
        Map<Integer, Integer> defined = new TreeMap<>();
        if (mapping != null) {
            mapping.forEach((key, value) -> {
                if (key != null && value != null) {
                    defined.put(key, value);
                }
            });
        }
        return Correspondence.of(defined);
    }

    private static NodeDto toDto(Node node) {
        return NodeDto.builder()
                .id(node.getId())
                .x(node.getX())
                .y(node.getY())
                .build();
    }

    private static LinkDto toDto(Edge edge) {
        return LinkDto.builder()
                .source(edge.getSource())
                .target(edge.getTarget())
                .build();
    }

    private static double coordinate(Double value) {
        return value == null ? 0.0 : value;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
