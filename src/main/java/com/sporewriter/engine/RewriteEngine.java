package com.sporewriter.engine;

import com.sporewriter.exception.RewriteError;
import com.sporewriter.exception.RewriteException;
import com.sporewriter.model.graph.Edge;
import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.graph.Node;
import com.sporewriter.model.mapping.Correspondence;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Applies a rule (LHS, RHS, gluing map) to an input graph at a match, with
 * single-pushout semantics.
 *
 * <ul>
 *   <li>LHS nodes outside the image of the gluing map are deleted, and so are
 *       their input images together with every incident input edge.</li>
 *   <li>RHS nodes in the gluing domain are kept as the input node their LHS
 *       counterpart matched.</li>
 *   <li>Other RHS nodes become new nodes with ids above the largest input id.</li>
 *   <li>Every surviving input edge is kept and every RHS edge is added
 *       between the corresponding output nodes.</li>
 * </ul>
 *
 * Input graphs are never modified; the output is a fresh graph. Validation
 * happens before anything is built, so a failed call produces nothing.
 */
@Slf4j
public class RewriteEngine {

    private final MatchValidator matchValidator;
    private final RewriteOptions options;

    public RewriteEngine(MatchValidator matchValidator, RewriteOptions options) {
        this.matchValidator = matchValidator;
        this.options = options;
    }

    /**
     * @param input  graph to rewrite
     * @param lhs    pattern graph
     * @param rhs    replacement graph
     * @param match  validated LHS to input map; re-checked against the graphs given here
     * @param gluing partial injective RHS to LHS map
     * @throws RewriteException if the gluing map is not injective or references unknown nodes,
     *         or if the new nodes cannot get ids above the largest input id
     * @throws com.sporewriter.exception.MatchException if the match no longer fits the graphs
     */
    public RewriteResult rewrite(Graph input, Graph lhs, Graph rhs, ValidatedMatch match, Correspondence gluing) {
        validateGluing(rhs, lhs, gluing);
        ValidatedMatch current = matchValidator.validate(lhs, input, match.correspondence());
        checkIdSpace(input, rhs.nodeCount() - gluing.size());

        Set<Integer> preservedLhs = gluing.image();
        Set<Integer> deletedImages = new HashSet<>();
        for (int lhsId : lhs.nodeIds()) {
            if (!preservedLhs.contains(lhsId)) {
                deletedImages.add(current.imageOf(lhsId));
            }
        }

        Set<Edge> droppedPatternEdges = options.isDeleteUnmatchedPatternEdges()
                ? unmatchedPatternEdges(lhs, rhs, current, gluing)
                : Set.of();

        Graph output = new Graph();
        for (Node node : input.nodes()) {
            if (!deletedImages.contains(node.getId())) {
                output.addNode(node.getId(), node.getX(), node.getY());
            }
        }

        SortedMap<Integer, Integer> rhsToOutput = new TreeMap<>();
        long nextFreshId = (long) input.maxNodeId() + 1;
        int createdNodes = 0;
        for (Node rhsNode : rhs.nodes()) {
            int rhsId = rhsNode.getId();
            if (gluing.isDefinedAt(rhsId)) {
                rhsToOutput.put(rhsId, current.imageOf(gluing.get(rhsId).get()));
            } else {
                int freshId = (int) nextFreshId++;
                output.addNode(freshId, rhsNode.getX(), rhsNode.getY());
                rhsToOutput.put(rhsId, freshId);
                createdNodes++;
                log.debug("Created node {} for RHS node {}", freshId, rhsId);
            }
        }

        int keptEdges = 0;
        for (Edge edge : input.edges()) {
            if (output.hasNode(edge.getSource()) && output.hasNode(edge.getTarget())
                    && !droppedPatternEdges.contains(edge)) {
                output.addEdge(edge.getSource(), edge.getTarget());
                keptEdges++;
            }
        }

        int addedEdges = 0;
        for (Edge edge : rhs.edges()) {
            int source = rhsToOutput.get(edge.getSource());
            int target = rhsToOutput.get(edge.getTarget());
            if (source != target && output.addEdge(source, target)) {
                addedEdges++;
                log.debug("Added edge {} -- {} for RHS edge {} -- {}",
                        source, target, edge.getSource(), edge.getTarget());
            }
        }

        RewriteResult result = RewriteResult.builder()
                .output(output)
                .rhsToOutput(rhsToOutput)
                .createdNodes(createdNodes)
                .removedNodes(deletedImages.size())
                .addedEdges(addedEdges)
                .removedEdges(input.edgeCount() - keptEdges)
                .build();
        log.info("Rewrite result: nodes={} edges={} | created_nodes={} removed_nodes={} added_edges={} removed_edges={}",
                output.nodeCount(), output.edgeCount(), result.getCreatedNodes(), result.getRemovedNodes(),
                result.getAddedEdges(), result.getRemovedEdges());
        return result;
    }

    /**
     * Checks the gluing map is injective and only references existing RHS and LHS nodes.
     * Totality over the RHS is not required.
     */
    public void validateGluing(Graph rhs, Graph lhs, Correspondence gluing) {
        gluing.firstSharedTarget().ifPresent(target -> {
            throw new RewriteException(RewriteError.AMBIGUOUS_GLUING,
                    "LHS node " + target + " is glued to more than one RHS node");
        });
        gluing.assignments().forEach((rhsId, lhsId) -> {
            if (!rhs.hasNode(rhsId)) {
                throw new RewriteException(RewriteError.INVALID_GLUING_REFERENCE,
                        "Gluing map references RHS node " + rhsId + ", which does not exist");
            }
            if (!lhs.hasNode(lhsId)) {
                throw new RewriteException(RewriteError.INVALID_GLUING_REFERENCE,
                        "Gluing map references LHS node " + lhsId + ", which does not exist");
            }
        });
    }

    private void checkIdSpace(Graph input, int newNodes) {
        long lastFreshId = (long) input.maxNodeId() + newNodes;
        if (lastFreshId > Integer.MAX_VALUE) {
            throw new RewriteException(RewriteError.NODE_IDS_EXHAUSTED,
                    String.format("Cannot allocate %d new node id(s) above input node %d",
                            newNodes, input.maxNodeId()));
        }
    }

    /**
     * Input edges matched by an LHS edge whose endpoints are both kept but whose
     * RHS counterparts are not adjacent.
     */
    private Set<Edge> unmatchedPatternEdges(Graph lhs, Graph rhs, ValidatedMatch match, Correspondence gluing) {
        Map<Integer, Integer> lhsToRhs = new HashMap<>();
        gluing.assignments().forEach((rhsId, lhsId) -> lhsToRhs.put(lhsId, rhsId));

        Set<Edge> dropped = new HashSet<>();
        for (Edge edge : lhs.edges()) {
            Integer rhsSource = lhsToRhs.get(edge.getSource());
            Integer rhsTarget = lhsToRhs.get(edge.getTarget());
            if (rhsSource == null || rhsTarget == null || rhs.hasEdge(rhsSource, rhsTarget)) {
                continue;
            }
            Edge image = Edge.of(match.imageOf(edge.getSource()), match.imageOf(edge.getTarget()));
            dropped.add(image);
            log.debug("Dropping input edge {} -- {} (LHS edge {} -- {} absent from RHS)",
                    image.getSource(), image.getTarget(), edge.getSource(), edge.getTarget());
        }
        return dropped;
    }
}
