package com.sporewriter.engine;

import com.sporewriter.exception.MatchError;
import com.sporewriter.exception.MatchException;
import com.sporewriter.exception.RewriteError;
import com.sporewriter.exception.RewriteException;
import com.sporewriter.model.graph.Edge;
import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.graph.Node;
import com.sporewriter.model.mapping.Correspondence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.sporewriter.engine.TestGraphs.edge;
import static com.sporewriter.engine.TestGraphs.graph;
import static com.sporewriter.engine.TestGraphs.nodes;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for RewriteEngine.
 */
class RewriteEngineTest {

    private MatchValidator validator;
    private RewriteEngine engine;

    @BeforeEach
    void setUp() {
        validator = new MatchValidator();
        engine = new RewriteEngine(validator, RewriteOptions.defaults());
    }

    private ValidatedMatch match(Graph lhs, Graph input, Map<Integer, Integer> mapping) {
        return validator.validate(lhs, input, Correspondence.of(mapping));
    }

    @Test
    void rewrite_DeletedPatternDropsIncidentEdges() {
        Graph input = graph(nodes(1, 2, 3), edge(1, 2), edge(2, 3));
        Graph lhs = graph(nodes(1, 2), edge(1, 2));
        Graph rhs = new Graph();
        rhs.addNode(1, 5.0, 6.0);

        RewriteResult result = engine.rewrite(input, lhs, rhs,
                match(lhs, input, Map.of(1, 1, 2, 2)), Correspondence.empty());

        Graph output = result.getOutput();
        assertEquals(List.of(3, 4), output.nodeIds());
        assertEquals(List.of(), output.edges());
        assertEquals(new Node(4, 5.0, 6.0), output.node(4).orElseThrow());
        assertEquals(1, result.getCreatedNodes());
        assertEquals(2, result.getRemovedNodes());
        assertEquals(2, result.getRemovedEdges());
        assertEquals(Map.of(1, 4), result.getRhsToOutput());
    }

    @Test
    void rewrite_PreservedEdgeIsNotDuplicated() {
        Graph input = graph(nodes(1, 2, 3), edge(1, 2), edge(2, 3), edge(1, 3));
        Graph lhs = graph(nodes(1, 2), edge(1, 2));
        Graph rhs = graph(nodes(1, 2), edge(1, 2));

        RewriteResult result = engine.rewrite(input, lhs, rhs,
                match(lhs, input, Map.of(1, 1, 2, 2)), Correspondence.of(Map.of(1, 1, 2, 2)));

        assertEquals(input.nodeIds(), result.getOutput().nodeIds());
        assertEquals(input.edges(), result.getOutput().edges());
        assertEquals(0, result.getAddedEdges());
        assertEquals(0, result.getCreatedNodes());
        assertEquals(0, result.getRemovedNodes());
    }

    @Test
    void rewrite_GluingTwoRhsNodesOntoOneIsAmbiguous() {
        Graph input = graph(nodes(1, 2), edge(1, 2));
        Graph lhs = graph(nodes(1, 2), edge(1, 2));
        Graph rhs = graph(nodes(1, 2));
        ValidatedMatch match = match(lhs, input, Map.of(1, 1, 2, 2));

        RewriteException ex = assertThrows(RewriteException.class,
                () -> engine.rewrite(input, lhs, rhs, match, Correspondence.of(Map.of(1, 1, 2, 1))));

        assertEquals(RewriteError.AMBIGUOUS_GLUING, ex.getError());
    }

    @Test
    void rewrite_GluingToUnknownNodesIsInvalidReference() {
        Graph input = graph(nodes(1, 2), edge(1, 2));
        Graph lhs = graph(nodes(1, 2), edge(1, 2));
        Graph rhs = graph(nodes(1));
        ValidatedMatch match = match(lhs, input, Map.of(1, 1, 2, 2));

        RewriteException unknownRhs = assertThrows(RewriteException.class,
                () -> engine.rewrite(input, lhs, rhs, match, Correspondence.of(Map.of(7, 1))));
        RewriteException unknownLhs = assertThrows(RewriteException.class,
                () -> engine.rewrite(input, lhs, rhs, match, Correspondence.of(Map.of(1, 7))));

        assertEquals(RewriteError.INVALID_GLUING_REFERENCE, unknownRhs.getError());
        assertEquals(RewriteError.INVALID_GLUING_REFERENCE, unknownLhs.getError());
        assertEquals(List.of(Edge.of(1, 2)), input.edges());
    }

    @Test
    void rewrite_NewRhsNodeAttachedToPreservedNode() {
        Graph input = graph(nodes(1, 2, 3), edge(1, 2), edge(2, 3));
        Graph lhs = graph(nodes(1));
        Graph rhs = graph(nodes(1, 2), edge(1, 2));

        RewriteResult result = engine.rewrite(input, lhs, rhs,
                match(lhs, input, Map.of(1, 2)), Correspondence.of(Map.of(1, 1)));

        Graph output = result.getOutput();
        assertEquals(List.of(1, 2, 3, 4), output.nodeIds());
        assertEquals(List.of(Edge.of(1, 2), Edge.of(2, 3), Edge.of(2, 4)), output.edges());
        assertEquals(Map.of(1, 2, 2, 4), result.getRhsToOutput());
        assertEquals(1, result.getAddedEdges());
    }

    @Test
    void rewrite_FreshIdsAboveLargestInputId() {
        Graph input = graph(nodes(2, 5));
        Graph lhs = new Graph();
        Graph rhs = graph(nodes(1, 2), edge(1, 2));

        RewriteResult result = engine.rewrite(input, lhs, rhs,
                match(lhs, input, Map.of()), Correspondence.empty());

        assertEquals(List.of(2, 5, 6, 7), result.getOutput().nodeIds());
        assertEquals(List.of(Edge.of(6, 7)), result.getOutput().edges());
    }

    @Test
    void rewrite_LastFreshIdMayBeMaxValue() {
        Graph input = graph(nodes(Integer.MAX_VALUE - 1));
        Graph lhs = new Graph();
        Graph rhs = graph(nodes(1));

        RewriteResult result = engine.rewrite(input, lhs, rhs,
                match(lhs, input, Map.of()), Correspondence.empty());

        assertEquals(List.of(Integer.MAX_VALUE - 1, Integer.MAX_VALUE), result.getOutput().nodeIds());
    }

    @Test
    void rewrite_NewNodesBeyondIdRangeRejected() {
        Graph input = graph(nodes(Integer.MAX_VALUE));
        Graph lhs = new Graph();
        Graph rhs = graph(nodes(1));

        RewriteException ex = assertThrows(RewriteException.class,
                () -> engine.rewrite(input, lhs, rhs, match(lhs, input, Map.of()), Correspondence.empty()));

        assertEquals(RewriteError.NODE_IDS_EXHAUSTED, ex.getError());
    }

    @Test
    void rewrite_MaxValueInputWithoutNewNodes() {
        Graph input = graph(nodes(1, Integer.MAX_VALUE), edge(1, Integer.MAX_VALUE));
        Graph lhs = graph(nodes(1));
        Graph rhs = graph(nodes(1));

        RewriteResult result = engine.rewrite(input, lhs, rhs,
                match(lhs, input, Map.of(1, Integer.MAX_VALUE)), Correspondence.of(Map.of(1, 1)));

        assertEquals(input.nodeIds(), result.getOutput().nodeIds());
        assertEquals(input.edges(), result.getOutput().edges());
    }

    @Test
    void rewrite_NodeCountLaw() {
        Graph input = graph(nodes(1, 2, 3, 4, 5), edge(1, 2), edge(2, 3), edge(3, 4), edge(4, 5));
        Graph lhs = graph(nodes(1, 2, 3), edge(1, 2), edge(2, 3));
        Graph rhs = graph(nodes(1, 2, 3, 4), edge(1, 3), edge(3, 4));
        Correspondence gluing = Correspondence.of(Map.of(1, 1, 3, 3));

        RewriteResult result = engine.rewrite(input, lhs, rhs,
                match(lhs, input, Map.of(1, 2, 2, 3, 3, 4)), gluing);

        int deleted = lhs.nodeCount() - gluing.image().size();
        int created = rhs.nodeCount() - gluing.size();
        assertEquals(input.nodeCount() - deleted + created, result.getOutput().nodeCount());
        assertEquals(List.of(1, 2, 4, 5, 6, 7), result.getOutput().nodeIds());
        assertEquals(List.of(Edge.of(1, 2), Edge.of(2, 4), Edge.of(4, 5), Edge.of(4, 7)),
                result.getOutput().edges());
    }

    @Test
    void rewrite_IdentityRuleLeavesGraphUnchanged() {
        Graph input = graph(nodes(1, 2, 3, 4), edge(1, 2), edge(2, 3), edge(3, 4), edge(4, 1));
        Graph lhs = graph(nodes(1, 2, 3), edge(1, 2), edge(2, 3));
        Graph rhs = graph(nodes(10, 20, 30), edge(10, 20), edge(20, 30));

        RewriteResult result = engine.rewrite(input, lhs, rhs,
                match(lhs, input, Map.of(1, 2, 2, 3, 3, 4)), Correspondence.of(Map.of(10, 1, 20, 2, 30, 3)));

        assertEquals(input.nodes(), result.getOutput().nodes());
        assertEquals(input.edges(), result.getOutput().edges());
    }

    @Test
    void rewrite_DeletingHubLeavesNoOrphanEdges() {
        Graph input = graph(nodes(1, 2, 3, 4), edge(1, 2), edge(1, 3), edge(1, 4), edge(2, 3));
        Graph lhs = graph(nodes(1));

        RewriteResult result = engine.rewrite(input, lhs, new Graph(),
                match(lhs, input, Map.of(1, 1)), Correspondence.empty());

        Graph output = result.getOutput();
        assertEquals(List.of(2, 3, 4), output.nodeIds());
        assertEquals(List.of(Edge.of(2, 3)), output.edges());
        for (Edge edge : output.edges()) {
            assertTrue(output.hasNode(edge.getSource()) && output.hasNode(edge.getTarget()));
        }
        assertEquals(3, result.getRemovedEdges());
    }

    @Test
    void rewrite_LeavesInputGraphsUntouched() {
        Graph input = graph(nodes(1, 2, 3), edge(1, 2), edge(2, 3));
        Graph lhs = graph(nodes(1, 2), edge(1, 2));
        Graph rhs = graph(nodes(1, 2));

        engine.rewrite(input, lhs, rhs, match(lhs, input, Map.of(1, 1, 2, 2)), Correspondence.of(Map.of(1, 1)));

        assertEquals(List.of(1, 2, 3), input.nodeIds());
        assertEquals(List.of(Edge.of(1, 2), Edge.of(2, 3)), input.edges());
        assertEquals(List.of(1, 2), rhs.nodeIds());
    }

    @Test
    void rewrite_StaleMatchRejected() {
        Graph input = graph(nodes(1, 2, 3), edge(1, 2), edge(2, 3));
        Graph lhs = graph(nodes(1, 2), edge(1, 2));
        ValidatedMatch match = match(lhs, input, Map.of(1, 2, 2, 3));

        input.toggleEdge(2, 3);

        MatchException ex = assertThrows(MatchException.class,
                () -> engine.rewrite(input, lhs, lhs, match, Correspondence.of(Map.of(1, 1, 2, 2))));
        assertEquals(MatchError.STRUCTURE_NOT_PRESERVED, ex.getError());
    }

    @Test
    void rewrite_PatternEdgeKeptByDefault() {
        Graph input = graph(nodes(1, 2, 3), edge(1, 2), edge(2, 3), edge(1, 3));
        Graph lhs = graph(nodes(1, 2), edge(1, 2));
        Graph rhs = graph(nodes(1, 2));

        RewriteResult result = engine.rewrite(input, lhs, rhs,
                match(lhs, input, Map.of(1, 1, 2, 2)), Correspondence.of(Map.of(1, 1, 2, 2)));

        assertEquals(3, result.getOutput().edgeCount());
    }

    @Test
    void rewrite_PatternEdgeDeletedWhenEnabled() {
        RewriteEngine deleting = new RewriteEngine(validator,
                RewriteOptions.builder().deleteUnmatchedPatternEdges(true).build());
        Graph input = graph(nodes(1, 2, 3), edge(1, 2), edge(2, 3), edge(1, 3));
        Graph lhs = graph(nodes(1, 2), edge(1, 2));
        Graph rhs = graph(nodes(1, 2));

        RewriteResult result = deleting.rewrite(input, lhs, rhs,
                match(lhs, input, Map.of(1, 1, 2, 2)), Correspondence.of(Map.of(1, 1, 2, 2)));

        assertEquals(List.of(Edge.of(1, 3), Edge.of(2, 3)), result.getOutput().edges());
        assertEquals(1, result.getRemovedEdges());
    }
}
