package com.sporewriter.engine;

import com.sporewriter.model.graph.Graph;
import lombok.Builder;
import lombok.Value;

import java.util.SortedMap;

/**
 * Output of a rewrite together with what changed.
 */
@Value
@Builder
public class RewriteResult {

    Graph output;

    /** Output node standing in for each RHS node. */
    SortedMap<Integer, Integer> rhsToOutput;

    int createdNodes;
    int removedNodes;
    int addedEdges;
    int removedEdges;
}
