package com.sporewriter.model.graph;

import lombok.Value;

/**
 * Graph node. The position is layout data only and never affects rewriting.
 */
@Value
public class Node {
    int id;
    double x;
    double y;
}
