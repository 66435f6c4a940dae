package org.gts3.atlantis.distance.solver;

/**
 * How edges are followed when measuring the path length from a node to a target.
 */
public enum EdgeTraversal {
    /** Paths follow edge direction, from the node towards the target. */
    FORWARD,
    /** Edge direction is ignored. */
    UNDIRECTED
}
