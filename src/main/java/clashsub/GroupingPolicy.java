package clashsub;

/**
 * Which classifier and group layout a deployment uses. The two are
 * alternative designs and are never mixed within one output.
 */
public enum GroupingPolicy {
    /** Regions derived from node names; fixed client settings. */
    HEURISTIC,
    /** Regions from the fixed pattern table; settings passed through from the subscription. */
    PATTERN
}
