package com.t2aassist.engine.graph;

/**
 * One row of the frequency-observed source; {@code supportCount} is the number of
 * independent observations backing the pair.
 */
public record ObservedRecord(String code, String associatedCode, int supportCount) {
}
