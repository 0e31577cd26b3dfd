package com.t2aassist.engine.graph;

/**
 * One row of the official incompatibility source.
 */
public record IncompatibilityRecord(String code, String incompatibleCode) {
}
