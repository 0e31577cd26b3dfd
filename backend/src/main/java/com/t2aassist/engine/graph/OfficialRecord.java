package com.t2aassist.engine.graph;

import com.t2aassist.model.enums.AssociationKind;

/**
 * One row of the official compatibility source.
 */
public record OfficialRecord(String code, String associatedCode, AssociationKind kind) {
}
