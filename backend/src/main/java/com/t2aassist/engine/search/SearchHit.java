package com.t2aassist.engine.search;

import com.t2aassist.engine.catalog.CatalogCode;

/**
 * A ranked search result. Scores are only comparable within one stage.
 */
public record SearchHit(CatalogCode code, double score) {
}
