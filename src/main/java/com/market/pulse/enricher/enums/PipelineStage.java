package com.market.pulse.enricher.enums;

/**
 * Steps one market event walks through inside the enrichment consumer.
 */
public enum PipelineStage {
    RECEIVED,
    FILTERED,
    FETCHING,
    SCORING,
    PUBLISHING,
    DONE
}
