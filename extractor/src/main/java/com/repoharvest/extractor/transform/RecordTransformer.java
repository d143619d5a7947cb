package com.repoharvest.extractor.transform;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Maps one raw API object to one normalized record. Implementations are pure:
 * no I/O and no shared mutable state.
 */
@FunctionalInterface
public interface RecordTransformer {

    TransformResult transform(JsonNode raw);
}
