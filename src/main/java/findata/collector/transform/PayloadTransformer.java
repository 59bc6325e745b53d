package findata.collector.transform;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Job-specific conversion of fetched data before it is forwarded.
 * Implementations must be pure: no I/O, no shared mutable state.
 */
@FunctionalInterface
public interface PayloadTransformer {

    JsonNode transform(JsonNode data) throws Exception;
}
