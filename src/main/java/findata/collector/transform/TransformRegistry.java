package findata.collector.transform;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only mapping from job name to its transform.
 * Built once at startup; jobs without an entry forward the raw fetched data.
 */
public final class TransformRegistry {

    private final Map<String, PayloadTransformer> transformers;

    private TransformRegistry(Map<String, PayloadTransformer> transformers) {
        this.transformers = Map.copyOf(transformers);
    }

    public static TransformRegistry of(Map<String, PayloadTransformer> transformers) {
        return new TransformRegistry(transformers);
    }

    public static TransformRegistry empty() {
        return new TransformRegistry(Map.of());
    }

    /** The transforms shipped with the collector. */
    public static TransformRegistry builtIn(ObjectMapper mapper, Clock clock) {
        return new TransformRegistry(Map.of(
                FundCompareTransformer.JOB_NAME, new FundCompareTransformer(mapper, clock)));
    }

    public Optional<PayloadTransformer> find(String jobName) {
        return Optional.ofNullable(transformers.get(jobName));
    }

    public int size() {
        return transformers.size();
    }
}
