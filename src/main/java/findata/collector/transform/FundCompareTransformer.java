package findata.collector.transform;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Transform for the {@code fund_compare} job.
 *
 * Reads {@code items[]} from the fundcompare feed, cleans every row into a
 * {@link ProcessedFund} and wraps them as
 * {@code {"source":"fipiran_fundcompare","fetched_at":...,"items":[...]}}.
 * A missing {@code items} key produces an empty list.
 */
public class FundCompareTransformer implements PayloadTransformer {

    public static final String JOB_NAME = "fund_compare";
    public static final String SOURCE = "fipiran_fundcompare";

    private final ObjectMapper mapper;
    private final Clock clock;

    public FundCompareTransformer(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public JsonNode transform(JsonNode data) throws Exception {
        JsonNode rawItems = data.path("items");
        List<ProcessedFund> items = new ArrayList<>();

        if (rawItems.isArray()) {
            for (JsonNode raw : rawItems) {
                FundItem item = mapper.treeToValue(raw, FundItem.class);
                items.add(ProcessedFund.from(item));
            }
        } else if (!rawItems.isMissingNode() && !rawItems.isNull()) {
            throw new IllegalArgumentException("'items' must be an array");
        }

        FundPayload payload = new FundPayload(SOURCE, Instant.now(clock), items);
        return mapper.valueToTree(payload);
    }

    /** Body POSTed to the target service. */
    public record FundPayload(
            @JsonProperty("source") String source,
            @JsonProperty("fetched_at") Instant fetchedAt,
            @JsonProperty("items") List<ProcessedFund> items) {
    }
}
