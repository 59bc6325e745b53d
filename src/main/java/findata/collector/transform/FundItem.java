package findata.collector.transform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One fund row of the fundcompare feed. Unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FundItem(
        @JsonProperty(value = "regNo", required = true) String regNo,
        @JsonProperty(value = "name", required = true) String name,
        @JsonProperty(value = "fundType", required = true) Integer fundType,
        @JsonProperty("fundSize") Long fundSize,
        @JsonProperty(value = "initiationDate", required = true) String initiationDate,
        @JsonProperty("annualEfficiency") Double annualEfficiency,
        @JsonProperty("netAsset") Long netAsset,
        @JsonProperty(value = "date", required = true) String date,
        @JsonProperty("manager") String manager,
        @JsonProperty("websiteAddress") List<String> websiteAddress) {

    /** Check the fields the feed guarantees; Jackson only enforces presence. */
    public void validate() {
        if (regNo == null || regNo.isBlank()) {
            throw new IllegalArgumentException("regNo is required");
        }
        if (name == null) {
            throw new IllegalArgumentException("name is required for fund " + regNo);
        }
        if (fundType == null) {
            throw new IllegalArgumentException("fundType is required for fund " + regNo);
        }
        FeedDates.parse(initiationDate, "initiationDate");
        FeedDates.parse(date, "date");
    }
}
