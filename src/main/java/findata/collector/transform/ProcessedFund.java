package findata.collector.transform;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.temporal.Temporal;
import java.util.List;

/**
 * Cleaned-up fund row sent to the target service.
 * {@code date} keeps the feed's offset when it had one.
 */
public record ProcessedFund(
        @JsonProperty("reg_no") String regNo,
        @JsonProperty("name") String name,
        @JsonProperty("fund_type") int fundType,
        @JsonProperty("fund_size") Long fundSize,
        @JsonProperty("annual_efficiency") Double annualEfficiency,
        @JsonProperty("net_asset") Long netAsset,
        @JsonProperty("date") Temporal date,
        @JsonProperty("manager") String manager,
        @JsonProperty("main_website") String mainWebsite) {

    public static ProcessedFund from(FundItem item) {
        item.validate();
        List<String> sites = item.websiteAddress();
        String mainSite = sites == null || sites.isEmpty() ? null : sites.get(0);
        return new ProcessedFund(
                item.regNo(),
                item.name(),
                item.fundType(),
                item.fundSize(),
                item.annualEfficiency(),
                item.netAsset(),
                FeedDates.parse(item.date(), "date"),
                item.manager(),
                mainSite);
    }
}
