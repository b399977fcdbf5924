package at.sv.tide.tide;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public final class TideStoreConfig {
    /**
     * Number of header lines preceding the tide rows of each table.
     */
    @Builder.Default
    int headerLines = 20;
    /**
     * The earliest year tables are available for. Earlier years, e.g. from an unset system clock after boot, are
     * replaced by this year and the load is flagged as degraded.
     */
    @Builder.Default
    int minSupportedYear = 2022;
    /**
     * From the day after this day of December on, the next year's table is loaded as well. The default covers
     * December 16th to 31st.
     */
    @Builder.Default
    int yearEndLeadDays = 15;
    /**
     * Before this day of January, the previous year's table is loaded as well. The default covers January 1st to 4th.
     */
    @Builder.Default
    int yearStartTrailDays = 5;
    /**
     * Maximum number of parsed annual tables kept in memory.
     */
    @Builder.Default
    int maxCachedTables = 8;

    public static TideStoreConfig defaults() {
        return TideStoreConfig.builder().build();
    }
}
