package at.sv.tide.tide;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the tide table of the selected station. Loads are all-or-nothing: a table is only published once all of its
 * years have been read successfully, replacing the previous table in a single step.
 */
@Slf4j
public final class TideEventStore {

    private final TideResourceProvider resourceProvider;
    private final TideStoreConfig config;
    private final TideTableParser parser;
    private final Cache<String, TideTable> annualTables;
    private final AtomicReference<TideLoadResult> current;

    public TideEventStore(TideResourceProvider resourceProvider, TideStoreConfig config) {
        this.resourceProvider = resourceProvider;
        this.config = config;
        parser = new TideTableParser(config.getHeaderLines());
        annualTables = Caffeine.newBuilder()
                               .maximumSize(config.getMaxCachedTables())
                               .build();
        current = new AtomicReference<>();
    }

    /**
     * Loads and publishes the table needed around the given date, see {@link #yearsFor(LocalDate)}.
     *
     * @throws TideDataException if a table is missing or invalid; the previous table stays active
     */
    public TideLoadResult load(String stationId, LocalDate date) {
        return publish(read(stationId, yearsFor(date)));
    }

    /**
     * Loads and publishes the table of one or two consecutive years.
     *
     * @throws TideDataException if a table is missing or invalid; the previous table stays active
     */
    public TideLoadResult load(String stationId, int primaryYear, OptionalInt secondYear) {
        List<Integer> years = new ArrayList<>();
        years.add(primaryYear);
        secondYear.ifPresent(years::add);
        return publish(read(stationId, years));
    }

    /**
     * The years whose tables are needed around the given date. Near the turn of the year this includes the adjacent
     * year, so the active tide window always has enough past and future events.
     */
    public List<Integer> yearsFor(LocalDate date) {
        int year = date.getYear();
        if (date.getMonth() == Month.DECEMBER && date.getDayOfMonth() > config.getYearEndLeadDays()) {
            return List.of(year, year + 1);
        }
        if (date.getMonth() == Month.JANUARY && date.getDayOfMonth() < config.getYearStartTrailDays()) {
            return List.of(year - 1, year);
        }
        return List.of(year);
    }

    /**
     * Reads the tables of the given years without publishing them.
     */
    TideLoadResult read(String stationId, List<Integer> years) {
        boolean degraded = false;
        List<Integer> effectiveYears = new ArrayList<>();
        for (int year : years) {
            int effectiveYear = year;
            if (year < config.getMinSupportedYear()) {
                effectiveYear = config.getMinSupportedYear();
                degraded = true;
            }
            if (!effectiveYears.contains(effectiveYear)) {
                effectiveYears.add(effectiveYear);
            }
        }
        if (degraded) {
            log.warn("Unsupported tide year(s) {} for station {}, using {} until a valid date is available",
                    years, stationId, effectiveYears);
        }
        TideTable table = null;
        for (int year : effectiveYears) {
            TideTable annual = annualTable(stationId, year);
            table = table == null ? annual : concat(table, annual);
        }
        if (table == null) {
            table = TideTable.empty(stationId);
        }
        return new TideLoadResult(table, List.copyOf(years), degraded);
    }

    private static TideTable concat(TideTable first, TideTable second) {
        try {
            return first.concat(second);
        } catch (IllegalArgumentException e) {
            throw new TideDataException("Can't combine tide tables " + first + " and " + second + ": " + e.getMessage(), e);
        }
    }

    private TideTable annualTable(String stationId, int year) {
        return annualTables.get(stationId + "-" + year, key -> readAnnualTable(stationId, year));
    }

    private TideTable readAnnualTable(String stationId, int year) {
        String resourceName = TideResourceProvider.resourceName(stationId, year);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resourceProvider.open(stationId, year), StandardCharsets.UTF_8))) {
            TideTable table = parser.parse(stationId, year, resourceName, reader);
            log.info("Loaded {} tides from '{}'", table.size(), resourceName);
            return table;
        } catch (IOException e) {
            throw new TideDataException("Failed to read tide table '" + resourceName + "': " + e.getMessage(),
                    new UncheckedIOException(e));
        }
    }

    TideLoadResult publish(TideLoadResult result) {
        current.set(result);
        log.debug("Active tide table: {}", result.table());
        return result;
    }

    public Optional<TideLoadResult> getCurrent() {
        return Optional.ofNullable(current.get());
    }

    public Optional<TideTable> getCurrentTable() {
        return getCurrent().map(TideLoadResult::table);
    }

    public void clearCache() {
        annualTables.invalidateAll();
    }
}
