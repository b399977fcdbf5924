package at.sv.tide;

import at.sv.tide.astro.CelestialState;
import at.sv.tide.astro.CelestialStateProviderImpl;
import at.sv.tide.astro.DayFractionMode;
import at.sv.tide.astro.Daylight;
import at.sv.tide.render.RenderArea;
import at.sv.tide.tide.ActiveTideWindow;
import at.sv.tide.tide.ClasspathTideResourceProvider;
import at.sv.tide.tide.DirectoryTideResourceProvider;
import at.sv.tide.tide.TideEvent;
import at.sv.tide.tide.TideEventStore;
import at.sv.tide.tide.TidePoint;
import at.sv.tide.tide.TideRegion;
import at.sv.tide.tide.TideResourceProvider;
import at.sv.tide.tide.TideStation;
import at.sv.tide.tide.TideStoreConfig;
import at.sv.tide.tide.TideTableLoader;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

@Command(name = "TideFace", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Computes the state of the ocean tides watch face for a location and tide station.")
public final class TideFace implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(TideFace.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat",
            defaultValue = "${env:LAT:-40.297119}",
            description = "The latitude of your location in degrees [-90..90], used for sunrise and sunset.")
    double latitude;
    @Option(names = "--long",
            defaultValue = "${env:LONG:--111.695007}",
            description = "The longitude of your location in degrees [-180..180], used for sunrise and sunset.")
    double longitude;
    @Option(names = "--station", paramLabel = "<id>",
            defaultValue = "${env:STATION}",
            description = "The NOAA tide station id. If not set, the station is selected with --region and --spot.")
    String stationId;
    @Option(names = "--region", paramLabel = "<index>",
            defaultValue = "${env:REGION:-0}",
            description = "The region of the station catalog: 0 = West Coast, 1 = East Coast. Default: ${DEFAULT-VALUE}")
    int region;
    @Option(names = "--spot", paramLabel = "<index>",
            defaultValue = "${env:SPOT:-0}",
            description = "The station within the selected region. Default: ${DEFAULT-VALUE}")
    int spot;
    @Option(names = "--tide-dir", paramLabel = "<dir>",
            defaultValue = "${env:TIDE_DIR}",
            description = "The directory containing the 'tides_<station>_<year>.txt' files. " +
                          "If not set, the bundled tide tables are used.")
    Path tideDirectory;
    @Option(names = "--time", paramLabel = "<date-time>",
            defaultValue = "${env:TIME}",
            description = "The ISO zoned date-time to render, e.g. 2023-12-20T14:30-08:00[America/Los_Angeles]. " +
                          "Default: now")
    String time;
    @Option(names = "--size", paramLabel = "<px>",
            defaultValue = "${env:FACE_SIZE:-450}",
            description = "The size of the square watch face in pixels. Default: ${DEFAULT-VALUE}")
    double faceSize;
    @Option(names = "--min-supported-year", paramLabel = "<year>",
            defaultValue = "${env:MIN_SUPPORTED_YEAR:-2022}",
            description = "The earliest year tide tables exist for. Earlier dates use this year's table instead. " +
                          "Default: ${DEFAULT-VALUE}")
    int minSupportedYear;
    @Option(names = "--year-end-lead-days", paramLabel = "<days>",
            defaultValue = "${env:YEAR_END_LEAD_DAYS:-15}",
            description = "Load the next year's table as well after this day of December. " +
                          "Default: ${DEFAULT-VALUE}")
    int yearEndLeadDays;
    @Option(names = "--year-start-trail-days", paramLabel = "<days>",
            defaultValue = "${env:YEAR_START_TRAIL_DAYS:-5}",
            description = "Load the previous year's table as well before this day of January. " +
                          "Default: ${DEFAULT-VALUE}")
    int yearStartTrailDays;
    @Option(names = "--header-lines", paramLabel = "<lines>",
            defaultValue = "${env:HEADER_LINES:-20}",
            description = "The number of header lines preceding the rows of each tide table. Default: ${DEFAULT-VALUE}")
    int headerLines;
    @Option(names = "--moon-day-fraction",
            defaultValue = "${env:MOON_DAY_FRACTION:-UTC_CORRECTED}",
            description = "How the fraction of the current day is derived for the moon phase. " +
                          "Valid values: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    DayFractionMode dayFractionMode;
    @Option(names = "--reload-retry-interval", paramLabel = "<duration>",
            defaultValue = "${env:RELOAD_RETRY_INTERVAL:-PT1H}",
            description = "The minimum time between two attempts to reload tides, while not enough are loaded. " +
                          "Default: ${DEFAULT-VALUE}")
    Duration reloadRetryInterval;
    @Option(names = "--follow",
            description = "Render one frame per minute until interrupted.")
    boolean follow;
    @Option(names = "--json",
            description = "Print the face state as JSON.")
    boolean json;

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final PrintStream out;

    public TideFace() {
        this(System.out);
    }

    TideFace(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new TideFace()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        FaceSettings settings = new FaceSettings(latitude, longitude, resolveStationId());
        Supplier<ZonedDateTime> currentTime = createTimeSupplier();
        LOG.info("Tide station: {}", describeStation(settings.stationId()));
        if (follow) {
            follow(settings, currentTime);
        } else {
            TideFaceEngine engine = createEngine(settings, currentTime, Runnable::run);
            print(engine.onFrame(currentTime.get(), RenderMode.INTERACTIVE));
        }
    }

    private void follow(FaceSettings settings, Supplier<ZonedDateTime> currentTime) {
        ExecutorService loadExecutor = Executors.newSingleThreadExecutor();
        FrameScheduler frameScheduler = new FrameSchedulerImpl(Executors.newSingleThreadScheduledExecutor());
        TideFaceEngine engine = createEngine(settings, currentTime, loadExecutor);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            frameScheduler.shutdown();
            loadExecutor.shutdownNow();
            stopped.countDown();
        }));
        frameScheduler.scheduleAtFixedRate(() -> {
            MDC.put("context", "frame");
            print(engine.onFrame(currentTime.get(), RenderMode.INTERACTIVE));
        }, 0, 1, TimeUnit.MINUTES);
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    TideFaceEngine createEngine(FaceSettings settings, Supplier<ZonedDateTime> currentTime,
                                Executor loadExecutor) {
        TideStoreConfig config = TideStoreConfig.builder()
                                                .headerLines(headerLines)
                                                .minSupportedYear(minSupportedYear)
                                                .yearEndLeadDays(yearEndLeadDays)
                                                .yearStartTrailDays(yearStartTrailDays)
                                                .build();
        TideEventStore store = new TideEventStore(createResourceProvider(), config);
        TideTableLoader loader = new TideTableLoader(store, loadExecutor);
        return new TideFaceEngine(loader, new CelestialStateProviderImpl(dayFractionMode), currentTime, settings,
                faceSize, reloadRetryInterval);
    }

    private TideResourceProvider createResourceProvider() {
        if (tideDirectory == null) {
            return new ClasspathTideResourceProvider("tides");
        }
        return new DirectoryTideResourceProvider(tideDirectory);
    }

    private String resolveStationId() {
        if (stationId != null && !stationId.isBlank()) {
            return stationId.trim();
        }
        return TideRegion.byIndex(region).station(spot).id();
    }

    /**
     * A fixed {@code --time} is advanced with the wall clock, so {@code --follow} still moves forward.
     */
    private Supplier<ZonedDateTime> createTimeSupplier() {
        if (time == null) {
            return ZonedDateTime::now;
        }
        ZonedDateTime start = parseTime(time);
        long startNanos = System.nanoTime();
        return () -> start.plusNanos(System.nanoTime() - startNanos);
    }

    private ZonedDateTime parseTime(String value) {
        try {
            return ZonedDateTime.parse(value);
        } catch (DateTimeParseException e) {
            fail("--time must be an ISO zoned date-time, e.g. 2023-12-20T14:30-08:00: " + e.getLocalizedMessage());
            return null;
        }
    }

    private void assertConfigurationParameters() {
        assertGeographicConfigurations();
        assertTideConfigurations();
        assertRenderConfigurations();
    }

    private void assertGeographicConfigurations() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
    }

    private void assertTideConfigurations() {
        if (tideDirectory != null && !Files.isDirectory(tideDirectory)) {
            fail("--tide-dir '" + tideDirectory + "' is not a directory");
        }
        if (headerLines < 0) {
            fail("--header-lines must be >= 0");
        }
        if (yearEndLeadDays < 0) {
            fail("--year-end-lead-days must be >= 0");
        }
        if (yearStartTrailDays < 0) {
            fail("--year-start-trail-days must be >= 0");
        }
        if (reloadRetryInterval.isNegative() || reloadRetryInterval.isZero()) {
            fail("--reload-retry-interval must be > 0");
        }
    }

    private void assertRenderConfigurations() {
        if (faceSize <= 0) {
            fail("--size must be > 0");
        }
        if (time != null) {
            parseTime(time);
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    private void print(FaceState state) {
        if (json) {
            out.println(toJson(state));
        } else {
            out.println(toText(state));
        }
        out.flush();
    }

    String toJson(FaceState state) {
        try {
            return objectMapper.writeValueAsString(toJsonTree(state));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Map<String, Object> toJsonTree(FaceState state) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("time", state.getFrameTime().toOffsetDateTime().toString());
        tree.put("station", state.getSettings().stationId());
        CelestialState celestialState = state.getCelestialState();
        tree.put("daylight", celestialState.daylight().name());
        tree.put("sunriseHour", celestialState.sunriseHour());
        tree.put("sunsetHour", celestialState.sunsetHour());
        tree.put("moonPhase", celestialState.moonPhase());
        tree.put("placeholder", state.getTideWindow().isPlaceholder());
        tree.put("degraded", state.isDegraded());
        tree.put("loadedTides", state.getLoadedTideCount());
        state.getNextTide().ifPresent(tide -> {
            Map<String, Object> next = new LinkedHashMap<>();
            next.put("time", tide.timestamp().atZone(state.getFrameTime().getZone()).toOffsetDateTime().toString());
            next.put("heightFeet", tide.heightFeet());
            next.put("high", tide.highTide());
            tree.put("nextTide", next);
        });
        List<Map<String, Object>> window = new ArrayList<>();
        for (TidePoint point : state.getTideWindow().getPoints()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("hourOffset", point.hourOffset());
            entry.put("heightFeet", point.heightFeet());
            entry.put("high", point.highTide());
            RenderArea area = state.getRenderArea();
            if (area != null) {
                entry.put("x", area.mapHour(point.hourOffset()));
                entry.put("y", area.mapHeight(point.heightFeet()));
            }
            window.add(entry);
        }
        tree.put("window", window);
        return tree;
    }

    private static String toText(FaceState state) {
        StringBuilder text = new StringBuilder();
        CelestialState celestialState = state.getCelestialState();
        text.append("Time:      ").append(FormatUtil.formatClockTime(state.getFrameTime()))
            .append(" (").append(state.getFrameTime()).append(")\n");
        text.append("Station:   ").append(describeStation(state.getSettings().stationId())).append('\n');
        if (celestialState.daylight() == Daylight.NORMAL) {
            text.append("Sunrise:   ").append(FormatUtil.formatHourOfDay(celestialState.sunriseHour())).append('\n');
            text.append("Sunset:    ").append(FormatUtil.formatHourOfDay(celestialState.sunsetHour())).append('\n');
        } else {
            text.append("Daylight:  ").append(celestialState.daylight()).append('\n');
        }
        text.append("Moon:      ").append(String.format(Locale.ROOT, "%.2f", celestialState.moonPhase()))
            .append('\n');
        ActiveTideWindow window = state.getTideWindow();
        if (window.isPlaceholder()) {
            text.append("Next tide: unknown (").append(state.getLoadedTideCount()).append(" tides loaded)\n");
        } else {
            TideEvent next = state.getNextTide().orElseThrow();
            text.append("Next tide: ")
                .append(FormatUtil.formatClockTime(next.timestamp().atZone(state.getFrameTime().getZone())))
                .append(' ').append(FormatUtil.formatTideHeight(next.heightFeet())).append(" FT ")
                .append(next.highTide() ? "HIGH" : "LOW").append('\n');
        }
        if (state.isDegraded()) {
            text.append("Warning:   tides of a substitute year are shown\n");
        }
        text.append("Window:   ");
        for (TidePoint point : window.getPoints()) {
            text.append(String.format(Locale.ROOT, " %+.1fh %s %s", point.hourOffset(),
                    FormatUtil.formatTideHeight(point.heightFeet()), point.highTide() ? "H" : "L"));
        }
        return text.toString();
    }

    private static String describeStation(String stationId) {
        return TideRegion.findStation(stationId)
                         .map(TideStation::name)
                         .map(name -> name + " (" + stationId + ")")
                         .orElse(stationId);
    }
}
