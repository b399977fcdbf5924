package at.sv.tide;

import at.sv.tide.astro.CelestialState;
import at.sv.tide.astro.CelestialStateProvider;
import at.sv.tide.render.InvalidRenderBoundsException;
import at.sv.tide.render.RenderArea;
import at.sv.tide.render.TideAreaLayout;
import at.sv.tide.tide.ActiveTideWindow;
import at.sv.tide.tide.TideEventStore;
import at.sv.tide.tide.TideLoadResult;
import at.sv.tide.tide.TideTable;
import at.sv.tide.tide.TideTableLoader;
import at.sv.tide.tide.TideWindowTracker;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Drives the face state from the frames of an external render loop.
 * <p>
 * Sun and moon are recomputed when the hour changes, the tide window when the minute changes. Tide tables are
 * requested on the first frame, after a station change, and whenever the years needed for the current date change,
 * e.g. at the turn of the year or once a clock that reported an unsupported year has been corrected.
 * <p>
 * Not thread safe: all methods are meant to be called from the render callback. Table loads may complete on other
 * threads; their results are picked up by the next frame.
 */
public final class TideFaceEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TideFaceEngine.class);

    private final TideTableLoader loader;
    private final TideEventStore store;
    private final CelestialStateProvider celestialStateProvider;
    private final Supplier<ZonedDateTime> currentTime;
    private final double faceSizePx;
    private final Duration reloadRetryInterval;
    private final TideWindowTracker windowTracker;

    private FaceSettings settings;
    private boolean celestialStateOutdated = true;
    private ZonedDateTime previousFrame;
    private CelestialState celestialState;
    private TideLoadResult appliedLoad;
    private RenderArea renderArea;
    private ReloadRequest lastRequest;
    private Instant lastRequestTime;
    private volatile FaceState state;

    public TideFaceEngine(TideTableLoader loader, CelestialStateProvider celestialStateProvider,
                          Supplier<ZonedDateTime> currentTime, FaceSettings settings, double faceSizePx,
                          Duration reloadRetryInterval) {
        this.loader = loader;
        this.store = loader.getStore();
        this.celestialStateProvider = celestialStateProvider;
        this.currentTime = currentTime;
        this.settings = settings;
        this.faceSizePx = faceSizePx;
        this.reloadRetryInterval = reloadRetryInterval;
        windowTracker = new TideWindowTracker();
        renderArea = buildRenderArea(0, 0);
    }

    public FaceState onFrame(ZonedDateTime now, RenderMode renderMode) {
        MDC.put("context", "frame");
        try {
            requestTablesIfNeeded(now);
            TideLoadResult loaded = store.getCurrent().orElse(null);
            if (loaded != appliedLoad) {
                applyLoad(loaded);
            }
            if (celestialStateOutdated || hourChanged(now)) {
                updateCelestialState(now);
            }
            ActiveTideWindow window = windowTracker.update(loaded != null ? loaded.table() : null, now);
            if (window.isNeedsReload()) {
                retryLoad(now);
            }
            previousFrame = now;
            FaceState next = FaceState.builder()
                                      .frameTime(now)
                                      .renderMode(renderMode)
                                      .settings(settings)
                                      .celestialState(celestialState)
                                      .tideWindow(window)
                                      .renderArea(renderArea)
                                      .loadedTideCount(loaded != null ? loaded.table().size() : 0)
                                      .degraded(loaded != null && loaded.degraded())
                                      .build();
            state = next;
            return next;
        } finally {
            MDC.remove("context");
        }
    }

    /**
     * Applies changed user settings. A changed location takes effect with the next frame; a changed station
     * triggers a load of its tide tables, while the current table stays visible until the new one is ready.
     *
     * @return the issued load request, if the station changed
     */
    public Optional<ReloadRequest> applySettingsDiff(double newLatitude, double newLongitude, String newStationId) {
        FaceSettings updated = new FaceSettings(newLatitude, newLongitude, newStationId);
        if (updated.equals(settings)) {
            return Optional.empty();
        }
        boolean stationChanged = !updated.stationId().equals(settings.stationId());
        if (updated.latitude() != settings.latitude() || updated.longitude() != settings.longitude()) {
            LOG.info("Location changed to {},{}", newLatitude, newLongitude);
            celestialStateOutdated = true;
        }
        settings = updated;
        if (!stationChanged) {
            return Optional.empty();
        }
        LOG.info("Tide station changed to {}", newStationId);
        ZonedDateTime now = previousFrame != null ? previousFrame : currentTime.get();
        return Optional.of(issue(new ReloadRequest(newStationId, store.yearsFor(now.toLocalDate())), now));
    }

    private void requestTablesIfNeeded(ZonedDateTime now) {
        ReloadRequest needed = new ReloadRequest(settings.stationId(), store.yearsFor(now.toLocalDate()));
        if (!needed.equals(lastRequest)) {
            issue(needed, now);
        }
    }

    private void retryLoad(ZonedDateTime now) {
        if (lastRequest == null || lastRequestTime == null) {
            return;
        }
        if (Duration.between(lastRequestTime, now.toInstant()).compareTo(reloadRetryInterval) >= 0) {
            LOG.debug("Not enough tides around {}, retrying load of {}", now, lastRequest);
            issue(lastRequest, now);
        }
    }

    private ReloadRequest issue(ReloadRequest request, ZonedDateTime now) {
        LOG.info("Requesting tide tables {}", request);
        lastRequest = request;
        lastRequestTime = now.toInstant();
        loader.requestLoad(request.stationId(), request.years());
        return request;
    }

    private void applyLoad(@Nullable TideLoadResult loaded) {
        appliedLoad = loaded;
        if (loaded == null) {
            return;
        }
        TideTable table = loaded.table();
        if (loaded.degraded()) {
            LOG.warn("Showing tides of {} for requested years {}", table.getYears(), loaded.requestedYears());
        }
        RenderArea area = buildRenderArea(table.getMinHeight(), table.getMaxHeight());
        if (area != null) {
            renderArea = area;
        }
    }

    private @Nullable RenderArea buildRenderArea(double minHeight, double maxHeight) {
        try {
            return TideAreaLayout.forFace(faceSizePx, minHeight, maxHeight);
        } catch (InvalidRenderBoundsException e) {
            LOG.warn("Invalid tide render area, keeping previous one: {}", e.getMessage());
            return null;
        }
    }

    private boolean hourChanged(ZonedDateTime now) {
        return previousFrame == null
               || now.getHour() != previousFrame.getHour()
               || !now.toLocalDate().equals(previousFrame.toLocalDate());
    }

    private void updateCelestialState(ZonedDateTime now) {
        celestialState = celestialStateProvider.getCelestialState(now, settings.latitude(), settings.longitude());
        celestialStateOutdated = false;
        LOG.debug("Celestial state: {}", celestialState);
    }

    /**
     * @return the state of the last frame, or null before the first frame
     */
    public @Nullable FaceState getState() {
        return state;
    }

    public FaceSettings getSettings() {
        return settings;
    }
}
