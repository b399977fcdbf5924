package at.sv.tide.tide;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;

/**
 * Loads tide tables off the render path. A new request replaces any load still in flight: the older one is
 * cancelled and its result, should it still complete, is never published.
 */
@Slf4j
public final class TideTableLoader {

    private final TideEventStore store;
    private final Executor executor;

    private long generation;
    private Future<?> inFlight;

    public TideTableLoader(TideEventStore store, Executor executor) {
        this.store = store;
        this.executor = executor;
    }

    public synchronized Future<?> requestLoad(String stationId, List<Integer> years) {
        long requestGeneration = ++generation;
        if (inFlight != null && !inFlight.isDone()) {
            log.debug("Cancelling superseded tide load");
            inFlight.cancel(true);
        }
        FutureTask<Void> task = new FutureTask<>(() -> {
            load(requestGeneration, stationId, years);
            return null;
        });
        inFlight = task;
        executor.execute(task);
        return task;
    }

    private void load(long requestGeneration, String stationId, List<Integer> years) {
        MDC.put("context", "load " + stationId);
        try {
            TideLoadResult result = store.read(stationId, years);
            publishIfCurrent(requestGeneration, result);
        } catch (TideDataException e) {
            log.warn("Failed to load tides for station {} {}: {}", stationId, years, e.getMessage());
        } catch (Exception e) {
            log.error("Uncaught exception while loading tides: {}", e.getLocalizedMessage(), e);
        } finally {
            MDC.remove("context");
        }
    }

    private synchronized void publishIfCurrent(long requestGeneration, TideLoadResult result) {
        if (requestGeneration != generation) {
            log.debug("Discarding tide load for {} as a newer request exists", result.requestedYears());
            return;
        }
        store.publish(result);
    }

    public TideEventStore getStore() {
        return store;
    }
}
