package at.sv.tide;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Slf4j
public final class FrameSchedulerImpl implements FrameScheduler {

    private final ScheduledExecutorService scheduler;

    public FrameSchedulerImpl(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void scheduleAtFixedRate(Runnable runnable, long initialDelay, long period, TimeUnit unit) {
        scheduler.scheduleAtFixedRate(logUncaughtException(runnable), initialDelay, period, unit);
    }

    @Override
    public void shutdown() {
        scheduler.shutdownNow();
    }

    /**
     * An exception escaping a periodic task would silently cancel all further frames.
     */
    static Runnable logUncaughtException(Runnable runnable) {
        return () -> {
            try {
                runnable.run();
            } catch (Exception e) {
                log.error("Uncaught exception: {}", e.getLocalizedMessage(), e);
            }
        };
    }
}
