package at.sv.tide;

import java.util.concurrent.TimeUnit;

public interface FrameScheduler {
    void scheduleAtFixedRate(Runnable runnable, long initialDelay, long period, TimeUnit unit);

    void shutdown();
}
