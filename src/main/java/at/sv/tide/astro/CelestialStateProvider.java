package at.sv.tide.astro;

import java.time.ZonedDateTime;

public interface CelestialStateProvider {

    CelestialState getCelestialState(ZonedDateTime dateTime, double latitude, double longitude);

    default String toDebugString(ZonedDateTime dateTime, double latitude, double longitude) {
        return null;
    }

    void clearCache();
}
