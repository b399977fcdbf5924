package at.sv.tide.astro;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.OptionalDouble;

public final class CelestialStateProviderImpl implements CelestialStateProvider {

    /**
     * Enough for today and tomorrow of a few locations.
     */
    static final int MAX_CACHED_DAYS = 16;

    private final LunarPhaseCalculator lunarPhaseCalculator;
    private final Cache<String, SunHours> cache;

    public CelestialStateProviderImpl(DayFractionMode dayFractionMode) {
        this.lunarPhaseCalculator = new LunarPhaseCalculator(dayFractionMode);
        cache = Caffeine.newBuilder()
                        .maximumSize(MAX_CACHED_DAYS)
                        .build();
    }

    @Override
    public CelestialState getCelestialState(ZonedDateTime dateTime, double latitude, double longitude) {
        SunHours sunHours = sunHoursFor(dateTime, latitude, longitude);
        double moonPhase = lunarPhaseCalculator.computePhase(dateTime);
        return new CelestialState(sunHours.sunrise(), sunHours.sunset(), moonPhase, sunHours.daylight());
    }

    private SunHours sunHoursFor(ZonedDateTime dateTime, double latitude, double longitude) {
        String key = generateKey(dateTime, latitude, longitude);
        return cache.get(key, k -> computeSunHours(dateTime, latitude, longitude));
    }

    private static SunHours computeSunHours(ZonedDateTime dateTime, double latitude, double longitude) {
        OptionalDouble sunrise = SolarEphemeris.computeEventHour(dateTime, latitude, longitude, SunEvent.SUNRISE);
        OptionalDouble sunset = SolarEphemeris.computeEventHour(dateTime, latitude, longitude, SunEvent.SUNSET);
        if (sunrise.isPresent() && sunset.isPresent()) {
            return new SunHours(sunrise.getAsDouble(), sunset.getAsDouble(), Daylight.NORMAL);
        }
        SunEvent missing = sunrise.isEmpty() ? SunEvent.SUNRISE : SunEvent.SUNSET;
        Daylight daylight = SolarEphemeris.daylightOn(dateTime, latitude, longitude, missing);
        return new SunHours(sunrise.orElse(0.0), sunset.orElse(0.0), daylight);
    }

    private static String generateKey(ZonedDateTime dateTime, double latitude, double longitude) {
        return dateTime.toLocalDate() + "-" + dateTime.getOffset() + "-" + latitude + "-" + longitude;
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime, double latitude, double longitude) {
        CelestialState state = getCelestialState(dateTime, latitude, longitude);
        return "sunrise: " + format(state.sunriseHour()) +
               "\nsunset: " + format(state.sunsetHour()) +
               "\ndaylight: " + state.daylight() +
               "\nmoon_phase: " + String.format(Locale.ROOT, "%.3f", state.moonPhase());
    }

    @Override
    public void clearCache() {
        cache.invalidateAll();
    }

    long cachedDays() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static String format(double hour) {
        int minutes = (int) Math.round(hour * 60) % (24 * 60);
        return String.format(Locale.ROOT, "%02d:%02d", minutes / 60, minutes % 60);
    }

    private record SunHours(double sunrise, double sunset, Daylight daylight) {
    }
}
