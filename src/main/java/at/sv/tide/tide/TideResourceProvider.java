package at.sv.tide.tide;

import java.io.IOException;
import java.io.InputStream;

/**
 * Source of the annual tide tables, one resource per station and year.
 */
public interface TideResourceProvider {

    /**
     * @return a new stream of the table, to be closed by the caller
     * @throws TideResourceMissingException if there is no table for the given station and year
     * @throws IOException                  if the table exists but can't be opened
     */
    InputStream open(String stationId, int year) throws IOException;

    static String resourceName(String stationId, int year) {
        return "tides_" + stationId + "_" + year + ".txt";
    }
}
