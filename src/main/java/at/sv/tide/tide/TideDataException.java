package at.sv.tide.tide;

/**
 * Base class for failures while loading tide tables. A failed load never replaces the previously loaded table.
 */
public class TideDataException extends RuntimeException {
    public TideDataException(String message) {
        super(message);
    }

    public TideDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
