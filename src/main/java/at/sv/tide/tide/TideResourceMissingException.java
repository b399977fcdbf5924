package at.sv.tide.tide;

public class TideResourceMissingException extends TideDataException {
    public TideResourceMissingException(String message) {
        super(message);
    }
}
