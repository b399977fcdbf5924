package at.sv.tide.tide;

import lombok.Getter;

@Getter
public class TideTableParseException extends TideDataException {

    private final String resourceName;
    private final int lineNumber;

    public TideTableParseException(String resourceName, int lineNumber, String line, Throwable cause) {
        super("Invalid tide row in '" + resourceName + "' at line " + lineNumber + ": '" + line + "'"
              + (cause != null ? " (" + cause.getMessage() + ")" : ""), cause);
        this.resourceName = resourceName;
        this.lineNumber = lineNumber;
    }

    public TideTableParseException(String resourceName, int lineNumber, String line, String reason) {
        super("Invalid tide row in '" + resourceName + "' at line " + lineNumber + ": '" + line + "' (" + reason + ")");
        this.resourceName = resourceName;
        this.lineNumber = lineNumber;
    }
}
