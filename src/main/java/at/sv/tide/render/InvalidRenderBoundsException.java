package at.sv.tide.render;

/**
 * Signals a render area whose hour or tide domain has no extent, which would lead to a division by zero when mapping.
 */
public class InvalidRenderBoundsException extends RuntimeException {
    public InvalidRenderBoundsException(String message) {
        super(message);
    }
}
