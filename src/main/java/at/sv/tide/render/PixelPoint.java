package at.sv.tide.render;

public record PixelPoint(double x, double y) {
    public static PixelPoint of(double x, double y) {
        return new PixelPoint(x, y);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ')';
    }
}
