package com.alchemist.model;

/**
 * Axis-aligned rectangle in world units. (x, y) is the top-left corner.
 */
public final class Rect {
    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public Rect(double x, double y, double width, double height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Rect size must not be negative: " + width + "x" + height);
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public static Rect centeredOn(double centerX, double centerY, double width, double height) {
        return new Rect(centerX - width / 2.0, centerY - height / 2.0, width, height);
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }
    public double getRight() { return x + width; }
    public double getBottom() { return y + height; }
    public double getCenterX() { return x + width / 2.0; }
    public double getCenterY() { return y + height / 2.0; }

    public Rect translate(double dx, double dy) {
        return new Rect(x + dx, y + dy, width, height);
    }

    // Touching edges do not count as overlap
    public boolean intersects(Rect other) {
        return x < other.getRight() && other.x < getRight()
                && y < other.getBottom() && other.y < getBottom();
    }

    public boolean contains(double px, double py) {
        return px >= x && px < getRight() && py >= y && py < getBottom();
    }

    @Override
    public String toString() {
        return "Rect[" + x + "," + y + " " + width + "x" + height + "]";
    }
}
