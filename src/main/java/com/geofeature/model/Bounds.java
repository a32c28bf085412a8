package com.geofeature.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Envelope;

/**
 * Bounds represents an axis-aligned bounding box.
 * A new instance is empty until initialized or expanded; an empty box has no
 * coordinates and never contributes to a union.
 */
@Getter
@EqualsAndHashCode
@NoArgsConstructor
public class Bounds {
    private boolean empty = true;
    private double minX;
    private double minY;
    private double maxX;
    private double maxY;

    public static Bounds empty() {
        return new Bounds();
    }

    public static Bounds of(double minX, double minY, double maxX, double maxY) {
        Bounds bounds = new Bounds();
        bounds.init(minX, minY, maxX, maxY);
        return bounds;
    }

    /**
     * Convert a JTS envelope; a null envelope becomes an empty box
     */
    public static Bounds fromEnvelope(Envelope envelope) {
        if (envelope == null || envelope.isNull()) {
            return empty();
        }
        return of(envelope.getMinX(), envelope.getMinY(), envelope.getMaxX(), envelope.getMaxY());
    }

    /**
     * Set all four corners. Swapped corners are normalized.
     */
    public void init(double x0, double y0, double x1, double y1) {
        minX = Math.min(x0, x1);
        minY = Math.min(y0, y1);
        maxX = Math.max(x0, x1);
        maxY = Math.max(y0, y1);
        empty = false;
    }

    public void expandToInclude(double x, double y) {
        if (empty) {
            init(x, y, x, y);
        } else {
            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
            maxX = Math.max(maxX, x);
            maxY = Math.max(maxY, y);
        }
    }

    public void expandToInclude(Bounds other) {
        if (other == null || other.empty) return;
        if (empty) {
            init(other.minX, other.minY, other.maxX, other.maxY);
        } else {
            minX = Math.min(minX, other.minX);
            minY = Math.min(minY, other.minY);
            maxX = Math.max(maxX, other.maxX);
            maxY = Math.max(maxY, other.maxY);
        }
    }

    public double getWidth() {
        return empty ? 0 : maxX - minX;
    }

    public double getHeight() {
        return empty ? 0 : maxY - minY;
    }

    public boolean contains(double x, double y) {
        return !empty && x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    public boolean intersects(Bounds other) {
        if (empty || other == null || other.empty) return false;
        return other.minX <= maxX && other.maxX >= minX
                && other.minY <= maxY && other.maxY >= minY;
    }

    public Envelope toEnvelope() {
        return empty ? new Envelope() : new Envelope(minX, maxX, minY, maxY);
    }

    @Override
    public String toString() {
        if (empty) {
            return "Bounds(empty)";
        }
        return "Bounds(" + minX + "," + minY + "," + maxX + "," + maxY + ")";
    }
}
