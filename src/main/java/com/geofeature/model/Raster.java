package com.geofeature.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Objects;

/**
 * Pixel raster attached to a feature. Features share rasters by reference
 * and never look at the pixels.
 */
@Getter
public class Raster {

    private final Bounds extent;
    private final int width;
    private final int height;

    // ARGB, row-major
    @Getter(AccessLevel.NONE)
    private final int[] pixels;

    public Raster(Bounds extent, int width, int height, int[] pixels) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Raster size must not be negative: " + width + "x" + height);
        }
        Objects.requireNonNull(pixels, "pixels");
        int expected = pixelCount(width, height);
        if (pixels.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Pixel buffer holds %d values, expected %d for %dx%d", pixels.length, expected, width, height));
        }
        this.extent = Objects.requireNonNull(extent, "extent");
        this.width = width;
        this.height = height;
        this.pixels = pixels.clone();
    }

    /**
     * Create a fully transparent raster
     */
    public static Raster blank(Bounds extent, int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Raster size must not be negative: " + width + "x" + height);
        }
        return new Raster(extent, width, height, new int[pixelCount(width, height)]);
    }

    private static int pixelCount(int width, int height) {
        long count = (long) width * height;
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Raster too large: " + width + "x" + height);
        }
        return (int) count;
    }

    /**
     * Copy of the pixel buffer
     */
    public int[] getPixels() {
        return pixels.clone();
    }

    @Override
    public String toString() {
        return "Raster(" + width + "x" + height + ", extent=" + extent + ")";
    }
}
