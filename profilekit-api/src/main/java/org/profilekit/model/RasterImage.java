package org.profilekit.model;

import lombok.AccessLevel;
import lombok.Getter;
import org.profilekit.exception.ApiError;

import java.util.Arrays;

/**
 * Interleaved 8-bit pixel buffer, row-major, RGB or RGBA.
 * <p>
 * Instances never expose their backing array; {@link #copyData()} hands out a copy.
 * Construction does not reject malformed buffers so that callers can hand over whatever
 * they decoded; every operation consuming an image calls {@link #requireWellFormed(String)} first.
 */
@Getter
public final class RasterImage {

    public static final int RGB = 3;
    public static final int RGBA = 4;

    private final int width;
    private final int height;
    private final int channels;

    @Getter(AccessLevel.NONE)
    private final byte[] data;

    public RasterImage(int width, int height, int channels, byte[] data) {
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data == null ? new byte[0] : data.clone();
    }

    /**
     * Allocates an image filled with a single colour. Alpha is ignored for {@link #RGB} images.
     */
    public static RasterImage filled(int width, int height, int channels, int red, int green, int blue, int alpha) {
        if (width <= 0 || height <= 0) {
            throw ApiError.INVALID_ARGUMENT.createException("image dimensions must be positive, got " + width + "x" + height);
        }
        if (channels != RGB && channels != RGBA) {
            throw ApiError.INVALID_ARGUMENT.createException("channel count must be 3 or 4, got " + channels);
        }
        byte[] pixels = new byte[width * height * channels];
        for (int i = 0; i < pixels.length; i += channels) {
            pixels[i] = (byte) red;
            pixels[i + 1] = (byte) green;
            pixels[i + 2] = (byte) blue;
            if (channels == RGBA) {
                pixels[i + 3] = (byte) alpha;
            }
        }
        return new RasterImage(width, height, channels, pixels);
    }

    public boolean hasAlpha() {
        return channels == RGBA;
    }

    public boolean isWellFormed() {
        return width > 0
                && height > 0
                && (channels == RGB || channels == RGBA)
                && (long) width * height * channels == data.length;
    }

    /**
     * @param role name used in the error message, e.g. "portrait"
     * @return this image, for chaining
     */
    public RasterImage requireWellFormed(String role) {
        if (width <= 0 || height <= 0) {
            throw ApiError.INVALID_INPUT.createException(role + " has zero area (" + width + "x" + height + ")");
        }
        if (channels != RGB && channels != RGBA) {
            throw ApiError.INVALID_INPUT.createException(role + " has unsupported channel count " + channels);
        }
        long expected = (long) width * height * channels;
        if (expected != data.length) {
            throw ApiError.INVALID_INPUT.createException(role + " declares " + expected + " bytes but buffer holds " + data.length);
        }
        return this;
    }

    /**
     * @return the sample of channel {@code channel} at (x, y), in [0, 255]
     */
    public int getSample(int x, int y, int channel) {
        return data[(y * width + x) * channels + channel] & 0xFF;
    }

    /**
     * Alpha at (x, y); 255 for images without an alpha channel.
     */
    public int getAlpha(int x, int y) {
        return hasAlpha() ? getSample(x, y, 3) : 255;
    }

    public byte[] copyData() {
        return data.clone();
    }

    public int byteLength() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RasterImage other)) return false;
        return width == other.width
                && height == other.height
                && channels == other.channels
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(width);
        result = 31 * result + Integer.hashCode(height);
        result = 31 * result + Integer.hashCode(channels);
        result = 31 * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public String toString() {
        return "RasterImage(" + width + "x" + height + "x" + channels + ")";
    }
}
