package org.profilekit.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Arrays;

/**
 * Single-channel 8-bit opacity map, 0 fully transparent, 255 fully opaque.
 */
@Getter
public final class AlphaMask {

    private final int width;
    private final int height;

    @Getter(AccessLevel.NONE)
    private final byte[] alpha;

    public AlphaMask(int width, int height, byte[] alpha) {
        if ((long) width * height != alpha.length) {
            throw new IllegalArgumentException("Mask buffer holds " + alpha.length + " bytes, expected " + width * height);
        }
        this.width = width;
        this.height = height;
        this.alpha = alpha.clone();
    }

    public int getAlpha(int x, int y) {
        return alpha[y * width + x] & 0xFF;
    }

    public byte[] copyData() {
        return alpha.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlphaMask other)) return false;
        return width == other.width && height == other.height && Arrays.equals(alpha, other.alpha);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(alpha);
    }

    @Override
    public String toString() {
        return "AlphaMask(" + width + "x" + height + ")";
    }
}
