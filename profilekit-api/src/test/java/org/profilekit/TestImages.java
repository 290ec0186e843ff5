package org.profilekit;

import org.profilekit.model.RasterImage;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

public final class TestImages {

    public static final int[] RED = {255, 0, 0};
    public static final int[] GREEN = {0, 255, 0};
    public static final int[] BLUE = {0, 0, 255};

    private TestImages() {
    }

    public static RasterImage opaque(int width, int height, int[] rgb) {
        return RasterImage.filled(width, height, RasterImage.RGB, rgb[0], rgb[1], rgb[2], 255);
    }

    public static RasterImage rgba(int width, int height, int[] rgb, int alpha) {
        return RasterImage.filled(width, height, RasterImage.RGBA, rgb[0], rgb[1], rgb[2], alpha);
    }

    /**
     * Three equal vertical bands: outer bands {@code sides}, middle band {@code middle}.
     */
    public static RasterImage verticalBands(int bandWidth, int height, int[] sides, int[] middle) {
        int width = bandWidth * 3;
        byte[] data = new byte[width * height * 3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int[] c = (x >= bandWidth && x < 2 * bandWidth) ? middle : sides;
                int i = (y * width + x) * 3;
                data[i] = (byte) c[0];
                data[i + 1] = (byte) c[1];
                data[i + 2] = (byte) c[2];
            }
        }
        return new RasterImage(width, height, RasterImage.RGB, data);
    }

    public static int[] rgbAt(RasterImage image, int x, int y) {
        return new int[]{image.getSample(x, y, 0), image.getSample(x, y, 1), image.getSample(x, y, 2)};
    }

    public static byte[] png(int width, int height, int argb, boolean alpha) {
        BufferedImage image = new BufferedImage(width, height, alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, argb);
            }
        }
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
