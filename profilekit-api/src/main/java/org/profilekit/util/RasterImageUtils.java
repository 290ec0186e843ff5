package org.profilekit.util;

import lombok.experimental.UtilityClass;
import org.profilekit.model.RasterImage;

import java.awt.image.BufferedImage;

/**
 * Bridges {@link RasterImage} and Java2D. Conversions go through packed ARGB ints so the
 * colour model of the incoming {@link BufferedImage} does not matter.
 */
@UtilityClass
public class RasterImageUtils {

    public BufferedImage toBufferedImage(RasterImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int type = image.hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage out = new BufferedImage(w, h, type);
        byte[] data = image.copyData();
        int channels = image.getChannels();
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            int base = y * w * channels;
            for (int x = 0; x < w; x++) {
                int i = base + x * channels;
                int a = channels == RasterImage.RGBA ? data[i + 3] & 0xFF : 0xFF;
                row[x] = (a << 24) | ((data[i] & 0xFF) << 16) | ((data[i + 1] & 0xFF) << 8) | (data[i + 2] & 0xFF);
            }
            out.setRGB(0, y, w, 1, row, 0, w);
        }
        return out;
    }

    /**
     * @param channels {@link RasterImage#RGB} drops alpha, {@link RasterImage#RGBA} keeps it
     */
    public RasterImage fromBufferedImage(BufferedImage image, int channels) {
        int w = image.getWidth();
        int h = image.getHeight();
        byte[] data = new byte[w * h * channels];
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            int base = y * w * channels;
            for (int x = 0; x < w; x++) {
                int argb = row[x];
                int i = base + x * channels;
                data[i] = (byte) (argb >>> 16);
                data[i + 1] = (byte) (argb >>> 8);
                data[i + 2] = (byte) argb;
                if (channels == RasterImage.RGBA) {
                    data[i + 3] = (byte) (argb >>> 24);
                }
            }
        }
        return new RasterImage(w, h, channels, data);
    }

    public RasterImage fromBufferedImage(BufferedImage image) {
        return fromBufferedImage(image, image.getColorModel().hasAlpha() ? RasterImage.RGBA : RasterImage.RGB);
    }

    /**
     * Copies an image into a 4-channel buffer; missing alpha becomes fully opaque.
     */
    public RasterImage withAlpha(RasterImage image) {
        if (image.hasAlpha()) {
            return image;
        }
        int pixels = image.getWidth() * image.getHeight();
        byte[] src = image.copyData();
        byte[] dst = new byte[pixels * RasterImage.RGBA];
        for (int p = 0, s = 0, d = 0; p < pixels; p++, s += 3, d += 4) {
            dst[d] = src[s];
            dst[d + 1] = src[s + 1];
            dst[d + 2] = src[s + 2];
            dst[d + 3] = (byte) 0xFF;
        }
        return new RasterImage(image.getWidth(), image.getHeight(), RasterImage.RGBA, dst);
    }
}
