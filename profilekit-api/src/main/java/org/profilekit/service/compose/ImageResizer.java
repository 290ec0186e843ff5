package org.profilekit.service.compose;

import lombok.extern.slf4j.Slf4j;
import org.profilekit.exception.ApiError;
import org.profilekit.model.RasterImage;
import org.profilekit.model.enums.ResizePolicy;
import org.profilekit.util.RasterImageUtils;
import org.springframework.stereotype.Service;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Resizes images to exact target dimensions. The output keeps the source channel count; a resize
 * to the source's own dimensions returns an unchanged copy without resampling.
 */
@Slf4j
@Service
public class ImageResizer {

    public RasterImage resize(RasterImage source, int targetWidth, int targetHeight, ResizePolicy policy) {
        if (targetWidth <= 0 || targetHeight <= 0) {
            throw ApiError.INVALID_ARGUMENT.createException("resize target must be positive, got " + targetWidth + "x" + targetHeight);
        }
        if (source == null) {
            throw ApiError.INVALID_INPUT.createException("source image is missing");
        }
        source.requireWellFormed("source image");

        if (source.getWidth() == targetWidth && source.getHeight() == targetHeight) {
            return new RasterImage(targetWidth, targetHeight, source.getChannels(), source.copyData());
        }

        return switch (policy) {
            case STRETCH_TO_FILL -> stretchToFill(source, targetWidth, targetHeight);
            case CENTER_CROP_TO_FILL -> centerCropToFill(source, targetWidth, targetHeight);
        };
    }

    public RasterImage stretchToFill(RasterImage source, int targetWidth, int targetHeight) {
        return scaleRegion(source, 0, 0, source.getWidth(), source.getHeight(), targetWidth, targetHeight);
    }

    public RasterImage centerCropToFill(RasterImage source, int targetWidth, int targetHeight) {
        int srcW = source.getWidth();
        int srcH = source.getHeight();
        int cropW = srcW;
        int cropH = srcH;

        // cross-multiplied aspect comparison: srcW/srcH vs targetWidth/targetHeight
        long lhs = (long) srcW * targetHeight;
        long rhs = (long) targetWidth * srcH;
        if (lhs > rhs) {
            cropW = (int) Math.max(1, Math.round((double) srcH * targetWidth / targetHeight));
        } else if (lhs < rhs) {
            cropH = (int) Math.max(1, Math.round((double) srcW * targetHeight / targetWidth));
        }
        int cropX = (srcW - cropW) / 2;
        int cropY = (srcH - cropH) / 2;

        log.debug("Center crop {}x{} -> region {}x{} at ({}, {}) -> {}x{}",
                srcW, srcH, cropW, cropH, cropX, cropY, targetWidth, targetHeight);
        return scaleRegion(source, cropX, cropY, cropW, cropH, targetWidth, targetHeight);
    }

    private RasterImage scaleRegion(RasterImage source, int x, int y, int w, int h, int targetWidth, int targetHeight) {
        if (w == targetWidth && h == targetHeight) {
            return crop(source, x, y, w, h);
        }
        BufferedImage src = RasterImageUtils.toBufferedImage(source);
        // sub-image bounds keep interpolation from sampling pixels outside the crop region
        BufferedImage region = src.getSubimage(x, y, w, h);
        BufferedImage dst = new BufferedImage(targetWidth, targetHeight, src.getType());
        Graphics2D g = dst.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(region, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g.dispose();
        }
        RasterImage result = RasterImageUtils.fromBufferedImage(dst, source.getChannels());
        src.flush();
        dst.flush();
        return result;
    }

    private RasterImage crop(RasterImage source, int x, int y, int w, int h) {
        int channels = source.getChannels();
        byte[] src = source.copyData();
        byte[] dst = new byte[w * h * channels];
        int srcStride = source.getWidth() * channels;
        int rowBytes = w * channels;
        for (int row = 0; row < h; row++) {
            System.arraycopy(src, (y + row) * srcStride + x * channels, dst, row * rowBytes, rowBytes);
        }
        return new RasterImage(w, h, channels, dst);
    }
}
