package org.profilekit.service.compose;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.profilekit.exception.ApiError;
import org.profilekit.model.AlphaMask;
import org.profilekit.model.CompositeResult;
import org.profilekit.model.LayoutSpec;
import org.profilekit.model.RasterImage;
import org.profilekit.model.enums.PasteOutcome;
import org.profilekit.model.enums.ResizePolicy;
import org.profilekit.util.RasterImageUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a circular portrait over a banner for each requested layout.
 * <p>
 * Inputs are validated up front, before any buffer is allocated. Masks and cropped portraits are
 * cached per diameter for the duration of one call only; nothing is retained between calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PreviewCompositor {

    private final MaskGenerator maskGenerator;
    private final ImageResizer imageResizer;

    public AlphaMask generateMask(int size) {
        return maskGenerator.generateMask(size);
    }

    public List<CompositeResult> composePreviews(RasterImage portrait, RasterImage banner, List<LayoutSpec> layouts) {
        validate(portrait, banner, layouts);

        Map<Integer, RasterImage> maskedPortraits = new HashMap<>();
        List<CompositeResult> results = new ArrayList<>(layouts.size());
        for (LayoutSpec layout : layouts) {
            RasterImage canvas = RasterImageUtils.withAlpha(
                    imageResizer.resize(banner, layout.getCanvasWidth(), layout.getCanvasHeight(), ResizePolicy.STRETCH_TO_FILL));

            if (!layout.portraitOverlapsCanvas()) {
                log.warn("Portrait anchored at ({}, {}) lies outside the {}x{} canvas of layout '{}', returning banner only",
                        layout.getAnchorX(), layout.getAnchorY(), layout.getCanvasWidth(), layout.getCanvasHeight(), layout.getName());
                results.add(new CompositeResult(layout.getName(), canvas, PasteOutcome.NONE));
                continue;
            }

            RasterImage maskedPortrait = maskedPortraits.computeIfAbsent(layout.getPortraitDiameter(),
                    diameter -> maskPortrait(portrait, diameter));
            RasterImage composite = alphaOver(canvas, maskedPortrait, layout.getAnchorX(), layout.getAnchorY());
            PasteOutcome outcome = layout.portraitFitsCanvas() ? PasteOutcome.FULL : PasteOutcome.CLIPPED;

            log.debug("Composed layout '{}' {}x{}, portrait {}px at ({}, {}), outcome {}",
                    layout.getName(), layout.getCanvasWidth(), layout.getCanvasHeight(),
                    layout.getPortraitDiameter(), layout.getAnchorX(), layout.getAnchorY(), outcome);
            results.add(new CompositeResult(layout.getName(), composite, outcome));
        }
        return results;
    }

    /**
     * Crops the portrait to a {@code diameter}-sized square and multiplies its alpha with a circular mask.
     */
    public RasterImage maskPortrait(RasterImage portrait, int diameter) {
        RasterImage cropped = imageResizer.resize(portrait, diameter, diameter, ResizePolicy.CENTER_CROP_TO_FILL);
        return applyMask(cropped, maskGenerator.generateMask(diameter));
    }

    /**
     * @return a 4-channel copy of {@code image} whose alpha is {@code imageAlpha * maskAlpha / 255}
     */
    public RasterImage applyMask(RasterImage image, AlphaMask mask) {
        image.requireWellFormed("masked image");
        if (image.getWidth() != mask.getWidth() || image.getHeight() != mask.getHeight()) {
            throw ApiError.INVALID_ARGUMENT.createException("mask " + mask.getWidth() + "x" + mask.getHeight()
                    + " does not match image " + image.getWidth() + "x" + image.getHeight());
        }
        RasterImage rgba = RasterImageUtils.withAlpha(image);
        byte[] data = rgba.copyData();
        byte[] maskData = mask.copyData();
        for (int p = 0; p < maskData.length; p++) {
            int a = data[p * 4 + 3] & 0xFF;
            int m = maskData[p] & 0xFF;
            data[p * 4 + 3] = (byte) mulDiv255(a, m);
        }
        return new RasterImage(rgba.getWidth(), rgba.getHeight(), RasterImage.RGBA, data);
    }

    /**
     * Pastes {@code overlay} onto a copy of {@code canvas} with its top-left at (anchorX, anchorY),
     * clipped to the canvas. Both images must carry alpha.
     */
    public RasterImage alphaOver(RasterImage canvas, RasterImage overlay, int anchorX, int anchorY) {
        int cw = canvas.getWidth();
        int ch = canvas.getHeight();
        int ow = overlay.getWidth();

        int x0 = Math.max(0, anchorX);
        int y0 = Math.max(0, anchorY);
        int x1 = (int) Math.min(cw, (long) anchorX + ow);
        int y1 = (int) Math.min(ch, (long) anchorY + overlay.getHeight());

        byte[] dst = canvas.copyData();
        if (x0 >= x1 || y0 >= y1) {
            return new RasterImage(cw, ch, RasterImage.RGBA, dst);
        }
        byte[] src = overlay.copyData();
        for (int y = y0; y < y1; y++) {
            int srcRow = (y - anchorY) * ow;
            int dstRow = y * cw;
            for (int x = x0; x < x1; x++) {
                int s = (srcRow + x - anchorX) * 4;
                int d = (dstRow + x) * 4;
                int sa = src[s + 3] & 0xFF;
                if (sa == 0) {
                    continue;
                }
                if (sa == 255) {
                    System.arraycopy(src, s, dst, d, 4);
                    continue;
                }
                int inv = 255 - sa;
                for (int c = 0; c < 3; c++) {
                    dst[d + c] = (byte) (((src[s + c] & 0xFF) * sa + (dst[d + c] & 0xFF) * inv + 127) / 255);
                }
                int da = dst[d + 3] & 0xFF;
                dst[d + 3] = (byte) (sa + mulDiv255(da, inv));
            }
        }
        return new RasterImage(cw, ch, RasterImage.RGBA, dst);
    }

    private void validate(RasterImage portrait, RasterImage banner, List<LayoutSpec> layouts) {
        if (portrait == null) {
            throw ApiError.INVALID_INPUT.createException("portrait is missing");
        }
        if (banner == null) {
            throw ApiError.INVALID_INPUT.createException("banner is missing");
        }
        portrait.requireWellFormed("portrait");
        banner.requireWellFormed("banner");
        if (layouts == null) {
            throw ApiError.INVALID_ARGUMENT.createException("layouts must not be null");
        }
        for (LayoutSpec layout : layouts) {
            if (layout == null) {
                throw ApiError.INVALID_ARGUMENT.createException("layouts must not contain null entries");
            }
            layout.validate();
        }
    }

    private static int mulDiv255(int a, int b) {
        return (a * b + 127) / 255;
    }
}
