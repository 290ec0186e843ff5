package org.profilekit.service.compose;

import lombok.extern.slf4j.Slf4j;
import org.profilekit.exception.ApiError;
import org.profilekit.model.AlphaMask;
import org.springframework.stereotype.Service;

/**
 * Circular opacity masks for cropping portraits.
 * <p>
 * Hard edge, sampled at pixel centres: a pixel is opaque when its centre lies on or inside the
 * inscribed circle, i.e. {@code (2x+1-size)^2 + (2y+1-size)^2 <= size^2}. The test is symmetric
 * under flips and transposition and uses integer arithmetic only, so the output for a given size
 * never varies.
 */
@Slf4j
@Service
public class MaskGenerator {

    public AlphaMask generateMask(int size) {
        if (size <= 0) {
            throw ApiError.INVALID_ARGUMENT.createException("mask size must be positive, got " + size);
        }
        long radiusSq = (long) size * size;
        byte[] alpha = new byte[size * size];
        for (int y = 0; y < size; y++) {
            long dy = 2L * y + 1 - size;
            long dySq = dy * dy;
            int row = y * size;
            for (int x = 0; x < size; x++) {
                long dx = 2L * x + 1 - size;
                if (dx * dx + dySq <= radiusSq) {
                    alpha[row + x] = (byte) 0xFF;
                }
            }
        }
        log.debug("Generated {}x{} circular mask", size, size);
        return new AlphaMask(size, size, alpha);
    }
}
