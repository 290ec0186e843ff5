package org.profilekit.service.image;

import lombok.extern.slf4j.Slf4j;
import org.profilekit.exception.ApiError;
import org.profilekit.model.RasterImage;
import org.profilekit.util.RasterImageUtils;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Decodes uploaded images into raster buffers and encodes rendered previews as PNG.
 */
@Slf4j
@Service
public class PreviewImageCodec {

    public RasterImage decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw ApiError.IMAGE_DECODE_FAILED.createException("no image data");
        }
        BufferedImage image = null;
        try (ByteArrayInputStream bais = new ByteArrayInputStream(bytes)) {
            image = ImageIO.read(bais);
            if (image == null) {
                log.warn("Uploaded data ({} bytes) is not a supported image format", bytes.length);
                throw ApiError.IMAGE_DECODE_FAILED.createException("unsupported image format");
            }
            return RasterImageUtils.fromBufferedImage(image);
        } catch (IOException e) {
            log.warn("Failed to decode uploaded image: {}", e.getMessage());
            throw ApiError.IMAGE_DECODE_FAILED.createException(e, e.getMessage());
        } finally {
            if (image != null) {
                image.flush();
            }
        }
    }

    public byte[] encodePng(RasterImage image) {
        image.requireWellFormed("preview");
        BufferedImage buffered = RasterImageUtils.toBufferedImage(image);
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(buffered, "png", baos)) {
                throw ApiError.IMAGE_ENCODE_FAILED.createException("no PNG writer available");
            }
            return baos.toByteArray();
        } catch (IOException e) {
            log.error("PNG encoding failed for {}", image, e);
            throw ApiError.IMAGE_ENCODE_FAILED.createException(e, e.getMessage());
        } finally {
            buffered.flush();
        }
    }
}
