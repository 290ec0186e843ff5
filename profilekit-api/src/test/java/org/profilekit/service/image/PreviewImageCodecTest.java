package org.profilekit.service.image;

import org.junit.jupiter.api.Test;
import org.profilekit.exception.APIException;
import org.profilekit.exception.ApiError;
import org.profilekit.model.RasterImage;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.profilekit.TestImages.*;

class PreviewImageCodecTest {

    private final PreviewImageCodec codec = new PreviewImageCodec();

    @Test
    void decode_opaquePngYieldsRgbImage() {
        RasterImage image = codec.decode(png(12, 7, 0xFF0000FF, false));

        assertThat(image.getWidth()).isEqualTo(12);
        assertThat(image.getHeight()).isEqualTo(7);
        assertThat(image.getChannels()).isEqualTo(RasterImage.RGB);
        assertThat(rgbAt(image, 3, 3)).containsExactly(BLUE);
    }

    @Test
    void decode_transparentPngKeepsAlpha() {
        RasterImage image = codec.decode(png(5, 5, 0x40FF0000, true));

        assertThat(image.getChannels()).isEqualTo(RasterImage.RGBA);
        assertThat(image.getAlpha(2, 2)).isEqualTo(0x40);
        assertThat(rgbAt(image, 2, 2)).containsExactly(RED);
    }

    @Test
    void decode_rejectsUnsupportedBytes() {
        byte[] notAnImage = "definitely not an image".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(notAnImage))
                .isInstanceOfSatisfying(APIException.class, e -> assertThat(e.getError()).isEqualTo(ApiError.IMAGE_DECODE_FAILED));
        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOfSatisfying(APIException.class, e -> assertThat(e.getError()).isEqualTo(ApiError.IMAGE_DECODE_FAILED));
        assertThatThrownBy(() -> codec.decode(null))
                .isInstanceOfSatisfying(APIException.class, e -> assertThat(e.getError()).isEqualTo(ApiError.IMAGE_DECODE_FAILED));
    }

    @Test
    void encodePng_writesReadablePngWithAlpha() throws IOException {
        RasterImage image = rgba(9, 4, GREEN, 200);

        byte[] bytes = codec.encodePng(image);

        assertThat(bytes).isNotEmpty();
        assertThat(bytes[1]).isEqualTo((byte) 'P');
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(bytes));
        assertThat(decoded.getWidth()).isEqualTo(9);
        assertThat(decoded.getHeight()).isEqualTo(4);
        assertThat(decoded.getRGB(4, 2)).isEqualTo(0xC800FF00);
    }

    @Test
    void encodePng_rejectsMalformedImage() {
        RasterImage malformed = new RasterImage(3, 3, RasterImage.RGB, new byte[5]);

        assertThatThrownBy(() -> codec.encodePng(malformed))
                .isInstanceOfSatisfying(APIException.class, e -> assertThat(e.getError()).isEqualTo(ApiError.INVALID_INPUT));
    }
}
