package org.profilekit.exception;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ApiErrorTest {

    @Test
    void createException_formatsDetails() {
        APIException e = ApiError.LAYOUT_NOT_FOUND.createException("watch");

        assertThat(e.getError()).isEqualTo(ApiError.LAYOUT_NOT_FOUND);
        assertThat(e.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(e.getMessage()).isEqualTo("Layout not found: watch");
    }

    @Test
    void createException_withoutDetailsDropsPlaceholder() {
        assertThat(ApiError.INVALID_INPUT.createException().getMessage()).isEqualTo("Invalid input image");
    }

    @Test
    void createException_keepsCause() {
        IOException cause = new IOException("disk full");

        APIException e = ApiError.IMAGE_ENCODE_FAILED.createException(cause, cause.getMessage());

        assertThat(e).hasCause(cause);
        assertThat(e.getMessage()).isEqualTo("Failed to encode preview image: disk full");
        assertThat(e.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
