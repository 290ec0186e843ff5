package org.profilekit.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ApiError {
    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST, "Invalid argument: %s"),
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input image: %s"),
    IMAGE_DECODE_FAILED(HttpStatus.UNPROCESSABLE_ENTITY, "Cannot open image: %s"),
    IMAGE_ENCODE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to encode preview image: %s"),
    LAYOUT_NOT_FOUND(HttpStatus.NOT_FOUND, "Layout not found: %s");

    private final HttpStatus status;
    private final String message;

    ApiError(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public APIException createException(Object... details) {
        String formattedMessage = (details.length > 0) ? String.format(message, details) : message.replace(": %s", "");
        return new APIException(this, formattedMessage);
    }

    public APIException createException(Throwable cause, Object... details) {
        String formattedMessage = (details.length > 0) ? String.format(message, details) : message.replace(": %s", "");
        return new APIException(this, formattedMessage, cause);
    }
}
