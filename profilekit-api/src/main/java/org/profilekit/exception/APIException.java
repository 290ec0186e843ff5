package org.profilekit.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class APIException extends RuntimeException {

    private final ApiError error;
    private final HttpStatus status;

    public APIException(ApiError error, String message) {
        super(message);
        this.error = error;
        this.status = error.getStatus();
    }

    public APIException(ApiError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.status = error.getStatus();
    }
}
