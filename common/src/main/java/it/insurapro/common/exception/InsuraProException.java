package it.insurapro.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception for all InsuraPro CRM business exceptions.
 */
@Getter
public class InsuraProException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public InsuraProException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public InsuraProException(String message, HttpStatus status, String errorCode, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }
}
