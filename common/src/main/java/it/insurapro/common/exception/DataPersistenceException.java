package it.insurapro.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a data file cannot be opened or written during save.
 */
public class DataPersistenceException extends InsuraProException {

    private final String path;

    public DataPersistenceException(String path, String message, Throwable cause) {
        super(
            String.format("Cannot write data file '%s': %s", path, message),
            HttpStatus.INTERNAL_SERVER_ERROR,
            "CRM_ERR_500",
            cause
        );
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
