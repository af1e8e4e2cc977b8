package it.insurapro.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a lookup by key or position finds nothing.
 */
public class ResourceNotFoundException extends InsuraProException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
            String.format("%s not found with identifier: %s", resourceType, identifier),
            HttpStatus.NOT_FOUND,
            "CRM_ERR_404"
        );
    }

    public ResourceNotFoundException(String message) {
        super(message, HttpStatus.NOT_FOUND, "CRM_ERR_404");
    }
}
