package it.insurapro.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a data file line does not decode to a record.
 * Raised by the record codec and absorbed by the loader; never reaches a client.
 */
public class MalformedRecordException extends InsuraProException {

    private final int fieldCount;

    public MalformedRecordException(String recordType, int expectedFields, int fieldCount) {
        super(
            String.format("Malformed %s record: expected %d fields, found %d",
                    recordType, expectedFields, fieldCount),
            HttpStatus.UNPROCESSABLE_ENTITY,
            "CRM_ERR_422"
        );
        this.fieldCount = fieldCount;
    }

    public int getFieldCount() {
        return fieldCount;
    }
}
