package org.finos.legend.querybuild.execution;

/**
 * A single-row lookup matched no rows.
 */
public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String message) {
        super(message);
    }
}
