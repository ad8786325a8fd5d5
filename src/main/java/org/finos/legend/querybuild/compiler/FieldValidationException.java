package org.finos.legend.querybuild.compiler;

/**
 * A request named a field that is not in the entity's catalog.
 */
public class FieldValidationException extends QueryBuildException {

    private final String fieldName;

    public FieldValidationException(String fieldName) {
        super("invalid field name: " + fieldName);
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
