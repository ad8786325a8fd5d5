package org.finos.legend.querybuild.store;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the column a record component maps to when a {@link FieldCatalog}
 * is derived from a record class. Without it the column is the snake_case
 * form of the component name.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface ColumnName {

    String value();
}
