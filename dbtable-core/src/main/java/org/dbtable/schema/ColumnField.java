package org.dbtable.schema;

/**
 * The individual attributes of a column descriptor that can be queried by name.
 */
public enum ColumnField {
    COLUMN,
    TYPE,
    LENGTH,
    OPTS,
    DEFAULT,
    PRIMARY,
    CONSTRAINT,
    FOREIGNKEY,
    GENERATEDIDENTITY,
    NOCREATE;

    /**
     * Resolves a field by its name, case-insensitive.
     *
     * @param name the field name, e.g. {@code "default"}
     * @return the field
     * @throws IllegalArgumentException if no field has that name
     */
    public static ColumnField fromString(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Column field name must not be blank");
        }
        return valueOf(name.trim().toUpperCase());
    }
}
