package org.dbtable.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;
import org.dbtable.exception.TableConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.dbtable.config.DbTableConstants.DEFAULT_IDENTITY_KEYWORD;
import static org.dbtable.config.DbTableConstants.IDENTITY_CLAUSE;

/**
 * Immutable description of one table column: name, SQL type, sizing, options
 * and the table-creation directives attached to it.
 *
 * <p>Column lists are declared once per table type, in order:</p>
 * <pre>{@code
 * List.of(
 *     ColumnSchema.builder("EMPNO", "CHAR").length(6).options("NOT NULL").primary().build(),
 *     ColumnSchema.builder("NAME", "CHAR").length(12).build(),
 *     ColumnSchema.builder("ID", "INTEGER").generatedIdentity().build());
 * }</pre>
 *
 * <p>Names are normalised to upper case.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ColumnSchema {

    private final String name;
    private final String sqlType;
    private final String length;
    private final String options;
    private final Object defaultValue;
    private final boolean primary;
    private final List<String> constraints;
    private final List<String> foreignKeys;
    private final boolean generatedIdentity;
    private final String identityDirective;
    private final boolean noCreate;

    private ColumnSchema(Builder builder) {
        this.name = builder.name;
        this.sqlType = builder.sqlType;
        this.length = builder.length;
        this.options = builder.options;
        this.defaultValue = builder.defaultValue;
        this.primary = builder.primary;
        this.constraints = Collections.unmodifiableList(new ArrayList<>(builder.constraints));
        this.foreignKeys = Collections.unmodifiableList(new ArrayList<>(builder.foreignKeys));
        this.generatedIdentity = builder.generatedIdentity;
        this.identityDirective = builder.identityDirective;
        this.noCreate = builder.noCreate;
    }

    /**
     * Starts a column descriptor.
     *
     * @param name column name, upper-cased on build
     * @param sqlType SQL type, e.g. {@code CHAR}, {@code DECIMAL} or the {@code BOOL} pseudo-type
     * @return a new Builder
     */
    public static Builder builder(String name, String sqlType) {
        return new Builder(name, sqlType);
    }

    public Optional<String> length() {
        return Optional.ofNullable(length);
    }

    public Optional<String> options() {
        return Optional.ofNullable(options);
    }

    /**
     * Whether the options text itself declares an identity column.
     */
    public boolean optionsDeclareIdentity() {
        return options != null && StringUtils.containsIgnoreCase(options, IDENTITY_CLAUSE);
    }

    /**
     * Whether the column value is assigned by the database, either through a
     * generated-identity directive or through its options text.
     */
    public boolean isIdentity() {
        return generatedIdentity || optionsDeclareIdentity();
    }

    /**
     * Value of a single attribute.
     *
     * <p>Boolean flags are only present when set. The identity directive is
     * absent both when the column is not an identity and when it uses the
     * default directive.</p>
     *
     * @param field the attribute
     * @return the value, or empty if the attribute is not present on this column
     */
    public Optional<Object> get(ColumnField field) {
        switch (field) {
            case COLUMN:
                return Optional.of(name);
            case TYPE:
                return Optional.of(sqlType);
            case LENGTH:
                return Optional.ofNullable(length);
            case OPTS:
                return Optional.ofNullable(options);
            case DEFAULT:
                return Optional.ofNullable(defaultValue);
            case PRIMARY:
                return primary ? Optional.of(Boolean.TRUE) : Optional.empty();
            case CONSTRAINT:
                return constraints.isEmpty() ? Optional.empty() : Optional.of(constraints);
            case FOREIGNKEY:
                return foreignKeys.isEmpty() ? Optional.empty() : Optional.of(foreignKeys);
            case GENERATEDIDENTITY:
                return Optional.ofNullable(identityDirective);
            case NOCREATE:
                return noCreate ? Optional.of(Boolean.TRUE) : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    /**
     * Builder for ColumnSchema instances.
     */
    public static final class Builder {
        private final String name;
        private final String sqlType;
        private String length;
        private String options;
        private Object defaultValue;
        private boolean primary;
        private final List<String> constraints = new ArrayList<>();
        private final List<String> foreignKeys = new ArrayList<>();
        private boolean generatedIdentity;
        private String identityDirective;
        private boolean noCreate;

        private Builder(String name, String sqlType) {
            if (StringUtils.isBlank(name)) {
                throw new TableConfigurationException("Column name must not be blank");
            }
            if (StringUtils.isBlank(sqlType)) {
                throw new TableConfigurationException("Column " + name + " needs a SQL type");
            }
            this.name = name.trim().toUpperCase(Locale.ROOT);
            this.sqlType = sqlType.trim();
        }

        public Builder length(int length) {
            this.length = String.valueOf(length);
            return this;
        }

        /**
         * Length text for sized types, e.g. {@code "8,2"} for a DECIMAL.
         */
        public Builder length(String length) {
            this.length = StringUtils.trimToNull(length);
            return this;
        }

        /**
         * Free-text column option fragment, e.g. {@code "NOT NULL"}.
         */
        public Builder options(String options) {
            this.options = StringUtils.trimToNull(options);
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder primary() {
            this.primary = true;
            return this;
        }

        /**
         * Adds table-level constraint text, emitted as {@code CONSTRAINT <text>} on creation.
         */
        public Builder constraint(String... constraints) {
            this.constraints.addAll(Arrays.asList(constraints));
            return this;
        }

        /**
         * Adds a reference, emitted as {@code FOREIGN KEY (<column>) REFERENCES <text>} on creation.
         * The text starts with the referenced table and may carry ON DELETE / ON UPDATE clauses.
         */
        public Builder foreignKey(String... references) {
            this.foreignKeys.addAll(Arrays.asList(references));
            return this;
        }

        /**
         * Marks the column as a database-generated identity using the default directive.
         */
        public Builder generatedIdentity() {
            return generatedIdentity(null);
        }

        /**
         * Marks the column as a database-generated identity.
         *
         * @param directive identity options text such as {@code "(START WITH 100)"};
         *                  null or {@code "default"} selects the default directive
         */
        public Builder generatedIdentity(String directive) {
            String trimmed = StringUtils.trimToNull(directive);
            this.generatedIdentity = true;
            this.identityDirective = DEFAULT_IDENTITY_KEYWORD.equalsIgnoreCase(trimmed) ? null : trimmed;
            return this;
        }

        /**
         * Excludes the column from INSERT statements.
         */
        public Builder noCreate() {
            this.noCreate = true;
            return this;
        }

        public ColumnSchema build() {
            return new ColumnSchema(this);
        }
    }
}
