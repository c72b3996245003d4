package org.dbtable.table;

import org.dbtable.exception.TableConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

import static org.dbtable.config.DbTableConstants.BOOL_FALSE;
import static org.dbtable.config.DbTableConstants.BOOL_TRUE;

/**
 * One row of a table: current column values plus the set of columns changed
 * since the row was loaded or last saved.
 *
 * <p>This is also the base row type. Tables with their own row class
 * subclass it and add typed accessors over {@link #getColumn} and
 * {@link #setColumn}.</p>
 */
public class Row {

    private final TableGateway<?> table;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Set<String> modified = new LinkedHashSet<>();

    /**
     * @param table the owning table
     * @param initialValues column values, keyed by column name (case-insensitive)
     * @throws TableConfigurationException if a key is not a column of the table
     */
    public Row(TableGateway<?> table, Map<String, ?> initialValues) {
        if (table == null) {
            throw new TableConfigurationException("A row needs its owning table");
        }
        this.table = table;
        for (Map.Entry<String, ?> entry : initialValues.entrySet()) {
            values.put(requireColumn(entry.getKey()), entry.getValue());
        }
    }

    public TableGateway<?> getTable() {
        return table;
    }

    /**
     * @param name column name, case-insensitive
     * @return the current value, null if the column has no value
     * @throws TableConfigurationException if the table has no such column
     */
    public Object getColumn(String name) {
        return values.get(requireColumn(name));
    }

    public String getString(String name) {
        Object value = getColumn(name);
        return value == null ? null : value.toString();
    }

    /**
     * Reads a BOOL pseudo-type column stored as {@code 'Y'} / {@code 'N'}.
     *
     * @return null when the column has no value
     */
    public Boolean getBoolean(String name) {
        String value = getString(name);
        if (value == null) {
            return null;
        }
        return BOOL_TRUE.equalsIgnoreCase(value.trim());
    }

    /**
     * Sets a column value and marks the column modified.
     *
     * @throws TableConfigurationException if the table has no such column
     */
    public void setColumn(String name, Object value) {
        String column = requireColumn(name);
        values.put(column, value);
        modified.add(column);
    }

    /**
     * Writes a BOOL pseudo-type column as {@code 'Y'} / {@code 'N'}; null clears it.
     */
    public void setBoolean(String name, Boolean value) {
        setColumn(name, value == null ? null : (value ? BOOL_TRUE : BOOL_FALSE));
    }

    public boolean isModified() {
        return !modified.isEmpty();
    }

    /**
     * Names of the columns changed since load or the last save.
     */
    public Set<String> modifiedColumns() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(modified));
    }

    public Optional<String> primaryColumn() {
        return table.primaryColumn();
    }

    /**
     * @throws TableConfigurationException if the table has no primary column
     */
    public Object primaryColumnValue() {
        String primary = primaryColumn().orElseThrow(() ->
                new TableConfigurationException(table.fullTableName() + " has no primary column"));
        return values.get(primary);
    }

    /**
     * Read-only view of the current values, keyed by column name.
     */
    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    public OptionalInt save() {
        return table.save(this);
    }

    public OptionalInt delete() {
        return table.delete(this);
    }

    public OptionalInt insert() {
        return table.insert(this);
    }

    public OptionalInt update() {
        return table.update(this);
    }

    void markSaved() {
        modified.clear();
    }

    private String requireColumn(String name) {
        return table.getColumn(name)
                .orElseThrow(() -> new TableConfigurationException(
                        "No column " + name + " in " + table.fullTableName()))
                .getName();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + table.fullTableName() + " " + values +
                (modified.isEmpty() ? "" : ", modified=" + modified) + "}";
    }
}
