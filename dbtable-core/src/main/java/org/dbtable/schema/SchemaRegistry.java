package org.dbtable.schema;

import lombok.extern.slf4j.Slf4j;
import org.dbtable.exception.TableConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Derived view of one table's ordered column declarations.
 *
 * <p>The declarations are pulled from the supplier on first use and everything
 * derived from them (column order, name lookup, primary and identity column)
 * is cached for the lifetime of the registry. {@link #reset()} drops all of
 * it at once and is meant for re-initialisation in tests.</p>
 *
 * <p>Not thread-safe. Callers sharing a table across threads must serialise access.</p>
 */
@Slf4j
public class SchemaRegistry {

    private final Supplier<List<ColumnSchema>> columnSource;
    private final boolean primaryColumnEnabled;

    private List<ColumnSchema> declarations;
    private List<String> columnOrder;
    private Map<String, ColumnSchema> columnsByName;
    private Optional<String> primaryColumn;
    private Optional<String> identityColumn;

    /**
     * Creates a registry whose primary column is inferred from the declarations.
     *
     * @param columnSource supplies the ordered column declarations
     */
    public SchemaRegistry(Supplier<List<ColumnSchema>> columnSource) {
        this(columnSource, true);
    }

    /**
     * Creates a registry.
     *
     * @param columnSource supplies the ordered column declarations
     * @param primaryColumnEnabled false for tables that explicitly have no primary column
     */
    public SchemaRegistry(Supplier<List<ColumnSchema>> columnSource, boolean primaryColumnEnabled) {
        this.columnSource = columnSource;
        this.primaryColumnEnabled = primaryColumnEnabled;
    }

    /**
     * The column declarations in declared order.
     */
    public List<ColumnSchema> declarations() {
        if (declarations == null) {
            List<ColumnSchema> declared = columnSource.get();
            if (declared == null || declared.isEmpty()) {
                throw new TableConfigurationException("Table must declare at least one column");
            }
            declarations = Collections.unmodifiableList(new ArrayList<>(declared));
        }
        return declarations;
    }

    /**
     * Column names in declaration order.
     *
     * @throws TableConfigurationException if two declarations share a name
     */
    public List<String> columnList() {
        if (columnOrder == null) {
            columnOrder = Collections.unmodifiableList(new ArrayList<>(columnsByName().keySet()));
        }
        return columnOrder;
    }

    /**
     * All descriptors keyed by column name, iterating in declaration order.
     *
     * @throws TableConfigurationException if two declarations share a name
     */
    public Map<String, ColumnSchema> columnsByName() {
        if (columnsByName == null) {
            Map<String, ColumnSchema> byName = new LinkedHashMap<>();
            for (ColumnSchema column : declarations()) {
                if (byName.put(column.getName(), column) != null) {
                    throw new TableConfigurationException("Column " + column.getName() + " is declared twice");
                }
            }
            columnsByName = Collections.unmodifiableMap(byName);
            log.debug("Derived schema registry with columns {}", columnsByName.keySet());
        }
        return columnsByName;
    }

    /**
     * Looks up a descriptor by name, case-insensitive.
     *
     * @param name the column name
     * @return the descriptor, or empty if the table has no such column
     */
    public Optional<ColumnSchema> getColumn(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(columnsByName().get(name.toUpperCase(Locale.ROOT)));
    }

    /**
     * Looks up one attribute of a column.
     *
     * @param name the column name, case-insensitive
     * @param field the attribute
     * @return the value, or empty if the column or the attribute is absent
     */
    public Optional<Object> getColumn(String name, ColumnField field) {
        return getColumn(name).flatMap(column -> column.get(field));
    }

    public boolean hasColumn(String name) {
        return getColumn(name).isPresent();
    }

    /**
     * The primary column: the first declaration flagged primary, otherwise
     * the last declared column. Empty when the table has no primary column.
     */
    public Optional<String> primaryColumn() {
        if (primaryColumn == null) {
            primaryColumn = primaryColumnEnabled ? Optional.of(findPrimaryColumn()) : Optional.empty();
        }
        return primaryColumn;
    }

    private String findPrimaryColumn() {
        List<ColumnSchema> columns = declarations();
        for (ColumnSchema column : columns) {
            if (column.isPrimary()) {
                return column.getName();
            }
        }
        return columns.get(columns.size() - 1).getName();
    }

    /**
     * The first column, in declared order, that the database generates as an identity.
     */
    public Optional<String> identityColumn() {
        if (identityColumn == null) {
            identityColumn = declarations().stream()
                    .filter(ColumnSchema::isIdentity)
                    .map(ColumnSchema::getName)
                    .findFirst();
        }
        return identityColumn;
    }

    /**
     * Columns written by INSERT: every column except those flagged no-create and the identity column.
     */
    public List<String> insertableColumns() {
        String identity = identityColumn().orElse(null);
        List<String> columns = new ArrayList<>();
        for (ColumnSchema column : declarations()) {
            if (!column.isNoCreate() && !column.getName().equals(identity)) {
                columns.add(column.getName());
            }
        }
        return columns;
    }

    /**
     * Clears every cached derivation so the next call re-reads the declarations.
     */
    public void reset() {
        declarations = null;
        columnOrder = null;
        columnsByName = null;
        primaryColumn = null;
        identityColumn = null;
    }
}
