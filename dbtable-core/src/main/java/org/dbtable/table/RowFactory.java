package org.dbtable.table;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw result tuples into rows of the table's concrete row type, using
 * the table's declared column order for position.
 *
 * <p>SQL NULLs leave the column without a value. String values lose their
 * trailing whitespace (CHAR padding) unless that is switched off in the
 * configuration.</p>
 *
 * @param <R> the row type
 */
public class RowFactory<R extends Row> {

    private final TableGateway<R> table;
    private final RowConstructor<R> constructor;
    private final boolean trimTrailingWhitespace;

    public RowFactory(TableGateway<R> table, RowConstructor<R> constructor, boolean trimTrailingWhitespace) {
        this.table = table;
        this.constructor = constructor;
        this.trimTrailingWhitespace = trimTrailingWhitespace;
    }

    /**
     * Builds a row from one positional result tuple.
     */
    public R fromResult(List<Object> raw) {
        List<String> columns = table.columnList();
        Map<String, Object> values = new LinkedHashMap<>();
        int width = Math.min(columns.size(), raw.size());
        for (int i = 0; i < width; i++) {
            Object value = raw.get(i);
            if (value != null) {
                values.put(columns.get(i), clean(value));
            }
        }
        return constructor.create(table, values);
    }

    public List<R> fromResults(List<List<Object>> raws) {
        List<R> rows = new ArrayList<>(raws.size());
        for (List<Object> raw : raws) {
            rows.add(fromResult(raw));
        }
        return rows;
    }

    /**
     * Builds a row from named values, skipping nulls.
     */
    public R fromValues(Map<String, ?> named) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : named.entrySet()) {
            if (entry.getValue() != null) {
                values.put(entry.getKey(), entry.getValue());
            }
        }
        return constructor.create(table, values);
    }

    private Object clean(Object value) {
        if (trimTrailingWhitespace && value instanceof String) {
            return StringUtils.stripEnd((String) value, null);
        }
        return value;
    }
}
