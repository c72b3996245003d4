package org.dbtable.samples;

import org.dbtable.table.TableGateway;
import org.dbtable.table.Row;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Row type shared by the sample tables, with numeric accessors for DECIMAL and INTEGER columns.
 */
public class SampleRow extends Row {

    public SampleRow(TableGateway<?> table, Map<String, ?> values) {
        super(table, values);
    }

    public BigDecimal getDecimal(String column) {
        Object value = getColumn(column);
        if (value == null || value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        return new BigDecimal(value.toString().trim());
    }

    public Integer getInteger(String column) {
        Object value = getColumn(column);
        if (value == null || value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.valueOf(value.toString().trim());
    }
}
