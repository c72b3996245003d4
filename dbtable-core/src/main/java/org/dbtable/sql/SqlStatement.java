package org.dbtable.sql;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Parameterized SQL text together with its ordered bind values.
 */
@Getter
@EqualsAndHashCode
public final class SqlStatement {
    private final String sql;
    private final List<Object> binds;

    public SqlStatement(String sql, List<?> binds) {
        this.sql = sql;
        this.binds = Collections.unmodifiableList(new ArrayList<>(binds));
    }

    public SqlStatement(String sql, Object... binds) {
        this(sql, binds == null ? Collections.emptyList() : Arrays.asList(binds));
    }

    @Override
    public String toString() {
        return sql + " " + binds;
    }
}
