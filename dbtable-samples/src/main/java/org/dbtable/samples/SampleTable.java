package org.dbtable.samples;

import org.dbtable.table.Database;
import org.dbtable.table.Row;
import org.dbtable.table.RowConstructor;
import org.dbtable.table.TableGateway;

/**
 * Base for every table in the sample schema. It only fixes the schema name.
 *
 * @param <R> the row type
 */
public abstract class SampleTable<R extends Row> extends TableGateway<R> {

    public static final String SCHEMA = "SAMPLE";

    protected SampleTable(Database database, RowConstructor<R> rowConstructor) {
        super(database, rowConstructor);
    }

    @Override
    public String schemaName() {
        return SCHEMA;
    }
}
