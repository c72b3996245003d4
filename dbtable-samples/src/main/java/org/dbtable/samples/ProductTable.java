package org.dbtable.samples;

import org.dbtable.schema.ColumnSchema;
import org.dbtable.table.Database;

import java.util.List;

/**
 * Products. No column is flagged primary, so the last one, the generated
 * {@code PRODID}, is the primary column. Rows use the shared {@link SampleRow} type.
 */
public class ProductTable extends SampleTable<SampleRow> {

    public static final String PRODNAME = "PRODNAME";
    public static final String BASEPRICE = "BASEPRICE";
    public static final String PRODID = "PRODID";

    public ProductTable(Database database) {
        super(database, SampleRow::new);
    }

    @Override
    protected List<ColumnSchema> columns() {
        return List.of(
                ColumnSchema.builder(PRODNAME, "VARCHAR").length(30).options("NOT NULL").build(),
                ColumnSchema.builder(BASEPRICE, "DECIMAL").length("8,2").build(),
                ColumnSchema.builder(PRODID, "INTEGER").generatedIdentity().build());
    }
}
