package org.dbtable.samples;

import org.dbtable.schema.ColumnSchema;
import org.dbtable.table.Database;

import java.util.List;

/**
 * Employees, keyed by employee number. The table name is {@code EMPLOYEE}.
 */
public class EmployeeTable extends SampleTable<EmployeeRow> {

    public static final String EMPNO = "EMPNO";
    public static final String FIRSTNAME = "FIRSTNAME";
    public static final String MIDINIT = "MIDINIT";
    public static final String LASTNAME = "LASTNAME";
    public static final String SALARY = "SALARY";

    public EmployeeTable(Database database) {
        super(database, EmployeeRow::new);
    }

    @Override
    protected List<ColumnSchema> columns() {
        return List.of(
                ColumnSchema.builder(EMPNO, "CHAR").length(6).options("NOT NULL").primary().build(),
                ColumnSchema.builder(FIRSTNAME, "CHAR").length(12).options("NOT NULL").build(),
                ColumnSchema.builder(MIDINIT, "CHAR").build(),
                ColumnSchema.builder(LASTNAME, "CHAR").length(15).options("NOT NULL").build(),
                ColumnSchema.builder(SALARY, "DECIMAL").length("8,2").build());
    }
}
