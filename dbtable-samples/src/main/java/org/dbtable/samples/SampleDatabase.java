package org.dbtable.samples;

import org.dbtable.config.DbTableConfiguration;
import org.dbtable.jdbc.DatabaseConnection;
import org.dbtable.table.Database;

/**
 * The sample schema: employees and products over one connection.
 */
public class SampleDatabase extends Database {

    private final EmployeeTable employees;
    private final ProductTable products;

    public SampleDatabase(DatabaseConnection connection) {
        this(connection, DbTableConfiguration.load());
    }

    public SampleDatabase(DatabaseConnection connection, DbTableConfiguration configuration) {
        super(connection, configuration);
        this.employees = register(new EmployeeTable(this));
        this.products = register(new ProductTable(this));
    }

    public EmployeeTable employees() {
        return employees;
    }

    public ProductTable products() {
        return products;
    }
}
