package org.dbtable.testutil;

import org.dbtable.schema.ColumnSchema;
import org.dbtable.table.Database;
import org.dbtable.table.ProvisioningEvent;
import org.dbtable.table.Row;
import org.dbtable.table.TableGateway;

import java.util.ArrayList;
import java.util.List;

/**
 * Small table declarations shared by the core tests.
 */
public final class TestTables {

    private TestTables() {
    }

    /**
     * {@code TEST.STAFF (EMPNO CHAR(6) primary, NAME CHAR(12))}.
     */
    public static class StaffTable extends TableGateway<Row> {

        public StaffTable(Database database) {
            super(database, Row::new);
        }

        @Override
        public String schemaName() {
            return "test";
        }

        @Override
        protected List<ColumnSchema> columns() {
            return List.of(
                    ColumnSchema.builder("EMPNO", "CHAR").length(6).primary().build(),
                    ColumnSchema.builder("NAME", "CHAR").length(12).build());
        }
    }

    /**
     * {@code TEST.ITEM} with a generated identity, a no-create column and a BOOL column.
     */
    public static class ItemTable extends TableGateway<Row> {

        public ItemTable(Database database) {
            super(database, Row::new);
        }

        @Override
        public String schemaName() {
            return "TEST";
        }

        @Override
        protected List<ColumnSchema> columns() {
            return List.of(
                    ColumnSchema.builder("LABEL", "VARCHAR").length(30).options("NOT NULL").defaultValue("unnamed").build(),
                    ColumnSchema.builder("ACTIVE", "BOOL").length(1).defaultValue("Y").build(),
                    ColumnSchema.builder("OWNER", "CHAR").length(6).foreignKey("!Staff! ON DELETE CASCADE").build(),
                    ColumnSchema.builder("UPDATED", "TIMESTAMP").noCreate().build(),
                    ColumnSchema.builder("ITEMID", "INTEGER").generatedIdentity().build());
        }
    }

    /**
     * {@code TEST.AUDITLOG}, a table with no primary column.
     */
    public static class AuditLogTable extends TableGateway<Row> {

        public AuditLogTable(Database database) {
            super(database, Row::new);
        }

        @Override
        public String schemaName() {
            return "TEST";
        }

        @Override
        protected boolean hasPrimaryColumn() {
            return false;
        }

        @Override
        protected List<ColumnSchema> columns() {
            return List.of(
                    ColumnSchema.builder("MESSAGE", "VARCHAR").length(200).build(),
                    ColumnSchema.builder("LOGGED", "TIMESTAMP").build());
        }
    }

    /**
     * Records provisioning events instead of granting.
     */
    public static class HookedStaffTable extends StaffTable {
        private final List<String> events = new ArrayList<>();

        public HookedStaffTable(Database database) {
            super(database);
        }

        @Override
        public String tableName() {
            return "STAFF";
        }

        @Override
        protected void onProvisioned(ProvisioningEvent event) {
            events.add(event.toString());
        }

        public List<String> getEvents() {
            return events;
        }
    }
}
