package org.dbtable.table;

import org.dbtable.config.DbTableConfiguration;
import org.dbtable.exception.TableConfigurationException;
import org.dbtable.exception.UnknownTableException;
import org.dbtable.testutil.RecordingConnection;
import org.dbtable.testutil.TestTables.AuditLogTable;
import org.dbtable.testutil.TestTables.ItemTable;
import org.dbtable.testutil.TestTables.StaffTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseTest {

    private RecordingConnection connection;
    private Database database;

    @BeforeEach
    void setUp() {
        connection = new RecordingConnection();
        database = new Database(connection, DbTableConfiguration.builder().defaultGrantee("").build());
    }

    @Test
    void testRegisterAndLookup() {
        StaffTable staff = database.register(new StaffTable(database));
        ItemTable items = database.register(new ItemTable(database));

        assertSame(staff, database.getTable("staff"));
        assertSame(items, database.getTable("ITEM"));
        assertSame(items, database.getTable(ItemTable.class));
        assertEquals(List.of(staff, items), database.getTables());
        assertEquals("TEST.ITEM", database.fullTableNameOf("Item"));
    }

    @Test
    void testUnknownTable() {
        database.register(new StaffTable(database));

        UnknownTableException e = assertThrows(UnknownTableException.class, () -> database.getTable("DEPT"));
        assertEquals("DEPT", e.getTableName());
        assertThrows(UnknownTableException.class, () -> database.getTable(AuditLogTable.class));
        assertThrows(UnknownTableException.class, () -> database.getTable((String) null));
    }

    @Test
    void testDuplicateRegistrationIsRejected() {
        database.register(new StaffTable(database));

        assertThrows(TableConfigurationException.class, () -> database.register(new StaffTable(database)));
    }

    @Test
    void testTableOfAnotherDatabaseIsRejected() {
        Database other = new Database(new RecordingConnection(), DbTableConfiguration.defaults());

        assertThrows(TableConfigurationException.class, () -> database.register(new StaffTable(other)));
    }

    @Test
    void testNullConnectionIsRejected() {
        assertThrows(TableConfigurationException.class, () -> new Database(null));
    }

    @Test
    void testEnsureSchemaInRegistrationOrder() throws SQLException {
        database.register(new StaffTable(database));
        database.register(new ItemTable(database));

        database.ensureSchema();

        List<String> ddl = connection.getDdl();
        assertEquals(2, ddl.size());
        assertTrue(ddl.get(0).startsWith("CREATE TABLE TEST.STAFF ("));
        assertEquals("CREATE TABLE TEST.ITEM (LABEL VARCHAR (30) NOT NULL, " +
                "ACTIVE CHAR (1) CHECK (ACTIVE IN ('Y','N')), OWNER CHAR (6), UPDATED TIMESTAMP, " +
                "ITEMID INTEGER GENERATED ALWAYS AS IDENTITY (START WITH 0, INCREMENT BY 1, NO CACHE), " +
                "PRIMARY KEY (ITEMID), FOREIGN KEY (OWNER) REFERENCES TEST.STAFF ON DELETE CASCADE) " +
                "DATA CAPTURE NONE", ddl.get(1));
    }

    @Test
    void testCloseClosesConnection() throws SQLException {
        database.close();

        assertTrue(connection.isClosed());
    }
}
