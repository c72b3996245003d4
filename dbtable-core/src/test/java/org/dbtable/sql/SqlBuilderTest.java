package org.dbtable.sql;

import org.dbtable.config.DbTableConfiguration;
import org.dbtable.exception.TableConfigurationException;
import org.dbtable.exception.UnknownTableException;
import org.dbtable.schema.ColumnSchema;
import org.dbtable.schema.SchemaRegistry;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlBuilderTest {

    private static final TableReferenceResolver RESOLVER = name -> {
        if ("DEPT".equalsIgnoreCase(name)) {
            return "SAMPLE.DEPT";
        }
        throw new UnknownTableException(name);
    };

    private static SqlBuilder builder(DbTableConfiguration configuration, ColumnSchema... columns) {
        SchemaRegistry registry = new SchemaRegistry(() -> Arrays.asList(columns));
        return new SqlBuilder(registry, new TableReferences("SAMPLE.EMPLOYEE", RESOLVER), configuration);
    }

    private static SqlBuilder builder(ColumnSchema... columns) {
        return builder(DbTableConfiguration.defaults(), columns);
    }

    private static SqlBuilder employees() {
        return builder(
                ColumnSchema.builder("EMPNO", "CHAR").length(6).options("NOT NULL").primary().build(),
                ColumnSchema.builder("FIRSTNAME", "CHAR").length(12).options("NOT NULL").build(),
                ColumnSchema.builder("SALARY", "DECIMAL").length("8,2").build());
    }

    @Test
    void testSelect() {
        SqlStatement all = employees().select("COUNT(*)", null);
        SqlStatement filtered = employees().selectDistinct("FIRSTNAME", "SALARY > ?", 1000);

        assertEquals("SELECT COUNT(*) FROM SAMPLE.EMPLOYEE", all.getSql());
        assertTrue(all.getBinds().isEmpty());
        assertEquals("SELECT DISTINCT FIRSTNAME FROM SAMPLE.EMPLOYEE WHERE SALARY > ?", filtered.getSql());
        assertEquals(List.of(1000), filtered.getBinds());
    }

    @Test
    void testSelectJoinSubstitutesPlaceholders() {
        SqlStatement statement = employees().selectJoin("E.FIRSTNAME", "!!! AS E, !Dept! AS D",
                "E.WORKDEPT = D.DEPTNO AND D.DEPTNAME = ?", "SALES");

        assertEquals("SELECT E.FIRSTNAME FROM SAMPLE.EMPLOYEE AS E, SAMPLE.DEPT AS D " +
                "WHERE E.WORKDEPT = D.DEPTNO AND D.DEPTNAME = ?", statement.getSql());
    }

    @Test
    void testPrimaryKeyStatements() {
        SqlBuilder sql = employees();

        assertEquals(new SqlStatement("SELECT COUNT(*) FROM SAMPLE.EMPLOYEE WHERE EMPNO IN ?", "000010"),
                sql.countByPrimaryKey("000010").orElseThrow());
        assertEquals(new SqlStatement("DELETE FROM SAMPLE.EMPLOYEE WHERE EMPNO IN ?", "000010"),
                sql.delete("000010").orElseThrow());
        assertEquals("EMPNO IN (?, ?, ?)", sql.primaryKeyListPredicate(3));
    }

    @Test
    void testNoPrimaryColumnStatements() {
        SchemaRegistry registry = new SchemaRegistry(
                () -> List.of(ColumnSchema.builder("MESSAGE", "VARCHAR").length(200).build()), false);
        SqlBuilder sql = new SqlBuilder(registry, new TableReferences("SAMPLE.LOG", RESOLVER),
                DbTableConfiguration.defaults());

        assertFalse(sql.countByPrimaryKey("x").isPresent());
        assertFalse(sql.delete("x").isPresent());
        assertFalse(sql.update(Map.of("MESSAGE", "x"), Set.of("MESSAGE")).isPresent());
        assertThrows(TableConfigurationException.class, () -> sql.primaryKeyListPredicate(1));
    }

    @Test
    void testInsertSkipsNoCreateAndIdentityColumns() {
        SqlBuilder sql = builder(
                ColumnSchema.builder("PRODNAME", "VARCHAR").length(30).build(),
                ColumnSchema.builder("UPDATED", "TIMESTAMP").noCreate().build(),
                ColumnSchema.builder("BASEPRICE", "DECIMAL").length("8,2").build(),
                ColumnSchema.builder("PRODID", "INTEGER").generatedIdentity().build());
        Map<String, Object> values = new HashMap<>();
        values.put("PRODNAME", "Widget");
        values.put("UPDATED", "2024-01-01");
        values.put("PRODID", 7);

        SqlStatement insert = sql.insert(values);

        assertEquals("INSERT INTO SAMPLE.EMPLOYEE (PRODNAME, BASEPRICE) VALUES(?, ?)", insert.getSql());
        assertEquals(Arrays.asList("Widget", null), insert.getBinds());
    }

    @Test
    void testUpdateOnlyModifiedColumns() {
        Map<String, Object> values = Map.of("EMPNO", "000010", "FIRSTNAME", "CHRISTINE", "SALARY", 5000);

        Optional<SqlStatement> update = employees().update(values, Set.of("SALARY", "FIRSTNAME"));

        assertEquals("UPDATE SAMPLE.EMPLOYEE SET FIRSTNAME = ?, SALARY = ? WHERE EMPNO IN ?",
                update.orElseThrow().getSql());
        assertEquals(List.of("CHRISTINE", 5000, "000010"), update.get().getBinds());
    }

    @Test
    void testUpdateNeverRewritesPrimaryKey() {
        Map<String, Object> values = Map.of("EMPNO", "000010", "FIRSTNAME", "CHRISTINE");

        assertFalse(employees().update(values, Set.of("EMPNO")).isPresent());
        assertFalse(employees().update(values, Set.of()).isPresent());
    }

    @Test
    void testCreateTable() {
        assertEquals("CREATE TABLE SAMPLE.EMPLOYEE (EMPNO CHAR (6) NOT NULL, FIRSTNAME CHAR (12) NOT NULL, " +
                        "SALARY DECIMAL (8,2), PRIMARY KEY (EMPNO)) DATA CAPTURE NONE",
                employees().createTable());
    }

    @Test
    void testCreateTableConstraintOrder() {
        DbTableConfiguration noOptions = DbTableConfiguration.builder().tableOptions("  ").build();
        SqlBuilder sql = builder(noOptions,
                ColumnSchema.builder("NAME", "VARCHAR").length(40)
                        .constraint("NAME_UNIQUE UNIQUE (NAME)").build(),
                ColumnSchema.builder("DEPTNO", "CHAR").length(3)
                        .foreignKey("!Dept! ON DELETE CASCADE").build(),
                ColumnSchema.builder("ID", "INTEGER").options("NOT NULL").build());

        assertEquals("CREATE TABLE SAMPLE.EMPLOYEE (NAME VARCHAR (40), DEPTNO CHAR (3), ID INTEGER NOT NULL, " +
                        "CONSTRAINT NAME_UNIQUE UNIQUE (NAME), PRIMARY KEY (ID), " +
                        "FOREIGN KEY (DEPTNO) REFERENCES SAMPLE.DEPT ON DELETE CASCADE)",
                sql.createTable());
    }

    @Test
    void testBoolColumnDefinition() {
        ColumnSchema active = ColumnSchema.builder("ACTIVE", "BOOL").length(1).options("NOT NULL").build();

        assertEquals("ACTIVE CHAR (1) NOT NULL CHECK (ACTIVE IN ('Y','N'))",
                employees().columnDefinition(active));
    }

    @Test
    void testIdentityColumnDefinitions() {
        SqlBuilder sql = employees();
        String defaultDirective = "ID INTEGER GENERATED ALWAYS AS IDENTITY (START WITH 0, INCREMENT BY 1, NO CACHE)";

        assertEquals(defaultDirective,
                sql.columnDefinition(ColumnSchema.builder("ID", "INTEGER").generatedIdentity().build()));
        assertEquals(defaultDirective,
                sql.columnDefinition(ColumnSchema.builder("ID", "INTEGER").generatedIdentity("default").build()));
        assertEquals("ID INTEGER NOT NULL GENERATED ALWAYS AS IDENTITY (START WITH 100)",
                sql.columnDefinition(ColumnSchema.builder("ID", "INTEGER").options("NOT NULL")
                        .generatedIdentity("(START WITH 100)").build()));
    }

    @Test
    void testAlterAddOneStatementPerColumn() {
        List<String> statements = employees().alterAdd(List.of("salary", "FIRSTNAME"));

        assertEquals(List.of(
                "ALTER TABLE SAMPLE.EMPLOYEE ADD SALARY DECIMAL (8,2)",
                "ALTER TABLE SAMPLE.EMPLOYEE ADD FIRSTNAME CHAR (12) NOT NULL"), statements);
        assertThrows(TableConfigurationException.class, () -> employees().alterAdd(List.of("BONUS")));
    }

    @Test
    void testHousekeepingStatements() {
        SqlBuilder sql = employees();

        assertEquals("SELECT * FROM SAMPLE.EMPLOYEE WHERE 1 = 0", sql.emptySelect());
        assertEquals("GRANT SELECT,INSERT,UPDATE,DELETE ON TABLE SAMPLE.EMPLOYEE TO USER NOBODY",
                sql.grantAll("NOBODY"));
        assertEquals("E.EMPNO, E.FIRSTNAME, E.SALARY", sql.columnSelection("E."));
    }
}
