package org.dbtable.schema;

import org.dbtable.exception.TableConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ColumnSchemaTest {

    @Test
    void testBuilderNormalizesName() {
        ColumnSchema column = ColumnSchema.builder(" empno ", "CHAR").length(6).build();

        assertEquals("EMPNO", column.getName());
        assertEquals("CHAR", column.getSqlType());
        assertEquals(Optional.of("6"), column.length());
        assertEquals(Optional.empty(), column.options());
    }

    @Test
    void testBlankNameIsRejected() {
        assertThrows(TableConfigurationException.class, () -> ColumnSchema.builder("  ", "CHAR"));
        assertThrows(TableConfigurationException.class, () -> ColumnSchema.builder("NAME", null));
    }

    @Test
    void testFieldAccess() {
        ColumnSchema column = ColumnSchema.builder("SALARY", "DECIMAL")
                .length("8,2")
                .options("NOT NULL")
                .defaultValue(0)
                .constraint("SALARY_POSITIVE CHECK (SALARY >= 0)")
                .build();

        assertEquals(Optional.of("SALARY"), column.get(ColumnField.COLUMN));
        assertEquals(Optional.of("DECIMAL"), column.get(ColumnField.TYPE));
        assertEquals(Optional.of("8,2"), column.get(ColumnField.LENGTH));
        assertEquals(Optional.of("NOT NULL"), column.get(ColumnField.OPTS));
        assertEquals(Optional.of(0), column.get(ColumnField.DEFAULT));
        assertEquals(Optional.of(List.of("SALARY_POSITIVE CHECK (SALARY >= 0)")), column.get(ColumnField.CONSTRAINT));
        assertEquals(Optional.empty(), column.get(ColumnField.PRIMARY), "Unset flags should be absent");
        assertEquals(Optional.empty(), column.get(ColumnField.FOREIGNKEY));
        assertEquals(Optional.empty(), column.get(ColumnField.NOCREATE));
    }

    @Test
    void testGeneratedIdentityDirective() {
        ColumnSchema byDefault = ColumnSchema.builder("ID", "INTEGER").generatedIdentity().build();
        ColumnSchema keyword = ColumnSchema.builder("ID", "INTEGER").generatedIdentity("default").build();
        ColumnSchema explicit = ColumnSchema.builder("ID", "INTEGER").generatedIdentity("(START WITH 100)").build();

        assertTrue(byDefault.isGeneratedIdentity());
        assertTrue(byDefault.isIdentity());
        assertEquals(Optional.empty(), byDefault.get(ColumnField.GENERATEDIDENTITY));
        assertTrue(keyword.isGeneratedIdentity());
        assertEquals(Optional.empty(), keyword.get(ColumnField.GENERATEDIDENTITY),
                "The default keyword should read back like no directive");
        assertEquals(byDefault, keyword);
        assertEquals(Optional.of("(START WITH 100)"), explicit.get(ColumnField.GENERATEDIDENTITY));
    }

    @Test
    void testIdentityDeclaredInOptions() {
        ColumnSchema column = ColumnSchema.builder("ID", "INTEGER")
                .options("not null generated always as identity (start with 1)")
                .build();

        assertFalse(column.isGeneratedIdentity());
        assertTrue(column.optionsDeclareIdentity(), "Options match should ignore case");
        assertTrue(column.isIdentity());
    }

    @Test
    void testFieldNamesParse() {
        assertEquals(ColumnField.FOREIGNKEY, ColumnField.fromString("foreignkey"));
        assertEquals(ColumnField.NOCREATE, ColumnField.fromString("NOCREATE"));
    }
}
