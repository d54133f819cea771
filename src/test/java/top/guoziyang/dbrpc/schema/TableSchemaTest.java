package top.guoziyang.dbrpc.schema;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

public class TableSchemaTest {

    @Test
    public void testCreateSqlWithConstraints() {
        TableSchema schema = new TableSchema("methods", Arrays.asList(
            new ColumnDef("class_id", "INTEGER", true, null, false, false),
            new ColumnDef("name", "TEXT", true, null, false, false),
            new ColumnDef("docstring", "TEXT", false, "it's", false, false)),
            Arrays.asList(
                TableConstraint.primaryKey(Arrays.asList("class_id", "name")),
                TableConstraint.foreignKey(Collections.singletonList("class_id"), "classes",
                    Collections.singletonList("id"))));

        assertEquals("CREATE TABLE IF NOT EXISTS methods ("
            + "class_id INTEGER NOT NULL, name TEXT NOT NULL, docstring TEXT DEFAULT 'it''s', "
            + "PRIMARY KEY (class_id, name), FOREIGN KEY (class_id) REFERENCES classes (id))",
            schema.toCreateSql());
    }

    @Test
    public void testFromMapRoundTrip() {
        Map<String, Object> column = new LinkedHashMap<>();
        column.put("name", "path");
        column.put("type", "TEXT");
        column.put("nullable", false);
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("name", "files");
        raw.put("columns", Collections.singletonList(column));

        TableSchema schema = TableSchema.fromMap(raw);
        assertTrue(schema.getColumn("path").isNotNull());
        assertEquals(schema.toCreateSql(), TableSchema.fromMap(schema.toMap()).toCreateSql());
    }

    @Test
    public void testRejectsBadDefinitions() {
        List<Runnable> bad = Arrays.asList(
            () -> new TableSchema("files", Collections.<ColumnDef>emptyList(), null),
            () -> ColumnDef.fromMap(Collections.<String, Object>singletonMap("type", "TEXT); DROP TABLE x; --")),
            () -> TableConstraint.fromMap(Collections.<String, Object>singletonMap("type", "check")));
        for (Runnable r : bad) {
            try {
                r.run();
                fail("expected INVALID_SCHEMA");
            } catch (DriverException e) {
                assertEquals(ErrorCode.INVALID_SCHEMA, e.getCode());
            }
        }
        try {
            new TableSchema("files; --", Collections.singletonList(ColumnDef.of("a", "TEXT")), null);
            fail("expected INVALID_PARAMS");
        } catch (DriverException e) {
            assertEquals(ErrorCode.INVALID_PARAMS, e.getCode());
        }
        assertFalse(SqlIdentifiers.isValid("1abc"));
    }
}
