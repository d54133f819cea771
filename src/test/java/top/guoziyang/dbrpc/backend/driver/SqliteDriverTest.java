package top.guoziyang.dbrpc.backend.driver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import top.guoziyang.dbrpc.backend.config.DriverConfig;
import top.guoziyang.dbrpc.backend.tree.TreeHandler;
import top.guoziyang.dbrpc.backend.tree.TreeRequest;
import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.schema.ColumnDef;
import top.guoziyang.dbrpc.schema.TableSchema;
import top.guoziyang.dbrpc.transport.Params;

public class SqliteDriverTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final List<DatabaseDriver> opened = new ArrayList<>();

    @After
    public void closeDrivers() {
        for (DatabaseDriver driver : opened) {
            driver.close();
        }
    }

    private DatabaseDriver open(long lockTimeoutMillis, long idleMillis, TreeHandler handler) throws Exception {
        DriverConfig config = new DriverConfig()
            .setDatabasePath(tmp.getRoot().toPath().resolve("test.db"))
            .setLockTimeoutMillis(lockTimeoutMillis)
            .setTransactionIdleTimeoutMillis(idleMillis);
        DatabaseDriver driver = DatabaseDriver.open(config, handler);
        opened.add(driver);
        return driver;
    }

    private DatabaseDriver open() throws Exception {
        return open(300L, 60_000L, null);
    }

    private static TableSchema itemsTable() {
        return new TableSchema("items", Arrays.asList(
            new ColumnDef("id", "INTEGER", false, null, true, true),
            new ColumnDef("name", "TEXT", true, null, false, false),
            ColumnDef.of("qty", "INTEGER")), null);
    }

    private static Map<String, Object> row(String name, long qty) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        data.put("qty", qty);
        return data;
    }

    private static void assertCode(ErrorCode expected, Runnable action) {
        try {
            action.run();
            fail("expected " + expected);
        } catch (DriverException e) {
            assertEquals(expected, e.getCode());
        }
    }

    @Test
    public void testCrud() throws Exception {
        DatabaseDriver driver = open();
        assertTrue(driver.createTable(itemsTable(), null));
        assertTrue(driver.createTable(itemsTable(), null));

        assertEquals(1L, driver.insert("items", row("apple", 3), null));
        assertEquals(2L, driver.insert("items", row("pear", 5), null));

        List<Map<String, Object>> rows = driver.select("items",
            Collections.<String, Object>singletonMap("name", "apple"), null, null, null, null, null);
        assertEquals(1, rows.size());
        assertEquals(1L, rows.get(0).get("id"));
        assertEquals(3L, rows.get(0).get("qty"));

        assertEquals(1, driver.update("items", Collections.<String, Object>singletonMap("name", "pear"),
            Collections.<String, Object>singletonMap("qty", 7L), null));
        rows = driver.select("items", null, Arrays.asList("name", "qty"), 10L, 0L,
            Collections.singletonList("qty desc"), null);
        assertEquals("pear", rows.get(0).get("name"));
        assertEquals(7L, rows.get(0).get("qty"));
        assertFalse(rows.get(0).containsKey("id"));

        assertEquals(1, driver.delete("items", Collections.<String, Object>singletonMap("id", 1L), null));
        assertEquals(1, driver.select("items", null, null, null, null, null, null).size());
    }

    @Test
    public void testValidationErrors() throws Exception {
        DatabaseDriver driver = open();
        driver.createTable(itemsTable(), null);

        assertCode(ErrorCode.TABLE_NOT_FOUND, () -> driver.insert("missing", row("x", 1), null));
        assertCode(ErrorCode.COLUMN_NOT_FOUND,
            () -> driver.insert("items", Collections.<String, Object>singletonMap("colour", "red"), null));
        assertCode(ErrorCode.INVALID_PARAMS, () -> driver.select("items; DROP TABLE items", null,
            null, null, null, null, null));
        assertCode(ErrorCode.INVALID_PARAMS, () -> driver.select("items", null, null, -1L, null, null, null));
        assertCode(ErrorCode.STORAGE_ERROR,
            () -> driver.insert("items", Collections.<String, Object>singletonMap("qty", 1L), null));
    }

    @Test
    public void testAlterTable() throws Exception {
        DatabaseDriver driver = open();
        driver.createTable(itemsTable(), null);
        driver.insert("items", row("apple", 1), null);

        Map<String, Object> result = driver.alterTable("items",
            Collections.singletonList(new ColumnDef("colour", "TEXT", false, "green", false, false)), "fruit", null);
        assertEquals("fruit", result.get("table"));
        assertEquals(Collections.singletonList("colour"), result.get("added_columns"));

        List<Map<String, Object>> rows = driver.select("fruit", null, null, null, null, null, null);
        assertEquals("green", rows.get(0).get("colour"));
        assertCode(ErrorCode.TABLE_NOT_FOUND, () -> driver.getTableInfo("items"));
        assertCode(ErrorCode.INVALID_SCHEMA, () -> driver.alterTable("fruit",
            Collections.singletonList(new ColumnDef("weight", "REAL", true, null, false, false)), null, null));
        assertEquals(4, driver.getTableInfo("fruit").size());
    }

    @Test
    public void testRollbackDiscardsRows() throws Exception {
        DatabaseDriver driver = open();
        driver.createTable(itemsTable(), null);

        String tx = driver.beginTransaction();
        assertEquals(tx, driver.activeTransaction());
        driver.insert("items", row("ghost", 1), tx);
        assertEquals(1, driver.select("items", null, null, null, null, null, tx).size());
        assertTrue(driver.rollbackTransaction(tx));

        assertNull(driver.activeTransaction());
        assertTrue(driver.select("items", null, null, null, null, null, null).isEmpty());
        assertCode(ErrorCode.TRANSACTION_NOT_FOUND, () -> driver.commitTransaction(tx));
    }

    @Test
    public void testCommitKeepsRows() throws Exception {
        DatabaseDriver driver = open();
        driver.createTable(itemsTable(), null);

        String tx = driver.beginTransaction();
        driver.insert("items", row("a", 1), tx);
        driver.insert("items", row("b", 2), tx);
        assertTrue(driver.commitTransaction(tx));

        assertEquals(2, driver.select("items", null, null, null, null, null, null).size());
    }

    @Test
    public void testForeignTransactionAndLockTimeout() throws Exception {
        DatabaseDriver driver = open();
        driver.createTable(itemsTable(), null);
        String tx = driver.beginTransaction();

        assertCode(ErrorCode.TRANSACTION_NOT_FOUND, () -> driver.insert("items", row("x", 1), "tx-unknown"));
        long start = System.currentTimeMillis();
        assertCode(ErrorCode.LOCK_TIMEOUT, () -> driver.insert("items", row("x", 1), null));
        assertTrue(System.currentTimeMillis() - start >= 250L);

        driver.rollbackTransaction(tx);
        assertEquals(1L, driver.insert("items", row("x", 1), null));
    }

    @Test
    public void testIdleTransactionIsReaped() throws Exception {
        DatabaseDriver driver = open(300L, 200L, null);
        driver.createTable(itemsTable(), null);
        String tx = driver.beginTransaction();
        driver.insert("items", row("abandoned", 1), tx);

        long deadline = System.currentTimeMillis() + 5_000L;
        while (driver.activeTransaction() != null && System.currentTimeMillis() < deadline) {
            Thread.sleep(50L);
        }
        assertNull(driver.activeTransaction());
        assertCode(ErrorCode.TRANSACTION_NOT_FOUND, () -> driver.commitTransaction(tx));
        assertTrue(driver.select("items", null, null, null, null, null, null).isEmpty());
    }

    @Test
    public void testConcurrentTransactionsSerialize() throws Exception {
        DatabaseDriver driver = open(10_000L, 60_000L, null);
        driver.createTable(itemsTable(), null);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (String owner : Arrays.asList("left", "right")) {
            futures.add(pool.submit(() -> {
                go.await();
                String tx = driver.beginTransaction();
                for (int i = 0; i < 20; i++) {
                    driver.insert("items", row(owner, i), tx);
                }
                driver.commitTransaction(tx);
                return null;
            }));
        }
        go.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        List<Map<String, Object>> rows = driver.select("items", null, null, null, null,
            Collections.singletonList("id"), null);
        assertEquals(40, rows.size());
        // 一个事务的行必须连续出现，不会与另一个事务交错
        String first = (String) rows.get(0).get("name");
        for (int i = 0; i < 40; i++) {
            boolean firstHalf = i < 20;
            assertEquals(firstHalf, first.equals(rows.get(i).get("name")));
        }
    }

    @Test
    public void testExecute() throws Exception {
        DatabaseDriver driver = open();
        driver.createTable(itemsTable(), null);

        Map<String, Object> insert = driver.execute("INSERT INTO items (name, qty) VALUES (?, ?)",
            Arrays.<Object>asList("kiwi", 4L), null);
        assertEquals(1L, insert.get("affected_rows"));
        assertEquals(1L, insert.get("last_row_id"));

        Map<String, Object> query = driver.execute("SELECT name FROM items WHERE qty > ?",
            Collections.<Object>singletonList(1L), null);
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> data = (List<Map<String, Object>>) query.get("data");
        assertEquals("kiwi", data.get(0).get("name"));

        assertCode(ErrorCode.INVALID_PARAMS, () -> driver.execute("BEGIN", null, null));
        assertCode(ErrorCode.INVALID_PARAMS, () -> driver.execute("  commit;", null, null));
        assertCode(ErrorCode.STORAGE_ERROR, () -> driver.execute("SELECT * FROM nowhere", null, null));
    }

    @Test
    public void testTreeOperations() throws Exception {
        DatabaseDriver plain = open();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("file_id", 7L);
        params.put("filter", Collections.singletonMap("type", "ClassDef"));
        TreeRequest query = TreeRequest.forQuery(new Params(params));
        assertCode(ErrorCode.NOT_SUPPORTED, () -> plain.queryTree(query));
        plain.close();
        opened.clear();

        DatabaseDriver withHandler = open(300L, 60_000L, new TreeHandler() {
            @Override
            public Map<String, Object> query(TreeRequest request) {
                return Collections.<String, Object>singletonMap("file_id", request.getFileId());
            }

            @Override
            public Map<String, Object> modify(TreeRequest request) {
                return Collections.<String, Object>singletonMap("action", request.getAction().wireName());
            }
        });
        assertEquals(7L, withHandler.queryTree(query).get("file_id"));

        params.put("action", "insert");
        assertCode(ErrorCode.INVALID_PARAMS, () -> TreeRequest.forModify(new Params(params)));
        params.put("nodes", Collections.singletonList(Collections.singletonMap("code", "x = 1")));
        assertEquals("insert", withHandler.modifyTree(TreeRequest.forModify(new Params(params))).get("action"));
    }
}
