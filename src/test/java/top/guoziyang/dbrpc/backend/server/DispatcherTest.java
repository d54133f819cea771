package top.guoziyang.dbrpc.backend.server;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import top.guoziyang.dbrpc.backend.config.DriverConfig;
import top.guoziyang.dbrpc.backend.driver.DatabaseDriver;
import top.guoziyang.dbrpc.backend.queue.RequestQueue;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.schema.ColumnDef;
import top.guoziyang.dbrpc.schema.TableSchema;
import top.guoziyang.dbrpc.transport.Method;
import top.guoziyang.dbrpc.transport.Priority;
import top.guoziyang.dbrpc.transport.Request;
import top.guoziyang.dbrpc.transport.Result;

public class DispatcherTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private DatabaseDriver driver;
    private RequestQueue queue;
    private PendingResponseRegistry registry;
    private Dispatcher dispatcher;

    @Before
    public void setUp() throws Exception {
        driver = DatabaseDriver.open(new DriverConfig().setDatabasePath(tmp.getRoot().toPath().resolve("d.db")), null);
        driver.createTable(new TableSchema("t", Collections.singletonList(ColumnDef.of("k", "TEXT")), null), null);
        queue = new RequestQueue(1000);
        registry = new PendingResponseRegistry();
        dispatcher = new Dispatcher(queue, registry, new Executor(driver, null), 1, 1L);
    }

    @After
    public void tearDown() {
        dispatcher.stop();
        driver.close();
    }

    @Test
    public void testUrgentInsertOvertakesQueuedSelects() throws Exception {
        List<PendingResponse> pendings = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            Request select = Request.create(Method.SELECT,
                Collections.<String, Object>singletonMap("table_name", "t"), Priority.NORMAL, 30_000L);
            pendings.add(registry.register(select.getId()));
            queue.enqueue(select);
        }
        Request insert = Request.create(Method.INSERT, insertParams(), Priority.URGENT, 30_000L);
        PendingResponse insertPending = registry.register(insert.getId());
        queue.enqueue(insert);

        List<String> dispatched = Collections.synchronizedList(new ArrayList<>());
        dispatcher.setListener(q -> dispatched.add(q.getRequest().getMethod()));
        dispatcher.start();

        Result inserted = insertPending.await(10_000L);
        assertNotNull(inserted);
        assertFalse(inserted.isError());
        for (PendingResponse p : pendings) {
            assertNotNull(p.await(10_000L));
        }
        assertEquals(101, dispatched.size());
        assertEquals("insert", dispatched.get(0));
        assertTrue(dispatched.subList(1, 101).stream().allMatch("select"::equals));
    }

    @Test
    public void testAbandonedRequestIsSkipped() throws Exception {
        Request insert = Request.create(Method.INSERT, insertParams(), Priority.NORMAL, 30_000L);
        PendingResponse pending = registry.register(insert.getId());
        queue.enqueue(insert);
        pending.abandon();

        Request select = Request.create(Method.SELECT,
            Collections.<String, Object>singletonMap("table_name", "t"), Priority.LOW, 30_000L);
        PendingResponse selectPending = registry.register(select.getId());
        queue.enqueue(select);
        dispatcher.start();

        Result rows = selectPending.await(10_000L);
        assertTrue(rows instanceof Result.Rows);
        assertTrue(((Result.Rows) rows).getRecords().isEmpty());
    }

    @Test
    public void testTransactionIsNotStarvedByWaitingSelects() throws Exception {
        dispatcher = new Dispatcher(queue, registry, new Executor(driver, null), 2, 1L,
            driver::activeTransaction, 4_000L);
        String tx = driver.beginTransaction();
        dispatcher.start();

        List<PendingResponse> selects = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            Request select = Request.create(Method.SELECT,
                Collections.<String, Object>singletonMap("table_name", "t"), Priority.NORMAL, 10_000L);
            selects.add(registry.register(select.getId()));
            queue.enqueue(select);
        }
        Thread.sleep(300);

        Map<String, Object> params = insertParams();
        params.put("transaction_id", tx);
        Request insert = Request.create(Method.INSERT, params, Priority.URGENT, 2_000L);
        PendingResponse insertPending = registry.register(insert.getId());
        queue.enqueue(insert);

        Result inserted = insertPending.await(2_000L);
        assertNotNull(inserted);
        assertFalse(inserted.isError());
        assertEquals(2, queue.size());
        for (PendingResponse p : selects) {
            assertNull(p.getResult());
        }

        assertTrue(driver.commitTransaction(tx));
        for (PendingResponse p : selects) {
            Result rows = p.await(10_000L);
            assertTrue(rows instanceof Result.Rows);
            assertEquals(1, ((Result.Rows) rows).getRecords().size());
        }
    }

    @Test
    public void testWaitingRequestFailsWithLockTimeout() throws Exception {
        dispatcher = new Dispatcher(queue, registry, new Executor(driver, null), 2, 1L,
            driver::activeTransaction, 200L);
        String tx = driver.beginTransaction();
        dispatcher.start();

        Request select = Request.create(Method.SELECT,
            Collections.<String, Object>singletonMap("table_name", "t"), Priority.NORMAL, 10_000L);
        PendingResponse pending = registry.register(select.getId());
        queue.enqueue(select);

        Result result = pending.await(5_000L);
        assertTrue(result instanceof Result.Error);
        assertEquals(ErrorCode.LOCK_TIMEOUT, ((Result.Error) result).getCode());
        assertEquals(0, queue.size());
        assertTrue(driver.rollbackTransaction(tx));
    }

    private static Map<String, Object> insertParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("table_name", "t");
        params.put("data", Collections.singletonMap("k", "v"));
        return params;
    }
}
