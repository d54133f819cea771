package top.guoziyang.dbrpc.backend.server;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import top.guoziyang.dbrpc.backend.config.DriverConfig;
import top.guoziyang.dbrpc.backend.driver.DatabaseDriver;
import top.guoziyang.dbrpc.backend.tree.TreeHandler;
import top.guoziyang.dbrpc.backend.tree.TreeRequest;
import top.guoziyang.dbrpc.client.Client;
import top.guoziyang.dbrpc.client.ClientConfig;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.schema.ColumnDef;
import top.guoziyang.dbrpc.schema.TableSchema;
import top.guoziyang.dbrpc.transport.Encoder;
import top.guoziyang.dbrpc.transport.Method;
import top.guoziyang.dbrpc.transport.Package;
import top.guoziyang.dbrpc.transport.Packager;
import top.guoziyang.dbrpc.transport.Priority;
import top.guoziyang.dbrpc.transport.Request;
import top.guoziyang.dbrpc.transport.Result;
import top.guoziyang.dbrpc.transport.Transporter;

public class ServerTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path socket;
    private DatabaseDriver driver;
    private Server server;
    private Client client;
    private final CountDownLatch treeGate = new CountDownLatch(1);
    private final AtomicBoolean treeQueried = new AtomicBoolean();

    @Before
    public void setUp() throws Exception {
        socket = tmp.getRoot().toPath().resolve("db.sock");
        DriverConfig config = new DriverConfig()
            .setDatabasePath(tmp.getRoot().toPath().resolve("server.db"))
            .setSocketPath(socket)
            .setWorkers(4)
            .setLockTimeoutMillis(10_000L);
        driver = DatabaseDriver.open(config, new TreeHandler() {
            @Override
            public Map<String, Object> query(TreeRequest request) {
                try {
                    treeGate.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                treeQueried.set(true);
                return Collections.<String, Object>singletonMap("file_id", request.getFileId());
            }

            @Override
            public Map<String, Object> modify(TreeRequest request) {
                return Collections.<String, Object>emptyMap();
            }
        });
        server = new Server(config, driver);
        server.bind();
        Thread acceptor = new Thread(server::serve, "test-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        client = new Client(new ClientConfig(socket).setPoolSize(2));
        client.createTable(new TableSchema("t", Collections.singletonList(ColumnDef.of("k", "TEXT")), null), null);
    }

    @After
    public void tearDown() {
        treeGate.countDown();
        client.close();
        server.stop();
        driver.close();
    }

    @Test
    public void testInsertThenSelect() {
        assertEquals(1L, client.insert("t", Collections.<String, Object>singletonMap("k", "v"), null));

        List<Map<String, Object>> rows = client.select("t", null);
        assertEquals(1, rows.size());
        assertEquals(Collections.singletonMap("k", "v"), rows.get(0));
    }

    @Test
    public void testRolledBackInsertIsInvisible() {
        String tx = client.beginTransaction();
        client.insert("t", Collections.<String, Object>singletonMap("k", "ghost"), tx);
        assertTrue(client.rollbackTransaction(tx));

        assertTrue(client.select("t", null).isEmpty());
    }

    @Test
    public void testValidationErrorIsTypedResult() {
        Result result = client.call(Method.SELECT, Collections.<String, Object>singletonMap("table_name", "nope"));
        assertTrue(result.isError());
        assertEquals(ErrorCode.TABLE_NOT_FOUND, ((Result.Error) result).getCode());
    }

    @Test
    public void testUnknownMethodKeepsConnection() throws Exception {
        Packager packager = new Packager(Transporter.connect(socket), new Encoder());
        try {
            packager.send(Package.request(new Request("r1", "frobnicate", null, Priority.NORMAL, Instant.now(), 5_000L)));
            Package reply = packager.receive();
            assertEquals(Package.Type.PROTOCOL_ERROR, reply.getType());
            assertEquals("r1", reply.getRequestId());
            assertEquals(ErrorCode.UNKNOWN_METHOD, reply.getErr().getCode());

            Request health = Request.create(Method.HEALTH_CHECK, null, Priority.NORMAL, 5_000L);
            packager.send(Package.request(health));
            reply = packager.receive();
            assertEquals(Package.Type.RESULT, reply.getType());
            assertEquals(health.getId(), reply.getRequestId());
            assertFalse(reply.getResult().isError());
        } finally {
            packager.close();
        }
    }

    @Test
    public void testMalformedFrameGetsProtocolError() throws Exception {
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        channel.connect(UnixDomainSocketAddress.of(socket));
        Packager packager = new Packager(new Transporter(channel), new Encoder());
        try {
            channel.write(ByteBuffer.wrap("not-hex\n".getBytes(StandardCharsets.US_ASCII)));
            Package reply = packager.receive();
            assertEquals(Package.Type.PROTOCOL_ERROR, reply.getType());
            assertEquals(ErrorCode.MALFORMED_FRAME, reply.getErr().getCode());
        } finally {
            packager.close();
        }
    }

    @Test
    public void testTimeoutIsReportedOnceAndLateResultCounted() throws Exception {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("file_id", 1L);
        params.put("filter", Collections.singletonMap("type", "ClassDef"));
        Result result = client.call(Method.QUERY_TREE, params, Priority.NORMAL, 300L);
        assertTrue(result.isError());
        assertEquals(ErrorCode.TIMEOUT, ((Result.Error) result).getCode());

        treeGate.countDown();

        long deadline = System.currentTimeMillis() + 10_000L;
        Map<String, Object> health = client.healthCheck();
        while (((Number) health.get("late_results")).longValue() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50L);
            health = client.healthCheck();
        }
        assertEquals(1L, ((Number) health.get("late_results")).longValue());
        assertNotNull(health.get("queue"));
        // 调用方放弃等待不会取消已经开始执行的请求
        assertTrue(treeQueried.get());
    }

    @Test
    public void testUnencodableParamsComeBackAsError() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("table_name", "t");
        params.put("data", Collections.singletonMap("k", new BigDecimal("1.5")));
        Result result = client.call(Method.INSERT, params);
        assertTrue(result.isError());
        assertEquals(ErrorCode.INVALID_PARAMS, ((Result.Error) result).getCode());

        assertEquals(1L, client.insert("t", Collections.<String, Object>singletonMap("k", "v"), null));
    }

    @Test
    public void testTransactionProceedsWhileOtherCallersWait() throws Exception {
        String tx = client.beginTransaction();
        Client background = new Client(new ClientConfig(socket).setPoolSize(8));
        try {
            List<Thread> readers = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                Thread reader = new Thread(() -> background.call(Method.SELECT,
                    Collections.<String, Object>singletonMap("table_name", "t"), Priority.NORMAL, 10_000L));
                reader.start();
                readers.add(reader);
            }
            Thread.sleep(300L);

            Map<String, Object> params = new LinkedHashMap<>();
            params.put("table_name", "t");
            params.put("data", Collections.singletonMap("k", "in-tx"));
            params.put("transaction_id", tx);
            Result inserted = client.call(Method.INSERT, params, Priority.URGENT, 2_000L);
            assertFalse(inserted.isError());
            assertTrue(client.commitTransaction(tx));
            for (Thread reader : readers) {
                reader.join(10_000L);
            }
        } finally {
            background.close();
        }
        assertEquals(1, client.select("t", null).size());
    }
}
