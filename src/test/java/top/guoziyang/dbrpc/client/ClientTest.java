package top.guoziyang.dbrpc.client;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import top.guoziyang.dbrpc.backend.config.DriverConfig;
import top.guoziyang.dbrpc.backend.driver.DatabaseDriver;
import top.guoziyang.dbrpc.backend.server.Server;
import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.schema.ColumnDef;
import top.guoziyang.dbrpc.schema.TableSchema;
import top.guoziyang.dbrpc.transport.Method;
import top.guoziyang.dbrpc.transport.Result;

public class ClientTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testBackoffGrowsToCap() {
        ClientConfig config = new ClientConfig(Path.of("/tmp/none.sock"))
            .setBackoffInitialMillis(100L)
            .setBackoffMaxMillis(500L);
        assertEquals(100L, config.backoffMillis(1));
        assertEquals(200L, config.backoffMillis(2));
        assertEquals(400L, config.backoffMillis(3));
        assertEquals(500L, config.backoffMillis(4));
        assertEquals(500L, config.backoffMillis(30));
    }

    @Test
    public void testUnreachableDriverAfterRetries() {
        Path socket = tmp.getRoot().toPath().resolve("missing.sock");
        Client client = new Client(new ClientConfig(socket)
            .setMaxAttempts(3)
            .setBackoffInitialMillis(20L));
        try {
            long start = System.currentTimeMillis();
            Result result = client.call(Method.HEALTH_CHECK, null);
            assertTrue(result.isError());
            assertEquals(ErrorCode.CONNECTION_UNAVAILABLE, ((Result.Error) result).getCode());
            // 两次退避：20 + 40
            assertTrue(System.currentTimeMillis() - start >= 60L);
            try {
                client.healthCheck();
                fail("expected CONNECTION_UNAVAILABLE");
            } catch (DriverException e) {
                assertEquals(ErrorCode.CONNECTION_UNAVAILABLE, e.getCode());
            }
        } finally {
            client.close();
        }
    }

    @Test
    public void testRecoversWhenDriverRestarts() throws Exception {
        Path socket = tmp.getRoot().toPath().resolve("d.sock");
        DriverConfig config = new DriverConfig()
            .setDatabasePath(tmp.getRoot().toPath().resolve("c.db"))
            .setSocketPath(socket);
        DatabaseDriver driver = DatabaseDriver.open(config, null);
        Client client = new Client(new ClientConfig(socket).setPoolSize(1).setBackoffInitialMillis(20L));
        try {
            Server first = new Server(config, driver);
            first.bind();
            new Thread(first::serve).start();
            client.createTable(new TableSchema("t", Collections.singletonList(ColumnDef.of("k", "TEXT")), null), null);
            first.stop();

            Server second = new Server(config, driver);
            second.bind();
            new Thread(second::serve).start();
            try {
                // 池里的旧连接已断开，只读请求换新连接重试
                List<Map<String, Object>> rows = client.select("t", null);
                assertTrue(rows.isEmpty());
            } finally {
                second.stop();
            }
        } finally {
            client.close();
            driver.close();
        }
    }

    @Test
    public void testEmbeddedClientSharesWrappers() throws Exception {
        DatabaseDriver driver = DatabaseDriver.open(new DriverConfig()
            .setDatabasePath(tmp.getRoot().toPath().resolve("e.db")), null);
        try (EmbeddedClient client = new EmbeddedClient(driver)) {
            client.createTable(new TableSchema("t", Collections.singletonList(ColumnDef.of("k", "TEXT")), null), null);
            client.insert("t", Collections.<String, Object>singletonMap("k", "v"), null);
            assertEquals(1, client.update("t", Collections.<String, Object>singletonMap("k", "v"),
                Collections.<String, Object>singletonMap("k", "w"), null));
            assertEquals("w", client.select("t", null).get(0).get("k"));
            assertEquals("0.0.0", client.getSchemaVersion());
            assertEquals("ok", client.healthCheck().get("status"));
            try {
                client.queryTree(Collections.<String, Object>singletonMap("file_id", 1L));
                fail("expected INVALID_PARAMS");
            } catch (DriverException e) {
                assertEquals(ErrorCode.INVALID_PARAMS, e.getCode());
            }
        } finally {
            driver.close();
        }
    }
}
