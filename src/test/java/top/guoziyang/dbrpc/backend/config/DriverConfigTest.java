package top.guoziyang.dbrpc.backend.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

public class DriverConfigTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testDefaults() {
        DriverConfig config = new DriverConfig().setDatabasePath(Paths.get("/data/code.db"));
        assertEquals(DriverConfig.DEFAULT_WORKERS, config.getWorkers());
        assertEquals(DriverConfig.DEFAULT_QUEUE_MAX, config.getQueueMaxSize());
        assertEquals(DriverConfig.DEFAULT_TIMEOUT_MILLIS, config.getRequestTimeoutMillis());
        assertEquals(Paths.get("/data/backups"), config.getBackupDir());
    }

    @Test
    public void testLoadProperties() throws Exception {
        Path file = tmp.newFile("driver.properties").toPath();
        Files.write(file, ("dbrpc.database=/tmp/a.db\n"
            + "dbrpc.socket=/tmp/a.sock\n"
            + "dbrpc.workers=3\n"
            + "dbrpc.queue.max=50\n"
            + "dbrpc.timeout.ms=1500\n").getBytes(StandardCharsets.UTF_8));

        DriverConfig config = DriverConfig.load(file);
        config.validate();

        assertEquals(Paths.get("/tmp/a.db"), config.getDatabasePath());
        assertEquals(Paths.get("/tmp/a.sock"), config.getSocketPath());
        assertEquals(3, config.getWorkers());
        assertEquals(50, config.getQueueMaxSize());
        assertEquals(1500L, config.getRequestTimeoutMillis());
    }

    @Test
    public void testInvalidValues() {
        Properties props = new Properties();
        props.setProperty("dbrpc.workers", "many");
        try {
            new DriverConfig().apply(props);
            fail("expected DriverException");
        } catch (DriverException e) {
            // expected
        }
        try {
            new DriverConfig().setDatabasePath(Paths.get("x.db")).validate();
            fail("socket path missing");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void testQueueSizeOutOfIntRange() {
        Properties props = new Properties();
        props.setProperty("dbrpc.queue.max", "3000000000");
        try {
            new DriverConfig().apply(props);
            fail("expected DriverException");
        } catch (DriverException e) {
            assertEquals(ErrorCode.INVALID_PARAMS, e.getCode());
        }
    }
}
