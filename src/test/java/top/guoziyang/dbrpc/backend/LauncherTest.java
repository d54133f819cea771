package top.guoziyang.dbrpc.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import top.guoziyang.dbrpc.backend.config.DriverConfig;
import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

public class LauncherTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static CommandLine parse(String... args) throws ParseException {
        return new DefaultParser().parse(Launcher.options(), args);
    }

    @Test
    public void testOptionsOverrideConfigFile() throws Exception {
        File props = tmp.newFile("driver.properties");
        Files.write(props.toPath(), ("dbrpc.database=/data/from-file.db\n"
            + "dbrpc.socket=/tmp/from-file.sock\n"
            + "dbrpc.workers=3\n"
            + "dbrpc.tx.idle.ms=1234\n").getBytes(StandardCharsets.UTF_8));

        DriverConfig config = Launcher.parseConfig(parse(
            "-config", props.getPath(), "-socket", "/tmp/cli.sock", "-workers", "8", "-lockTimeout", "500"));
        config.validate();

        assertEquals(Path.of("/data/from-file.db"), config.getDatabasePath());
        assertEquals(Path.of("/tmp/cli.sock"), config.getSocketPath());
        assertEquals(8, config.getWorkers());
        assertEquals(500L, config.getLockTimeoutMillis());
        assertEquals(1234L, config.getTransactionIdleTimeoutMillis());
        assertEquals(DriverConfig.DEFAULT_QUEUE_MAX, config.getQueueMaxSize());
    }

    @Test
    public void testNonNumericOption() throws Exception {
        try {
            Launcher.parseConfig(parse("-db", "x.db", "-timeout", "soon"));
            fail("expected INVALID_PARAMS");
        } catch (DriverException e) {
            assertEquals(ErrorCode.INVALID_PARAMS, e.getCode());
        }
    }

    @Test
    public void testWorkerCountOutOfIntRange() throws Exception {
        try {
            Launcher.parseConfig(parse("-db", "x.db", "-workers", "4294967297"));
            fail("expected INVALID_PARAMS");
        } catch (DriverException e) {
            assertEquals(ErrorCode.INVALID_PARAMS, e.getCode());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testMissingSocketFailsValidation() throws Exception {
        Launcher.parseConfig(parse("-db", "x.db")).validate();
    }
}
