package top.guoziyang.dbrpc.save;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import top.guoziyang.dbrpc.backend.config.DriverConfig;
import top.guoziyang.dbrpc.backend.driver.DatabaseDriver;
import top.guoziyang.dbrpc.backup.BackupManager;
import top.guoziyang.dbrpc.client.EmbeddedClient;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.schema.ColumnDef;
import top.guoziyang.dbrpc.schema.TableSchema;

public class AtomicSaverTest {

    private static final byte[] OLD = "first line\nsecond line\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NEW = "alpha\nbeta\ngamma\n".getBytes(StandardCharsets.UTF_8);

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private DatabaseDriver driver;
    private EmbeddedClient db;
    private BackupManager backups;
    private Path workDir;
    private Path target;

    /**
     * 每一行文本对应一条 file_lines 记录
     */
    private static class LineExtractor implements DerivedDataExtractor {
        @Override
        public String tableName() {
            return "file_lines";
        }

        @Override
        public String fileColumn() {
            return "file_path";
        }

        @Override
        public List<Map<String, Object>> extract(Path file, byte[] content) {
            List<Map<String, Object>> rows = new ArrayList<>();
            String[] lines = new String(content, StandardCharsets.UTF_8).split("\n");
            for (int i = 0; i < lines.length; i++) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("line_no", (long) i + 1);
                row.put("text", lines[i]);
                rows.add(row);
            }
            return rows;
        }
    }

    @Before
    public void setUp() throws Exception {
        workDir = tmp.newFolder("project").toPath();
        target = workDir.resolve("notes.txt");
        driver = DatabaseDriver.open(new DriverConfig().setDatabasePath(tmp.getRoot().toPath().resolve("a.db")), null);
        db = new EmbeddedClient(driver);
        db.createTable(new TableSchema("file_lines", Arrays.asList(
            ColumnDef.of("file_path", "TEXT"),
            ColumnDef.of("line_no", "INTEGER"),
            ColumnDef.of("text", "TEXT")), null), null);
        backups = new BackupManager(tmp.newFolder("backups").toPath());
    }

    @After
    public void tearDown() {
        db.close();
        driver.close();
    }

    private AtomicSaver saver() {
        return new AtomicSaver(db, backups, new Utf8TextValidator(), new LineExtractor());
    }

    private List<Map<String, Object>> rows() {
        return db.select("file_lines", null, null, null, null, Collections.singletonList("line_no"), null);
    }

    private void seedOldState() throws IOException {
        SaveResult seeded = saver().save(target, OLD, "seed");
        assertTrue(seeded.toString(), seeded.isSuccess());
    }

    private List<Path> strayFiles() throws IOException {
        List<Path> stray = new ArrayList<>();
        try (Stream<Path> files = Files.list(workDir)) {
            files.filter(p -> !p.equals(target)).forEach(stray::add);
        }
        return stray;
    }

    @Test
    public void testSuccessfulSave() throws Exception {
        seedOldState();

        SaveResult result = saver().save(target, NEW, "edit");

        assertTrue(result.isSuccess());
        assertNull(result.getBackupUuid());
        assertArrayEquals(NEW, Files.readAllBytes(target));
        List<Map<String, Object>> rows = rows();
        assertEquals(3, rows.size());
        assertEquals("gamma", rows.get(2).get("text"));
        assertEquals(target.toAbsolutePath().normalize().toString(), rows.get(0).get("file_path"));
        assertTrue(backups.list().isEmpty());
        assertTrue(strayFiles().isEmpty());
    }

    @Test
    public void testKeepBackup() throws Exception {
        seedOldState();

        SaveResult result = saver().setKeepBackup(true).save(target, NEW, "edit");

        assertTrue(result.isSuccess());
        assertNotNull(result.getBackupUuid());
        backups.restore(result.getBackupUuid());
        assertArrayEquals(OLD, Files.readAllBytes(target));
    }

    @Test
    public void testInvalidContentHasNoSideEffects() throws Exception {
        seedOldState();

        SaveResult result = saver().save(target, new byte[]{'o', 'k', (byte) 0xc3}, "broken");

        assertFalse(result.isSuccess());
        assertEquals(SaveStage.VALIDATE, result.getFailedStage());
        assertEquals(ErrorCode.ATOMIC_SAVE_FAILED, result.getError().getCode());
        assertTrue(result.isClean());
        assertArrayEquals(OLD, Files.readAllBytes(target));
        assertEquals(2, rows().size());
        assertTrue(backups.list().isEmpty());
    }

    @Test
    public void testFailureAtEveryStageLeavesOldState() throws Exception {
        seedOldState();
        List<Map<String, Object>> before = rows();

        for (SaveStage failing : SaveStage.values()) {
            SaveResult result = saver()
                .setListener(stage -> {
                    if (stage == failing) {
                        throw new IllegalStateException("injected failure at " + stage);
                    }
                })
                .save(target, NEW, "edit");

            assertFalse(failing.name(), result.isSuccess());
            assertEquals(failing, result.getFailedStage());
            assertTrue(failing.name(), result.isClean());
            assertArrayEquals(failing.name(), OLD, Files.readAllBytes(target));
            assertEquals(failing.name(), before, rows());
            assertNull(driver.activeTransaction());
            assertTrue(failing.name(), strayFiles().isEmpty());
            assertTrue(failing.name(), backups.list().isEmpty());
        }
    }

    @Test
    public void testFailedSaveOfNewFileRemovesIt() throws Exception {
        DerivedDataExtractor failing = new LineExtractor() {
            @Override
            public List<Map<String, Object>> extract(Path file, byte[] content) {
                List<Map<String, Object>> rows = super.extract(file, content);
                rows.get(0).put("no_such_column", 1L);
                return rows;
            }
        };
        AtomicSaver saver = new AtomicSaver(db, backups, new Utf8TextValidator(), failing);

        SaveResult result = saver.save(target, NEW, "create");

        assertFalse(result.isSuccess());
        assertEquals(SaveStage.UPDATE_DATABASE, result.getFailedStage());
        assertFalse(Files.exists(target));
        assertTrue(rows().isEmpty());
        assertTrue(strayFiles().isEmpty());
    }

    @Test
    public void testCommitStageFailureOnNewFileDeletesIt() throws Exception {
        SaveResult result = saver()
            .setListener(stage -> {
                if (stage == SaveStage.COMMIT) {
                    throw new IllegalStateException("injected");
                }
            })
            .save(target, NEW, "create");

        assertEquals(SaveStage.COMMIT, result.getFailedStage());
        assertTrue(result.isClean());
        assertFalse(Files.exists(target));
        assertTrue(rows().isEmpty());
    }
}
