package top.guoziyang.dbrpc.backup;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * 备份管理器 - 管理文件备份和数据库快照
 *
 * 目录结构：
 * backupDir/
 *   index.txt                      备份索引
 *   <原文件名>-<uuid>               文件备份
 *   database-<库名>-<uuid>.db       数据库快照
 *
 * 索引格式（每行一条，#开头为注释）：
 * UUID|原文件路径|时间戳|命令|备份文件名|备注
 *
 * 备份文件名为空表示"新文件"记录，原文件在备份时并不存在。
 *
 * 并发：
 * 所有公共方法都是synchronized的，索引文件的读-改-写不会交错。
 * 索引本身通过"写临时文件+原子重命名"落盘，进程中途退出不会留下半截索引。
 *
 * 失败处理：
 * IO错误包装成STORAGE_ERROR抛出。路径里含'|'或换行时以INVALID_PARAMS拒绝。备份是原子保存的前提，
 * 备份失败时调用方必须放弃后续步骤，而不是像"尽力而为"那样返回空值继续执行。
 */
public class BackupManager {

    private static final Logger LOG = LoggerFactory.getLogger(BackupManager.class);

    static final String INDEX_FILE = "index.txt";
    private static final String INDEX_HEADER = "# UUID|File Path|Timestamp|Command|Backup File|Comment";

    private final Path backupDir;
    private final Path indexFile;

    /**
     * 数据库快照的写出方式，由持有数据库连接的一方提供（例如 VACUUM INTO）
     */
    public interface SnapshotWriter {
        void writeTo(Path target) throws IOException;
    }

    public BackupManager(Path backupDir) {
        this.backupDir = backupDir.toAbsolutePath().normalize();
        this.indexFile = this.backupDir.resolve(INDEX_FILE);
    }

    public Path getBackupDir() {
        return backupDir;
    }

    /**
     * 备份一个文件的当前内容
     *
     * 文件不存在时只登记一条"新文件"记录，不复制任何内容。
     *
     * @param file 要备份的文件
     * @param command 触发备份的操作名
     * @param comment 备注
     * @return 新建的备份记录
     */
    public synchronized BackupRecord createBackup(Path file, String command, String comment) {
        Path original = indexable(file);
        String uuid = UUID.randomUUID().toString();
        try {
            Files.createDirectories(backupDir);
            Path backupFile = null;
            if (Files.exists(original)) {
                backupFile = backupDir.resolve(original.getFileName() + "-" + uuid);
                Files.copy(original, backupFile, StandardCopyOption.COPY_ATTRIBUTES);
            }
            BackupRecord record = new BackupRecord(uuid, original, backupFile, Instant.now(), command, comment);
            Map<String, BackupRecord> index = loadIndex();
            index.put(uuid, record);
            saveIndex(index);
            LOG.info("Backup created: {} ({})", original, backupFile == null ? "new file" : uuid);
            return record;
        } catch (IOException e) {
            throw DriverException.wrap(ErrorCode.STORAGE_ERROR, "Failed to back up " + original, e);
        }
    }

    /**
     * 为数据库创建快照备份
     *
     * @param dbPath 数据库文件路径，仅用于登记和命名
     * @param comment 备注
     * @param writer 负责把一致的快照写到目标文件
     * @return 新建的备份记录
     */
    public synchronized BackupRecord createDatabaseBackup(Path dbPath, String comment, SnapshotWriter writer) {
        Path original = indexable(dbPath);
        String uuid = UUID.randomUUID().toString();
        String stem = original.getFileName().toString();
        int dot = stem.lastIndexOf('.');
        if (dot > 0) {
            stem = stem.substring(0, dot);
        }
        Path target = backupDir.resolve("database-" + stem + "-" + uuid + ".db");
        try {
            Files.createDirectories(backupDir);
            writer.writeTo(target);
            BackupRecord record = new BackupRecord(uuid, original, target, Instant.now(), "sync_schema", comment);
            Map<String, BackupRecord> index = loadIndex();
            index.put(uuid, record);
            saveIndex(index);
            LOG.info("Database backup created: {} ({})", target, uuid);
            return record;
        } catch (IOException e) {
            throw DriverException.wrap(ErrorCode.STORAGE_ERROR, "Failed to back up database " + original, e);
        }
    }

    /**
     * 按UUID恢复备份
     *
     * - 普通记录：备份内容先复制到同目录临时文件，再原子替换原文件
     * - 新文件记录：删除原文件
     */
    public synchronized void restore(String uuid) {
        BackupRecord record = find(uuid);
        if (record == null) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "Backup not found: " + uuid);
        }
        Path original = record.getOriginalPath();
        try {
            if (record.isNewFile()) {
                Files.deleteIfExists(original);
                LOG.info("Restored {} by removing the new file", original);
                return;
            }
            if (!Files.exists(record.getBackupFile())) {
                throw DriverException.of(ErrorCode.STORAGE_ERROR, "Backup file missing: " + record.getBackupFile());
            }
            Path parent = original.getParent();
            Files.createDirectories(parent);
            Path tmp = parent.resolve("." + original.getFileName() + ".restore-" + uuid);
            Files.copy(record.getBackupFile(), tmp, StandardCopyOption.REPLACE_EXISTING);
            try {
                Files.move(tmp, original, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tmp);
            }
            LOG.info("Restored {} from backup {}", original, uuid);
        } catch (IOException e) {
            throw DriverException.wrap(ErrorCode.STORAGE_ERROR, "Failed to restore " + original, e);
        }
    }

    /**
     * 删除备份记录及其备份文件
     *
     * @return 记录不存在时返回false
     */
    public synchronized boolean delete(String uuid) {
        try {
            Map<String, BackupRecord> index = loadIndex();
            BackupRecord record = index.remove(uuid);
            if (record == null) {
                return false;
            }
            if (record.getBackupFile() != null) {
                Files.deleteIfExists(record.getBackupFile());
            }
            saveIndex(index);
            LOG.debug("Backup deleted: {}", uuid);
            return true;
        } catch (IOException e) {
            throw DriverException.wrap(ErrorCode.STORAGE_ERROR, "Failed to delete backup " + uuid, e);
        }
    }

    public synchronized BackupRecord find(String uuid) {
        return loadIndexUnchecked().get(uuid);
    }

    /**
     * 列出全部备份，最新的在前
     */
    public synchronized List<BackupRecord> list() {
        List<BackupRecord> records = new ArrayList<>(loadIndexUnchecked().values());
        records.sort(Comparator.comparing(BackupRecord::getTimestamp).reversed());
        return records;
    }

    /**
     * 列出某个文件的全部备份版本，最新的在前
     */
    public synchronized List<BackupRecord> listVersions(Path file) {
        Path original = file.toAbsolutePath().normalize();
        List<BackupRecord> versions = new ArrayList<>();
        for (BackupRecord record : list()) {
            if (record.getOriginalPath().equals(original)) {
                versions.add(record);
            }
        }
        return versions;
    }

    private Map<String, BackupRecord> loadIndexUnchecked() {
        try {
            return loadIndex();
        } catch (IOException e) {
            throw DriverException.wrap(ErrorCode.STORAGE_ERROR, "Failed to read backup index", e);
        }
    }

    private Map<String, BackupRecord> loadIndex() throws IOException {
        Map<String, BackupRecord> index = new LinkedHashMap<>();
        if (!Files.exists(indexFile)) {
            return index;
        }
        for (String line : Files.readAllLines(indexFile, StandardCharsets.UTF_8)) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split("\\|", -1);
            if (parts.length < 3) {
                LOG.warn("Skipping malformed backup index line: {}", line);
                continue;
            }
            Instant timestamp;
            try {
                timestamp = Instant.parse(parts[2]);
            } catch (DateTimeParseException e) {
                LOG.warn("Skipping backup index line with bad timestamp: {}", line);
                continue;
            }
            String command = parts.length > 3 ? parts[3] : "";
            String backupName = parts.length > 4 ? parts[4] : "";
            String comment = parts.length > 5 ? parts[5] : "";
            Path backupFile = backupName.isEmpty() ? null : backupDir.resolve(backupName);
            index.put(parts[0], new BackupRecord(parts[0], Path.of(parts[1]), backupFile, timestamp, command, comment));
        }
        return index;
    }

    private void saveIndex(Map<String, BackupRecord> index) throws IOException {
        Files.createDirectories(backupDir);
        Path tmp = backupDir.resolve(INDEX_FILE + ".tmp");
        try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            writer.write(INDEX_HEADER);
            writer.newLine();
            for (BackupRecord record : index.values()) {
                writer.write(record.getUuid() + "|" + record.getOriginalPath() + "|" + record.getTimestamp()
                    + "|" + clean(record.getCommand())
                    + "|" + (record.getBackupFile() == null ? "" : record.getBackupFile().getFileName())
                    + "|" + clean(record.getComment()));
                writer.newLine();
            }
        }
        Files.move(tmp, indexFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * 路径原样写进索引，含分隔符或换行的路径无法登记
     */
    private static Path indexable(Path file) {
        Path original = file.toAbsolutePath().normalize();
        String text = original.toString();
        if (text.indexOf('|') >= 0 || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "Cannot back up path containing '|' or a line break: "
                + text.replace('\n', ' ').replace('\r', ' '));
        }
        return original;
    }

    /**
     * 索引字段里不能出现分隔符和换行
     */
    private static String clean(String field) {
        if (field == null) {
            return "";
        }
        return field.replace('|', '/').replace('\n', ' ').replace('\r', ' ');
    }
}
