package top.guoziyang.dbrpc.backup;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 一条备份记录
 *
 * backupFile为null表示"新文件"记录：备份时原文件并不存在，
 * 恢复这条记录等于删除原文件。
 */
public class BackupRecord {

    private final String uuid;
    private final Path originalPath;
    private final Path backupFile;
    private final Instant timestamp;
    private final String command;
    private final String comment;

    public BackupRecord(String uuid, Path originalPath, Path backupFile, Instant timestamp,
                        String command, String comment) {
        this.uuid = uuid;
        this.originalPath = originalPath;
        this.backupFile = backupFile;
        this.timestamp = timestamp;
        this.command = command == null ? "" : command;
        this.comment = comment == null ? "" : comment;
    }

    public String getUuid() {
        return uuid;
    }

    public Path getOriginalPath() {
        return originalPath;
    }

    public Path getBackupFile() {
        return backupFile;
    }

    public boolean isNewFile() {
        return backupFile == null;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getCommand() {
        return command;
    }

    public String getComment() {
        return comment;
    }

    @Override
    public String toString() {
        return "BackupRecord{" + uuid + ", " + originalPath + (isNewFile() ? ", new file" : "") + "}";
    }
}
