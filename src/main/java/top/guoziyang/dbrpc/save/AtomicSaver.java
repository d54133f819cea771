package top.guoziyang.dbrpc.save;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.guoziyang.dbrpc.backup.BackupManager;
import top.guoziyang.dbrpc.backup.BackupRecord;
import top.guoziyang.dbrpc.client.DatabaseApi;
import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * 原子保存器 - 让文件内容和数据库里的派生行一起更新，要么全新，要么全旧
 *
 * 阶段：
 * 1. VALIDATE：校验待写内容，失败则什么都没发生
 * 2. BACKUP：备份目标文件当前内容（文件不存在时登记为新文件）
 * 3. WRITE_TEMP：在目标文件同目录写临时文件
 * 4. VALIDATE_TEMP：重新读出临时文件校验
 * 5. BEGIN_TRANSACTION：开启事务
 * 6. UPDATE_DATABASE：删除该文件的旧派生行，插入新行
 * 7. RENAME：临时文件原子替换目标文件，这是文件系统唯一保证原子的一步
 * 8. COMMIT：提交事务
 *
 * 回滚：
 * VALIDATE_TEMP及之后失败，回滚事务；已经改名的，从备份恢复原内容
 * （原本不存在的文件直接删除）；临时文件总是删除。
 * 回滚过程中再出错，结果标记为不干净并保留备份。
 *
 * 成功后删除备份，除非设置了keepBackup。
 *
 * 同一个目标文件的并发保存由调用方串行化。
 */
public class AtomicSaver {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicSaver.class);

    private static final String BACKUP_COMMAND = "atomic_save";

    private final DatabaseApi db;
    private final BackupManager backups;
    private final ContentValidator validator;
    private final DerivedDataExtractor extractor;
    private StageListener listener;
    private boolean keepBackup;

    public AtomicSaver(DatabaseApi db, BackupManager backups, ContentValidator validator,
                       DerivedDataExtractor extractor) {
        this.db = db;
        this.backups = backups;
        this.validator = validator;
        this.extractor = extractor;
    }

    public AtomicSaver setListener(StageListener listener) {
        this.listener = listener;
        return this;
    }

    public AtomicSaver setKeepBackup(boolean keepBackup) {
        this.keepBackup = keepBackup;
        return this;
    }

    /**
     * 保存一个文件
     *
     * @param target 目标文件
     * @param content 完整的新内容
     * @param comment 备份备注
     */
    public SaveResult save(Path target, byte[] content, String comment) {
        Path file = target.toAbsolutePath().normalize();
        SaveContext ctx = new SaveContext(file, content);
        SaveStage stage = SaveStage.VALIDATE;
        try {
            enter(stage);
            validator.validate(file, content);

            stage = SaveStage.BACKUP;
            enter(stage);
            BackupRecord record = backups.createBackup(file, BACKUP_COMMAND, comment);
            ctx.backupUuid = record.getUuid();

            stage = SaveStage.WRITE_TEMP;
            enter(stage);
            ctx.temp = Files.createTempFile(file.getParent(), "." + file.getFileName(), ".tmp");
            Files.write(ctx.temp, content);

            stage = SaveStage.VALIDATE_TEMP;
            enter(stage);
            byte[] written = Files.readAllBytes(ctx.temp);
            if (!Arrays.equals(written, content)) {
                throw DriverException.of(ErrorCode.STORAGE_ERROR, "Temporary file content differs from staged content");
            }
            validator.validate(file, written);

            stage = SaveStage.BEGIN_TRANSACTION;
            enter(stage);
            ctx.txId = db.beginTransaction();

            stage = SaveStage.UPDATE_DATABASE;
            enter(stage);
            replaceDerivedRows(ctx);

            stage = SaveStage.RENAME;
            enter(stage);
            Files.move(ctx.temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            ctx.renamed = true;

            stage = SaveStage.COMMIT;
            enter(stage);
            db.commitTransaction(ctx.txId);
            ctx.txId = null;
        } catch (IOException | RuntimeException e) {
            return fail(stage, e, ctx);
        }
        LOG.info("Saved {}", file);
        return SaveResult.succeeded(retainOrDrop(ctx.backupUuid, true));
    }

    private void enter(SaveStage stage) {
        LOG.debug("Save stage {}", stage);
        if (listener != null) {
            listener.beforeStage(stage);
        }
    }

    private void replaceDerivedRows(SaveContext ctx) {
        String table = extractor.tableName();
        String column = extractor.fileColumn();
        String key = ctx.file.toString();
        db.delete(table, Collections.<String, Object>singletonMap(column, key), ctx.txId);
        List<Map<String, Object>> rows = extractor.extract(ctx.file, ctx.content);
        for (Map<String, Object> row : rows) {
            Map<String, Object> data = new LinkedHashMap<>(row);
            data.put(column, key);
            db.insert(table, data, ctx.txId);
        }
    }

    private SaveResult fail(SaveStage stage, Exception cause, SaveContext ctx) {
        DriverException error = new DriverException(ErrorCode.ATOMIC_SAVE_FAILED,
            "Save of " + ctx.file + " failed at " + stage + ": " + cause.getMessage(), cause);
        LOG.warn("{}", error.getMessage());
        boolean clean = true;
        if (ctx.txId != null) {
            clean &= rollbackTransaction(ctx.txId);
        }
        if (ctx.renamed) {
            clean &= restoreFile(ctx);
        }
        if (ctx.temp != null) {
            try {
                Files.deleteIfExists(ctx.temp);
            } catch (IOException e) {
                LOG.warn("Failed to remove temporary file {}: {}", ctx.temp, e.getMessage());
            }
        }
        if (!clean) {
            LOG.error("Rollback of {} incomplete, backup {} retained", ctx.file, ctx.backupUuid);
        }
        return SaveResult.failed(stage, error, retainOrDrop(ctx.backupUuid, clean), clean);
    }

    private boolean rollbackTransaction(String txId) {
        try {
            db.rollbackTransaction(txId);
            return true;
        } catch (DriverException e) {
            if (e.getCode() == ErrorCode.TRANSACTION_NOT_FOUND) {
                // 提交失败时驱动已经回滚并结束了事务
                return true;
            }
            LOG.error("Failed to roll back transaction {}: {}", txId, e.getMessage());
            return false;
        }
    }

    private boolean restoreFile(SaveContext ctx) {
        try {
            backups.restore(ctx.backupUuid);
            return true;
        } catch (DriverException e) {
            LOG.error("Failed to restore {} from backup {}: {}", ctx.file, ctx.backupUuid, e.getMessage());
            return false;
        }
    }

    /**
     * @return 保留的备份UUID，已删除时返回null
     */
    private String retainOrDrop(String backupUuid, boolean clean) {
        if (backupUuid == null) {
            return null;
        }
        if (keepBackup || !clean) {
            return backupUuid;
        }
        try {
            backups.delete(backupUuid);
            return null;
        } catch (DriverException e) {
            LOG.warn("Failed to delete backup {}: {}", backupUuid, e.getMessage());
            return backupUuid;
        }
    }

    private static class SaveContext {
        final Path file;
        final byte[] content;
        String backupUuid;
        Path temp;
        String txId;
        boolean renamed;

        SaveContext(Path file, byte[] content) {
            this.file = file;
            this.content = content;
        }
    }
}
