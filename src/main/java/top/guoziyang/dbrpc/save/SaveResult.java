package top.guoziyang.dbrpc.save;

import top.guoziyang.dbrpc.common.DriverException;

/**
 * 原子保存的结果
 *
 * clean为false表示回滚本身没有完全成功，文件或数据库可能需要人工检查，
 * 此时备份一定会保留，backupUuid指向它。
 */
public class SaveResult {

    private final boolean success;
    private final SaveStage failedStage;
    private final String backupUuid;
    private final DriverException error;
    private final boolean clean;

    private SaveResult(boolean success, SaveStage failedStage, String backupUuid,
                       DriverException error, boolean clean) {
        this.success = success;
        this.failedStage = failedStage;
        this.backupUuid = backupUuid;
        this.error = error;
        this.clean = clean;
    }

    static SaveResult succeeded(String backupUuid) {
        return new SaveResult(true, null, backupUuid, null, true);
    }

    static SaveResult failed(SaveStage stage, DriverException error, String backupUuid, boolean clean) {
        return new SaveResult(false, stage, backupUuid, error, clean);
    }

    public boolean isSuccess() {
        return success;
    }

    public SaveStage getFailedStage() {
        return failedStage;
    }

    /**
     * @return 保留下来的备份，没有保留时为null
     */
    public String getBackupUuid() {
        return backupUuid;
    }

    public DriverException getError() {
        return error;
    }

    public boolean isClean() {
        return clean;
    }

    @Override
    public String toString() {
        if (success) {
            return "SaveResult{success, backup=" + backupUuid + "}";
        }
        return "SaveResult{failed at " + failedStage + ", clean=" + clean + ", error=" + error + "}";
    }
}
