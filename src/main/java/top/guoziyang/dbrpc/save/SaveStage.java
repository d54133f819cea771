package top.guoziyang.dbrpc.save;

/**
 * 原子保存的阶段，按执行顺序声明
 */
public enum SaveStage {
    VALIDATE,
    BACKUP,
    WRITE_TEMP,
    VALIDATE_TEMP,
    BEGIN_TRANSACTION,
    UPDATE_DATABASE,
    RENAME,
    COMMIT;

    /**
     * 从这个阶段起失败需要回滚（事务、文件、临时文件）
     */
    public boolean needsRollback() {
        return ordinal() >= VALIDATE_TEMP.ordinal();
    }
}
