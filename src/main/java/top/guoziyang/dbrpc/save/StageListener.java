package top.guoziyang.dbrpc.save;

/**
 * 阶段监听器，每个阶段开始前调用；抛出异常等同于该阶段失败
 */
public interface StageListener {
    void beforeStage(SaveStage stage);
}
