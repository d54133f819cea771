package top.guoziyang.dbrpc.save;

import java.nio.file.Path;

/**
 * 内容校验器 - 按目标格式检查待写入的内容
 */
public interface ContentValidator {

    /**
     * @param target 目标文件，只用于报错和按扩展名区分格式
     * @param content 待校验的完整内容
     * @throws top.guoziyang.dbrpc.common.DriverException INVALID_PARAMS，内容不合法
     */
    void validate(Path target, byte[] content);
}
