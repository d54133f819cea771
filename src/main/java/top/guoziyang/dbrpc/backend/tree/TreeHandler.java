package top.guoziyang.dbrpc.backend.tree;

import java.util.Map;

/**
 * 语法树操作的外部实现
 *
 * 驱动本身不理解语法树，只负责参数校验和转发。
 * 处理器在驱动的工作线程里执行，可以抛出DriverException表示业务错误。
 */
public interface TreeHandler {

    Map<String, Object> query(TreeRequest request);

    Map<String, Object> modify(TreeRequest request);
}
