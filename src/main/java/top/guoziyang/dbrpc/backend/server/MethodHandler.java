package top.guoziyang.dbrpc.backend.server;

import top.guoziyang.dbrpc.transport.Params;
import top.guoziyang.dbrpc.transport.Result;

/**
 * 一个RPC方法的处理器
 */
@FunctionalInterface
interface MethodHandler {
    Result handle(Params params);
}
