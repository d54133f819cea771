package top.guoziyang.dbrpc.backend.server;

import top.guoziyang.dbrpc.backend.queue.QueuedRequest;

/**
 * 调度循环每取出一个请求、提交给工作线程之前回调一次，按出队顺序
 */
public interface DispatchListener {
    void dispatched(QueuedRequest item);
}
