package top.guoziyang.dbrpc.backend.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 不可恢复的启动错误：记录后直接退出进程
 */
public class Panic {

    private static final Logger LOG = LoggerFactory.getLogger(Panic.class);

    public static void panic(Exception err) {
        LOG.error("Fatal: {}", err.getMessage(), err);
        System.exit(1);
    }
}
