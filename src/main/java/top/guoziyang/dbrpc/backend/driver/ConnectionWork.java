package top.guoziyang.dbrpc.backend.driver;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 在持有连接通道时执行的一段数据库操作
 */
@FunctionalInterface
public interface ConnectionWork<T> {
    T run(Connection conn) throws SQLException;
}
