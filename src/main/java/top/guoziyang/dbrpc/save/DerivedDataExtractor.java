package top.guoziyang.dbrpc.save;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 派生数据提取器 - 从文件内容算出要写进数据库的行
 *
 * 保存时先删除表中 fileColumn = 文件路径 的旧行，再插入extract返回的新行，
 * 新行的fileColumn由保存器填写。
 */
public interface DerivedDataExtractor {

    String tableName();

    String fileColumn();

    List<Map<String, Object>> extract(Path target, byte[] content);
}
