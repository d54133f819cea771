package top.guoziyang.dbrpc.schema;

import java.util.List;
import java.util.regex.Pattern;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * SQL标识符校验
 *
 * 表名、列名、索引名都会被直接拼进SQL语句，只能通过参数绑定传值，
 * 所以标识符本身必须满足 [A-Za-z_][A-Za-z0-9_]*。
 */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SqlIdentifiers() {
    }

    public static boolean isValid(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    /**
     * @throws DriverException INVALID_PARAMS，标识符为空或包含非法字符
     */
    public static String check(String name, String what) {
        if (!isValid(name)) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "Invalid " + what + " name: " + name);
        }
        return name;
    }

    public static List<String> checkAll(List<String> names, String what) {
        for (String name : names) {
            check(name, what);
        }
        return names;
    }
}
