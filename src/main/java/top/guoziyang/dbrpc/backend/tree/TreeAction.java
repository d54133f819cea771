package top.guoziyang.dbrpc.backend.tree;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

/**
 * modify_tree支持的修改动作
 */
public enum TreeAction {
    REPLACE,
    DELETE,
    INSERT;

    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * 除delete以外都需要携带nodes
     */
    public boolean needsNodes() {
        return this != DELETE;
    }

    public static TreeAction fromWire(String raw) {
        for (TreeAction action : values()) {
            if (action.wireName().equals(raw)) {
                return action;
            }
        }
        throw DriverException.of(ErrorCode.INVALID_PARAMS, "Invalid action: " + raw);
    }
}
