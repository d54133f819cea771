package top.guoziyang.dbrpc.backend.tree;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Params;

/**
 * query_tree / modify_tree 的参数
 *
 * - file_id：文件标识，整数或字符串
 * - filter：节点过滤条件，对驱动来说是不透明的map
 * - action：仅modify_tree，replace | delete | insert
 * - nodes：replace和insert时的新节点
 *
 * 这里只做必填项校验，过滤条件的语义完全由TreeHandler解释。
 */
public class TreeRequest {

    private final Object fileId;
    private final Map<String, Object> filter;
    private final TreeAction action;
    private final List<Object> nodes;

    private TreeRequest(Object fileId, Map<String, Object> filter, TreeAction action, List<Object> nodes) {
        this.fileId = fileId;
        this.filter = filter;
        this.action = action;
        this.nodes = nodes == null ? Collections.emptyList() : nodes;
    }

    public static TreeRequest forQuery(Params params) {
        return new TreeRequest(requireFileId(params), params.requireMap("filter"), null, params.getList("nodes"));
    }

    public static TreeRequest forModify(Params params) {
        Object fileId = requireFileId(params);
        Map<String, Object> filter = params.requireMap("filter");
        TreeAction action = TreeAction.fromWire(params.requireString("action"));
        List<Object> nodes = params.getList("nodes");
        if (action.needsNodes() && (nodes == null || nodes.isEmpty())) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS,
                "nodes parameter required for " + action.name() + " action");
        }
        return new TreeRequest(fileId, filter, action, nodes);
    }

    private static Object requireFileId(Params params) {
        Object fileId = params.get("file_id");
        if (fileId == null) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "file_id parameter is required");
        }
        if (!(fileId instanceof Long) && !(fileId instanceof String)) {
            throw DriverException.of(ErrorCode.INVALID_PARAMS, "file_id must be an integer or a string");
        }
        return fileId;
    }

    public Object getFileId() {
        return fileId;
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    /**
     * @return 查询请求时为null
     */
    public TreeAction getAction() {
        return action;
    }

    public List<Object> getNodes() {
        return nodes;
    }
}
