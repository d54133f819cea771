package top.guoziyang.dbrpc.transport;

/**
 * 请求优先级，声明顺序即从低到高
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    URGENT;

    public static Priority fromWire(Object raw) {
        if (raw == null) {
            return NORMAL;
        }
        for (Priority p : values()) {
            if (p.name().equalsIgnoreCase(raw.toString())) {
                return p;
            }
        }
        return NORMAL;
    }
}
