package org.javai.recovery.classify;

/**
 * The kinds of failure recognised by {@link DefaultTransientFaultClassifier}.
 */
public enum FaultCategory {

    NETWORK_TIMEOUT("network", "timeout", true),
    CONNECTION_REFUSED("network", "connection_refused", true),
    SOCKET("network", "socket", true),
    OPERATION_TIMEOUT("operation", "timeout", true),
    SQL_TRANSIENT("sql", "transient", true),
    SERVICE_UNAVAILABLE("recovery", "transient_fault", true),
    IO("io", "io_error", true),
    UNCATEGORIZED("unknown", "uncategorized", true),

    UNKNOWN_HOST("network", "unknown_host", false),
    FILE_NOT_FOUND("io", "file_not_found", false),
    ACCESS_DENIED("io", "access_denied", false),
    LATENCY_EXCEEDED("recovery", "latency_exceeded", false),
    INTERRUPTED("thread", "interrupted", false),
    DEFECT("defect", "defect", false);

    private final String namespace;
    private final String name;
    private final boolean isTransient;

    FaultCategory(String namespace, String name, boolean isTransient) {
        this.namespace = namespace;
        this.name = name;
        this.isTransient = isTransient;
    }

    /**
     * Stable identifier in the form {@code namespace:name}, e.g. {@code network:timeout}.
     */
    public String code() {
        return namespace + ":" + name;
    }

    public boolean isTransient() {
        return isTransient;
    }
}
