package com.robusta.sandbox.rdb;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class DriverException extends DbControllerException {
    private final String sql;
    private final List<Object> arguments;

    public DriverException(String message, Throwable cause) {
        super(message, cause);
        this.sql = null;
        this.arguments = Collections.emptyList();
    }

    public DriverException(String message) {
        super(message);
        this.sql = null;
        this.arguments = Collections.emptyList();
    }

    public DriverException(String message, Throwable cause, String sql, Object... arguments) {
        super(String.format("%s: %s SQL: [%s] Params: %s",
                message, cause == null ? null : cause.getMessage(), sql, Arrays.toString(arguments)), cause);
        this.sql = sql;
        this.arguments = arguments == null ? Collections.emptyList() : Collections.unmodifiableList(Arrays.asList(arguments));
    }

    /**
     * @return the SQL text of the failing statement, or {@code null} if the failure is not tied to one
     */
    public String getSql() {
        return sql;
    }

    public List<Object> getArguments() {
        return arguments;
    }
}
