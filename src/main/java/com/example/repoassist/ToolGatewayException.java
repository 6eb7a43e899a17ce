package com.example.repoassist;

/** Typed failure of a single tool call; the request itself carries on. */
public class ToolGatewayException extends Exception {

    private final ToolFailureKind kind;

    public ToolGatewayException(ToolFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ToolGatewayException(ToolFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ToolFailureKind getKind() {
        return kind;
    }
}
