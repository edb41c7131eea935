package com.officehub.backend.global.error;

/**
 * A typed failure raised by a workflow operation. Always thrown before any state is
 * written, or inside the transaction that is then rolled back.
 */
public class WorkflowException extends ProblemException {

    private final ErrorKind kind;

    public WorkflowException(ErrorKind kind, String code) {
        this(kind, code, null);
    }

    public WorkflowException(ErrorKind kind, String code, String detail) {
        super(kind.status(), code, detail);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static WorkflowException notFound(String code) {
        return new WorkflowException(ErrorKind.NOT_FOUND, code);
    }

    public static WorkflowException forbidden(String code) {
        return new WorkflowException(ErrorKind.FORBIDDEN, code);
    }

    public static WorkflowException invalidTransition(String code, String detail) {
        return new WorkflowException(ErrorKind.INVALID_TRANSITION, code, detail);
    }

    public static WorkflowException invalidInterval(String code, String detail) {
        return new WorkflowException(ErrorKind.INVALID_INTERVAL, code, detail);
    }

    public static WorkflowException conflict(String code, String detail) {
        return new WorkflowException(ErrorKind.CONFLICT, code, detail);
    }
}
