package com.fixagent.core.model;

import java.io.PrintWriter;
import java.io.Serializable;
import java.io.StringWriter;

/**
 * Captured details of a failure that ended a trial.
 */
public record ExceptionInfo(
    String exceptionType,
    String exceptionMessage,
    String traceback,
    FailureKind kind
) implements Serializable {

    public ExceptionInfo {
        if (kind == null) kind = FailureKind.UNEXPECTED;
    }

    public static ExceptionInfo from(Throwable t) {
        return new ExceptionInfo(
                t.getClass().getSimpleName(),
                t.getMessage() != null ? t.getMessage() : "",
                stackTrace(t),
                kindOf(t));
    }

    static FailureKind kindOf(Throwable t) {
        return t instanceof ClassifiedFailure classified && classified.failureKind() != null
                ? classified.failureKind()
                : FailureKind.UNEXPECTED;
    }

    public static String stackTrace(Throwable t) {
        var writer = new StringWriter();
        t.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
