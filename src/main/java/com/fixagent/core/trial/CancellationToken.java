package com.fixagent.core.trial;

import com.fixagent.core.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Cancellation signal for one trial run. Fires at most once; callbacks
 * registered after it fired run immediately.
 */
public class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final List<Runnable> callbacks = new ArrayList<>();
    private FailureKind reason;

    /**
     * @param kind {@link FailureKind#CANCELLED} or {@link FailureKind#TIMED_OUT}
     * @return false if the token had already fired
     */
    public boolean cancel(FailureKind kind) {
        List<Runnable> toRun;
        synchronized (this) {
            if (reason != null) {
                return false;
            }
            reason = kind;
            toRun = List.copyOf(callbacks);
        }
        toRun.forEach(CancellationToken::runSafely);
        return true;
    }

    public synchronized boolean isCancelled() {
        return reason != null;
    }

    /** Reason the token fired, or null. */
    public synchronized FailureKind reason() {
        return reason;
    }

    public void onCancel(Runnable callback) {
        synchronized (this) {
            if (reason == null) {
                callbacks.add(callback);
                return;
            }
        }
        runSafely(callback);
    }

    /**
     * @throws TrialCancelledException if the token has fired
     */
    public void throwIfCancelled() {
        FailureKind kind = reason();
        if (kind != null) {
            throw new TrialCancelledException(kind);
        }
    }

    private static void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.warn("Cancellation callback failed: {}", e.getMessage());
        }
    }
}
