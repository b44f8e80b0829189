package dao.tron.bridge.service;

import dao.tron.bridge.exception.BridgeErrorCode;
import dao.tron.bridge.exception.StateConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Single write path for all bridge state. Every mutating operation runs to completion
 * under one monitor before the next one starts, and a call that re-enters the control
 * plane while an operation is in flight (e.g. from inside an asset transfer) is rejected.
 */
@Slf4j
@Component
public class OperationGuard {

    private final Object monitor = new Object();
    private String inFlight;

    public <T> T execute(String operation, Supplier<T> body) {
        synchronized (monitor) {
            if (inFlight != null) {
                log.warn("Rejected re-entrant call: {} while {} is in flight", operation, inFlight);
                throw new StateConflictException(BridgeErrorCode.REENTRANT_CALL,
                        "Operation " + operation + " re-entered while " + inFlight + " is in flight",
                        Map.of("operation", operation, "inFlight", inFlight));
            }
            inFlight = operation;
            try {
                return body.get();
            } finally {
                inFlight = null;
            }
        }
    }

    public void run(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Read-only access; sees only committed state.
     */
    public <T> T read(Supplier<T> query) {
        synchronized (monitor) {
            return query.get();
        }
    }
}
