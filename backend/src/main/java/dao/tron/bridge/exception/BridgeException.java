package dao.tron.bridge.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of every rejection the control plane produces. The operation that threw it left
 * no visible state change behind.
 */
@Getter
public abstract class BridgeException extends RuntimeException {

    private final BridgeErrorCode code;
    /** State values relevant to the rejection, e.g. signatures vs. required. */
    private final Map<String, Object> details;

    protected BridgeException(BridgeErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}
