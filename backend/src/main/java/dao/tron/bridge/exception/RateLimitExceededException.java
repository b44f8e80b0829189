package dao.tron.bridge.exception;

import java.util.Map;

public class RateLimitExceededException extends BridgeException {

    public RateLimitExceededException(String message, Map<String, Object> details) {
        super(BridgeErrorCode.RATE_LIMIT_EXCEEDED, message, details, null);
    }
}
