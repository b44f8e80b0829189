package dao.tron.bridge.exception;

import java.util.Map;

public class AuthorizationException extends BridgeException {

    public AuthorizationException(BridgeErrorCode code, String message, Map<String, Object> details) {
        super(code, message, details, null);
    }
}
