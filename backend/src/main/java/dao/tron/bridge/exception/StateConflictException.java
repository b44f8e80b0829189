package dao.tron.bridge.exception;

import java.util.Map;

public class StateConflictException extends BridgeException {

    public StateConflictException(BridgeErrorCode code, String message, Map<String, Object> details) {
        super(code, message, details, null);
    }
}
