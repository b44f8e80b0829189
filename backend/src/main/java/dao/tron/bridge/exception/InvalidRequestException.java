package dao.tron.bridge.exception;

import java.util.Map;

public class InvalidRequestException extends BridgeException {

    public InvalidRequestException(BridgeErrorCode code, String message) {
        super(code, message, null, null);
    }

    public InvalidRequestException(BridgeErrorCode code, String message, Map<String, Object> details) {
        super(code, message, details, null);
    }
}
