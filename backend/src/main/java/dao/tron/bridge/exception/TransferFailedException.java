package dao.tron.bridge.exception;

import java.util.Map;

public class TransferFailedException extends BridgeException {

    public TransferFailedException(String message, Map<String, Object> details) {
        super(BridgeErrorCode.TRANSFER_FAILED, message, details, null);
    }

    public TransferFailedException(String message, Map<String, Object> details, Throwable cause) {
        super(BridgeErrorCode.TRANSFER_FAILED, message, details, cause);
    }
}
