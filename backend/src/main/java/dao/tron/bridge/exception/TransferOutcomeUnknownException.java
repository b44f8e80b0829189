package dao.tron.bridge.exception;

import lombok.Getter;

import java.util.Map;

/**
 * The transfer left this process but its result is not known. Funds may still move,
 * so nothing recorded for it may be rolled back.
 */
@Getter
public class TransferOutcomeUnknownException extends BridgeException {

    private final String txId;

    public TransferOutcomeUnknownException(String message, String txId, Map<String, Object> details, Throwable cause) {
        super(BridgeErrorCode.TRANSFER_UNCONFIRMED, message, details, cause);
        this.txId = txId;
    }
}
