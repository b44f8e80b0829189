package dao.tron.bridge.service;

import dao.tron.bridge.config.AssetProperties;
import dao.tron.bridge.exception.TransferFailedException;
import dao.tron.bridge.exception.TransferOutcomeUnknownException;
import dao.tron.bridge.model.TransferReceipt;
import dao.tron.bridge.model.TransferStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.tron.trident.abi.FunctionEncoder;
import org.tron.trident.abi.FunctionReturnDecoder;
import org.tron.trident.abi.TypeReference;
import org.tron.trident.abi.datatypes.Address;
import org.tron.trident.abi.datatypes.Bool;
import org.tron.trident.abi.datatypes.Function;
import org.tron.trident.abi.datatypes.Type;
import org.tron.trident.abi.datatypes.generated.Uint256;
import org.tron.trident.core.ApiWrapper;
import org.tron.trident.core.NodeType;
import org.tron.trident.proto.Chain;
import org.tron.trident.proto.Response;
import org.tron.trident.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves a TRC-20 token between users and the custody address derived from the configured key.
 * Locking pulls with transferFrom, so the user must have approved the custody address first.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "asset", name = "mode", havingValue = "trc20")
public class Trc20AssetLedger implements AssetLedger {

    private final ApiWrapper wrapper;
    private final String custodyAddress;
    private final String tokenAddress;
    private final AssetProperties.Trc20 props;

    public Trc20AssetLedger(AssetProperties assetProps) {
        this.props = assetProps.getTrc20();
        this.tokenAddress = props.getTokenAddress();

        String privateKey = props.getPrivateKey();
        if (privateKey == null || privateKey.isEmpty() || privateKey.equals("YOUR_PRIVATE_KEY_HERE")) {
            log.warn("No valid custody key configured. Set BRIDGE_CUSTODY_PRIVATE_KEY to enable token transfers.");
            this.wrapper = null;
            this.custodyAddress = "NOT_CONFIGURED";
            return;
        }

        ApiWrapper tempWrapper;
        String tempCustody;
        try {
            tempWrapper = ApiWrapper.ofNile(privateKey);
            tempCustody = tempWrapper.keyPair.toBase58CheckAddress();
            log.info("Trc20AssetLedger initialized: custody={}, token={}", tempCustody, tokenAddress);
        } catch (Exception e) {
            log.error("Failed to initialize: {}", e.getMessage());
            tempWrapper = null;
            tempCustody = "INIT_FAILED";
        }
        this.wrapper = tempWrapper;
        this.custodyAddress = tempCustody;
    }

    @Override
    public TransferReceipt debit(String account, BigInteger amount) {
        requireWrapper("transferFrom", account, amount);
        Function fn = new Function(
                "transferFrom",
                Arrays.asList(new Address(account), new Address(custodyAddress), new Uint256(amount)),
                Collections.singletonList(new TypeReference<Bool>() {})
        );
        return send("transferFrom", fn, account, amount);
    }

    @Override
    public TransferReceipt credit(String account, BigInteger amount) {
        requireWrapper("transfer", account, amount);
        Function fn = new Function(
                "transfer",
                Arrays.asList(new Address(account), new Uint256(amount)),
                Collections.singletonList(new TypeReference<Bool>() {})
        );
        return send("transfer", fn, account, amount);
    }

    /**
     * One TransactionInfo lookup. A transaction the node does not know yet is UNCONFIRMED.
     */
    @Override
    public TransferStatus transferStatus(String txId) {
        if (wrapper == null || txId == null || txId.isEmpty()) {
            return TransferStatus.UNCONFIRMED;
        }
        Response.TransactionInfo info;
        try {
            info = wrapper.getTransactionInfoById(txId);
        } catch (Exception e) {
            log.debug("TransactionInfo not yet available for {}: {}", txId, e.getMessage());
            return TransferStatus.UNCONFIRMED;
        }
        if (info == null || info.getId().isEmpty()) {
            return TransferStatus.UNCONFIRMED;
        }
        if (info.getResult() != Response.TransactionInfo.code.SUCESS) {
            log.warn("Transfer {} reverted: {}", txId, info.getResMessage().toStringUtf8());
            return TransferStatus.FAILED;
        }
        return TransferStatus.CONFIRMED;
    }

    @Override
    public BigInteger custodyBalance() {
        return balanceOf(custodyAddress);
    }

    @Override
    public BigInteger balanceOf(String account) {
        requireWrapper("balanceOf", account, BigInteger.ZERO);
        try {
            Function fn = new Function(
                    "balanceOf",
                    Collections.singletonList(new Address(account)),
                    Collections.singletonList(new TypeReference<Uint256>() {})
            );
            Response.TransactionExtention txn = wrapper.triggerConstantContract(
                    custodyAddress,
                    tokenAddress,
                    FunctionEncoder.encode(fn),
                    NodeType.SOLIDITY_NODE
            );
            String resultHex = Numeric.toHexString(txn.getConstantResult(0).toByteArray());
            List<Type> decoded = FunctionReturnDecoder.decode(resultHex, fn.getOutputParameters());
            if (decoded.isEmpty()) {
                throw new IllegalStateException("Empty balanceOf result for " + account);
            }
            return ((Uint256) decoded.get(0)).getValue();
        } catch (Exception e) {
            log.error("balanceOf failed for {}: {}", account, e.getMessage());
            throw new RuntimeException("Failed to read token balance", e);
        }
    }

    @Override
    public String custodyAccount() {
        return custodyAddress;
    }

    /**
     * Triggers, signs and broadcasts. Failures before the broadcast are definite;
     * once the broadcast has been attempted the outcome is left to {@link #transferStatus}.
     */
    private TransferReceipt send(String method, Function fn, String account, BigInteger amount) {
        Chain.Transaction signed;
        try {
            Response.TransactionExtention txnExt = wrapper.triggerContract(
                    custodyAddress,
                    tokenAddress,
                    FunctionEncoder.encode(fn),
                    0L,
                    0L,
                    null,
                    props.getFeeLimit()
            );
            if (!txnExt.getResult().getResult()) {
                String msg = txnExt.getResult().getMessage().toStringUtf8();
                throw new TransferFailedException(method + " trigger failed: " + msg, transferDetails(method, account, amount));
            }
            signed = wrapper.signTransaction(txnExt);
        } catch (TransferFailedException e) {
            throw e;
        } catch (Exception e) {
            log.error("{} could not be built for {}: {}", method, account, e.getMessage());
            throw new TransferFailedException(method + " could not be built", transferDetails(method, account, amount), e);
        }

        String txId;
        try {
            txId = wrapper.broadcastTransaction(signed);
        } catch (Exception e) {
            log.error("{} broadcast for {} ended without an answer: {}", method, account, e.getMessage());
            throw new TransferOutcomeUnknownException(method + " broadcast outcome unknown", null,
                    transferDetails(method, account, amount), e);
        }
        log.info("{} broadcast: account={}, amount={}, txId={}", method, account, amount, txId);
        return TransferReceipt.unconfirmed(txId);
    }

    private void requireWrapper(String method, String account, BigInteger amount) {
        if (wrapper == null) {
            throw new TransferFailedException("Token ledger not configured: " + custodyAddress,
                    transferDetails(method, account, amount));
        }
    }

    private Map<String, Object> transferDetails(String method, String account, BigInteger amount) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("method", method);
        details.put("account", account);
        details.put("amount", amount);
        return details;
    }
}
