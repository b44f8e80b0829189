package dao.tron.bridge.service;

import dao.tron.bridge.config.AssetProperties;
import dao.tron.bridge.exception.TransferFailedException;
import dao.tron.bridge.model.TransferReceipt;
import dao.tron.bridge.model.TransferStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@ConditionalOnProperty(prefix = "asset", name = "mode", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryAssetLedger implements AssetLedger {

    private final String custodyAccount;
    private final Map<String, BigInteger> balances = new HashMap<>();
    private long transferCount;

    public InMemoryAssetLedger(AssetProperties props) {
        this.custodyAccount = props.getCustodyAccount();
        if (props.getInitialBalances() != null) {
            props.getInitialBalances().forEach((account, amount) -> {
                String key = account.trim();
                if (key.equals(custodyAccount)) {
                    throw new IllegalArgumentException("Custody account cannot be seeded: " + key);
                }
                balances.put(key, amount);
            });
        }
        log.info("InMemoryAssetLedger initialized: custody={}, seededAccounts={}", custodyAccount, balances.size());
    }

    @Override
    public synchronized TransferReceipt debit(String account, BigInteger amount) {
        return move(account, custodyAccount, amount);
    }

    @Override
    public synchronized TransferReceipt credit(String account, BigInteger amount) {
        return move(custodyAccount, account, amount);
    }

    @Override
    public TransferStatus transferStatus(String txId) {
        // in-process moves settle before debit/credit return
        return TransferStatus.CONFIRMED;
    }

    @Override
    public synchronized BigInteger custodyBalance() {
        return balanceOf(custodyAccount);
    }

    @Override
    public synchronized BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public String custodyAccount() {
        return custodyAccount;
    }

    private TransferReceipt move(String from, String to, BigInteger amount) {
        BigInteger available = balanceOf(from);
        if (available.compareTo(amount) < 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("account", from);
            details.put("balance", available);
            details.put("requested", amount);
            throw new TransferFailedException("Insufficient balance", details);
        }
        balances.put(from, available.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        log.debug("Moved {} from {} to {}", amount, from, to);
        return TransferReceipt.confirmed("mem-" + (++transferCount));
    }
}
