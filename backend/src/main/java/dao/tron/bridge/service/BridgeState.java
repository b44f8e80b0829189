package dao.tron.bridge.service;

import dao.tron.bridge.config.BridgeProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Counters and live parameters shared by lock, release and governance.
 * Only mutated from inside an {@link OperationGuard} operation.
 */
@Slf4j
@Getter
@Component
public class BridgeState {

    private long nextNonce;
    private BigInteger totalLocked = BigInteger.ZERO;
    private BigInteger totalReleased = BigInteger.ZERO;
    private int requiredValidations;
    private boolean paused;

    public BridgeState(BridgeProperties props) {
        if (props.getRequiredValidations() < 1) {
            throw new IllegalArgumentException("bridge.required-validations must be at least 1");
        }
        this.requiredValidations = props.getRequiredValidations();
        this.paused = props.isPaused();
        log.info("BridgeState initialized: requiredValidations={}, paused={}", requiredValidations, paused);
    }

    long allocateNonce() {
        return nextNonce++;
    }

    /**
     * Gives back the most recently allocated nonce, keeping the sequence gap-free on rollback.
     */
    void returnNonce(long nonce) {
        if (nonce != nextNonce - 1) {
            throw new IllegalStateException("Only the last allocated nonce can be returned: " + nonce);
        }
        nextNonce--;
    }

    void addLocked(BigInteger amount) {
        totalLocked = totalLocked.add(amount);
    }

    void subtractLocked(BigInteger amount) {
        totalLocked = totalLocked.subtract(amount);
    }

    void addReleased(BigInteger amount) {
        totalReleased = totalReleased.add(amount);
    }

    void subtractReleased(BigInteger amount) {
        totalReleased = totalReleased.subtract(amount);
    }

    void setRequiredValidations(int requiredValidations) {
        this.requiredValidations = requiredValidations;
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }
}
