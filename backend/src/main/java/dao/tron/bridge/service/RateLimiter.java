package dao.tron.bridge.service;

import dao.tron.bridge.config.BridgeProperties;
import dao.tron.bridge.exception.RateLimitExceededException;
import dao.tron.bridge.model.RateLimitWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Daily volume ceiling shared by LOCK and RELEASE.
 * <p>
 * The window resets lazily: the first reservation made at least one day after the window
 * started zeroes the volume and starts a new window at that moment. No timer is involved,
 * so a quiet day leaves the old window in place until the next operation.
 */
@Slf4j
@Component
public class RateLimiter {

    static final Duration WINDOW = Duration.ofDays(1);

    private final Clock clock;
    private BigInteger dailyLimit;
    private RateLimitWindow window;

    public RateLimiter(BridgeProperties props, Clock clock) {
        if (props.getDailyLimit() == null || props.getDailyLimit().signum() <= 0) {
            throw new IllegalArgumentException("bridge.daily-limit must be positive");
        }
        this.clock = clock;
        this.dailyLimit = props.getDailyLimit();
        this.window = new RateLimitWindow(BigInteger.ZERO, clock.instant());
    }

    /**
     * Adds amount to the window volume, or throws without touching the window.
     */
    public void checkAndReserve(BigInteger amount) {
        Instant now = clock.instant();
        boolean rolled = hasElapsed(now);
        BigInteger current = rolled ? BigInteger.ZERO : window.getVolume();
        BigInteger next = current.add(amount);

        if (next.compareTo(dailyLimit) > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("dailyLimit", dailyLimit);
            details.put("dailyVolume", current);
            details.put("requested", amount);
            details.put("remaining", dailyLimit.subtract(current).max(BigInteger.ZERO));
            details.put("windowResetsAt", rolled ? now.plus(WINDOW) : window.getWindowStart().plus(WINDOW));
            throw new RateLimitExceededException("Daily limit exceeded", details);
        }

        if (rolled) {
            log.info("Rate limit window reset: previousStart={}, previousVolume={}, newStart={}",
                    window.getWindowStart(), window.getVolume(), now);
            window.setWindowStart(now);
        }
        window.setVolume(next);
    }

    /**
     * Headroom as a reservation made now would see it.
     */
    public BigInteger remaining() {
        BigInteger volume = currentVolume();
        return dailyLimit.subtract(volume).max(BigInteger.ZERO);
    }

    public BigInteger currentVolume() {
        return hasElapsed(clock.instant()) ? BigInteger.ZERO : window.getVolume();
    }

    public BigInteger getDailyLimit() {
        return dailyLimit;
    }

    void setDailyLimit(BigInteger dailyLimit) {
        log.info("Daily limit updated: {} -> {}", this.dailyLimit, dailyLimit);
        this.dailyLimit = dailyLimit;
    }

    public RateLimitWindow snapshot() {
        return window.copy();
    }

    /**
     * Puts back a window captured by {@link #snapshot()} in the same operation.
     */
    void restore(RateLimitWindow saved) {
        this.window = saved.copy();
    }

    private boolean hasElapsed(Instant now) {
        return !now.isBefore(window.getWindowStart().plus(WINDOW));
    }
}
