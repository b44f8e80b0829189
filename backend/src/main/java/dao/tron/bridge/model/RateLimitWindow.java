package dao.tron.bridge.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitWindow {

    private BigInteger volume;
    private Instant windowStart;

    public RateLimitWindow copy() {
        return new RateLimitWindow(volume, windowStart);
    }
}
