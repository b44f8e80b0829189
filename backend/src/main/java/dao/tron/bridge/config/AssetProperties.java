package dao.tron.bridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "asset")
@Data
public class AssetProperties {

    /**
     * Which asset-transfer backend moves the tokens: "in-memory" or "trc20".
     */
    private String mode = "in-memory";

    /**
     * Account that holds locked tokens (in-memory mode). It can never lock or receive a release.
     * In trc20 mode the custody account is the address of the configured private key.
     */
    private String custodyAccount = "bridge-custody";

    /**
     * Opening balances for the in-memory ledger, keyed by account.
     */
    private Map<String, BigInteger> initialBalances = new LinkedHashMap<>();

    private Trc20 trc20 = new Trc20();

    @Data
    public static class Trc20 {
        /**
         * TRC-20 token contract address (base58 format)
         * Example: TXYZopYRdj2D9XRtbG411XZZ3kM5VkAeBf
         */
        private String tokenAddress;

        /**
         * Custody private key (hex format, 64 characters)
         */
        private String privateKey;

        private long feeLimit = 100_000_000L;
    }
}
