package dao.tron.bridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "bridge")
@Data
public class BridgeProperties {

    /**
     * Ceiling on the volume moved per daily window, LOCK and RELEASE combined.
     * Base units of the bridged token.
     */
    private BigInteger dailyLimit = BigInteger.valueOf(10_000_000L);

    /**
     * Distinct validator attestations needed before a release may go through.
     */
    private int requiredValidations = 2;

    /**
     * Start in the paused state. Afterwards only governance can flip it.
     */
    private boolean paused = false;

    /**
     * Initial capability holders. Governance proposals change them at runtime.
     */
    private Roles roles = new Roles();

    @Data
    public static class Roles {
        private List<String> admins = new ArrayList<>();
        private List<String> proposers = new ArrayList<>();
        private List<String> approvers = new ArrayList<>();
        private List<String> validators = new ArrayList<>();
        private List<String> relayers = new ArrayList<>();
    }
}
