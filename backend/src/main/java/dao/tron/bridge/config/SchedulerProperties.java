package dao.tron.bridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private PendingReportConfig pendingReport = new PendingReportConfig();
    private ReconcileConfig reconcile = new ReconcileConfig();

    @Data
    public static class PendingReportConfig {
        /**
         * Enable/disable the stale pending-work report
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often to scan for stale attestations and proposals (in milliseconds)
         * Default: 60000ms (1 minute)
         */
        private long checkIntervalMs = 60_000;

        /**
         * Age after which a quorum still being collected, or an approved but unexecuted
         * proposal, is reported. Nothing expires; this only drives logging.
         * Default: 86400 seconds (1 day)
         */
        private long staleAfterSeconds = 86_400;
    }

    @Data
    public static class ReconcileConfig {
        /**
         * Enable/disable polling the asset ledger for unconfirmed transfers
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often to ask the asset ledger about unconfirmed transfers (in milliseconds)
         * Default: 15000ms
         */
        private long checkIntervalMs = 15_000;
    }
}
