package dao.tron.bridge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class BridgeConfig {

    /**
     * Single time source for transaction timestamps, the daily window and the audit stream.
     */
    @Bean
    public Clock bridgeClock() {
        return Clock.systemUTC();
    }
}
