package lab.escrow.common;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EscrowConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
