package lab.escrow.confirmation;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "escrow.confirmation")
public class ConfirmationProperties {

    private boolean autoStart = true;

    private Duration checkInterval = Duration.ofSeconds(30);

    private int requiredConfirmations = 3;

    /**
     * Age after which a still unconfirmed transaction is failed.
     */
    private Duration maxConfirmationTime = Duration.ofHours(24);

    /**
     * A transaction is failed once its lookup failures exceed maxRetries * 5.
     */
    private int maxRetries = 3;

    private int batchSize = 5;

    private Duration batchPause = Duration.ofSeconds(1);

    /**
     * How long a broadcast hash may stay unknown to the ledger.
     */
    private Duration notFoundGrace = Duration.ofMinutes(10);

    private int checkThreads = 5;
}
