package ai.pulse.longrunning;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

@Getter
@Setter
public class JobMonitorConfig {
    /**
     * Status queries per refresh, the first one included.
     */
    private int maxAttempts = 10;
    private Duration retryDelay = Duration.ofSeconds(2);
    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration timeout = Duration.ofSeconds(180);
    private int pollerThreads = 2;
}
