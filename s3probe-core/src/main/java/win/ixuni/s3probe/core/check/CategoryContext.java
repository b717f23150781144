package win.ixuni.s3probe.core.check;

import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.gateway.StorageGateway;

import java.time.Clock;
import java.time.Instant;

/**
 * Everything a category needs from its environment, handed over at construction
 */
@Value
@Builder
public class CategoryContext {

    StorageGateway gateway;

    ProbeProperties.TestDataConfig testData;

    /**
     * Logger handle of this category, named s3probe.check.&lt;category&gt;
     */
    Logger logger;

    /**
     * Probes do not start after this instant. Null for no deadline.
     */
    Instant deadline;

    @Builder.Default
    Clock clock = Clock.systemUTC();
}
