package io.relay.core.observability;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingMetricsSink implements MetricsSink {
    private static final Logger LOG = LoggerFactory.getLogger("io.relay.metrics");

    @Override
    public void write(List<MetricsEvent> events) {
        for (MetricsEvent event : events) {
            LOG.debug("{} {}", event.type(), event.attributes());
        }
    }
}
