package io.relay.core.observability;

import java.io.IOException;
import java.util.List;

public interface MetricsSink {
    void write(List<MetricsEvent> events) throws IOException;
}
