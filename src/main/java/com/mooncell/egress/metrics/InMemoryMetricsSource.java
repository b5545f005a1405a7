package com.mooncell.egress.metrics;

import com.mooncell.egress.core.anomaly.MetricSample;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

public class InMemoryMetricsSource implements MetricsSource {
    private final List<MetricSample> samples;

    public InMemoryMetricsSource(Collection<MetricSample> samples) {
        this.samples = List.copyOf(samples);
    }

    public InMemoryMetricsSource() {
        this(new ArrayList<>());
    }

    @Override
    public List<MetricSample> fetchSamples(long sinceSeconds, double now) {
        double cutoff = now - sinceSeconds;
        return samples.stream()
                .filter(s -> s.getTimestamp() >= cutoff)
                .collect(Collectors.toList());
    }
}
