package com.mooncell.egress.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 默认 sink：把事件以 JSON 写入日志
 */
@Slf4j
@RequiredArgsConstructor
public class LoggingMetricsSink implements MetricsSink {
    private final ObjectMapper objectMapper;

    @Override
    public void emit(String event, Map<String, Object> payload) {
        try {
            log.info("metrics_event={} {}", event, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            log.info("metrics_event={} {}", event, payload);
        }
    }
}
