package com.mooncell.egress.core.recalibration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "egress.recalibration", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RecalibrationScheduler {

    private final RecalibrationController recalibrationController;

    // 默认每小时重校准一次
    @Scheduled(initialDelayString = "${egress.recalibration.initial-delay-ms:60000}",
            fixedDelayString = "${egress.recalibration.interval-ms:3600000}")
    public void recalibrate() {
        try {
            recalibrationController.run();
        } catch (RuntimeException e) {
            log.error("Scheduled recalibration failed", e);
        }
    }
}
