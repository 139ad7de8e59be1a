package com.streamfirst.olap.cooldown.boot;

import com.streamfirst.olap.cooldown.application.CooldownService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically asks the cooldown service to try every tablet with a storage policy.
 */
@Slf4j
@RequiredArgsConstructor
public class CooldownScheduler {

    private final CooldownService cooldownService;

    @Scheduled(fixedDelayString = "${cooldown.interval:PT1M}", initialDelayString = "${cooldown.interval:PT1M}")
    public void runOnce() {
        int submitted = cooldownService.cooldownAll().size();
        log.debug("Cooldown pass submitted {} tablets", submitted);
    }
}
