package com.geoinsight.mcp.service;

import com.geoinsight.mcp.exception.InsightException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic and on-startup triggers of the advanced insight refresh.
 * A failed run is logged and retried at the next tick; reads keep the last good set meanwhile.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AdvancedInsightScheduler {

    private final AdvancedInsightService advancedInsightService;

    @Value("${mcp.advanced.refresh-on-startup:true}")
    private boolean refreshOnStartup;

    @EventListener(ApplicationReadyEvent.class)
    public void refreshOnStartup() {
        if (!refreshOnStartup) {
            log.info("Advanced insight startup refresh disabled");
            return;
        }
        runRefresh("startup");
    }

    @Scheduled(cron = "${mcp.advanced.refresh-cron:0 0 3 * * *}")
    public void refreshOnSchedule() {
        runRefresh("schedule");
    }

    private void runRefresh(String trigger) {
        try {
            advancedInsightService.refresh();
        } catch (InsightException e) {
            log.warn("⚠️  Advanced insight refresh ({}) failed [{}]: {}", trigger, e.getErrorCode(), e.getMessage());
        }
    }
}
