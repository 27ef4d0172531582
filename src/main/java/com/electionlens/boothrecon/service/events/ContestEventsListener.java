package com.electionlens.boothrecon.service.events;

import com.electionlens.boothrecon.service.orchestration.event.ContestFailedEvent;
import com.electionlens.boothrecon.service.orchestration.event.ContestReconciledEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Audit log of contest outcomes. Failure summaries are throttled per failure kind so that a bad
 * batch does not flood the log; the per-contest detail is already logged by the pipeline.
 */
@Component
class ContestEventsListener {
    private static final Logger LOG = LogManager.getLogger(ContestEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onReconciled(ContestReconciledEvent e) {
        if (e.warningCount() > 0) {
            LOG.info("Contest {} reconciled with {} warning(s) via {}: booths={}, outOfBooth={}",
                    e.contestId(), e.warningCount(), e.strategy(), e.booths(), e.outOfBooth());
        } else {
            LOG.debug("Contest {} reconciled via {}: booths={}, outOfBooth={}",
                    e.contestId(), e.strategy(), e.booths(), e.outOfBooth());
        }
    }

    @EventListener
    void onFailed(ContestFailedEvent e) {
        String key = "failed-" + e.kind();
        if (shouldLog(key)) {
            LOG.warn("Contest {} failed ({}): {}. Review the itemized issues and the source sheet.",
                    e.contestId(), e.kind(), e.issues().isEmpty() ? "no detail" : e.issues().get(0));
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
