package com.nosota.certledger.scheduler;

import com.nosota.certledger.chain.Chain;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scheduled audit of the in-memory chain.
 *
 * <p>Re-derives every block hash and checks numbering and linkage. Violations are
 * reported, never repaired.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   chain-integrity:
 *     enabled: true      # enable/disable scheduler
 *     interval: PT5M     # delay between runs
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.chain-integrity.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ChainIntegrityScheduler {

    private final Chain chain;

    @Scheduled(fixedDelayString = "${scheduler.chain-integrity.interval:PT5M}",
            initialDelayString = "${scheduler.chain-integrity.interval:PT5M}")
    public void verifyChainIntegrity() {
        log.debug("Starting scheduled job: verify chain integrity");

        List<String> violations = chain.integrityViolations();
        if (violations.isEmpty()) {
            log.info("Chain integrity verified: height={}, pending={}", chain.height(), chain.pendingCount());
            return;
        }

        log.error("Chain integrity check found {} violation(s)", violations.size());
        for (String violation : violations) {
            log.error("Chain integrity violation: {}", violation);
        }
    }
}
