package com.propertychain.throttling.service;

import com.propertychain.throttling.store.ViolationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shrinks the request budget of identities that keep hitting their limit.
 * <p>
 * Violations within the retention horizon (24 hours after the latest one) map to a multiplier:
 * <ul>
 *   <li>0 : 1.0</li>
 *   <li>1-2 : 0.8</li>
 *   <li>3-4 : 0.5</li>
 *   <li>5-9 : 0.2</li>
 *   <li>10+ : 0.1</li>
 * </ul>
 * Counts are never decremented; the record simply expires. {@link #clear(String)} lets callers
 * reset it early, for example after a successful login.
 * <p>
 * Store failures never reach the caller: an unreadable record means no penalty.
 */
public class ProgressivePenaltyTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressivePenaltyTracker.class);

    private final ViolationStore violations;

    public ProgressivePenaltyTracker(ViolationStore violations) {
        this.violations = violations;
    }

    public double multiplierFor(String identity) {
        return multiplierForCount(violationCount(identity));
    }

    public long violationCount(String identity) {
        try {
            return violations.count(identity);
        } catch (RuntimeException ex) {
            log.error("Could not read violations for {}, applying no penalty", identity, ex);
            return 0L;
        }
    }

    public void recordViolation(String identity) {
        try {
            violations.increment(identity);
        } catch (RuntimeException ex) {
            log.error("Could not record violation for {}", identity, ex);
        }
    }

    public void clear(String identity) {
        try {
            violations.clear(identity);
        } catch (RuntimeException ex) {
            log.error("Could not clear violations for {}", identity, ex);
        }
    }

    static double multiplierForCount(long violationCount) {
        if (violationCount >= 10) {
            return 0.1;
        }
        if (violationCount >= 5) {
            return 0.2;
        }
        if (violationCount >= 3) {
            return 0.5;
        }
        if (violationCount >= 1) {
            return 0.8;
        }
        return 1.0;
    }
}
