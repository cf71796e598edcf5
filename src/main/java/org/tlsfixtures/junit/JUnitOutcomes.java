package org.tlsfixtures.junit;

import com.google.common.base.Throwables;
import org.junit.AssumptionViolatedException;
import org.tlsfixtures.SetupOutcome;

/**
 * Maps {@link SetupOutcome}s onto JUnit: a skip becomes a failed assumption, which JUnit reports as an ignored test,
 * and a failure rethrows the setup error.
 */
final class JUnitOutcomes {

    private JUnitOutcomes() {
    }

    static void apply(SetupOutcome outcome) {
        switch (outcome.getKind()) {
            case SKIP:
                throw new AssumptionViolatedException(outcome.getReason());
            case FAIL:
                Throwables.throwIfUnchecked(outcome.getCause());
                throw new IllegalStateException("Fixture setup failed", outcome.getCause());
            default:
                break;
        }
    }
}
