package org.tlsfixtures.junit;

import com.google.common.base.Supplier;
import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;
import org.tlsfixtures.SetupOutcome;
import org.tlsfixtures.probe.TlsRequirements;

/**
 * Skips the tests it guards when the JVM cannot negotiate the required TLS version. For example:
 *
 * <pre>
 * &#064;ClassRule
 * public static final TlsVersionRule TLS_1_3 = TlsVersionRule.requiresTlsV1_3();
 * </pre>
 */
public class TlsVersionRule implements TestRule {

    private final Supplier<SetupOutcome> requirement;

    TlsVersionRule(Supplier<SetupOutcome> requirement) {
        this.requirement = requirement;
    }

    public static TlsVersionRule requiresTlsV1() {
        return new TlsVersionRule(() -> TlsRequirements.probed().requireTlsV1());
    }

    public static TlsVersionRule requiresTlsV1_1() {
        return new TlsVersionRule(() -> TlsRequirements.probed().requireTlsV1_1());
    }

    public static TlsVersionRule requiresTlsV1_2() {
        return new TlsVersionRule(() -> TlsRequirements.probed().requireTlsV1_2());
    }

    public static TlsVersionRule requiresTlsV1_3() {
        return new TlsVersionRule(() -> TlsRequirements.probed().requireTlsV1_3());
    }

    @Override
    public Statement apply(final Statement base, Description description) {
        return new Statement() {
            @Override
            public void evaluate() throws Throwable {
                JUnitOutcomes.apply(requirement.get());
                base.evaluate();
            }
        };
    }
}
