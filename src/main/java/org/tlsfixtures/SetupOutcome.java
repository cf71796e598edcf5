package org.tlsfixtures;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Result of preparing a fixture. A fixture either lets the test proceed, asks the runner to skip the test because
 * the environment lacks something the test needs, or fails with the error that prevented setup.
 */
public final class SetupOutcome {

    public enum Kind {
        PROCEED,
        SKIP,
        FAIL
    }

    private static final SetupOutcome PROCEED = new SetupOutcome(Kind.PROCEED, null, null);

    private final Kind kind;
    private final String reason;
    private final Throwable cause;

    private SetupOutcome(Kind kind, String reason, Throwable cause) {
        this.kind = kind;
        this.reason = reason;
        this.cause = cause;
    }

    public static SetupOutcome proceed() {
        return PROCEED;
    }

    /**
     * @param reason human-readable requirement that is not met, e.g. "Test requires TLSv1.3"
     */
    public static SetupOutcome skip(String reason) {
        return new SetupOutcome(Kind.SKIP, Preconditions.checkNotNull(reason, "reason"), null);
    }

    public static SetupOutcome fail(Throwable cause) {
        Preconditions.checkNotNull(cause, "cause");
        return new SetupOutcome(Kind.FAIL, cause.getMessage(), cause);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isProceed() {
        return kind == Kind.PROCEED;
    }

    public boolean isSkip() {
        return kind == Kind.SKIP;
    }

    public boolean isFail() {
        return kind == Kind.FAIL;
    }

    /**
     * The skip reason, or the failure message. Null when proceeding.
     */
    public String getReason() {
        return reason;
    }

    /**
     * The setup error. Only set for {@link Kind#FAIL}.
     */
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("kind", kind)
                .add("reason", reason)
                .toString();
    }
}
