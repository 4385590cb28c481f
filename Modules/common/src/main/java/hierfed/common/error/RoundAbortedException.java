package hierfed.common.error;

/** A round that cannot reach finalization. The global model stays unchanged. */
public class RoundAbortedException extends Exception {
    public enum Reason {
        NOT_READY,
        INSUFFICIENT_PARTICIPANTS,
        INSUFFICIENT_PARTIAL_SUMS,
        RECONSTRUCTION_FAILED,
        INSUFFICIENT_VOTES,
        VALIDATION_REJECTED,
        FINALIZATION_FAILED
    }

    private final long round;
    private final Reason reason;

    public RoundAbortedException(long round, Reason reason, String message) {
        super(message);
        this.round = round;
        this.reason = reason;
    }

    public long round() { return round; }
    public Reason reason() { return reason; }
}
