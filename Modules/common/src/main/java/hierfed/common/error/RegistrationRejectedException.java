package hierfed.common.error;

/** Terminal for one registration attempt; the facility must retry with a fresh proof. */
public class RegistrationRejectedException extends Exception {
    public enum Reason { INVALID_PROOF, REUSED_PROOF, DUPLICATE_ID, UNKNOWN_CHALLENGE, INVALID_ATTRIBUTES, REVOKED }

    private final Reason reason;

    public RegistrationRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() { return reason; }
}
