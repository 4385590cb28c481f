package hierfed.common.error;

import java.util.List;

/** The committee voted the candidate down. Carries the dissenting votes for the audit log. */
public class ValidationRejectedException extends RoundAbortedException {
    private final List<String> dissent;

    public ValidationRejectedException(long round, List<String> dissent, String message) {
        super(round, Reason.VALIDATION_REJECTED, message);
        this.dissent = List.copyOf(dissent);
    }

    public List<String> dissent() { return dissent; }
}
