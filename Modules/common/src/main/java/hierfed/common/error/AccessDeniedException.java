package hierfed.common.error;

/** Attribute keys do not satisfy a ciphertext's policy, or belong to an outdated epoch. */
public class AccessDeniedException extends Exception {
    private final boolean staleEpoch;

    public AccessDeniedException(String message, boolean staleEpoch) {
        super(message);
        this.staleEpoch = staleEpoch;
    }

    public boolean staleEpoch() { return staleEpoch; }
}
