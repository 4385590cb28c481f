package hierfed.common.error;

/** A message for a round that is already closed (or was never opened). Dropped without effect. */
public class StaleMessageException extends Exception {
    private final long messageRound;
    private final long activeRound;

    public StaleMessageException(long messageRound, long activeRound) {
        super("stale: round " + messageRound + " (active " + activeRound + ")");
        this.messageRound = messageRound;
        this.activeRound = activeRound;
    }

    public long messageRound() { return messageRound; }
    public long activeRound() { return activeRound; }
}
