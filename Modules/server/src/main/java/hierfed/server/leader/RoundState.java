package hierfed.server.leader;

public enum RoundState {
    IDLE,
    COLLECTING,
    FOG_RECONSTRUCTING,
    VALIDATING,
    FINALIZING,
    BROADCASTING
}
