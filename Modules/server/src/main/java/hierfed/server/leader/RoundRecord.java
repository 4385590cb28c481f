package hierfed.server.leader;

import hierfed.proto.RoundSummary;

import java.util.List;

/** Audit entry for one finished round. {@code version} is the model version current after the round. */
public record RoundRecord(long round,
                          Outcome outcome,
                          String reason,
                          long version,
                          List<String> participants,
                          List<Integer> fogIndices,
                          List<String> dissent,
                          long uploadBytes,
                          long downloadBytes) {

    public enum Outcome { FINALIZED, ABORTED }

    public RoundRecord {
        participants = List.copyOf(participants);
        fogIndices = List.copyOf(fogIndices);
        dissent = List.copyOf(dissent);
    }

    public boolean finalized() { return outcome == Outcome.FINALIZED; }

    public RoundSummary toProto() {
        return RoundSummary.newBuilder()
                .setRound(round)
                .setOutcome(outcome.name())
                .setReason(reason == null ? "" : reason)
                .setVersion(version)
                .addAllParticipants(participants)
                .addAllFogIndices(fogIndices)
                .addAllDissent(dissent)
                .setUploadBytes(uploadBytes)
                .setDownloadBytes(downloadBytes)
                .build();
    }
}
