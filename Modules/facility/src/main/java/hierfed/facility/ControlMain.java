package hierfed.facility;

import com.google.protobuf.ByteString;
import hierfed.common.config.DeploymentConfig;
import hierfed.common.net.ChannelFactory;
import hierfed.common.net.PeerChannels;
import hierfed.common.rpc.NodeLauncher;
import hierfed.common.util.Hex;
import hierfed.proto.Ack;
import hierfed.proto.Empty;
import hierfed.proto.FacilityRegistration;
import hierfed.proto.FacilityStatus;
import hierfed.proto.FogStatus;
import hierfed.proto.GlobalModelEnvelope;
import hierfed.proto.LeaderStatus;
import hierfed.proto.LocalDataDelta;
import hierfed.proto.RevokeRequest;
import hierfed.proto.RoundSummary;
import hierfed.proto.StartRoundReply;
import io.grpc.StatusRuntimeException;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/** Operator commands against a running deployment. */
@CommandLine.Command(name = "hierfed-ctl", mixinStandardHelpOptions = true,
        description = "Operate a running deployment.",
        subcommands = {
                ControlMain.Register.class,
                ControlMain.Feed.class,
                ControlMain.StartRound.class,
                ControlMain.ShowStatus.class,
                ControlMain.Revoke.class,
                ControlMain.Model.class
        })
public class ControlMain implements Callable<Integer> {
    static {
        if (System.getProperty("logback.statusListenerClass") == null) {
            System.setProperty("logback.statusListenerClass", "ch.qos.logback.core.status.NopStatusListener");
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new ControlMain()).execute(args));
    }

    @Override
    public Integer call() {
        new CommandLine(this).usage(System.out);
        return 0;
    }

    static class Connection {
        @CommandLine.Option(names = "--config", required = true, description = "Path to configs/deployment.json")
        Path configPath;

        @CommandLine.Option(names = "--deadline-ms", defaultValue = "10000", description = "Per-call deadline")
        long deadlineMs;
    }

    /** Shared plumbing for subcommands: config, channels and error reporting. */
    abstract static class Sub implements Callable<Integer> {
        @CommandLine.Mixin Connection connection = new Connection();

        abstract int run(DeploymentConfig cfg, PeerChannels peers) throws Exception;

        @Override
        public Integer call() throws Exception {
            NodeLauncher.quietGrpcLogging();
            DeploymentConfig cfg = DeploymentConfig.load(connection.configPath.toAbsolutePath());
            PeerChannels peers = new PeerChannels(cfg, ChannelFactory.netty());
            try {
                return run(cfg, peers);
            } catch (StatusRuntimeException e) {
                System.err.println("ERROR " + e.getStatus().getCode() + ": " + e.getStatus().getDescription());
                return 2;
            } finally {
                peers.shutdown();
            }
        }

        long deadline() { return connection.deadlineMs; }
    }

    @CommandLine.Command(name = "register", description = "Ask a facility to register with the authority.")
    static class Register extends Sub {
        @CommandLine.Option(names = "--facility", required = true) String facility;

        @Override
        int run(DeploymentConfig cfg, PeerChannels peers) {
            FacilityRegistration r = peers.facility(facility).withDeadlineAfter(deadline(), TimeUnit.MILLISECONDS)
                    .register(Empty.getDefaultInstance());
            System.out.printf("%s registered=%s attributes=%s epoch=%d%n",
                    r.getFacilityId(), r.getRegistered(), r.getAttributesList(), r.getKeyEpoch());
            return 0;
        }
    }

    @CommandLine.Command(name = "feed", description = "Hand local data to a facility for the next round.")
    static class Feed extends Sub {
        @CommandLine.Option(names = "--facility", required = true) String facility;
        @CommandLine.Option(names = "--file", description = "Raw little-endian float64 records") Path file;
        @CommandLine.Option(names = "--records", split = ";",
                description = "Inline records, e.g. \"1,2,3;4,5,6\"") List<String> records;

        @Override
        int run(DeploymentConfig cfg, PeerChannels peers) throws Exception {
            byte[] data;
            if (file != null) {
                data = Files.readAllBytes(file);
            } else if (records != null) {
                List<double[]> parsed = new ArrayList<>();
                for (String rec : records) {
                    String[] parts = rec.split(",");
                    double[] values = new double[parts.length];
                    for (int i = 0; i < parts.length; i++) values[i] = Double.parseDouble(parts[i].trim());
                    parsed.add(values);
                }
                data = RecordCodec.encode(parsed);
            } else {
                data = new byte[0];
            }
            Ack ack = peers.facility(facility).withDeadlineAfter(deadline(), TimeUnit.MILLISECONDS)
                    .startRound(LocalDataDelta.newBuilder().setData(ByteString.copyFrom(data)).build());
            System.out.printf("%s armed with %d bytes: %s%n", facility, data.length, ack.getAccepted() ? "OK" : ack.getReason());
            return ack.getAccepted() ? 0 : 1;
        }
    }

    @CommandLine.Command(name = "start-round", description = "Start a training round on the leader.")
    static class StartRound extends Sub {
        @CommandLine.Option(names = "--wait", description = "Poll until the round finishes") boolean waitForOutcome;

        @Override
        int run(DeploymentConfig cfg, PeerChannels peers) throws Exception {
            StartRoundReply r = peers.leader().withDeadlineAfter(deadline(), TimeUnit.MILLISECONDS)
                    .startRound(Empty.getDefaultInstance());
            System.out.printf("round %d started, collection closes at %tT%n", r.getRound(), r.getDeadlineMs());
            if (!waitForOutcome) return 0;
            while (true) {
                Thread.sleep(250L);
                LeaderStatus st = peers.leader().withDeadlineAfter(deadline(), TimeUnit.MILLISECONDS).status(Empty.getDefaultInstance());
                for (RoundSummary s : st.getHistoryList()) {
                    if (s.getRound() == r.getRound()) {
                        printHistory(List.of(s));
                        return "FINALIZED".equals(s.getOutcome()) ? 0 : 1;
                    }
                }
            }
        }
    }

    @CommandLine.Command(name = "status", description = "Show leader, fog and facility status.")
    static class ShowStatus extends Sub {
        @Override
        int run(DeploymentConfig cfg, PeerChannels peers) {
            LeaderStatus st = peers.leader().withDeadlineAfter(deadline(), TimeUnit.MILLISECONDS).status(Empty.getDefaultInstance());
            System.out.printf("leader: state=%s activeRound=%d modelVersion=%d upload=%dB download=%dB%n", st.getState(),
                    st.getActiveRound(), st.getModelVersion(), st.getTotalUploadBytes(), st.getTotalDownloadBytes());
            printHistory(st.getHistoryList());
            for (DeploymentConfig.FogMember fog : cfg.fogNodes) {
                try {
                    FogStatus fs = peers.fog(fog.id).withDeadlineAfter(deadline(), TimeUnit.MILLISECONDS).status(Empty.getDefaultInstance());
                    System.out.printf("fog %s index=%d collecting=%d lastClosed=%d shares=%d%n",
                            fs.getFogId(), fs.getIndex(), fs.getCollectingRound(), fs.getLastClosedRound(), fs.getSharesHeld());
                } catch (StatusRuntimeException e) {
                    System.out.printf("fog %s DOWN (%s)%n", fog.id, e.getStatus().getCode());
                }
            }
            for (DeploymentConfig.FacilityMember fm : cfg.facilities) {
                try {
                    FacilityStatus fs = peers.facility(fm.id).withDeadlineAfter(deadline(), TimeUnit.MILLISECONDS).status(Empty.getDefaultInstance());
                    System.out.printf("facility %s registered=%s armed=%s records=%d lastRound=%d model=v%d epoch=%d%n",
                            fs.getFacilityId(), fs.getRegistered(), fs.getArmed(), fs.getRecords(), fs.getLastSubmittedRound(),
                            fs.getModelVersion(), fs.getKeyEpoch());
                } catch (StatusRuntimeException e) {
                    System.out.printf("facility %s DOWN (%s)%n", fm.id, e.getStatus().getCode());
                }
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "revoke", description = "Revoke a facility and rotate attribute keys.")
    static class Revoke extends Sub {
        @CommandLine.Option(names = "--facility", required = true) String facility;
        @CommandLine.Option(names = "--reason", defaultValue = "operator") String reason;

        @Override
        int run(DeploymentConfig cfg, PeerChannels peers) {
            Ack ack = peers.authority().withDeadlineAfter(deadline(), TimeUnit.MILLISECONDS)
                    .revoke(RevokeRequest.newBuilder().setFacilityId(facility).setReason(reason).build());
            System.out.printf("revoke %s: %s%n", facility, ack.getAccepted() ? "OK" : ack.getReason());
            return ack.getAccepted() ? 0 : 1;
        }
    }

    @CommandLine.Command(name = "model", description = "Show the latest finalized model envelope.")
    static class Model extends Sub {
        @Override
        int run(DeploymentConfig cfg, PeerChannels peers) {
            GlobalModelEnvelope env = peers.leader().withDeadlineAfter(deadline(), TimeUnit.MILLISECONDS)
                    .getGlobalModel(Empty.getDefaultInstance());
            System.out.printf("version=%d round=%d modelHash=%s candidate=%s policy='%s' epoch=%d votes=%d%n",
                    env.getVersion(), env.getRound(), Hex.shortHex(env.getModelHash().toByteArray(), 16),
                    Hex.shortHex(env.getCandidateHash().toByteArray(), 16), env.getCiphertext().getPolicy(),
                    env.getCiphertext().getEpoch(), env.getVotesCount());
            return 0;
        }
    }

    static void printHistory(List<RoundSummary> history) {
        if (history.isEmpty()) {
            System.out.println("(no rounds)");
            return;
        }
        int wReason = "Reason".length();
        int wParts = "Participants".length();
        for (RoundSummary s : history) {
            wReason = Math.max(wReason, Math.min(60, s.getReason().length()));
            wParts = Math.max(wParts, String.join(",", s.getParticipantsList()).length());
        }
        String fmt = "| %-5s | %-9s | %-7s | %-" + wParts + "s | %-6s | %-" + wReason + "s |%n";
        String sep = "+" + "-".repeat(7) + "+" + "-".repeat(11) + "+" + "-".repeat(9) + "+" + "-".repeat(wParts + 2)
                + "+" + "-".repeat(8) + "+" + "-".repeat(wReason + 2) + "+";
        System.out.println(sep);
        System.out.printf(fmt, "Round", "Outcome", "Version", "Participants", "Fogs", "Reason");
        System.out.println(sep);
        for (RoundSummary s : history) {
            String reason = s.getReason().length() > 60 ? s.getReason().substring(0, 57) + "..." : s.getReason();
            StringBuilder fogs = new StringBuilder();
            for (int idx : s.getFogIndicesList()) fogs.append(fogs.length() == 0 ? "" : ",").append(idx);
            System.out.printf(fmt, s.getRound(), s.getOutcome(), s.getVersion(), String.join(",", s.getParticipantsList()),
                    fogs, reason);
            System.out.printf("    traffic up=%dB down=%dB%n", s.getUploadBytes(), s.getDownloadBytes());
            for (String d : s.getDissentList()) System.out.println("    dissent " + d);
        }
        System.out.println(sep);
    }
}
