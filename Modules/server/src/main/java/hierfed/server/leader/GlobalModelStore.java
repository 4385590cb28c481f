package hierfed.server.leader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.protobuf.InvalidProtocolBufferException;
import hierfed.common.crypto.Digests;
import hierfed.proto.GlobalModelEnvelope;
import hierfed.proto.SignedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Finalized global model versions. Only the leader writes here, and only from the finalizing
 * step; versions increase by exactly one per finalized round.
 * <p>
 * Also keeps the highest round number ever started, finalized or not, in {@code round-mark.json}
 * so a restarted leader never reissues a round number.
 */
public final class GlobalModelStore {
    private static final Logger log = LoggerFactory.getLogger(GlobalModelStore.class);
    private static final Pattern FILE = Pattern.compile("model-v(\\d+)\\.json");
    private static final String ROUND_MARK = "round-mark.json";

    /** On-disk form of one version. Protobuf parts are kept as their serialized bytes. */
    public static class StoredVersion {
        public long version;
        public long round;
        public double[] parameters;
        public byte[] envelope;
        public byte[] commitNotice;
    }

    /** On-disk form of the round high-water mark. */
    public static class RoundMark {
        public long round;
    }

    public record Snapshot(long version, long round, double[] parameters, byte[] hash,
                           GlobalModelEnvelope envelope, SignedMessage commitNotice) {}

    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();
    private final Path dir;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private Snapshot latest;
    private long highestRound;

    /** @param dir directory for model-v{n}.json files, or null to keep versions in memory only */
    public GlobalModelStore(int dimension, Path dir) throws IOException {
        this.dir = dir;
        double[] zeros = new double[dimension];
        this.latest = new Snapshot(1L, 0L, zeros, Digests.vectorHash(zeros), null, null);
        if (dir != null) {
            Files.createDirectories(dir);
            restore(dimension);
            restoreRoundMark();
        }
        highestRound = Math.max(highestRound, latest.round());
    }

    public Snapshot latest() {
        rw.readLock().lock();
        try {
            return latest;
        } finally {
            rw.readLock().unlock();
        }
    }

    public long latestVersion() {
        return latest().version();
    }

    /** Highest round number started so far, 0 before the first round. */
    public long highestRound() {
        rw.readLock().lock();
        try {
            return highestRound;
        } finally {
            rw.readLock().unlock();
        }
    }

    /**
     * Records that {@code round} has started. The mark only moves forward and is written before
     * the round is announced to anyone.
     */
    public void markRoundStarted(long round) throws IOException {
        rw.writeLock().lock();
        try {
            if (round <= highestRound) {
                throw new IllegalStateException("round " + round + " does not follow " + highestRound);
            }
            if (dir != null) {
                RoundMark mark = new RoundMark();
                mark.round = round;
                writeAtomically(ROUND_MARK, mark);
            }
            highestRound = round;
        } finally {
            rw.writeLock().unlock();
        }
    }

    public Optional<GlobalModelEnvelope> latestEnvelope() {
        return Optional.ofNullable(latest().envelope());
    }

    /**
     * @throws IllegalStateException if {@code version} is not exactly one above the current version
     */
    public void install(long version, long round, double[] parameters, GlobalModelEnvelope envelope,
                        SignedMessage commitNotice) throws IOException {
        rw.writeLock().lock();
        try {
            if (version != latest.version() + 1) {
                throw new IllegalStateException("version " + version + " does not follow " + latest.version());
            }
            if (dir != null) {
                StoredVersion sv = new StoredVersion();
                sv.version = version;
                sv.round = round;
                sv.parameters = parameters.clone();
                sv.envelope = envelope.toByteArray();
                sv.commitNotice = commitNotice.toByteArray();
                writeAtomically("model-v" + version + ".json", sv);
            }
            latest = new Snapshot(version, round, parameters.clone(), Digests.vectorHash(parameters), envelope, commitNotice);
            highestRound = Math.max(highestRound, round);
        } finally {
            rw.writeLock().unlock();
        }
    }

    private void writeAtomically(String name, Object value) throws IOException {
        Path tmp = dir.resolve(name + ".tmp");
        mapper.writeValue(tmp.toFile(), value);
        Files.move(tmp, dir.resolve(name), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private void restoreRoundMark() throws IOException {
        Path file = dir.resolve(ROUND_MARK);
        if (!Files.exists(file)) return;
        RoundMark mark = mapper.readValue(file.toFile(), RoundMark.class);
        highestRound = mark.round;
        log.info("Restored round mark {} from {}", mark.round, file);
    }

    private void restore(int dimension) throws IOException {
        Path newest = null;
        long newestVersion = 0L;
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                Matcher m = FILE.matcher(p.getFileName().toString());
                if (m.matches() && Long.parseLong(m.group(1)) > newestVersion) {
                    newestVersion = Long.parseLong(m.group(1));
                    newest = p;
                }
            }
        }
        if (newest == null) return;
        StoredVersion sv = mapper.readValue(newest.toFile(), StoredVersion.class);
        if (sv.parameters == null || sv.parameters.length != dimension) {
            throw new IllegalStateException("Stored model " + newest + " has wrong dimension");
        }
        try {
            GlobalModelEnvelope env = GlobalModelEnvelope.parseFrom(sv.envelope);
            SignedMessage commit = SignedMessage.parseFrom(sv.commitNotice);
            latest = new Snapshot(sv.version, sv.round, sv.parameters, Digests.vectorHash(sv.parameters), env, commit);
        } catch (InvalidProtocolBufferException e) {
            throw new IOException("Corrupt stored model " + newest, e);
        }
        log.info("Restored global model version {} from {}", sv.version, newest);
    }
}
