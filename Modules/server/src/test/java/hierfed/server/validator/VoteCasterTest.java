package hierfed.server.validator;

import com.google.protobuf.ByteString;
import hierfed.common.config.KeyRegistry;
import hierfed.common.crypto.Digests;
import hierfed.common.crypto.Domains;
import hierfed.common.error.StaleMessageException;
import hierfed.common.validation.MessageDecoder;
import hierfed.common.validation.MessageTypes;
import hierfed.common.validation.VoteCertificateValidator;
import hierfed.proto.CommitNotice;
import hierfed.proto.SignedMessage;
import hierfed.proto.ValidationRequest;
import hierfed.proto.Vote;
import hierfed.server.DeploymentFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VoteCasterTest {
    private DeploymentFixture fx;
    private VoteCaster v1;

    @BeforeEach
    void setUp() throws Exception {
        fx = new DeploymentFixture();
        v1 = caster("v1", VoteCaster.Fault.NONE);
    }

    private VoteCaster caster(String id, VoteCaster.Fault fault) throws Exception {
        return new VoteCaster(fx.node(id), new CandidateChecker(fx.cfg.protocol), fault);
    }

    private static ValidationRequest request(long round, CommittedModel base, double... update) {
        ValidationRequest.Builder b = ValidationRequest.newBuilder()
                .setRound(round)
                .setCandidateHash(ByteString.copyFrom(Digests.vectorHash(update)))
                .setBaseVersion(base.version())
                .setBaseModelHash(ByteString.copyFrom(base.hash()))
                .setParticipantCount(3);
        for (double v : update) b.addValues(v);
        return b.build();
    }

    private Vote decode(SignedMessage env) {
        var r = MessageDecoder.decode(env, MessageTypes.VOTE, Domains.VOTE, fx.keys, KeyRegistry.Role.VALIDATOR, Vote.parser());
        assertTrue(r.ok(), "vote should verify: " + r.validation());
        return r.message();
    }

    @Test
    void honestValidatorAcceptsAndSigns() throws Exception {
        Vote vote = decode(v1.vote(request(1, v1.committed(), 0.1, -0.1)));
        assertTrue(vote.getAccept(), vote.getReason());
        assertEquals("v1", vote.getValidatorId());
        assertEquals(1L, vote.getRound());
    }

    @Test
    void repeatedRequestGetsTheSameVote() throws Exception {
        ValidationRequest req = request(3, v1.committed(), 0.1, -0.1);
        SignedMessage first = v1.vote(req);
        assertSame(first, v1.vote(req));
    }

    @Test
    void olderRoundIsStale() throws Exception {
        v1.vote(request(5, v1.committed(), 0.1, 0.1));
        StaleMessageException e = assertThrows(StaleMessageException.class,
                () -> v1.vote(request(4, v1.committed(), 0.1, 0.1)));
        assertEquals(4L, e.messageRound());
    }

    @Test
    void faultModesShapeTheVote() throws Exception {
        CommittedModel base = v1.committed();
        Vote rejected = decode(caster("v2", VoteCaster.Fault.REJECT).vote(request(1, base, 0.1, 0.1)));
        assertFalse(rejected.getAccept());

        Vote accepted = decode(caster("v3", VoteCaster.Fault.ACCEPT_ALL).vote(request(1, base, 1e6, 1e6)));
        assertTrue(accepted.getAccept());

        SignedMessage garbled = caster("v4", VoteCaster.Fault.BAD_SIGNATURE).vote(request(1, base, 0.1, 0.1));
        var r = MessageDecoder.decode(garbled, MessageTypes.VOTE, Domains.VOTE, fx.keys, KeyRegistry.Role.VALIDATOR, Vote.parser());
        assertFalse(r.ok());
    }

    @Test
    void faultNamesParse() {
        assertEquals(VoteCaster.Fault.BAD_SIGNATURE, VoteCaster.Fault.parse("bad-signature"));
        assertEquals(VoteCaster.Fault.NONE, VoteCaster.Fault.parse(""));
    }

    @Test
    void certifiedCommitAdvancesTheBaseModel() throws Exception {
        double[] update = {0.25, -0.5};
        ValidationRequest req = request(1, v1.committed(), update);
        List<SignedMessage> votes = new ArrayList<>();
        votes.add(v1.vote(req));
        votes.add(caster("v2", VoteCaster.Fault.NONE).vote(req));
        votes.add(caster("v3", VoteCaster.Fault.NONE).vote(req));
        assertTrue(VoteCertificateValidator.validate(votes, 1, req.getCandidateHash(), fx.keys, 4).ok());

        CommitNotice notice = CommitNotice.newBuilder()
                .setRound(1).setVersion(2).setCandidateHash(req.getCandidateHash())
                .addParameters(0.25).addParameters(-0.5)
                .addAllVotes(votes)
                .build();
        assertNull(v1.commit(notice));
        assertEquals(2L, v1.committed().version());
        assertNull(v1.commit(notice), "re-delivery is a no-op");

        Vote staleBase = decode(v1.vote(request(2, CommittedModel.bootstrap(2), 0.1, 0.1)));
        assertFalse(staleBase.getAccept());
        assertTrue(staleBase.getReason().contains("base version"), staleBase.getReason());
    }

    @Test
    void commitWithoutQuorumIsRefused() throws Exception {
        ValidationRequest req = request(1, v1.committed(), 0.1, 0.1);
        CommitNotice notice = CommitNotice.newBuilder()
                .setRound(1).setVersion(2).setCandidateHash(req.getCandidateHash())
                .addParameters(0.1).addParameters(0.1)
                .addVotes(v1.vote(req))
                .build();
        String refusal = v1.commit(notice);
        assertNotNull(refusal);
        assertTrue(refusal.contains("insufficient"), refusal);
        assertEquals(1L, v1.committed().version());
    }
}
