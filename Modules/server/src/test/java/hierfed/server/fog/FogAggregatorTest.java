package hierfed.server.fog;

import hierfed.common.crypto.Domains;
import hierfed.common.error.StaleMessageException;
import hierfed.common.sharing.FixedPointCodec;
import hierfed.common.sharing.PrimeField;
import hierfed.common.sharing.ShamirSharing;
import hierfed.common.sharing.VectorShare;
import hierfed.common.validation.MessageTypes;
import hierfed.proto.CertifiedMessage;
import hierfed.proto.CollectionClose;
import hierfed.proto.ShareSubmission;
import hierfed.proto.SignedMessage;
import hierfed.server.DeploymentFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FogAggregatorTest {
    private final PrimeField field = PrimeField.standard();
    private final FixedPointCodec codec = new FixedPointCodec(field, 24);
    private DeploymentFixture fx;
    private ShamirSharing sharing;
    private FogAggregator fog1;

    @BeforeEach
    void setUp() throws Exception {
        fx = new DeploymentFixture();
        sharing = new ShamirSharing(field, 2, new SecureRandom());
        fog1 = new FogAggregator(fx.node("fog1"), field, new SecureRandom(), FogAggregator.Fault.NONE);
    }

    private VectorShare shareFor(double... update) {
        return sharing.split(codec.encode(update), new int[]{1, 2, 3}).get(0);
    }

    private CertifiedMessage submission(String facility, long round, int index, VectorShare share) throws Exception {
        ShareSubmission s = ShareSubmission.newBuilder()
                .setRound(round).setFacilityId(facility).setFogIndex(index).addAllValues(share.toWire()).build();
        return fx.certified(Domains.SHARE, MessageTypes.SHARE_SUBMISSION, s, facility, round);
    }

    private SignedMessage close(long round, String signer, String... participants) throws Exception {
        CollectionClose c = CollectionClose.newBuilder().setRound(round).addAllParticipants(List.of(participants)).build();
        return fx.sign(Domains.CLOSE, MessageTypes.COLLECTION_CLOSE, c, signer, round);
    }

    @Test
    void partialSumCoversExactlyTheClosedParticipants() throws Exception {
        VectorShare a = shareFor(0.5, 1.0);
        VectorShare b = shareFor(-0.25, 2.0);
        VectorShare c = shareFor(9.0, 9.0);
        assertNull(fog1.acceptShare(submission("f1", 1, 1, a)));
        assertNull(fog1.acceptShare(submission("f2", 1, 1, b)));
        assertNull(fog1.acceptShare(submission("f3", 1, 1, c)));

        FogAggregator.CloseOutcome out = fog1.close(close(1, "leader", "f1", "f2"));

        assertTrue(out.ok(), out.refusal());
        assertEquals(2, out.partialSum().getParticipantCount());
        VectorShare expected = sharing.sum(1, List.of(a, b), 2);
        VectorShare actual = VectorShare.fromWire(1, out.partialSum().getValuesList());
        assertArrayEquals(expected.values(), actual.values());
        assertEquals(0, fog1.status().getSharesHeld(), "shares are discarded on close");
    }

    @Test
    void duplicateAndMisroutedSharesAreRefused() throws Exception {
        assertNull(fog1.acceptShare(submission("f1", 1, 1, shareFor(0.1, 0.1))));
        assertNotNull(fog1.acceptShare(submission("f1", 1, 1, shareFor(0.2, 0.2))));
        String misrouted = fog1.acceptShare(submission("f2", 1, 2, shareFor(0.1, 0.1)));
        assertTrue(misrouted.contains("index"), misrouted);
    }

    @Test
    void shareWithoutAuthorityCertificateIsRefused() throws Exception {
        CertifiedMessage cm = submission("f1", 1, 1, shareFor(0.1, 0.1));
        CertifiedMessage relabelled = cm.toBuilder()
                .setCertificate(cm.getCertificate().toBuilder().setSignerId("fog2"))
                .build();
        assertNotNull(fog1.acceptShare(relabelled));
    }

    @Test
    void missingParticipantShareYieldsNoPartialSum() throws Exception {
        fog1.acceptShare(submission("f1", 1, 1, shareFor(0.1, 0.1)));
        FogAggregator.CloseOutcome out = fog1.close(close(1, "leader", "f1", "f4"));
        assertFalse(out.ok());
        assertTrue(out.refusal().contains("f4"), out.refusal());
    }

    @Test
    void closedRoundsAreStale() throws Exception {
        fog1.acceptShare(submission("f1", 2, 1, shareFor(0.1, 0.1)));
        fog1.close(close(2, "leader", "f1"));
        assertThrows(StaleMessageException.class, () -> fog1.acceptShare(submission("f2", 2, 1, shareFor(0.1, 0.1))));
        assertThrows(StaleMessageException.class, () -> fog1.close(close(2, "leader", "f1")));
        assertThrows(StaleMessageException.class, () -> fog1.close(close(1, "leader", "f1")));
    }

    @Test
    void closeMustComeFromTheLeader() throws Exception {
        fog1.acceptShare(submission("f1", 1, 1, shareFor(0.1, 0.1)));
        FogAggregator.CloseOutcome out = fog1.close(close(1, "v1", "f1"));
        assertFalse(out.ok());
        assertEquals(1, fog1.status().getSharesHeld(), "a forged close leaves the round open");
    }

    @Test
    void corruptFogSendsGarbage() throws Exception {
        fog1.setFault(FogAggregator.Fault.CORRUPT);
        VectorShare a = shareFor(0.5, 0.5);
        fog1.acceptShare(submission("f1", 1, 1, a));
        FogAggregator.CloseOutcome out = fog1.close(close(1, "leader", "f1"));
        assertTrue(out.ok());
        BigInteger[] sent = VectorShare.fromWire(1, out.partialSum().getValuesList()).values();
        assertFalse(Arrays.equals(a.values(), sent));
    }
}
