package hierfed.common.validation;

public final class MessageTypes {
    private MessageTypes() {}

    public static final String REGISTRATION_REQUEST = "hierfed.RegistrationRequest";
    public static final String IDENTITY_CERTIFICATE = "hierfed.IdentityCertificate";
    public static final String KEY_REFRESH_REQUEST  = "hierfed.KeyRefreshRequest";
    public static final String POLICY_KEYS_REQUEST  = "hierfed.PolicyKeysRequest";

    public static final String ROUND_ANNOUNCEMENT   = "hierfed.RoundAnnouncement";
    public static final String SHARE_SUBMISSION     = "hierfed.ShareSubmission";
    public static final String SUBMISSION_NOTICE    = "hierfed.SubmissionNotice";
    public static final String COLLECTION_CLOSE     = "hierfed.CollectionClose";
    public static final String FOG_PARTIAL_SUM      = "hierfed.FogPartialSum";

    public static final String VALIDATION_REQUEST   = "hierfed.ValidationRequest";
    public static final String VOTE                 = "hierfed.Vote";
    public static final String COMMIT_NOTICE        = "hierfed.CommitNotice";
}
