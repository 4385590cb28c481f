package hierfed.common.crypto;

/** Signature domain-separation strings, one per message kind. */
public final class Domains {
    private Domains() {}

    public static final String REGISTRATION   = "HIERFED:REGISTRATION";
    public static final String CERTIFICATE    = "HIERFED:IDENTITY-CERT";
    public static final String KEY_REFRESH    = "HIERFED:KEY-REFRESH";
    public static final String POLICY_KEYS    = "HIERFED:POLICY-KEYS";

    public static final String ANNOUNCEMENT   = "HIERFED:ROUND-ANNOUNCEMENT";
    public static final String SHARE          = "HIERFED:SHARE";
    public static final String NOTICE         = "HIERFED:SUBMISSION-NOTICE";
    public static final String CLOSE          = "HIERFED:COLLECTION-CLOSE";
    public static final String PARTIAL_SUM    = "HIERFED:PARTIAL-SUM";

    public static final String VALIDATION     = "HIERFED:VALIDATION-REQUEST";
    public static final String VOTE           = "HIERFED:VOTE";
    public static final String COMMIT         = "HIERFED:COMMIT";
}
