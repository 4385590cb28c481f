package hierfed.server.validator;

import hierfed.common.crypto.Digests;

/** The last global model this validator saw finalized. Version 1 is the all-zero bootstrap model. */
public record CommittedModel(long version, double[] parameters, byte[] hash) {

    public static CommittedModel bootstrap(int dimension) {
        double[] zeros = new double[dimension];
        return new CommittedModel(1L, zeros, Digests.vectorHash(zeros));
    }

    public static CommittedModel of(long version, double[] parameters) {
        return new CommittedModel(version, parameters.clone(), Digests.vectorHash(parameters));
    }
}
