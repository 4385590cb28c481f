package hierfed.facility;

import java.util.List;

/**
 * Local training step. Produces the parameter change this facility proposes for the current
 * global model from its private records. Implementations must not retain the records.
 */
public interface LocalTrainer {
    double[] computeUpdate(double[] model, List<double[]> records);
}
