package hierfed.facility;

import java.util.List;

/** Moves the model a fraction {@code learningRate} of the way toward the mean of the local records. */
public final class MeanRecordTrainer implements LocalTrainer {
    private final double learningRate;

    public MeanRecordTrainer(double learningRate) {
        if (!(learningRate > 0)) throw new IllegalArgumentException("learningRate must be > 0");
        this.learningRate = learningRate;
    }

    @Override
    public double[] computeUpdate(double[] model, List<double[]> records) {
        double[] update = new double[model.length];
        if (records.isEmpty()) return update;
        for (double[] rec : records) {
            for (int i = 0; i < update.length; i++) update[i] += rec[i];
        }
        for (int i = 0; i < update.length; i++) {
            update[i] = learningRate * (update[i] / records.size() - model[i]);
        }
        return update;
    }
}
