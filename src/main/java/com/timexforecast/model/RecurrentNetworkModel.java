package com.timexforecast.model;

import com.timexforecast.exception.TrainingException;
import com.timexforecast.series.TimeSeriesWindow;
import lombok.extern.slf4j.Slf4j;
import org.deeplearning4j.nn.conf.GradientNormalization;
import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.layers.RnnOutputLayer;
import org.deeplearning4j.nn.conf.layers.recurrent.SimpleRnn;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Single-layer recurrent network (DL4J {@link SimpleRnn} feeding an
 * {@link RnnOutputLayer}) trained on the standardized first differences of
 * the series, so a trend is carried by the mean difference rather than
 * learned from raw levels. Each training sequence of {@code lookback}
 * differences is labelled with the same sequence shifted one step ahead;
 * multi-step forecasts feed each predicted difference back as the next input.
 * <p>
 * The network is seeded from {@link ModelSpec#randomSeed()} and trained full
 * batch, so a given seed always yields the same network. It has no interval
 * of its own: bounds are the point widened by z times the in-sample one-step
 * residual standard deviation.
 */
@Slf4j
public class RecurrentNetworkModel implements ForecastModel {

    private static final double GRADIENT_CLIP = 1.0;

    private final RecurrentNetworkConfig config;
    private final long seed;
    private final double z;

    private MultiLayerNetwork network;
    private double diffMean;
    private double diffScale;
    private double[] lastInputs;
    private double lastLevel;
    private double residualStd;

    public RecurrentNetworkModel(ModelSpec spec, RecurrentNetworkConfig config) {
        this.config = config;
        this.seed = spec.randomSeed();
        this.z = ConfidenceLevels.zScore(spec.confidenceLevel());
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.RECURRENT_NETWORK;
    }

    @Override
    public int minTrainingLength() {
        return config.lookback() + 3;
    }

    @Override
    public ForecastModel fit(TimeSeriesWindow training) {
        ModelSupport.checkTrainingLength(variant(), training, minTrainingLength());
        double[] y = training.filledValues();
        double[] diffs = new double[y.length - 1];
        for (int i = 0; i < diffs.length; i++) {
            diffs[i] = y[i + 1] - y[i];
        }
        double mean = Arrays.stream(diffs).average().orElse(0.0);
        double variance = Arrays.stream(diffs).map(d -> (d - mean) * (d - mean)).average().orElse(0.0);
        double scale = Math.sqrt(variance) > 1e-12 ? Math.sqrt(variance) : 1.0;
        double[] standardized = Arrays.stream(diffs).map(d -> (d - mean) / scale).toArray();

        int lookback = config.lookback();
        int samples = standardized.length - lookback;
        checkInterrupted(0);
        INDArray features = Nd4j.zeros(DataType.DOUBLE, samples, 1, lookback);
        INDArray labels = Nd4j.zeros(DataType.DOUBLE, samples, 1, lookback);
        for (int s = 0; s < samples; s++) {
            for (int t = 0; t < lookback; t++) {
                features.putScalar(new int[]{s, 0, t}, standardized[s + t]);
                labels.putScalar(new int[]{s, 0, t}, standardized[s + t + 1]);
            }
        }
        DataSet dataSet = new DataSet(features, labels);

        MultiLayerNetwork net = new MultiLayerNetwork(configuration());
        net.init();
        double loss = Double.NaN;
        for (int epoch = 0; epoch < config.epochs(); epoch++) {
            checkInterrupted(epoch);
            net.fit(dataSet);
            loss = net.score();
            if (!Double.isFinite(loss)) {
                throw new TrainingException(variant() + " did not converge on " + training.getName()
                    + " (loss diverged at epoch " + epoch + ")");
            }
        }

        INDArray fitted = net.output(features, false);
        double squared = 0.0;
        for (int s = 0; s < samples; s++) {
            double residual = scale * (fitted.getDouble(s, 0, lookback - 1) - standardized[s + lookback]);
            squared += residual * residual;
        }
        if (!Double.isFinite(squared)) {
            throw new TrainingException(variant() + " produced non-finite in-sample forecasts on " + training.getName());
        }

        this.network = net;
        this.diffMean = mean;
        this.diffScale = scale;
        this.lastInputs = Arrays.copyOfRange(standardized, standardized.length - lookback, standardized.length);
        this.lastLevel = y[y.length - 1];
        this.residualStd = Math.sqrt(squared / samples);
        log.debug("Recurrent network fitted | series={} | samples={} | epochs={} | loss={} | residualStd={}",
            training.getName(), samples, config.epochs(), loss, residualStd);
        return this;
    }

    @Override
    public List<ForecastInterval> predict(int horizon, Map<String, double[]> futureRegressors) {
        ModelSupport.checkPredictable(variant(), network != null, horizon, maxHorizon());
        int lookback = lastInputs.length;
        INDArray inputs = Nd4j.zeros(DataType.DOUBLE, 1, 1, lookback);
        for (int t = 0; t < lookback; t++) {
            inputs.putScalar(new int[]{0, 0, t}, lastInputs[t]);
        }
        double level = lastLevel;
        double halfWidth = z * residualStd;
        List<ForecastInterval> forecast = new ArrayList<>(horizon);
        for (int k = 0; k < horizon; k++) {
            double next = network.output(inputs, false).getDouble(0, 0, lookback - 1);
            for (int t = 0; t < lookback - 1; t++) {
                inputs.putScalar(new int[]{0, 0, t}, inputs.getDouble(0, 0, t + 1));
            }
            inputs.putScalar(new int[]{0, 0, lookback - 1}, next);
            level += diffMean + diffScale * next;
            forecast.add(ForecastInterval.symmetric(level, halfWidth));
        }
        return forecast;
    }

    private MultiLayerConfiguration configuration() {
        return new NeuralNetConfiguration.Builder()
            .seed(seed)
            .dataType(DataType.DOUBLE)
            .weightInit(WeightInit.XAVIER)
            .updater(new Adam(config.learningRate()))
            .gradientNormalization(GradientNormalization.ClipL2PerLayer)
            .gradientNormalizationThreshold(GRADIENT_CLIP)
            .list()
            .layer(new SimpleRnn.Builder()
                .nIn(1)
                .nOut(config.hiddenUnits())
                .activation(Activation.TANH)
                .build())
            .layer(new RnnOutputLayer.Builder(LossFunctions.LossFunction.MSE)
                .nIn(config.hiddenUnits())
                .nOut(1)
                .activation(Activation.IDENTITY)
                .build())
            .build();
    }

    private void checkInterrupted(int epoch) {
        if (Thread.currentThread().isInterrupted()) {
            throw new TrainingException(variant() + " training was interrupted at epoch " + epoch);
        }
    }

    /**
     * Hyper-parameters of the network.
     */
    public record RecurrentNetworkConfig(int lookback, int hiddenUnits, int epochs, double learningRate) {
        public static final RecurrentNetworkConfig DEFAULT = new RecurrentNetworkConfig(8, 8, 60, 0.01);

        public RecurrentNetworkConfig {
            if (lookback < 1 || hiddenUnits < 1 || epochs < 1) {
                throw new IllegalArgumentException("lookback, hiddenUnits and epochs must be >= 1");
            }
            if (!(learningRate > 0.0)) {
                throw new IllegalArgumentException("learningRate must be > 0, got: " + learningRate);
            }
        }
    }
}
