package com.timexforecast.config;

import com.timexforecast.dto.EnsemblePolicy;
import com.timexforecast.dto.ErrorMetric;
import com.timexforecast.dto.ForecastSettings;
import com.timexforecast.model.ModelVariant;
import com.timexforecast.model.RecurrentNetworkModel.RecurrentNetworkConfig;
import com.timexforecast.series.Transformation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Defaults for every pipeline option, bound from {@code timex.pipeline.*}.
 * Callers that pass no explicit settings get {@link #toSettings()}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "timex.pipeline")
public class ForecastPipelineProperties {

    @NotEmpty
    private Set<ModelVariant> candidateModels = EnumSet.allOf(ModelVariant.class);

    @Min(1)
    private int foldCount = 3;

    @Min(1)
    private int foldTestLength = 5;

    @Min(1)
    private int forecastHorizon = 5;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double confidenceLevel = 0.95;

    @NotNull
    private EnsemblePolicy ensemblePolicy = EnsemblePolicy.BEST_OF;

    @Min(1)
    private int workerPoolSize = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

    @NotNull
    private Duration perModelTimeout = Duration.ofSeconds(60);

    private long randomSeed = 42L;

    @NotNull
    private ErrorMetric primaryMetric = ErrorMetric.MAPE;

    @NotNull
    private Transformation transformation = Transformation.NONE;

    @Min(1)
    private Integer seasonalPeriod;

    @Valid
    private Recurrent recurrent = new Recurrent();

    public ForecastSettings toSettings() {
        return ForecastSettings.builder()
            .candidateModels(EnumSet.copyOf(candidateModels))
            .foldCount(foldCount)
            .foldTestLength(foldTestLength)
            .forecastHorizon(forecastHorizon)
            .confidenceLevel(confidenceLevel)
            .ensemblePolicy(ensemblePolicy)
            .workerPoolSize(workerPoolSize)
            .perModelTimeout(perModelTimeout)
            .randomSeed(randomSeed)
            .primaryMetric(primaryMetric)
            .transformation(transformation)
            .seasonalPeriod(seasonalPeriod)
            .build();
    }

    @Getter
    @Setter
    public static class Recurrent {
        @Min(1)
        private int lookback = RecurrentNetworkConfig.DEFAULT.lookback();

        @Min(1)
        private int hiddenUnits = RecurrentNetworkConfig.DEFAULT.hiddenUnits();

        @Min(1)
        private int epochs = RecurrentNetworkConfig.DEFAULT.epochs();

        @DecimalMin(value = "0.0", inclusive = false)
        private double learningRate = RecurrentNetworkConfig.DEFAULT.learningRate();

        public RecurrentNetworkConfig toConfig() {
            return new RecurrentNetworkConfig(lookback, hiddenUnits, epochs, learningRate);
        }
    }
}
