package com.timexforecast.service;

import com.timexforecast.config.ForecastPipelineProperties;
import com.timexforecast.exception.TrainingException;
import com.timexforecast.model.ForecastModel;
import com.timexforecast.model.ForecastModelFactory;
import com.timexforecast.model.ModelSpec;
import com.timexforecast.model.ModelVariant;
import com.timexforecast.model.RecurrentNetworkModel;
import com.timexforecast.model.RecurrentNetworkModel.RecurrentNetworkConfig;
import com.timexforecast.model.SeasonalDecompositionModel;
import com.timexforecast.model.SeasonalRegressionModel;
import com.timexforecast.model.TransformedForecastModel;
import com.timexforecast.series.Transformation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps each model variant to the factory that builds fresh instances of it.
 * Immutable; {@link #withFactory} returns a new registry.
 */
@Slf4j
@Service
public class ForecastModelRegistry {

    private final Map<ModelVariant, ForecastModelFactory> factories;

    @Autowired
    public ForecastModelRegistry(ForecastPipelineProperties properties) {
        this(defaultFactories(properties.getRecurrent().toConfig()));
    }

    public ForecastModelRegistry(Map<ModelVariant, ForecastModelFactory> factories) {
        Map<ModelVariant, ForecastModelFactory> copy = new EnumMap<>(ModelVariant.class);
        copy.putAll(factories);
        this.factories = Collections.unmodifiableMap(copy);
        log.info("ForecastModelRegistry initialised → {}", this.factories.keySet());
    }

    public static ForecastModelRegistry defaults() {
        return new ForecastModelRegistry(defaultFactories(RecurrentNetworkConfig.DEFAULT));
    }

    public ForecastModelRegistry withFactory(ModelVariant variant, ForecastModelFactory factory) {
        Map<ModelVariant, ForecastModelFactory> copy = new EnumMap<>(ModelVariant.class);
        copy.putAll(factories);
        copy.put(variant, factory);
        return new ForecastModelRegistry(copy);
    }

    public Set<ModelVariant> registeredVariants() {
        return factories.keySet();
    }

    /**
     * Fresh untrained instance, wrapped so that it fits on transformed values
     * when a transformation other than {@link Transformation#NONE} is set.
     */
    public ForecastModel create(ModelVariant variant, ModelSpec spec, Transformation transformation) {
        ForecastModelFactory factory = factories.get(variant);
        if (factory == null) {
            throw new TrainingException("No model factory registered for " + variant);
        }
        ForecastModel model = factory.create(spec);
        if (transformation == null || transformation == Transformation.NONE) {
            return model;
        }
        return new TransformedForecastModel(model, transformation);
    }

    private static Map<ModelVariant, ForecastModelFactory> defaultFactories(RecurrentNetworkConfig recurrent) {
        Map<ModelVariant, ForecastModelFactory> map = new EnumMap<>(ModelVariant.class);
        map.put(ModelVariant.SEASONAL_DECOMPOSITION, SeasonalDecompositionModel::new);
        map.put(ModelVariant.SEASONAL_REGRESSION, SeasonalRegressionModel::new);
        map.put(ModelVariant.RECURRENT_NETWORK, spec -> new RecurrentNetworkModel(spec, recurrent));
        return map;
    }
}
