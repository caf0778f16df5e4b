package com.forecastmonitor.service;

import com.forecastmonitor.exception.ModelNotFoundException;
import com.forecastmonitor.model.ModelCategory;
import com.forecastmonitor.model.ModelComplexity;
import com.forecastmonitor.model.ModelDescriptor;
import com.forecastmonitor.model.ModelFamily;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only catalog of forecasting models. Seeded once at start-up; seeding again never adds
 * duplicates.
 */
@Slf4j
@Service
public class ModelRegistryService {

    static final List<ModelDescriptor> DEFAULT_MODELS = List.of(
        ModelDescriptor.builder()
            .id("linear-regression").name("Linear Regression")
            .category(ModelCategory.STATISTICAL).complexity(ModelComplexity.BEGINNER)
            .family(ModelFamily.TREND)
            .description("Simple linear trend analysis for data with clear upward or downward trends")
            .parameter("method", "least_squares").parameter("confidence_interval", 95)
            .parameter("seasonality", false).parameter("polynomial_degree", 1)
            .bestFor("Clear trends, simple forecasting, historical sales data")
            .build(),
        ModelDescriptor.builder()
            .id("exponential-smoothing").name("Exponential Smoothing")
            .category(ModelCategory.STATISTICAL).complexity(ModelComplexity.INTERMEDIATE)
            .family(ModelFamily.SMOOTHING)
            .description("Gives more weight to recent observations, with trend and seasonal components")
            .parameter("alpha", 0.3).parameter("beta", 0.1).parameter("gamma", 0.1)
            .parameter("seasonal_periods", 12).parameter("trend", "additive")
            .parameter("seasonal", "multiplicative")
            .bestFor("Seasonal data, inventory forecasting, demand planning")
            .build(),
        ModelDescriptor.builder()
            .id("moving-average").name("Moving Average")
            .category(ModelCategory.STATISTICAL).complexity(ModelComplexity.BEGINNER)
            .family(ModelFamily.MOVING_AVERAGE)
            .description("Smooths out fluctuations to identify trends")
            .parameter("window_size", 3).parameter("weighted", false).parameter("center", false)
            .bestFor("Noisy data, short-term trends, basic smoothing")
            .build(),
        ModelDescriptor.builder()
            .id("polynomial-regression").name("Polynomial Regression")
            .category(ModelCategory.STATISTICAL).complexity(ModelComplexity.INTERMEDIATE)
            .family(ModelFamily.POLYNOMIAL)
            .description("Captures non-linear patterns using polynomial curves")
            .parameter("degree", 2).parameter("regularization", "ridge").parameter("alpha", 0.1)
            .bestFor("Non-linear trends, curved patterns, growth acceleration")
            .build(),
        ModelDescriptor.builder()
            .id("ai-neural-network").name("AI Neural Network")
            .category(ModelCategory.AI_POWERED).complexity(ModelComplexity.ADVANCED)
            .family(ModelFamily.NEURAL)
            .description("Captures complex patterns and non-linear relationships")
            .parameter("layers", List.of(64, 32, 16, 1)).parameter("epochs", 150)
            .parameter("learning_rate", 0.001).parameter("dropout", 0.2)
            .parameter("activation", "relu").parameter("optimizer", "adam")
            .bestFor("Complex patterns, large datasets, multi-variable forecasting")
            .build(),
        ModelDescriptor.builder()
            .id("arima").name("ARIMA Model")
            .category(ModelCategory.STATISTICAL).complexity(ModelComplexity.ADVANCED)
            .family(ModelFamily.AUTOREGRESSIVE)
            .description("AutoRegressive Integrated Moving Average for series with trends and seasonality")
            .parameter("p", 2).parameter("d", 1).parameter("q", 2)
            .parameter("seasonal", true).parameter("seasonal_periods", 12)
            .parameter("information_criterion", "aic")
            .bestFor("Financial forecasting, economic indicators, weather prediction")
            .build(),
        ModelDescriptor.builder()
            .id("random-forest").name("Random Forest")
            .category(ModelCategory.MACHINE_LEARNING).complexity(ModelComplexity.ADVANCED)
            .family(ModelFamily.ENSEMBLE)
            .description("Ensemble of decision trees for robust predictions")
            .parameter("n_estimators", 100).parameter("tree_count", 5).parameter("max_depth", 10)
            .parameter("min_samples_split", 2).parameter("random_state", 42)
            .bestFor("Mixed data types, feature interactions, robust predictions")
            .build(),
        ModelDescriptor.builder()
            .id("seasonal-decompose").name("Seasonal Decompose")
            .category(ModelCategory.STATISTICAL).complexity(ModelComplexity.INTERMEDIATE)
            .family(ModelFamily.SEASONAL)
            .description("Separates trend, seasonal and residual components")
            .parameter("model", "additive").parameter("period", 12)
            .parameter("two_sided", true).parameter("extrapolate_trend", "freq")
            .bestFor("Seasonal patterns, component analysis, cyclical data")
            .build()
    );

    private final Map<String, ModelDescriptor> models = new LinkedHashMap<>();

    @PostConstruct
    void init() {
        seedDefaults();
    }

    public synchronized int seedDefaults() {
        int added = 0;
        for (ModelDescriptor model : DEFAULT_MODELS) {
            if (register(model)) {
                added++;
            }
        }
        if (added > 0) {
            log.info("Model catalog seeded | added={} | total={}", added, models.size());
        }
        return added;
    }

    /** Adds a model unless its id or name is already registered. */
    synchronized boolean register(ModelDescriptor model) {
        if (models.containsKey(model.getId())) {
            return false;
        }
        boolean nameTaken = models.values().stream().anyMatch(m -> m.getName().equals(model.getName()));
        if (nameTaken) {
            log.warn("Model not registered, name already in use | id={} | name={}", model.getId(), model.getName());
            return false;
        }
        models.put(model.getId(), model);
        return true;
    }

    public synchronized List<ModelDescriptor> listModels() {
        return List.copyOf(models.values());
    }

    public synchronized List<ModelDescriptor> listModels(ModelCategory category) {
        return models.values().stream()
            .filter(m -> category == null || m.getCategory() == category)
            .toList();
    }

    public synchronized ModelDescriptor getModel(String id) {
        ModelDescriptor model = models.get(id);
        if (model == null) {
            throw new ModelNotFoundException(id);
        }
        return model;
    }
}
