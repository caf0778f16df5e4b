package com.forecastmonitor.service;

import com.forecastmonitor.exception.ModelNotFoundException;
import com.forecastmonitor.model.ModelCategory;
import com.forecastmonitor.model.ModelDescriptor;
import com.forecastmonitor.model.ModelFamily;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ModelRegistryServiceTest {

    private ModelRegistryService registry;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistryService();
    }

    @Test
    void seedDefaults_isIdempotent() {
        assertThat(registry.seedDefaults()).isEqualTo(8);
        assertThat(registry.seedDefaults()).isZero();
        assertThat(registry.listModels()).hasSize(8);
    }

    @Test
    void listModels_keepsRegistrationOrder() {
        registry.seedDefaults();
        assertThat(registry.listModels()).extracting(ModelDescriptor::getId).startsWith(
            "linear-regression", "exponential-smoothing", "moving-average");
    }

    @Test
    void listModels_filtersByCategory() {
        registry.seedDefaults();
        assertThat(registry.listModels(ModelCategory.AI_POWERED))
            .extracting(ModelDescriptor::getId).containsExactly("ai-neural-network");
        assertThat(registry.listModels(ModelCategory.MACHINE_LEARNING))
            .extracting(ModelDescriptor::getId).containsExactly("random-forest");
        assertThat(registry.listModels(ModelCategory.STATISTICAL)).hasSize(6);
    }

    @Test
    void getModel_unknownId_throws() {
        registry.seedDefaults();
        assertThatThrownBy(() -> registry.getModel("prophet"))
            .isInstanceOf(ModelNotFoundException.class)
            .hasMessageContaining("prophet");
    }

    @Test
    void register_rejectsDuplicateName() {
        registry.seedDefaults();
        ModelDescriptor clash = ModelDescriptor.builder()
            .id("linear-regression-v2").name("Linear Regression").family(ModelFamily.TREND).build();

        assertThat(registry.register(clash)).isFalse();
        assertThat(registry.listModels()).hasSize(8);
    }

    @Test
    void defaultCatalog_carriesGeneratorParameters() {
        registry.seedDefaults();
        assertThat(registry.getModel("moving-average").intParameter("window_size", 0)).isEqualTo(3);
        assertThat(registry.getModel("random-forest").intParameter("tree_count", 0)).isEqualTo(5);
        assertThat(registry.getModel("seasonal-decompose").intParameter("period", 0)).isEqualTo(12);
    }
}
