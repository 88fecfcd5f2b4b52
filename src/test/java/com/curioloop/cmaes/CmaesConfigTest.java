/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for CmaesConfig construction and validation.
 */
public class CmaesConfigTest {

    @Test
    @DisplayName("Defaults: mu=15, lambda=2mu, zero weights, unset rates")
    void testDefaults() {
        CmaesConfig config = CmaesConfig.defaults();
        
        assertThat(config.getMu()).isEqualTo(15);
        assertThat(config.getLambda()).isEqualTo(30);
        assertThat(config.getWeights()).hasSize(30).containsOnly(0.0);
        assertThat(config.getC1()).isNaN();
        assertThat(config.getCc()).isNaN();
        assertThat(config.getCMu()).isNaN();
        assertThat(config.getCSigma()).isNaN();
        assertThat(config.getCm()).isEqualTo(1.0);
        assertThat(config.getSigma0()).isEqualTo(1.0);
    }
    
    @Test
    @DisplayName("Lambda defaults to twice the configured mu")
    void testLambdaFollowsMu() {
        CmaesConfig config = CmaesConfig.builder().mu(4).build();
        
        assertThat(config.getLambda()).isEqualTo(8);
        assertThat(config.getWeights()).hasSize(8);
    }
    
    @Test
    @DisplayName("mu >= lambda is rejected")
    void testMuNotSmallerThanLambda() {
        assertThatThrownBy(() -> CmaesConfig.builder().mu(6).lambda(6).build())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("larger than parent");
        
        assertThatThrownBy(() -> CmaesConfig.builder().mu(7).lambda(6).build())
            .isInstanceOf(ConfigurationException.class);
    }
    
    @Test
    @DisplayName("Weight count must equal lambda")
    void testWeightLengthMismatch() {
        assertThatThrownBy(() -> CmaesConfig.builder().mu(2).lambda(4).weights(0.5, 0.5, 0.0).build())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Number of weights must be 4");
    }
    
    @Test
    @DisplayName("cm above 1 is rejected, cm equal to 1 is accepted")
    void testMeanLearningRateBound() {
        assertThatThrownBy(() -> CmaesConfig.builder().cm(1.0001).build())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("cm");
        
        assertThat(CmaesConfig.builder().cm(1.0).build().getCm()).isEqualTo(1.0);
        assertThat(CmaesConfig.builder().cm(0.5).build().getCm()).isEqualTo(0.5);
    }
    
    @Test
    @DisplayName("Configuration errors carry INVALID_CONFIGURATION status")
    void testConfigurationStatus() {
        Throwable thrown = catchThrowable(() -> CmaesConfig.builder().mu(3).lambda(2).build());
        
        assertThat(thrown).isInstanceOf(ConfigurationException.class);
        assertThat(((OptimizationException) thrown).getStatus()).isEqualTo(UpdateStatus.INVALID_CONFIGURATION);
        assertThat(((OptimizationException) thrown).getStatus().isStop()).isTrue();
    }
    
    @Test
    @DisplayName("Builder setters reject invalid scalars eagerly")
    void testSetterValidation() {
        assertThatThrownBy(() -> CmaesConfig.builder().mu(0)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CmaesConfig.builder().sigma0(0.0)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CmaesConfig.builder().sigma0(Double.NaN)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CmaesConfig.builder().c1(-0.1)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CmaesConfig.builder().cSigma(Double.POSITIVE_INFINITY))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CmaesConfig.builder().weights(1.0, Double.NaN))
            .isInstanceOf(ConfigurationException.class);
    }
    
    @Test
    @DisplayName("NaN learning rates mean unset")
    void testUnsetRates() {
        CmaesConfig config = CmaesConfig.builder()
            .c1(0.1)
            .c1(CmaesConfig.UNSET)
            .cMu(0.2)
            .build();
        
        assertThat(config.getC1()).isNaN();
        assertThat(config.getCMu()).isEqualTo(0.2);
    }
    
    @Test
    @DisplayName("Supplied weights are copied")
    void testWeightsCopied() {
        double[] weights = {0.5, 0.5, 0.0, 0.0};
        CmaesConfig config = CmaesConfig.builder().mu(2).lambda(4).weights(weights).build();
        
        weights[0] = 42.0;
        double[] exposed = config.getWeights();
        exposed[1] = 42.0;
        
        assertThat(config.getWeights()).containsExactly(0.5, 0.5, 0.0, 0.0);
    }
}
