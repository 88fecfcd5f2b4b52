/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests demonstrating the strategy API as a driver uses it.
 */
public class CmaesStrategyTest {

    @Test
    @DisplayName("Driver loop: minimize a shifted quadratic")
    void testDriverLoop() {
        CmaesStrategy strategy = CmaesStrategy.builder()
            .mu(5)
            .lambda(10)
            .sigma0(0.5)
            .build();
        Objective quadratic = x -> Math.pow(x[0] - 2, 2) + Math.pow(x[1] - 3, 2) + Math.pow(x[2] + 1, 2);
        Population population = Population.filled(strategy.getPopulationSize(), new double[]{0, 0, 0}, 3);
        CmaesState state = strategy.initialState(population);
        Well19937c random = new Well19937c(2025);
        Termination termination = Termination.builder().maxIterations(400).absoluteTolerance(1e-12).build();
        
        int itr = 0;
        while (itr < termination.getMaxIterations() && state.value() > termination.getAbsoluteTolerance()) {
            UpdateResult result = strategy.update(quadratic, Constraints.none(), state, population, itr, random);
            assertThat(result.shouldStop()).isFalse();
            itr++;
        }
        
        assertThat(state.value()).isLessThanOrEqualTo(1e-12);
        assertThat(state.minimizer()).containsExactly(new double[]{2.0, 3.0, -1.0}, within(1e-5));
        assertThat(population.get(0)).containsExactly(state.minimizer());
    }
    
    @Test
    @DisplayName("Population size is mu")
    void testPopulationSize() {
        assertThat(CmaesStrategy.of(CmaesConfig.defaults()).getPopulationSize()).isEqualTo(15);
        assertThat(CmaesStrategy.builder().mu(4).build().getPopulationSize()).isEqualTo(4);
        assertThat(CmaesStrategy.builder().mu(4).build().getConfig().getLambda()).isEqualTo(8);
    }
    
    @Test
    @DisplayName("Default termination: 1500 iterations, absolute tolerance 1e-15")
    void testDefaultTermination() {
        Termination term = CmaesStrategy.of(CmaesConfig.defaults()).defaultTermination();
        
        assertThat(term.getMaxIterations()).isEqualTo(1500);
        assertThat(term.getAbsoluteTolerance()).isEqualTo(1e-15);
    }
    
    @Test
    @DisplayName("Termination: Builder configuration")
    void testTerminationBuilder() {
        Termination term = Termination.builder()
            .maxIterations(500)
            .absoluteTolerance(1e-8)
            .build();
        
        assertThat(term.getMaxIterations()).isEqualTo(500);
        assertThat(term.getAbsoluteTolerance()).isEqualTo(1e-8);
        assertThatThrownBy(() -> Termination.builder().maxIterations(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Termination.builder().absoluteTolerance(-1)).isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    @DisplayName("Builder forwards every parameter to the configuration")
    void testBuilderForwarding() {
        CmaesStrategy strategy = CmaesStrategy.builder()
            .mu(2).lambda(4)
            .c1(0.1).cc(0.2).cMu(0.3).cSigma(0.4).cm(0.9).sigma0(2.0)
            .weights(0.5, 0.5, 0.0, 0.0)
            .build();
        CmaesConfig config = strategy.getConfig();
        
        assertThat(config.getC1()).isEqualTo(0.1);
        assertThat(config.getCc()).isEqualTo(0.2);
        assertThat(config.getCMu()).isEqualTo(0.3);
        assertThat(config.getCSigma()).isEqualTo(0.4);
        assertThat(config.getCm()).isEqualTo(0.9);
        assertThat(config.getSigma0()).isEqualTo(2.0);
        assertThat(config.getWeights()).containsExactly(0.5, 0.5, 0.0, 0.0);
        assertThatThrownBy(() -> CmaesStrategy.builder().mu(3).lambda(3).build())
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new CmaesStrategy(null)).isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    @DisplayName("Update status codes")
    void testUpdateStatus() {
        assertThat(UpdateStatus.CONTINUE.isStop()).isFalse();
        assertThat(UpdateStatus.NUMERIC_DEGENERACY.isStop()).isTrue();
        assertThat(UpdateStatus.NUMERIC_DEGENERACY.getCode()).isEqualTo(-1);
        assertThat(UpdateStatus.CONTINUE.toString()).isEqualTo("CONTINUE(0): Generation completed");
    }
}
