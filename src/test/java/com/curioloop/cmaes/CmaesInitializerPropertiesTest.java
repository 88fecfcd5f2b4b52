/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for parameter derivation.
 */
public class CmaesInitializerPropertiesTest {

    /**
     * For any valid configuration with default weights, initialization succeeds and
     * every resolved parameter satisfies its range.
     */
    @Property(tries = 200)
    @Label("Default weights always resolve to valid parameters")
    void defaultWeightsResolveToValidParameters(
            @ForAll @IntRange(min = 1, max = 30) int n,
            @ForAll @IntRange(min = 1, max = 20) int mu,
            @ForAll @IntRange(min = 1, max = 30) int extraOffspring
    ) {
        CmaesConfig config = CmaesConfig.builder()
                .mu(mu)
                .lambda(mu + extraOffspring)
                .build();
        
        CmaesState state = CmaesInitializer.initialize(config, new double[n]);
        
        assertValidParameters(state, mu);
        assertThat(state.getWeights()).hasSize(mu + extraOffspring);
    }
    
    /**
     * Positive default weights sum to one and are ordered best rank first;
     * the tail is negative.
     */
    @Property(tries = 100)
    @Label("Default weights are decreasing with unit positive mass")
    void defaultWeightsAreDecreasing(
            @ForAll @IntRange(min = 1, max = 20) int n,
            @ForAll @IntRange(min = 1, max = 15) int mu,
            @ForAll @IntRange(min = 1, max = 15) int extraOffspring
    ) {
        CmaesConfig config = CmaesConfig.builder().mu(mu).lambda(mu + extraOffspring).build();
        
        double[] w = CmaesInitializer.initialize(config, new double[n]).getWeights();
        
        double positive = Arrays.stream(w).filter(v -> v >= 0).sum();
        assertThat(positive).isCloseTo(1.0, within(1e-12));
        for (int i = 1; i < w.length; i++) {
            assertThat(w[i]).isLessThanOrEqualTo(w[i - 1]);
        }
        assertThat(w[w.length - 1]).isNegative();
    }
    
    /**
     * Intermediate recombination (w = 1/μ on the first μ ranks) has μ_eff = μ and is
     * accepted as supplied.
     */
    @Property(tries = 100)
    @Label("Intermediate weights hit the upper mu_eff boundary and are kept")
    void intermediateWeightsAreKept(
            @ForAll @IntRange(min = 2, max = 30) int n,
            @ForAll @IntRange(min = 1, max = 20) int mu,
            @ForAll @IntRange(min = 1, max = 10) int extraOffspring
    ) {
        double[] weights = new double[mu + extraOffspring];
        Arrays.fill(weights, 0, mu, 1.0 / mu);
        CmaesConfig config = CmaesConfig.builder()
                .mu(mu)
                .lambda(mu + extraOffspring)
                .weights(weights)
                .build();
        
        CmaesState state = CmaesInitializer.initialize(config, new double[n]);
        
        assertThat(state.getWeights()).containsExactly(weights);
        assertThat(state.getMuEff()).isCloseTo(mu, within(1e-9));
        assertValidParameters(state, mu);
    }
    
    private static void assertValidParameters(CmaesState state, int mu) {
        assertThat(state.getMuEff()).isBetween(1.0, (double) mu);
        assertThat(state.getC1() + state.getCMu()).isLessThanOrEqualTo(1.0);
        assertThat(state.getCSigma()).isGreaterThan(0.0).isLessThan(1.0);
        assertThat(state.getCc()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        assertThat(state.getDSigma()).isPositive();
        assertThat(state.getC1()).isNotNaN();
        assertThat(state.getCMu()).isNotNaN();
    }
}
