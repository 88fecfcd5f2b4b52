/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the population buffer.
 */
public class PopulationTest {

    @Test
    @DisplayName("Shaped individuals are stored flat, row-major")
    void testShapedIndividuals() {
        Population population = Population.allocate(2, 2, 3);
        
        assertThat(population.size()).isEqualTo(2);
        assertThat(population.getDimension()).isEqualTo(6);
        assertThat(population.getShape()).containsExactly(2, 3);
        
        population.set(1, new double[]{1, 2, 3, 4, 5, 6});
        
        assertThat(population.get(1)).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(population.getMatrix(1)).isDeepEqualTo(new double[][]{{1, 2, 3}, {4, 5, 6}});
        assertThat(population.get(0)).containsOnly(0.0);
    }
    
    @Test
    @DisplayName("Vector populations copy their input")
    void testOfCopies() {
        double[] a = {1.0, 2.0};
        Population population = Population.of(a, new double[]{3.0, 4.0});
        a[0] = 42.0;
        population.get(1)[0] = 42.0;
        
        assertThat(population.get(0)).containsExactly(1.0, 2.0);
        assertThat(population.get(1)).containsExactly(3.0, 4.0);
        assertThat(population.getShape()).containsExactly(2);
    }
    
    @Test
    @DisplayName("Compatibility checks size and dimension")
    void testCompatibility() {
        Population population = Population.filled(3, new double[]{0, 0, 0, 0}, 2, 2);
        
        assertThat(population.isCompatible(3, 4)).isTrue();
        assertThat(population.isCompatible(2, 4)).isFalse();
        assertThat(population.isCompatible(3, 2)).isFalse();
    }
    
    @Test
    @DisplayName("Invalid shapes and individuals are rejected")
    void testValidation() {
        assertThatThrownBy(() -> Population.allocate(0, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Population.allocate(2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Population.allocate(2, 2, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Population.allocate(2, 3).set(0, new double[2]))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("dimension 3");
        assertThatThrownBy(() -> Population.allocate(2, 3).getMatrix(0)).isInstanceOf(IllegalStateException.class);
    }
    
    @Test
    @DisplayName("Matrix-shaped individuals run through the update step")
    void testMatrixShapedRun() {
        CmaesStrategy strategy = CmaesStrategy.builder().mu(2).lambda(6).sigma0(0.5).build();
        Population population = Population.filled(2, new double[]{1, 1, 1, 1}, 2, 2);
        CmaesState state = strategy.initialState(population);
        // Frobenius norm of (X - I)
        Objective frobenius = x -> (x[0] - 1) * (x[0] - 1) + x[1] * x[1] + x[2] * x[2] + (x[3] - 1) * (x[3] - 1);
        Well19937c random = new Well19937c(8);
        
        for (int itr = 0; itr < 10; itr++) {
            strategy.update(frobenius, Constraints.none(), state, population, itr, random);
        }
        
        assertThat(population.getShape()).containsExactly(2, 2);
        assertThat(population.getMatrix(0)).hasDimensions(2, 2);
        assertThat(frobenius.evaluate(population.get(0))).isEqualTo(state.value());
    }
}
