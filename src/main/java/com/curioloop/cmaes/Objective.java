/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

/**
 * Functional interface for black-box objective functions.
 * <p>
 * CMA-ES never asks for a gradient. Lower values are better.
 * </p>
 */
@FunctionalInterface
public interface Objective {
    
    /**
     * Evaluates the objective at the given individual.
     *
     * @param individual Flat individual of length N (read-only)
     * @return Fitness of the individual
     */
    double evaluate(double[] individual);
}
