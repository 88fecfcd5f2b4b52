/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

/**
 * Constraint handling applied to every sampled candidate.
 * <p>
 * The update step first calls {@link #repair(double[])} on a raw sample, then
 * {@link #evaluate(Objective, double[])} on the repaired candidate. Implementations
 * that penalize rather than repair override {@code evaluate} and may leave
 * {@code repair} as the identity.
 * </p>
 */
public interface Constraints {
    
    /**
     * Maps a candidate onto the feasible region.
     * <p>
     * Implementations must return an array of the same length and must not keep a
     * reference to the argument.
     * </p>
     *
     * @param candidate Raw sample (may be modified in place)
     * @return Feasible candidate
     */
    double[] repair(double[] candidate);
    
    /**
     * Evaluates a (repaired) individual under these constraints.
     *
     * @param objective Objective function
     * @param individual Feasible individual
     * @return Fitness, including any penalty
     */
    default double evaluate(Objective objective, double[] individual) {
        return objective.evaluate(individual);
    }
    
    /**
     * Gets the constraint handler of an unconstrained problem.
     * @return Identity repair with plain objective evaluation
     */
    static Constraints none() {
        return candidate -> candidate;
    }
}
