/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

/**
 * Result of one CMA-ES update step.
 * <p>
 * {@link UpdateStatus#CONTINUE} means the state advanced by one generation.
 * {@link UpdateStatus#NUMERIC_DEGENERACY} means the covariance matrix could not be
 * decomposed; the state was left untouched and {@link #getFailure()} describes
 * the offending matrix.
 * </p>
 */
public final class UpdateResult {
    
    private final UpdateStatus status;
    private final int generation;
    private final double bestFitness;
    private final double sigma;
    private final NumericDegeneracyException failure;
    
    private UpdateResult(UpdateStatus status, int generation, double bestFitness, double sigma,
                         NumericDegeneracyException failure) {
        this.status = status;
        this.generation = generation;
        this.bestFitness = bestFitness;
        this.sigma = sigma;
        this.failure = failure;
    }
    
    static UpdateResult proceed(int generation, double bestFitness, double sigma) {
        return new UpdateResult(UpdateStatus.CONTINUE, generation, bestFitness, sigma, null);
    }
    
    static UpdateResult stop(int generation, CmaesState state, NumericDegeneracyException failure) {
        return new UpdateResult(UpdateStatus.NUMERIC_DEGENERACY, generation, state.value(), state.getSigma(), failure);
    }
    
    /**
     * Gets the status of the step.
     * @return Status
     */
    public UpdateStatus getStatus() {
        return status;
    }
    
    /**
     * Checks if the driver should stop calling the update step.
     * @return true on a fatal numeric condition
     */
    public boolean shouldStop() {
        return status.isStop();
    }
    
    /**
     * Gets the generation index passed to the step.
     * @return Generation index
     */
    public int getGeneration() {
        return generation;
    }
    
    /**
     * Gets the best fitness of the state after the step.
     * @return Best survivor fitness
     */
    public double getBestFitness() {
        return bestFitness;
    }
    
    /**
     * Gets the step size after the step.
     * @return σ
     */
    public double getSigma() {
        return sigma;
    }
    
    /**
     * Gets the degeneracy report of a stopping step.
     * @return Report, null when the step continued
     */
    public NumericDegeneracyException getFailure() {
        return failure;
    }
    
    @Override
    public String toString() {
        return "UpdateResult{" +
                "status=" + status +
                ", generation=" + generation +
                ", bestFitness=" + bestFitness +
                ", sigma=" + sigma +
                (failure != null ? ", failure=" + failure.getMessage() : "") +
                '}';
    }
}
