/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

/**
 * Stopping options a driver should use with CMA-ES unless told otherwise.
 * <p>
 * The strategy core never checks these values; it only reports numerically
 * fatal conditions through {@link UpdateStatus}. They are published by
 * {@link CmaesStrategy#defaultTermination()} for the driver that owns the
 * stopping policy.
 * </p>
 */
public final class Termination {
    
    private final int maxIterations;
    private final double absoluteTolerance;
    
    private Termination(Builder builder) {
        this.maxIterations = builder.maxIterations;
        this.absoluteTolerance = builder.absoluteTolerance;
    }
    
    /**
     * Creates a new builder for termination options.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Gets the maximum number of generations.
     * @return Maximum iterations
     */
    public int getMaxIterations() {
        return maxIterations;
    }
    
    /**
     * Gets the absolute fitness tolerance.
     * @return Absolute tolerance
     */
    public double getAbsoluteTolerance() {
        return absoluteTolerance;
    }
    
    /**
     * Builder for Termination options.
     */
    public static final class Builder {
        private int maxIterations = 1500;
        private double absoluteTolerance = 1e-15;
        
        private Builder() {}
        
        /**
         * Sets the maximum number of generations.
         * @param value Maximum iterations (must be positive)
         * @return This builder
         */
        public Builder maxIterations(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Max iterations must be positive");
            }
            this.maxIterations = value;
            return this;
        }
        
        /**
         * Sets the absolute fitness tolerance.
         * @param value Tolerance (must be non-negative)
         * @return This builder
         */
        public Builder absoluteTolerance(double value) {
            if (value < 0 || Double.isNaN(value)) {
                throw new IllegalArgumentException("Absolute tolerance must be non-negative");
            }
            this.absoluteTolerance = value;
            return this;
        }
        
        /**
         * Builds the termination options.
         * @return Termination options
         */
        public Termination build() {
            return new Termination(this);
        }
    }
    
    @Override
    public String toString() {
        return "Termination{" +
                "maxIterations=" + maxIterations +
                ", absoluteTolerance=" + absoluteTolerance +
                '}';
    }
}
