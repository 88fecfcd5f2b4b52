/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import java.util.Arrays;

/**
 * Immutable parameters of the (μ/μ<sub>W</sub>,λ)-CMA-ES strategy.
 * <p>
 * Learning rates left at {@link #UNSET} are derived from the problem dimension
 * by {@link CmaesInitializer}. Weights left at their all-zero default are
 * replaced by the standard logarithmic weights with negative (active) tail.
 * </p>
 *
 * <pre>{@code
 * CmaesConfig config = CmaesConfig.builder()
 *     .mu(3)
 *     .lambda(6)
 *     .sigma0(0.5)
 *     .build();
 * }</pre>
 *
 * @see CmaesInitializer
 */
public final class CmaesConfig {
    
    /** Marker for a learning rate that should be derived */
    public static final double UNSET = Double.NaN;
    
    private final int mu;
    private final int lambda;
    private final double c1;
    private final double cc;
    private final double cMu;
    private final double cSigma;
    private final double cm;
    private final double sigma0;
    private final double[] weights;
    
    private CmaesConfig(Builder builder, int lambda, double[] weights) {
        this.mu = builder.mu;
        this.lambda = lambda;
        this.c1 = builder.c1;
        this.cc = builder.cc;
        this.cMu = builder.cMu;
        this.cSigma = builder.cSigma;
        this.cm = builder.cm;
        this.sigma0 = builder.sigma0;
        this.weights = weights;
    }
    
    /**
     * Creates a new builder with the default parameters.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Creates the default configuration (μ = 15, λ = 30).
     * @return Default configuration
     */
    public static CmaesConfig defaults() {
        return builder().build();
    }
    
    /**
     * Gets the number of parents μ.
     * @return Parent count
     */
    public int getMu() {
        return mu;
    }
    
    /**
     * Gets the number of offspring λ.
     * @return Offspring count
     */
    public int getLambda() {
        return lambda;
    }
    
    /**
     * Gets the rank-one learning rate.
     * @return c<sub>1</sub>, NaN if unset
     */
    public double getC1() {
        return c1;
    }
    
    /**
     * Gets the cumulation rate of the covariance path.
     * @return c<sub>c</sub>, NaN if unset
     */
    public double getCc() {
        return cc;
    }
    
    /**
     * Gets the rank-μ learning rate.
     * @return c<sub>μ</sub>, NaN if unset
     */
    public double getCMu() {
        return cMu;
    }
    
    /**
     * Gets the cumulation rate of the step-size path.
     * @return c<sub>σ</sub>, NaN if unset
     */
    public double getCSigma() {
        return cSigma;
    }
    
    /**
     * Gets the mean learning rate.
     * @return c<sub>m</sub>
     */
    public double getCm() {
        return cm;
    }
    
    /**
     * Gets the initial step size.
     * @return σ<sub>0</sub>
     */
    public double getSigma0() {
        return sigma0;
    }
    
    /**
     * Gets the recombination weights as supplied.
     * @return Copy of the λ weights
     */
    public double[] getWeights() {
        return weights.clone();
    }
    
    /**
     * Builder for CMA-ES parameters.
     */
    public static final class Builder {
        private int mu = 15;
        private int lambda = 0;
        private double c1 = UNSET;
        private double cc = UNSET;
        private double cMu = UNSET;
        private double cSigma = UNSET;
        private double cm = 1.0;
        private double sigma0 = 1.0;
        private double[] weights;
        
        private Builder() {}
        
        /**
         * Sets the number of parents.
         * @param value μ (must be positive)
         * @return This builder
         */
        public Builder mu(int value) {
            if (value < 1) {
                throw new ConfigurationException("mu must be positive");
            }
            this.mu = value;
            return this;
        }
        
        /**
         * Sets the number of offspring. Defaults to 2μ.
         * @param value λ (must exceed μ at build time)
         * @return This builder
         */
        public Builder lambda(int value) {
            if (value < 2) {
                throw new ConfigurationException("lambda must be at least 2");
            }
            this.lambda = value;
            return this;
        }
        
        /**
         * Sets the rank-one learning rate.
         * @param value c<sub>1</sub>, or {@link #UNSET}
         * @return This builder
         */
        public Builder c1(double value) {
            this.c1 = checkRate("c1", value);
            return this;
        }
        
        /**
         * Sets the cumulation rate of the covariance path.
         * @param value c<sub>c</sub>, or {@link #UNSET}
         * @return This builder
         */
        public Builder cc(double value) {
            this.cc = checkRate("cc", value);
            return this;
        }
        
        /**
         * Sets the rank-μ learning rate.
         * @param value c<sub>μ</sub>, or {@link #UNSET}
         * @return This builder
         */
        public Builder cMu(double value) {
            this.cMu = checkRate("cMu", value);
            return this;
        }
        
        /**
         * Sets the cumulation rate of the step-size path.
         * @param value c<sub>σ</sub>, or {@link #UNSET}
         * @return This builder
         */
        public Builder cSigma(double value) {
            this.cSigma = checkRate("cSigma", value);
            return this;
        }
        
        /**
         * Sets the mean learning rate. Validated against c<sub>m</sub> ≤ 1 at build time.
         * @param value c<sub>m</sub>
         * @return This builder
         */
        public Builder cm(double value) {
            if (Double.isNaN(value)) {
                throw new ConfigurationException("cm must be a number");
            }
            this.cm = value;
            return this;
        }
        
        /**
         * Sets the initial step size.
         * @param value σ<sub>0</sub> (must be positive and finite)
         * @return This builder
         */
        public Builder sigma0(double value) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new ConfigurationException("sigma0 must be positive");
            }
            this.sigma0 = value;
            return this;
        }
        
        /**
         * Sets the recombination weights, best rank first.
         * <p>
         * Weights whose first μ entries give an effective selection mass outside
         * [1, μ] are replaced by the default weights during initialization.
         * </p>
         * @param values λ finite weights (copied)
         * @return This builder
         */
        public Builder weights(double... values) {
            if (values == null) {
                throw new ConfigurationException("weights cannot be null");
            }
            for (double w : values) {
                if (!Double.isFinite(w)) {
                    throw new ConfigurationException("weights must be finite");
                }
            }
            this.weights = values.clone();
            return this;
        }
        
        /**
         * Builds the configuration.
         * @return Immutable configuration
         * @throws ConfigurationException if μ ≥ λ, |weights| ≠ λ or c<sub>m</sub> > 1
         */
        public CmaesConfig build() {
            int resolvedLambda = lambda > 0 ? lambda : 2 * mu;
            if (mu >= resolvedLambda) {
                throw new ConfigurationException(
                    "Offspring population must be larger than parent population (mu=" + mu +
                    ", lambda=" + resolvedLambda + ")");
            }
            double[] resolvedWeights = weights != null ? weights : new double[resolvedLambda];
            if (resolvedWeights.length != resolvedLambda) {
                throw new ConfigurationException("Number of weights must be " + resolvedLambda +
                    ", got " + resolvedWeights.length);
            }
            if (cm > 1) {
                throw new ConfigurationException("cm must not exceed 1, got " + cm);
            }
            return new CmaesConfig(this, resolvedLambda, resolvedWeights);
        }
        
        private static double checkRate(String name, double value) {
            if (Double.isNaN(value)) {
                return UNSET;
            }
            if (value < 0 || Double.isInfinite(value)) {
                throw new ConfigurationException(name + " must be non-negative and finite");
            }
            return value;
        }
    }
    
    @Override
    public String toString() {
        return "CmaesConfig{" +
                "mu=" + mu +
                ", lambda=" + lambda +
                ", c1=" + c1 +
                ", cc=" + cc +
                ", cMu=" + cMu +
                ", cSigma=" + cSigma +
                ", cm=" + cm +
                ", sigma0=" + sigma0 +
                ", weights=" + Arrays.toString(weights) +
                '}';
    }
}
