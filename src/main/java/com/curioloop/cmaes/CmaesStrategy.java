/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Entry point of the CMA-ES strategy for an optimizer driver.
 * <p>
 * The strategy is stateless apart from its configuration: the driver obtains a
 * {@link CmaesState} from {@link #initialState(Population)} and advances it with
 * {@link #update} once per generation until its own stopping policy, or a
 * stopping {@link UpdateResult}, ends the run.
 * </p>
 * 
 * <h2>Example usage</h2>
 * <pre>{@code
 * CmaesStrategy strategy = CmaesStrategy.builder()
 *     .mu(3)
 *     .lambda(6)
 *     .build();
 *
 * Population population = Population.filled(strategy.getPopulationSize(), new double[]{1, 1}, 2);
 * CmaesState state = strategy.initialState(population);
 * RandomGenerator random = new Well19937c(42);
 *
 * for (int itr = 0; itr < 200; itr++) {
 *     UpdateResult result = strategy.update(x -> x[0]*x[0] + x[1]*x[1], Constraints.none(),
 *                                           state, population, itr, random);
 *     if (result.shouldStop()) {
 *         break;
 *     }
 * }
 * double[] best = state.minimizer();
 * }</pre>
 *
 * @see CmaesConfig
 * @see CmaesUpdate
 */
public final class CmaesStrategy {
    
    private final CmaesConfig config;
    
    /**
     * Creates a strategy with the given parameters.
     * @param config Strategy parameters
     */
    public CmaesStrategy(CmaesConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Configuration cannot be null");
        }
        this.config = config;
    }
    
    /**
     * Creates a new builder for a strategy.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Creates a strategy with the given parameters.
     * @param config Strategy parameters
     * @return Strategy
     */
    public static CmaesStrategy of(CmaesConfig config) {
        return new CmaesStrategy(config);
    }
    
    /**
     * Gets the strategy parameters.
     * @return Configuration
     */
    public CmaesConfig getConfig() {
        return config;
    }
    
    /**
     * Gets the size of the population buffer the driver must allocate.
     * @return μ
     */
    public int getPopulationSize() {
        return config.getMu();
    }
    
    /**
     * Gets the stopping options recommended for this strategy.
     * @return 1500 iterations and an absolute tolerance of 1e-15
     */
    public Termination defaultTermination() {
        return Termination.builder().build();
    }
    
    /**
     * Creates the initial state of a run.
     * @param population Initial population, individual 0 is the starting mean
     * @return Fresh state
     * @throws ConfigurationException if derived parameters violate an invariant
     */
    public CmaesState initialState(Population population) {
        return CmaesInitializer.initialize(config, population);
    }
    
    /**
     * Advances the state by one generation.
     * @see CmaesUpdate#update(CmaesConfig, Objective, Constraints, CmaesState, Population, int, RandomGenerator)
     */
    public UpdateResult update(Objective objective, Constraints constraints, CmaesState state,
                               Population population, int itr, RandomGenerator random) {
        return CmaesUpdate.update(config, objective, constraints, state, population, itr, random);
    }
    
    /**
     * Builder mirroring {@link CmaesConfig.Builder}.
     */
    public static final class Builder {
        private final CmaesConfig.Builder config = CmaesConfig.builder();
        
        private Builder() {}
        
        public Builder mu(int value) {
            config.mu(value);
            return this;
        }
        
        public Builder lambda(int value) {
            config.lambda(value);
            return this;
        }
        
        public Builder c1(double value) {
            config.c1(value);
            return this;
        }
        
        public Builder cc(double value) {
            config.cc(value);
            return this;
        }
        
        public Builder cMu(double value) {
            config.cMu(value);
            return this;
        }
        
        public Builder cSigma(double value) {
            config.cSigma(value);
            return this;
        }
        
        public Builder cm(double value) {
            config.cm(value);
            return this;
        }
        
        public Builder sigma0(double value) {
            config.sigma0(value);
            return this;
        }
        
        public Builder weights(double... values) {
            config.weights(values);
            return this;
        }
        
        /**
         * Builds the strategy.
         * @return Strategy
         * @throws ConfigurationException if the parameters are invalid
         */
        public CmaesStrategy build() {
            return new CmaesStrategy(config.build());
        }
    }
    
    @Override
    public String toString() {
        return "CmaesStrategy{" + config + '}';
    }
}
