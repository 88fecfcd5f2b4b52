/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

/**
 * Thrown when strategy parameters, supplied or derived, violate an invariant.
 * <p>
 * Raised by {@link CmaesConfig.Builder#build()} and {@link CmaesInitializer};
 * no partially built object escapes.
 * </p>
 */
public class ConfigurationException extends OptimizationException {
    
    private static final long serialVersionUID = 1L;
    
    /**
     * Creates a configuration exception.
     * @param message Violated invariant
     */
    public ConfigurationException(String message) {
        super(message, UpdateStatus.INVALID_CONFIGURATION);
    }
}
