/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

/**
 * Base exception of the CMA-ES core.
 */
public class OptimizationException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    private final UpdateStatus status;
    
    /**
     * Creates an optimization exception with status.
     * @param message Error message
     * @param status Status describing the failure
     */
    public OptimizationException(String message, UpdateStatus status) {
        super(message);
        this.status = status;
    }
    
    /**
     * Creates an optimization exception with status and cause.
     * @param message Error message
     * @param status Status describing the failure
     * @param cause Underlying cause
     */
    public OptimizationException(String message, UpdateStatus status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
    
    /**
     * Gets the status associated with this exception.
     * @return Status
     */
    public UpdateStatus getStatus() {
        return status;
    }
}
