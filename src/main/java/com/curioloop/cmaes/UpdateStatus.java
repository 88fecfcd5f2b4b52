/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

/**
 * Enumeration of CMA-ES status codes.
 * <p>
 * An update step only ever reports {@link #CONTINUE} or {@link #NUMERIC_DEGENERACY};
 * {@link #INVALID_CONFIGURATION} is carried by {@link ConfigurationException}.
 * </p>
 */
public enum UpdateStatus {
    
    /** Generation completed, the driver may call the update step again */
    CONTINUE(0, "Generation completed"),
    
    /** Covariance matrix could not be decomposed */
    NUMERIC_DEGENERACY(-1, "Covariance matrix decomposition failed"),
    
    /** Strategy parameters violate an invariant */
    INVALID_CONFIGURATION(-2, "Invalid configuration");
    
    private final int code;
    private final String message;
    
    UpdateStatus(int code, String message) {
        this.code = code;
        this.message = message;
    }
    
    /**
     * Gets the numeric status code.
     * @return Status code
     */
    public int getCode() {
        return code;
    }
    
    /**
     * Gets the status message.
     * @return Status message
     */
    public String getMessage() {
        return message;
    }
    
    /**
     * Checks if this status asks the driver to stop.
     * @return true if the run cannot continue
     */
    public boolean isStop() {
        return code < 0;
    }
    
    @Override
    public String toString() {
        return name() + "(" + code + "): " + message;
    }
}
