/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import java.util.Arrays;

/**
 * Describes a covariance matrix that could not be decomposed.
 * <p>
 * The update step never throws this exception. It is returned inside a failed
 * {@link CovarianceDecomposition} and a stopping {@link UpdateResult} so the driver
 * can abort, restart or rethrow it.
 * </p>
 */
public class NumericDegeneracyException extends OptimizationException {
    
    private static final long serialVersionUID = 1L;
    
    private final double[][] covariance;
    
    /**
     * Creates a degeneracy report.
     * @param message Reason the decomposition failed
     * @param covariance Offending covariance matrix (copied)
     */
    public NumericDegeneracyException(String message, double[][] covariance) {
        super(message, UpdateStatus.NUMERIC_DEGENERACY);
        this.covariance = Matrices.copy(covariance);
    }
    
    /**
     * Creates a degeneracy report caused by the numerical library.
     * @param message Reason the decomposition failed
     * @param covariance Offending covariance matrix (copied)
     * @param cause Exception raised by the eigen solver
     */
    public NumericDegeneracyException(String message, double[][] covariance, Throwable cause) {
        super(message, UpdateStatus.NUMERIC_DEGENERACY, cause);
        this.covariance = Matrices.copy(covariance);
    }
    
    /**
     * Gets the covariance matrix at the time of failure.
     * @return Copy of the covariance snapshot
     */
    public double[][] getCovarianceSnapshot() {
        return Matrices.copy(covariance);
    }
    
    /**
     * Formats the covariance snapshot for diagnostics.
     * @return Row-wise rendering of the snapshot
     */
    public String describeCovariance() {
        return Arrays.deepToString(covariance);
    }
}
