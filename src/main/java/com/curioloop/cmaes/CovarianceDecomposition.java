/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.MathUnsupportedOperationException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Outcome of decomposing a covariance matrix C = B·D²·Bᵗ.
 * <p>
 * Either a success carrying the orthonormal eigenvectors B and the scales
 * D = diag(√max(0, eigenvalue)), or a failure carrying a
 * {@link NumericDegeneracyException}. Nothing is thrown from {@link #of(double[][])}.
 * </p>
 * <p>
 * A matrix is rejected when it has a non-finite entry, is not symmetric within a
 * relative tolerance of {@value #SYMMETRY_TOLERANCE}, makes the eigen solver fail,
 * or has an eigenvalue below −{@value #NEGATIVE_EIGENVALUE_TOLERANCE} times
 * max(1, largest eigenvalue magnitude). Smaller negative eigenvalues are
 * rounding drift and are clamped to zero.
 * </p>
 */
public final class CovarianceDecomposition {
    
    /** Relative tolerance of the symmetry check */
    public static final double SYMMETRY_TOLERANCE = 1e-10;
    
    /** Relative tolerance for negative eigenvalues */
    public static final double NEGATIVE_EIGENVALUE_TOLERANCE = 1e-8;
    
    private final RealMatrix basis;
    private final double[] scales;
    private final NumericDegeneracyException failure;
    
    private CovarianceDecomposition(RealMatrix basis, double[] scales, NumericDegeneracyException failure) {
        this.basis = basis;
        this.scales = scales;
        this.failure = failure;
    }
    
    /**
     * Decomposes a covariance matrix.
     * @param covariance Square matrix (not modified)
     * @return Success or failure, never null
     */
    public static CovarianceDecomposition of(double[][] covariance) {
        int n = covariance != null ? covariance.length : 0;
        if (n == 0 || !Matrices.isSquare(covariance, n)) {
            return failed(new NumericDegeneracyException("Covariance matrix is not square", covariance));
        }
        if (!Matrices.isFinite(covariance)) {
            return failed(new NumericDegeneracyException("Covariance matrix has non-finite entries", covariance));
        }
        RealMatrix c = new Array2DRowRealMatrix(covariance, true);
        if (!MatrixUtils.isSymmetric(c, SYMMETRY_TOLERANCE)) {
            return failed(new NumericDegeneracyException("Covariance matrix is not symmetric", covariance));
        }
        
        // Exact symmetry keeps the solver on its symmetric path
        RealMatrix symmetric = c.add(c.transpose()).scalarMultiply(0.5);
        double[] values;
        RealMatrix vectors;
        try {
            EigenDecomposition eigen = new EigenDecomposition(symmetric);
            values = eigen.getRealEigenvalues();
            vectors = eigen.getV();
        } catch (MathIllegalStateException | MathArithmeticException
                 | MathIllegalArgumentException | MathUnsupportedOperationException e) {
            return failed(new NumericDegeneracyException(
                "Eigen decomposition failed: " + e.getMessage(), covariance, e));
        }
        
        double magnitude = 1.0;
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return failed(new NumericDegeneracyException("Eigenvalue is not finite", covariance));
            }
            magnitude = Math.max(magnitude, Math.abs(v));
        }
        double[] scales = new double[n];
        for (int i = 0; i < n; i++) {
            if (values[i] < -NEGATIVE_EIGENVALUE_TOLERANCE * magnitude) {
                return failed(new NumericDegeneracyException(
                    "Covariance matrix is not positive semi-definite (eigenvalue " + values[i] + ")",
                    covariance));
            }
            scales[i] = Math.sqrt(Math.max(0.0, values[i]));
        }
        return new CovarianceDecomposition(vectors, scales, null);
    }
    
    private static CovarianceDecomposition failed(NumericDegeneracyException failure) {
        return new CovarianceDecomposition(null, null, failure);
    }
    
    /**
     * Checks if the decomposition succeeded.
     * @return true if B and D are available
     */
    public boolean isSuccess() {
        return failure == null;
    }
    
    /**
     * Gets the failure report.
     * @return Degeneracy report, null on success
     */
    public NumericDegeneracyException getFailure() {
        return failure;
    }
    
    /**
     * Gets the eigenvector matrix B, one eigenvector per column.
     * @return Copy of B
     * @throws IllegalStateException if the decomposition failed
     */
    public double[][] getBasis() {
        checkSuccess();
        return basis.getData();
    }
    
    /**
     * Gets the diagonal of D, the square roots of the clamped eigenvalues.
     * @return Copy of the scales, aligned with the columns of B
     * @throws IllegalStateException if the decomposition failed
     */
    public double[] getScales() {
        checkSuccess();
        return scales.clone();
    }
    
    /**
     * Computes B·z.
     * @param z Vector of length N
     * @return Rotated vector
     */
    double[] rotate(double[] z) {
        return basis.operate(z);
    }
    
    /**
     * Computes B·D·z, mapping a standard-normal draw onto N(0, C).
     * @param z Vector of length N
     * @return Transformed vector
     */
    double[] transform(double[] z) {
        double[] scaled = new double[z.length];
        for (int i = 0; i < z.length; i++) {
            scaled[i] = scales[i] * z[i];
        }
        return basis.operate(scaled);
    }
    
    private void checkSuccess() {
        if (failure != null) {
            throw new IllegalStateException("Decomposition failed", failure);
        }
    }
}
