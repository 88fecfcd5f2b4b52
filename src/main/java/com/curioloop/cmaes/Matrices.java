/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

/**
 * Small dense-array helpers shared by the state and the update step.
 */
final class Matrices {
    
    private Matrices() {}
    
    static double[][] copy(double[][] matrix) {
        if (matrix == null) {
            return null;
        }
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }
    
    static double[][] identity(int n) {
        double[][] identity = new double[n][n];
        for (int i = 0; i < n; i++) {
            identity[i][i] = 1.0;
        }
        return identity;
    }
    
    static boolean isSquare(double[][] matrix, int n) {
        if (matrix == null || matrix.length != n) {
            return false;
        }
        for (double[] row : matrix) {
            if (row == null || row.length != n) {
                return false;
            }
        }
        return true;
    }
    
    static boolean isFinite(double[][] matrix) {
        for (double[] row : matrix) {
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    return false;
                }
            }
        }
        return true;
    }
}
