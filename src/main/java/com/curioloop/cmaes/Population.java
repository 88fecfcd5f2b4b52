/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import java.util.Arrays;

/**
 * Externally owned buffer of individuals.
 * <p>
 * Individuals are stored as flat row-major vectors of length N. The buffer
 * remembers the shape the caller works with (for example {@code {3, 4}} for a
 * 3×4 parameter matrix); the algorithm itself only sees the flat vectors.
 * </p>
 * <p>
 * The update step overwrites the buffer in place after each generation with the
 * selected survivors, index 0 being the best one.
 * </p>
 * 
 * <h2>Thread Safety</h2>
 * <p>
 * This class is <b>not thread-safe</b>.
 * </p>
 */
public final class Population {
    
    private final int[] shape;
    private final int dimension;
    private final double[][] individuals;
    
    private Population(int size, int[] shape) {
        this.dimension = dimensionOf(shape);
        this.shape = shape.clone();
        this.individuals = new double[size][dimension];
    }
    
    /**
     * Allocates a zero-filled buffer.
     * @param size Number of individuals (must be positive)
     * @param shape Shape of one individual (each extent must be positive)
     * @return New buffer
     */
    public static Population allocate(int size, int... shape) {
        if (size <= 0) {
            throw new IllegalArgumentException("Population size must be positive");
        }
        return new Population(size, shape);
    }
    
    /**
     * Creates a buffer of vector-shaped individuals.
     * @param individuals Individuals of equal length (copied)
     * @return New buffer
     */
    public static Population of(double[]... individuals) {
        if (individuals == null || individuals.length == 0) {
            throw new IllegalArgumentException("Individuals cannot be null or empty");
        }
        if (individuals[0] == null) {
            throw new IllegalArgumentException("Individual 0 cannot be null");
        }
        Population population = allocate(individuals.length, individuals[0].length);
        for (int i = 0; i < individuals.length; i++) {
            population.set(i, individuals[i]);
        }
        return population;
    }
    
    /**
     * Creates a buffer holding {@code size} copies of one shaped individual.
     * @param size Number of individuals
     * @param individual Flat row-major individual
     * @param shape Shape of the individual
     * @return New buffer
     */
    public static Population filled(int size, double[] individual, int... shape) {
        Population population = allocate(size, shape);
        for (int i = 0; i < size; i++) {
            population.set(i, individual);
        }
        return population;
    }
    
    /**
     * Gets the number of individuals.
     * @return Buffer size
     */
    public int size() {
        return individuals.length;
    }
    
    /**
     * Gets the flat length N of one individual.
     * @return Dimension
     */
    public int getDimension() {
        return dimension;
    }
    
    /**
     * Gets the shape of one individual.
     * @return Copy of the shape
     */
    public int[] getShape() {
        return shape.clone();
    }
    
    /**
     * Checks if this buffer fits a run with the given parameters.
     * @param size Expected number of individuals
     * @param dimension Expected flat dimension
     * @return true if compatible
     */
    public boolean isCompatible(int size, int dimension) {
        return individuals.length == size && this.dimension == dimension;
    }
    
    /**
     * Gets one individual.
     * @param i Index, 0 is the best after an update
     * @return Flat copy of the individual
     */
    public double[] get(int i) {
        return individuals[i].clone();
    }
    
    /**
     * Replaces one individual.
     * @param i Index
     * @param individual Flat individual of length N (copied)
     */
    public void set(int i, double[] individual) {
        if (individual == null || individual.length != dimension) {
            throw new IllegalArgumentException("Individual must have dimension " + dimension);
        }
        System.arraycopy(individual, 0, individuals[i], 0, dimension);
    }
    
    /**
     * Gets one individual of a two-dimensional shape as a matrix.
     * @param i Index
     * @return Row-major copy as {@code shape[0]} rows of {@code shape[1]} columns
     * @throws IllegalStateException if the shape is not two-dimensional
     */
    public double[][] getMatrix(int i) {
        if (shape.length != 2) {
            throw new IllegalStateException("Shape " + Arrays.toString(shape) + " is not two-dimensional");
        }
        double[][] matrix = new double[shape[0]][shape[1]];
        for (int r = 0; r < shape[0]; r++) {
            System.arraycopy(individuals[i], r * shape[1], matrix[r], 0, shape[1]);
        }
        return matrix;
    }
    
    private static int dimensionOf(int[] shape) {
        if (shape == null || shape.length == 0) {
            throw new IllegalArgumentException("Shape cannot be null or empty");
        }
        int n = 1;
        for (int extent : shape) {
            if (extent <= 0) {
                throw new IllegalArgumentException("Shape extents must be positive");
            }
            n = Math.multiplyExact(n, extent);
        }
        return n;
    }
    
    @Override
    public String toString() {
        return "Population{" +
                "size=" + individuals.length +
                ", shape=" + Arrays.toString(shape) +
                '}';
    }
}
