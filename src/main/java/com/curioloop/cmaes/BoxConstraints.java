/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import java.util.Arrays;

/**
 * Box constraints repaired by coordinate-wise projection.
 * <p>
 * Every sampled candidate is clamped into its {@link Bound}s before evaluation, so
 * the objective only ever sees feasible points.
 * </p>
 *
 * <pre>{@code
 * Constraints box = BoxConstraints.of(2, Bound.between(-5, 5));
 * }</pre>
 */
public final class BoxConstraints implements Constraints {
    
    private final Bound[] bounds;
    
    private BoxConstraints(Bound[] bounds) {
        this.bounds = bounds;
    }
    
    /**
     * Creates box constraints from one bound per coordinate.
     * @param bounds Bounds, null entries mean unbounded
     * @return Box constraints
     * @throws IllegalArgumentException if bounds is null or empty
     */
    public static BoxConstraints of(Bound... bounds) {
        if (bounds == null || bounds.length == 0) {
            throw new IllegalArgumentException("Bounds cannot be null or empty");
        }
        Bound[] copy = new Bound[bounds.length];
        for (int i = 0; i < bounds.length; i++) {
            copy[i] = bounds[i] != null ? bounds[i] : Bound.unbounded();
        }
        return new BoxConstraints(copy);
    }
    
    /**
     * Creates box constraints applying one bound to all coordinates.
     * @param dimension Number of coordinates (must be positive)
     * @param bound Bound for every coordinate
     * @return Box constraints
     */
    public static BoxConstraints of(int dimension, Bound bound) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive");
        }
        Bound[] all = new Bound[dimension];
        Arrays.fill(all, bound);
        return of(all);
    }
    
    /**
     * Gets the number of constrained coordinates.
     * @return Dimension
     */
    public int getDimension() {
        return bounds.length;
    }
    
    /**
     * Gets the bound of one coordinate.
     * @param i Coordinate index
     * @return Bound
     */
    public Bound getBound(int i) {
        return bounds[i];
    }
    
    /**
     * Checks whether an individual satisfies all bounds.
     * @param individual Flat individual
     * @return true if feasible
     */
    public boolean isFeasible(double[] individual) {
        checkDimension(individual);
        for (int i = 0; i < bounds.length; i++) {
            if (!bounds[i].contains(individual[i])) {
                return false;
            }
        }
        return true;
    }
    
    @Override
    public double[] repair(double[] candidate) {
        checkDimension(candidate);
        for (int i = 0; i < bounds.length; i++) {
            candidate[i] = bounds[i].clamp(candidate[i]);
        }
        return candidate;
    }
    
    private void checkDimension(double[] individual) {
        if (individual == null || individual.length != bounds.length) {
            throw new IllegalArgumentException("Individual must have dimension " + bounds.length);
        }
    }
    
    @Override
    public String toString() {
        return "BoxConstraints" + Arrays.toString(bounds);
    }
}
