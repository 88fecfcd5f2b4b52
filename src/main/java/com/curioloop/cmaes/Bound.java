/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

/**
 * Represents bounds for one coordinate of an individual.
 */
public final class Bound {
    
    /** Constant representing an unbounded value */
    public static final double UNBOUNDED = Double.NaN;
    
    private final double lower;
    private final double upper;
    
    /**
     * Creates a bound with specified lower and upper limits.
     * @param lower Lower bound (use UNBOUNDED for no lower bound)
     * @param upper Upper bound (use UNBOUNDED for no upper bound)
     */
    public Bound(double lower, double upper) {
        if (!Double.isNaN(lower) && !Double.isNaN(upper) && lower > upper) {
            throw new IllegalArgumentException("Lower bound must not exceed upper bound");
        }
        this.lower = lower;
        this.upper = upper;
    }
    
    /**
     * Creates an unbounded coordinate.
     * @return Unbounded bound
     */
    public static Bound unbounded() {
        return new Bound(UNBOUNDED, UNBOUNDED);
    }
    
    /**
     * Creates a bound with both lower and upper limits.
     * @param lower Lower bound
     * @param upper Upper bound
     * @return Bound with both limits
     */
    public static Bound between(double lower, double upper) {
        return new Bound(lower, upper);
    }
    
    /**
     * Creates a bound with only a lower limit (x >= value).
     * @param value Minimum value
     * @return Bound with lower limit only
     */
    public static Bound atLeast(double value) {
        return new Bound(value, UNBOUNDED);
    }
    
    /**
     * Creates a bound with only an upper limit (x <= value).
     * @param value Maximum value
     * @return Bound with upper limit only
     */
    public static Bound atMost(double value) {
        return new Bound(UNBOUNDED, value);
    }
    
    /**
     * Gets the lower bound.
     * @return Lower bound value (NaN if unbounded)
     */
    public double getLower() {
        return lower;
    }
    
    /**
     * Gets the upper bound.
     * @return Upper bound value (NaN if unbounded)
     */
    public double getUpper() {
        return upper;
    }
    
    public boolean hasLower() {
        return !Double.isNaN(lower);
    }
    
    public boolean hasUpper() {
        return !Double.isNaN(upper);
    }
    
    /**
     * Projects a value onto this bound.
     * @param value Coordinate value
     * @return Nearest value inside the bound
     */
    public double clamp(double value) {
        if (hasLower() && value < lower) return lower;
        if (hasUpper() && value > upper) return upper;
        return value;
    }
    
    /**
     * Checks whether a value lies inside this bound.
     * @param value Coordinate value
     * @return true if feasible
     */
    public boolean contains(double value) {
        return (!hasLower() || value >= lower) && (!hasUpper() || value <= upper);
    }
    
    @Override
    public String toString() {
        String l = hasLower() ? String.valueOf(lower) : "-∞";
        String u = hasUpper() ? String.valueOf(upper) : "+∞";
        return "[" + l + ", " + u + "]";
    }
}
