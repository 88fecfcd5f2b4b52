/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import org.apache.commons.math3.random.Well19937c;

/**
 * Seeded generator that counts standard-normal draws.
 */
class CountingRandom extends Well19937c {
    
    private static final long serialVersionUID = 1L;
    
    private long gaussians;
    
    CountingRandom(long seed) {
        super(seed);
    }
    
    @Override
    public double nextGaussian() {
        gaussians++;
        return super.nextGaussian();
    }
    
    long getGaussians() {
        return gaussians;
    }
    
    void reset() {
        gaussians = 0;
    }
}
