/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import java.util.Arrays;

/**
 * Mutable state of one CMA-ES run.
 * <p>
 * Created by {@link CmaesInitializer} and advanced in place, once per generation,
 * by {@link CmaesUpdate}. Strategy parameters (μ<sub>eff</sub>, learning rates,
 * damping, weights) are resolved at creation and never change afterwards.
 * All getters return copies.
 * </p>
 * 
 * <h2>Thread Safety</h2>
 * <p>
 * This class is <b>not thread-safe</b>. A state belongs to exactly one run and
 * must not be read while an update step is in flight on another thread.
 * </p>
 */
public final class CmaesState {
    
    private final int dimension;
    private final double muEff;
    private final double c1;
    private final double cc;
    private final double cMu;
    private final double cSigma;
    private final double dSigma;
    private final double[] weights;
    
    // Evolving quantities, written only by CmaesUpdate
    double[][] covariance;
    double[] s;
    double[] sSigma;
    double sigma;
    double[] parent;
    double[] fittest;
    double[] fitpop;
    
    CmaesState(int dimension, double muEff, double c1, double cc, double cMu, double cSigma,
               double dSigma, double[] weights, int mu, double sigma0, double[] individual) {
        this.dimension = dimension;
        this.muEff = muEff;
        this.c1 = c1;
        this.cc = cc;
        this.cMu = cMu;
        this.cSigma = cSigma;
        this.dSigma = dSigma;
        this.weights = weights.clone();
        
        this.fitpop = new double[mu];
        Arrays.fill(fitpop, Double.POSITIVE_INFINITY);
        this.covariance = Matrices.identity(dimension);
        this.s = new double[dimension];
        this.sSigma = new double[dimension];
        this.sigma = sigma0;
        this.parent = individual.clone();
        this.fittest = individual.clone();
    }
    
    /**
     * Gets the problem dimension N.
     * @return Dimension
     */
    public int getDimension() {
        return dimension;
    }
    
    /**
     * Gets the variance effective selection mass.
     * @return μ<sub>eff</sub>
     */
    public double getMuEff() {
        return muEff;
    }
    
    public double getC1() {
        return c1;
    }
    
    public double getCc() {
        return cc;
    }
    
    public double getCMu() {
        return cMu;
    }
    
    public double getCSigma() {
        return cSigma;
    }
    
    /**
     * Gets the step-size damping.
     * @return d<sub>σ</sub>
     */
    public double getDSigma() {
        return dSigma;
    }
    
    /**
     * Gets the resolved recombination weights.
     * @return Copy of the λ weights, best rank first
     */
    public double[] getWeights() {
        return weights.clone();
    }
    
    /**
     * Gets the covariance matrix C.
     * @return Copy of C
     */
    public double[][] getCovariance() {
        return Matrices.copy(covariance);
    }
    
    /**
     * Gets the covariance evolution path.
     * @return Copy of s
     */
    public double[] getCovariancePath() {
        return s.clone();
    }
    
    /**
     * Gets the step-size evolution path.
     * @return Copy of s<sub>σ</sub>
     */
    public double[] getStepSizePath() {
        return sSigma.clone();
    }
    
    /**
     * Gets the current step size.
     * @return σ
     */
    public double getSigma() {
        return sigma;
    }
    
    /**
     * Gets the current mean of the search distribution.
     * @return Flat copy of the parent
     */
    public double[] getParent() {
        return parent.clone();
    }
    
    /**
     * Gets the fitness values of the current survivors.
     * @return Copy of the μ fitness values, ascending
     */
    public double[] getFitpop() {
        return fitpop.clone();
    }
    
    /**
     * Gets the best fitness of the current survivors.
     * @return First entry of fitpop, +∞ before the first generation
     */
    public double value() {
        return fitpop[0];
    }
    
    /**
     * Gets the best survivor of the latest generation.
     * @return Flat copy of the fittest individual
     */
    public double[] minimizer() {
        return fittest.clone();
    }
    
    // Test hook for forcing degenerate matrices into the decomposition
    void setCovariance(double[][] covariance) {
        this.covariance = Matrices.copy(covariance);
    }
    
    @Override
    public String toString() {
        return "CmaesState{" +
                "dimension=" + dimension +
                ", sigma=" + sigma +
                ", value=" + value() +
                ", muEff=" + muEff +
                ", parent=" + Arrays.toString(parent) +
                '}';
    }
}
