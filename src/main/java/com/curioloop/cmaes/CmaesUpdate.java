/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.MathArrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;

/**
 * One generation of the (μ/μ<sub>W</sub>,λ)-CMA-ES with active covariance update.
 * <p>
 * A step decomposes C, samples λ offspring x<sub>i</sub> = repair(m + σ·B·D·z<sub>i</sub>),
 * ranks them by fitness (ascending, stable: equal fitness keeps sampling order,
 * NaN ranks last), moves the mean toward the weighted best μ, and adapts σ, the
 * two evolution paths and C. The ranking and every adaptation run only after all
 * λ evaluations finished and are committed to the state together.
 * </p>
 * <p>
 * Exactly N·λ values are drawn with {@link RandomGenerator#nextGaussian()} per
 * successful step, offspring-major and dimension-minor, so equal seeds give equal
 * trajectories. A failed decomposition draws nothing.
 * </p>
 * 
 * <h2>Thread Safety</h2>
 * <p>
 * Steps on one state must be sequential. Distinct states may be advanced from
 * distinct threads with distinct random generators.
 * </p>
 */
public final class CmaesUpdate {
    
    private static final Logger log = LoggerFactory.getLogger(CmaesUpdate.class);
    
    private CmaesUpdate() {}
    
    /**
     * Advances the state by one generation.
     *
     * @param config Strategy parameters the state was initialized with
     * @param objective Objective to minimize
     * @param constraints Constraint handling, {@link Constraints#none()} if unconstrained
     * @param state State to advance in place
     * @param population Buffer of μ individuals receiving the survivors, best first
     * @param itr Generation index, 0 for the first call
     * @param random Source of the standard-normal draws
     * @return {@link UpdateStatus#CONTINUE}, or {@link UpdateStatus#NUMERIC_DEGENERACY}
     *         with the state unchanged
     * @throws IllegalArgumentException if an argument is null or incompatible with the state
     */
    public static UpdateResult update(CmaesConfig config, Objective objective, Constraints constraints,
                                      CmaesState state, Population population, int itr,
                                      RandomGenerator random) {
        if (config == null || objective == null || constraints == null || state == null || random == null) {
            throw new IllegalArgumentException("Configuration, objective, constraints, state and random cannot be null");
        }
        if (itr < 0) {
            throw new IllegalArgumentException("Generation index must be non-negative");
        }
        int mu = config.getMu();
        int lambda = config.getLambda();
        int n = state.getDimension();
        if (population == null || !population.isCompatible(mu, n)) {
            throw new IllegalArgumentException("Population must hold " + mu + " individuals of dimension " + n);
        }
        double[] w = state.getWeights();
        if (w.length != lambda) {
            throw new IllegalArgumentException("State was initialized for lambda=" + w.length + ", not " + lambda);
        }
        
        double cm = config.getCm();
        double muEff = state.getMuEff();
        double c1 = state.getC1();
        double cc = state.getCc();
        double cMu = state.getCMu();
        double cSigma = state.getCSigma();
        double dSigma = state.getDSigma();
        double sigma = state.sigma;
        double[] parent = state.parent;
        double expectedNorm = Math.sqrt(n) * (1 - 1.0 / (4 * n) + 1.0 / (21.0 * n * n));
        
        CovarianceDecomposition decomposition = CovarianceDecomposition.of(state.covariance);
        if (!decomposition.isSuccess()) {
            NumericDegeneracyException failure = decomposition.getFailure();
            log.error("Break on eigen decomposition at generation {}: {}: {}",
                itr, failure.getMessage(), failure.describeCovariance());
            return UpdateResult.stop(itr, state, failure);
        }
        
        // Sample and evaluate offspring
        double[][] z = new double[lambda][n];
        double[][] y = new double[lambda][];
        double[][] offspring = new double[lambda][];
        double[] fitness = new double[lambda];
        for (int i = 0; i < lambda; i++) {
            for (int j = 0; j < n; j++) {
                z[i][j] = random.nextGaussian();
            }
            y[i] = decomposition.transform(z[i]);
            double[] candidate = new double[n];
            for (int j = 0; j < n; j++) {
                candidate[j] = parent[j] + sigma * y[i][j];
            }
            double[] repaired = constraints.repair(candidate);
            if (repaired == null || repaired.length != n) {
                throw new IllegalStateException("Constraints returned an individual of wrong dimension");
            }
            offspring[i] = repaired;
            fitness[i] = constraints.evaluate(objective, repaired.clone());
        }
        
        int[] rank = rank(fitness);
        
        // Recombination of the best mu
        double[] yBar = new double[n];
        double[] zBar = new double[n];
        for (int i = 0; i < mu; i++) {
            double[] o = offspring[rank[i]];
            double[] zi = z[rank[i]];
            for (int j = 0; j < n; j++) {
                yBar[j] += (o[j] - parent[j]) * (w[i] / sigma);
                zBar[j] += w[i] * zi[j];
            }
        }
        
        double[] newParent = new double[n];
        for (int j = 0; j < n; j++) {
            newParent[j] = parent[j] + cm * sigma * yBar[j];
        }
        
        // Step-size control
        double[] bzBar = decomposition.rotate(zBar);
        double sigmaPathScale = Math.sqrt(muEff * cSigma * (2 - cSigma));
        double[] newSSigma = new double[n];
        for (int j = 0; j < n; j++) {
            newSSigma[j] = (1 - cSigma) * state.sSigma[j] + sigmaPathScale * bzBar[j];
        }
        double sSigmaNorm = MathArrays.safeNorm(newSSigma);
        double newSigma = sigma * Math.exp((cSigma / dSigma) * (sSigmaNorm / expectedNorm - 1));
        
        boolean hSigma = sSigmaNorm / Math.sqrt(1 - Math.pow(1 - cSigma, 2.0 * (itr + 1)))
            < (1.4 + 2.0 / (n + 1)) * expectedNorm;
        
        // Covariance path
        double covPathScale = hSigma ? Math.sqrt(muEff * cc * (2 - cc)) : 0.0;
        double[] newS = new double[n];
        for (int j = 0; j < n; j++) {
            newS[j] = (1 - cc) * state.s[j] + covPathScale * yBar[j];
        }
        
        // Active rank-mu over all lambda ranked steps y = B·D·z, negative weights rescaled by N/‖B·z‖²
        double[] rankMuFactor = new double[lambda];
        double weightSum = 0.0;
        for (int i = 0; i < lambda; i++) {
            weightSum += w[i];
            double m = 1.0;
            if (w[i] < 0) {
                double bzNorm = MathArrays.safeNorm(decomposition.rotate(z[rank[i]]));
                m = n / (bzNorm * bzNorm);
            }
            rankMuFactor[i] = cMu * m * w[i];
        }
        
        double decay = 1 - c1 - cMu * weightSum;
        if (!hSigma) {
            decay += c1 * cc * (2 - cc);
        }
        double[][] c = state.covariance;
        double[][] newC = new double[n][n];
        for (int a = 0; a < n; a++) {
            for (int b = a; b < n; b++) {
                double rankMu = 0.0;
                for (int i = 0; i < lambda; i++) {
                    double[] yi = y[rank[i]];
                    rankMu += rankMuFactor[i] * yi[a] * yi[b];
                }
                double v = decay * c[a][b] + c1 * newS[a] * newS[b] + rankMu;
                newC[a][b] = v;
                newC[b][a] = v;
            }
        }
        
        double[] newFitpop = new double[mu];
        for (int i = 0; i < mu; i++) {
            newFitpop[i] = fitness[rank[i]];
        }
        
        // Commit
        for (int i = 0; i < mu; i++) {
            population.set(i, offspring[rank[i]]);
        }
        state.parent = newParent;
        state.sigma = newSigma;
        state.sSigma = newSSigma;
        state.s = newS;
        state.covariance = newC;
        state.fitpop = newFitpop;
        state.fittest = offspring[rank[0]].clone();
        
        log.debug("Generation {}: best={}, sigma={}, hSigma={}", itr, newFitpop[0], newSigma, hSigma);
        return UpdateResult.proceed(itr, newFitpop[0], newSigma);
    }
    
    /**
     * Orders offspring indices by ascending fitness, keeping sampling order on ties.
     * @param fitness Fitness per offspring
     * @return Offspring indices, best first
     */
    static int[] rank(double[] fitness) {
        Integer[] order = new Integer[fitness.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        // Arrays.sort on objects is a stable merge sort
        Arrays.sort(order, Comparator.comparingDouble(i -> fitness[i]));
        int[] rank = new int[order.length];
        for (int i = 0; i < order.length; i++) {
            rank[i] = order[i];
        }
        return rank;
    }
}
