/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.cmaes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the initial {@link CmaesState} of a run.
 * <p>
 * The effective selection mass of the supplied weights decides how parameters
 * are resolved:
 * </p>
 * <ul>
 *   <li><b>μ<sub>eff</sub> ∉ [1, μ]</b> (e.g. the all-zero default weights): the
 *       weights are replaced by logarithmic weights w'<sub>i</sub> = ln((λ+1)/2) − ln(i),
 *       positive ones normalized to sum 1 and negative ones scaled by
 *       min(α<sup>−</sup>, α<sup>−</sup><sub>eff</sub>, α<sup>−</sup><sub>pd</sub>) / α<sup>−</sup>;
 *       unset learning rates get the standard defaults. μ<sub>eff</sub> is taken over
 *       the leading non-negative w'<sub>i</sub> among the first μ, so a μ above the number
 *       of positive weights stays valid; α<sup>−</sup><sub>pd</sub> is +∞ when c<sub>μ</sub> = 0.</li>
 *   <li><b>μ<sub>eff</sub> ∈ [1, μ]</b>: the weights are kept and unset learning rates
 *       get the simplified defaults c<sub>c</sub> = c<sub>σ</sub> = 1/√N,
 *       c<sub>1</sub> = min(2/N², 1 − c<sub>μ</sub>), c<sub>μ</sub> = min(μ<sub>eff</sub>/N², 1 − c<sub>1</sub>).
 *       c<sub>1</sub> is resolved first, against the supplied c<sub>μ</sub> or 0 when c<sub>μ</sub>
 *       is unset.</li>
 * </ul>
 */
public final class CmaesInitializer {
    
    private static final Logger log = LoggerFactory.getLogger(CmaesInitializer.class);
    
    /** Learning-rate scale of the covariance update */
    private static final double ALPHA_COV = 2.0;
    
    /** Relative slack of the μ<sub>eff</sub> range check */
    static final double MU_EFF_TOLERANCE = 1e-12;
    
    private CmaesInitializer() {}
    
    /**
     * Creates the initial state from the first individual of a population.
     * @param config Strategy parameters
     * @param population Initial population, individual 0 is the starting mean
     * @return Fresh state
     * @throws ConfigurationException if derived parameters violate an invariant
     */
    public static CmaesState initialize(CmaesConfig config, Population population) {
        if (population == null) {
            throw new IllegalArgumentException("Population cannot be null");
        }
        return initialize(config, population.get(0));
    }
    
    /**
     * Creates the initial state from a sample individual.
     * @param config Strategy parameters
     * @param individual Flat starting mean (copied), its length is the dimension N
     * @return Fresh state
     * @throws ConfigurationException if derived parameters violate an invariant
     */
    public static CmaesState initialize(CmaesConfig config, double[] individual) {
        if (config == null) {
            throw new IllegalArgumentException("Configuration cannot be null");
        }
        if (individual == null || individual.length == 0) {
            throw new IllegalArgumentException("Individual cannot be null or empty");
        }
        
        int mu = config.getMu();
        int lambda = config.getLambda();
        int n = individual.length;
        double c1 = config.getC1();
        double cc = config.getCc();
        double cMu = config.getCMu();
        double cSigma = config.getCSigma();
        double[] weights = config.getWeights();
        
        double sumSq = 0.0;
        for (int i = 0; i < mu; i++) {
            sumSq += weights[i] * weights[i];
        }
        double muEff = 1.0 / sumSq;
        
        if (!inRange(muEff, mu)) {
            // default parameters for weighted recombination
            double[] raw = new double[lambda];
            double positiveSum = 0.0;
            double negativeSum = 0.0;
            for (int i = 0; i < lambda; i++) {
                raw[i] = Math.log((lambda + 1) / 2.0) - Math.log(i + 1);
                if (raw[i] >= 0) {
                    positiveSum += raw[i];
                } else {
                    negativeSum += raw[i];
                }
            }
            muEff = selectionMass(raw, 0, leadingPositive(raw, mu));
            double muEffMinus = selectionMass(raw, mu, lambda);
            double alphaMinus = -negativeSum;
            double alphaMinusEff = 1 + (2 * muEffMinus) / (muEff + 2);
            
            if (Double.isNaN(c1)) {
                c1 = ALPHA_COV / ((n + 1.3) * (n + 1.3) + muEff);
            }
            if (Double.isNaN(cMu)) {
                cMu = Math.min(1 - c1,
                    ALPHA_COV * (muEff - 2 + 1 / muEff) / ((n + 2) * (n + 2) + ALPHA_COV * muEff / 2));
            }
            if (Double.isNaN(cc)) {
                cc = (4 + muEff / n) / (n + 4 + 2 * muEff / n);
            }
            if (Double.isNaN(cSigma)) {
                cSigma = (muEff + 2) / (n + muEff + 5);
            }
            // without rank-mu learning the negative weights never reach C
            double alphaMinusPd = cMu > 0 ? (1 - c1 - cMu) / (n * cMu) : Double.POSITIVE_INFINITY;
            double negativeScale = Math.min(alphaMinus, Math.min(alphaMinusEff, alphaMinusPd)) / alphaMinus;
            
            for (int i = 0; i < lambda; i++) {
                weights[i] = raw[i] >= 0 ? raw[i] / positiveSum : negativeScale * raw[i];
            }
        } else {
            if (Double.isNaN(cc)) {
                cc = 1 / Math.sqrt(n);
            }
            if (Double.isNaN(cSigma)) {
                cSigma = 1 / Math.sqrt(n);
            }
            if (Double.isNaN(c1)) {
                c1 = Math.min(2.0 / ((double) n * n), 1 - (Double.isNaN(cMu) ? 0.0 : cMu));
            }
            if (Double.isNaN(cMu)) {
                cMu = Math.min(muEff / ((double) n * n), 1 - c1);
            }
        }
        
        if (!inRange(muEff, mu)) {
            throw new ConfigurationException("mu_eff " + muEff + " is not in [1, " + mu + "]");
        }
        muEff = Math.max(1.0, Math.min(mu, muEff));
        if (c1 + cMu > 1) {
            throw new ConfigurationException("c1 + cMu > 1 (c1=" + c1 + ", cMu=" + cMu + ")");
        }
        if (cSigma >= 1) {
            throw new ConfigurationException("cSigma >= 1 (cSigma=" + cSigma + ")");
        }
        if (cc > 1) {
            throw new ConfigurationException("cc > 1 (cc=" + cc + ")");
        }
        
        double dSigma = 1 + 2 * Math.max(0, Math.sqrt((muEff - 1) / (n + 1)) - 1) + cSigma;
        
        log.debug("CMA-ES initialized: n={}, mu={}, lambda={}, muEff={}, c1={}, cc={}, cMu={}, cSigma={}, dSigma={}",
            n, mu, lambda, muEff, c1, cc, cMu, cSigma, dSigma);
        
        return new CmaesState(n, muEff, c1, cc, cMu, cSigma, dSigma, weights, mu,
            config.getSigma0(), individual);
    }
    
    /**
     * Computes (Σ w)² / Σ w² over {@code weights[from, to)}.
     */
    private static double selectionMass(double[] weights, int from, int to) {
        double sum = 0.0;
        double sumSq = 0.0;
        for (int i = from; i < to; i++) {
            sum += weights[i];
            sumSq += weights[i] * weights[i];
        }
        return sum * sum / sumSq;
    }
    
    /**
     * Counts the non-negative weights among the first μ, at least one.
     */
    private static int leadingPositive(double[] weights, int mu) {
        int count = 1;
        while (count < mu && weights[count] >= 0) {
            count++;
        }
        return count;
    }
    
    /**
     * Checks 1 ≤ μ<sub>eff</sub> ≤ μ, allowing rounding slack at both ends.
     */
    static boolean inRange(double muEff, int mu) {
        return muEff >= 1 - MU_EFF_TOLERANCE && muEff <= mu * (1 + MU_EFF_TOLERANCE);
    }
}
