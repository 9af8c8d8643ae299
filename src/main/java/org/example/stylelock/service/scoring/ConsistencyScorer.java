package org.example.stylelock.service.scoring;

/**
 * Measures how closely a generated artifact matches the approved style baseline.
 */
public interface ConsistencyScorer {

    /**
     * Score an artifact against a baseline.
     *
     * @param artifactRef local reference of the generated artifact
     * @param baselineRef reference of the approved baseline
     * @return similarity in the range 0.0 to 10.0; identical inputs give identical scores
     * @throws ScoringUnavailableException when the baseline is missing or the scorer is down
     */
    double score(String artifactRef, String baselineRef) throws ScoringUnavailableException;
}
