package com.dcruver.goalrec.domain.posterior;

import com.dcruver.goalrec.domain.ErrorKind;
import com.dcruver.goalrec.domain.ScoringComputationException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects per-hypothesis likelihoods as they arrive and normalizes them on demand.
 * Every {@link #snapshot()} recomputes the distribution from the current set;
 * earlier snapshots are never touched. Safe for concurrent recording.
 */
@Slf4j
public class PosteriorAccumulator {

    private final Map<String, Recorded> likelihoods = new LinkedHashMap<>();
    private final Map<String, FailedHypothesis> failures = new LinkedHashMap<>();
    private int nextDiscoveryIndex = 0;

    @Value
    private static class Recorded {
        double likelihood;
        int discoveryIndex;
    }

    public synchronized void record(String hypothesis, double likelihood) {
        if (!Double.isFinite(likelihood) || likelihood < 0.0) {
            throw new IllegalArgumentException(
                "Likelihood of " + hypothesis + " must be finite and non-negative: " + likelihood);
        }
        checkNew(hypothesis);
        likelihoods.put(hypothesis, new Recorded(likelihood, nextDiscoveryIndex++));
        log.debug("Recorded {} with likelihood {}", hypothesis, likelihood);
    }

    public synchronized void recordFailure(String hypothesis, ErrorKind kind, String message) {
        checkNew(hypothesis);
        failures.put(hypothesis, new FailedHypothesis(hypothesis, kind, message, nextDiscoveryIndex++));
        log.debug("Recorded failure of {} ({})", hypothesis, kind);
    }

    /**
     * Remove a hypothesis from the set; later snapshots no longer include it
     */
    public synchronized boolean withdraw(String hypothesis) {
        return likelihoods.remove(hypothesis) != null || failures.remove(hypothesis) != null;
    }

    public synchronized boolean contains(String hypothesis) {
        return likelihoods.containsKey(hypothesis) || failures.containsKey(hypothesis);
    }

    /**
     * The name itself when unused, otherwise the first free "name#n" with n from 2
     */
    public synchronized String distinctName(String hypothesis) {
        if (!contains(hypothesis)) {
            return hypothesis;
        }
        int suffix = 2;
        while (contains(hypothesis + "#" + suffix)) {
            suffix++;
        }
        return hypothesis + "#" + suffix;
    }

    public synchronized int size() {
        return likelihoods.size() + failures.size();
    }

    /**
     * Normalize the current likelihoods: posterior(h) = L(h) / sum of L.
     *
     * @throws ScoringComputationException if the sum is zero or not finite
     */
    public synchronized PosteriorTable snapshot() {
        double sum = 0.0;
        for (Recorded recorded : likelihoods.values()) {
            sum += recorded.getLikelihood();
        }
        if (sum == 0.0 || !Double.isFinite(sum)) {
            throw new ScoringComputationException(String.format(
                "Cannot normalize %d likelihoods, sum is %s", likelihoods.size(), sum));
        }

        List<PosteriorEntry> entries = new ArrayList<>(likelihoods.size());
        for (Map.Entry<String, Recorded> entry : likelihoods.entrySet()) {
            Recorded recorded = entry.getValue();
            entries.add(new PosteriorEntry(entry.getKey(), recorded.getLikelihood(),
                recorded.getLikelihood() / sum, recorded.getDiscoveryIndex()));
        }

        log.info("Normalized {} hypotheses ({} failed), likelihood sum {}",
            entries.size(), failures.size(), String.format("%.10e", sum));
        return new PosteriorTable(entries, new ArrayList<>(failures.values()), sum);
    }

    private void checkNew(String hypothesis) {
        if (hypothesis == null || hypothesis.isBlank()) {
            throw new IllegalArgumentException("Hypothesis name must not be blank");
        }
        if (contains(hypothesis)) {
            throw new IllegalArgumentException("Hypothesis already recorded: " + hypothesis);
        }
    }
}
