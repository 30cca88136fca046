package com.dcruver.goalrec.domain.posterior;

import lombok.Getter;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable posterior distribution over the scored hypotheses at one point in time.
 */
public final class PosteriorTable {

    static final Comparator<PosteriorEntry> BY_POSTERIOR_DESCENDING =
        Comparator.comparingDouble(PosteriorEntry::getPosterior).reversed()
            .thenComparing(PosteriorEntry::getHypothesis);

    private final List<PosteriorEntry> discoveryOrder;
    private final List<PosteriorEntry> ranked;
    @Getter
    private final List<FailedHypothesis> failures;
    @Getter
    private final double likelihoodSum;

    PosteriorTable(List<PosteriorEntry> discoveryOrder, List<FailedHypothesis> failures, double likelihoodSum) {
        this.discoveryOrder = List.copyOf(discoveryOrder);
        this.ranked = discoveryOrder.stream().sorted(BY_POSTERIOR_DESCENDING).toList();
        this.failures = List.copyOf(failures);
        this.likelihoodSum = likelihoodSum;
    }

    /**
     * Entries by descending posterior, ties by ascending hypothesis name
     */
    public List<PosteriorEntry> ranked() {
        return ranked;
    }

    /**
     * Entries in the order the hypotheses were scored
     */
    public List<PosteriorEntry> discoveryOrder() {
        return discoveryOrder;
    }

    public Optional<PosteriorEntry> find(String hypothesis) {
        return discoveryOrder.stream()
            .filter(e -> e.getHypothesis().equals(hypothesis))
            .findFirst();
    }

    public Optional<PosteriorEntry> mostLikely() {
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    public int size() {
        return discoveryOrder.size();
    }
}
