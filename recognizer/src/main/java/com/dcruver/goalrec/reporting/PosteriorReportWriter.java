package com.dcruver.goalrec.reporting;

import com.dcruver.goalrec.domain.RecognitionException;
import com.dcruver.goalrec.domain.posterior.FailedHypothesis;
import com.dcruver.goalrec.domain.posterior.PosteriorEntry;
import com.dcruver.goalrec.domain.posterior.PosteriorTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.dcruver.goalrec.reporting.ReportFormats.errorTag;
import static com.dcruver.goalrec.reporting.ReportFormats.scientific;

/**
 * Writes posterior tables as a readable report (discovery order and ranking)
 * and as CSV rows "hypothesis,likelihood,posterior".
 */
@Component
@Slf4j
public class PosteriorReportWriter {

    private static final String RULE = "=".repeat(60);

    public String render(PosteriorTable table) {
        StringBuilder sb = new StringBuilder();

        sb.append(RULE).append("\n");
        sb.append("Results by Discovery Order\n");
        sb.append(RULE).append("\n\n");

        List<Object> discovered = new ArrayList<>(table.discoveryOrder());
        discovered.addAll(table.getFailures());
        discovered.sort(Comparator.comparingInt(PosteriorReportWriter::discoveryIndex));
        int iteration = 1;
        for (Object item : discovered) {
            if (item instanceof PosteriorEntry entry) {
                sb.append(String.format("Iteration %d: %s\n", iteration++, entry.getHypothesis()));
                sb.append("  Likelihood: ").append(scientific(entry.getLikelihood())).append("\n\n");
            } else if (item instanceof FailedHypothesis failure) {
                sb.append(String.format("Iteration %d: %s\n", iteration++, failure.getHypothesis()));
                sb.append("  Likelihood: ").append(errorTag(failure.getKind()))
                    .append(" ").append(failure.getMessage()).append("\n\n");
            }
        }

        sb.append(RULE).append("\n");
        sb.append("Results Ranked by Posterior\n");
        sb.append(RULE).append("\n\n");

        int rank = 1;
        for (PosteriorEntry entry : table.ranked()) {
            sb.append(String.format("Rank %d: %s\n", rank++, entry.getHypothesis()));
            sb.append("  Likelihood: ").append(scientific(entry.getLikelihood())).append("\n");
            sb.append("  Posterior:  ").append(scientific(entry.getPosterior())).append("\n\n");
        }
        for (FailedHypothesis failure : table.getFailures()) {
            sb.append(String.format("Unranked: %s %s\n", failure.getHypothesis(), errorTag(failure.getKind())));
        }

        sb.append("Likelihood sum: ").append(scientific(table.getLikelihoodSum())).append("\n");
        return sb.toString();
    }

    /**
     * Posterior line for a batch whose likelihoods could not be normalized
     */
    public String renderUnavailable(RecognitionException error) {
        return "Posterior: " + errorTag(error.getKind()) + " " + error.getMessage() + "\n";
    }

    public String renderCsv(PosteriorTable table) {
        StringBuilder sb = new StringBuilder();
        for (PosteriorEntry entry : table.ranked()) {
            sb.append(entry.getHypothesis()).append(",")
                .append(scientific(entry.getLikelihood())).append(",")
                .append(scientific(entry.getPosterior())).append("\n");
        }
        for (FailedHypothesis failure : table.getFailures()) {
            String tag = errorTag(failure.getKind());
            sb.append(failure.getHypothesis()).append(",").append(tag).append(",").append(tag).append("\n");
        }
        return sb.toString();
    }

    /**
     * Write the report and, when {@code csvFile} is not null, the CSV rows
     */
    public void write(PosteriorTable table, Path reportFile, Path csvFile) throws IOException {
        createParent(reportFile);
        Files.writeString(reportFile, render(table));
        log.info("Wrote posterior report: {}", reportFile);

        if (csvFile != null) {
            createParent(csvFile);
            Files.writeString(csvFile, renderCsv(table));
            log.info("Wrote posterior CSV: {}", csvFile);
        }
    }

    private static int discoveryIndex(Object item) {
        if (item instanceof PosteriorEntry entry) {
            return entry.getDiscoveryIndex();
        }
        return ((FailedHypothesis) item).getDiscoveryIndex();
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
