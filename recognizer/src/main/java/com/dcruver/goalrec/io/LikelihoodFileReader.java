package com.dcruver.goalrec.io;

import com.dcruver.goalrec.domain.InputFormatException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads per-hypothesis likelihoods, one hypothesis per line, either as
 * "name,likelihood" or "name likelihood". Blank lines and '#' comments are
 * skipped; malformed or negative rows are skipped with a warning.
 */
@Component
@Slf4j
public class LikelihoodFileReader {

    public List<LikelihoodRow> read(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file);
        } catch (IOException e) {
            throw new InputFormatException("Cannot read likelihood file " + file + ": " + e.getMessage(), e);
        }
        return parse(lines, file.toString());
    }

    public List<LikelihoodRow> parse(List<String> lines, String source) {
        List<LikelihoodRow> rows = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            String[] parts = line.contains(",") ? line.split(",", 2) : line.split("\\s+", 2);
            if (parts.length != 2 || parts[0].isBlank()) {
                log.warn("{}:{} skipped, expected 'hypothesis,likelihood': {}", source, i + 1, line);
                continue;
            }

            double likelihood;
            try {
                likelihood = Double.parseDouble(parts[1].strip());
            } catch (NumberFormatException e) {
                log.warn("{}:{} skipped, invalid likelihood: {}", source, i + 1, parts[1]);
                continue;
            }
            if (likelihood < 0 || !Double.isFinite(likelihood)) {
                log.warn("{}:{} skipped, likelihood must be finite and non-negative: {}",
                    source, i + 1, likelihood);
                continue;
            }

            rows.add(new LikelihoodRow(parts[0].strip(), likelihood));
        }

        if (rows.isEmpty()) {
            throw new InputFormatException("No valid hypotheses found in " + source);
        }
        return rows;
    }

    @Data
    public static class LikelihoodRow {
        private final String hypothesis;
        private final double likelihood;
    }
}
