package com.dcruver.goalrec.io;

import com.dcruver.goalrec.domain.InputFormatException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads and validates a {@link BatchManifest}.
 */
@Component
@Slf4j
public class BatchManifestReader {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public BatchManifest read(Path manifestFile) {
        BatchManifest manifest;
        try {
            manifest = objectMapper.readValue(manifestFile.toFile(), BatchManifest.class);
        } catch (IOException e) {
            throw new InputFormatException("Cannot read manifest " + manifestFile + ": " + e.getMessage(), e);
        }

        if (manifest.getModel() == null || manifest.getModel().isBlank()) {
            throw new InputFormatException(manifestFile + ": no model given");
        }
        if (manifest.getHypotheses().isEmpty()) {
            throw new InputFormatException(manifestFile + ": no hypotheses listed");
        }
        for (BatchManifest.Entry entry : manifest.getHypotheses()) {
            if (entry.getObservationLog() == null || entry.getBaselineLog() == null) {
                throw new InputFormatException(manifestFile + ": hypothesis "
                    + entry.getHypothesis() + " needs both observationLog and baselineLog");
            }
        }

        log.info("Read manifest {} with {} hypotheses", manifestFile, manifest.getHypotheses().size());
        return manifest;
    }

    /**
     * Resolve a path from the manifest relative to the manifest's directory
     */
    public Path resolve(Path manifestFile, String path) {
        if (path == null) {
            return null;
        }
        Path candidate = Path.of(path);
        if (candidate.isAbsolute()) {
            return candidate;
        }
        Path base = manifestFile.toAbsolutePath().getParent();
        return base == null ? candidate : base.resolve(candidate).normalize();
    }
}
