package com.dcruver.goalrec.io;

import com.dcruver.goalrec.domain.InputFormatException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads an observation sequence: one grounded action name per line,
 * blank lines and '#' comments skipped.
 */
@Component
public class ObservationFileReader {

    public List<String> read(Path file) {
        try {
            return Files.readAllLines(file).stream()
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .toList();
        } catch (IOException e) {
            throw new InputFormatException("Cannot read observation file " + file + ": " + e.getMessage(), e);
        }
    }
}
