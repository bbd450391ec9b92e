package org.example.pysolver.config;

import org.example.pysolver.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads requirement strings from a pip requirements file.
 *
 * <p>Blank lines and comments are skipped, backslash continuations are joined. pip
 * options ({@code -r}, {@code -e}, {@code --index-url}, ...) are not supported and
 * are skipped with a warning.</p>
 */
public class RequirementsFileReader {

    private static final Logger log = LoggerFactory.getLogger(RequirementsFileReader.class);

    // pip only treats '#' as a comment at line start or after whitespace
    private static final Pattern COMMENT = Pattern.compile("(^|\\s)#.*$");

    /**
     * @throws ConfigurationException if the file cannot be read
     */
    public List<String> read(Path file) throws ConfigurationException {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read requirements file " + file + ": " + e.getMessage(), e);
        }
        return parse(lines, file.toString());
    }

    List<String> parse(List<String> lines, String source) {
        List<String> requirements = new ArrayList<>();
        StringBuilder pending = new StringBuilder();

        for (String rawLine : lines) {
            String line = rawLine;
            if (line.endsWith("\\")) {
                pending.append(line, 0, line.length() - 1).append(' ');
                continue;
            }
            pending.append(line);
            String logical = pending.toString();
            pending.setLength(0);
            add(logical, source, requirements);
        }
        if (pending.length() > 0) {
            add(pending.toString(), source, requirements);
        }

        log.debug("Read {} requirements from {}", requirements.size(), source);
        return requirements;
    }

    private void add(String logicalLine, String source, List<String> requirements) {
        String line = COMMENT.matcher(logicalLine).replaceFirst("").trim();
        if (line.isEmpty()) {
            return;
        }
        if (line.startsWith("-")) {
            log.warn("Skipping unsupported option line in {}: {}", source, line);
            return;
        }
        requirements.add(line.replaceAll("\\s+", " "));
    }
}
