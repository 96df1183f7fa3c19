package com.testlantern.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Persists {@link AccessorReport}s as pretty-printed JSON.
 *
 * Writes go to a sibling temp file first and are then moved into place, so a reader
 * never sees a half-written report.
 */
public class AccessorReportWriter {

    private static final Logger log = LoggerFactory.getLogger(AccessorReportWriter.class);

    private final Path         reportPath;
    private final ObjectMapper mapper;

    public AccessorReportWriter(Path reportPath) {
        this.reportPath = reportPath;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes {@code report}, replacing any previous one.
     *
     * @throws UncheckedIOException when the file cannot be written
     */
    public synchronized void write(AccessorReport report) {
        try {
            Path parent = reportPath.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);

            Path tmp = reportPath.resolveSibling(reportPath.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), report);
            Files.move(tmp, reportPath, StandardCopyOption.REPLACE_EXISTING);
            log.info("AccessorReportWriter: Wrote {} accessors to {}",
                report.getAccessors().size(), reportPath.toAbsolutePath());
        } catch (IOException e) {
            log.error("AccessorReportWriter: Failed to write {}: {}", reportPath, e.getMessage());
            throw new UncheckedIOException("Could not write accessor report to " + reportPath, e);
        }
    }

    /** Reads the last written report, if there is a readable one. */
    public Optional<AccessorReport> read() {
        if (!Files.exists(reportPath)) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(reportPath.toFile(), AccessorReport.class));
        } catch (IOException e) {
            log.warn("AccessorReportWriter: Failed to read {}: {}", reportPath, e.getMessage());
            return Optional.empty();
        }
    }

    public Path getReportPath() { return reportPath; }
}
