package org.rapidrelief.engine.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Appends one JSON document per line to a file. Writes are serialised across runs.
 */
public final class JsonLinesAuditSink implements AuditSink {

    private static final Logger LOG = Logger.getLogger(JsonLinesAuditSink.class.getName());

    private final Path file;
    private final ObjectMapper mapper;

    public JsonLinesAuditSink(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    @Override
    public void record(PipelineRunRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        String line;
        try {
            line = mapper.writeValueAsString(record) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise audit record " + record.getRunId(), e);
        }
        synchronized (this) {
            try {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.write(file, line.getBytes(StandardCharsets.UTF_8),
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot append to audit log " + file, e);
            }
        }
        LOG.fine(() -> "Audited run " + record.getRunId() + " (" + record.getOutcome() + ")");
    }

    public Path getFile() {
        return file;
    }
}
