package io.kairos.core.cron;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public final class FileCronStore implements CronStore {
    private final Path path;
    private final ObjectMapper mapper;

    public FileCronStore(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        // stores written by other tools carry every schedule field, with nulls for the unused ones
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path path() {
        return path;
    }

    @Override
    public CronStoreDocument load() throws IOException {
        if (!Files.exists(path)) {
            return CronStoreDocument.empty();
        }
        CronStoreDocument document = mapper.readValue(Files.readString(path), CronStoreDocument.class);
        return document == null ? CronStoreDocument.empty() : document;
    }

    @Override
    public void save(CronStoreDocument document) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        Files.writeString(path, json + System.lineSeparator());
    }
}
