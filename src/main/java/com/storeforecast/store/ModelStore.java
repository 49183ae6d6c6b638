package com.storeforecast.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.storeforecast.config.ForecastProperties;
import com.storeforecast.engine.ForecastModel;
import com.storeforecast.engine.RegressionEngine;
import com.storeforecast.exception.ModelStoreException;
import com.storeforecast.model.ModelMetadata;
import com.storeforecast.model.TrainedModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Filesystem layout per store:
 * <pre>
 * store_&lt;id&gt;/CURRENT                       name of the published version
 * store_&lt;id&gt;/versions/&lt;version&gt;/model.bin
 * store_&lt;id&gt;/versions/&lt;version&gt;/metadata.json
 * </pre>
 * A version directory is complete before it gets its final name and is never modified after.
 * Publishing swaps {@code CURRENT} by an atomic rename, so readers see either the previous
 * pair or the new one. Versions other than the current one make up the history.
 */
@Slf4j
@Component
public class ModelStore {

    static final String CURRENT_POINTER = "CURRENT";
    static final String VERSIONS_DIR = "versions";
    static final String ARTIFACT_FILE = "model.bin";
    static final String METADATA_FILE = "metadata.json";
    static final String STAGING_PREFIX = ".staging-";

    private static final DateTimeFormatter VERSION_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path root;
    private final RegressionEngine engine;
    private final Clock clock;
    private final int keepHistory;
    private final ObjectMapper mapper = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT)
        .build();

    public ModelStore(ForecastProperties properties, RegressionEngine engine, Clock clock) {
        this.root = Paths.get(properties.getModelDir());
        this.engine = engine;
        this.clock = clock;
        this.keepHistory = properties.getTraining().getKeepModelHistory();
    }

    public static String storeDirectoryName(String storeId) {
        return "store_" + storeId.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    /** Timestamp version id, suffixed when a version with the same second already exists. */
    public String nextVersion(String storeId) {
        String base = LocalDateTime.now(clock).format(VERSION_FORMAT);
        Path versions = versionsDir(storeId);
        String candidate = base;
        int suffix = 1;
        while (Files.exists(versions.resolve(candidate))) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    /**
     * Writes artifact and metadata into a new version directory, points {@code CURRENT} at it
     * and prunes old versions. The caller must hold the store's exclusive lock.
     */
    public void publish(String storeId, ForecastModel model, ModelMetadata metadata) {
        String version = metadata.getModelVersion();
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Metadata has no model version");
        }
        Path versions = versionsDir(storeId);
        Path staging = versions.resolve(STAGING_PREFIX + version + "-" + UUID.randomUUID());
        try {
            Files.createDirectories(staging);
            try (OutputStream out = Files.newOutputStream(staging.resolve(ARTIFACT_FILE))) {
                engine.write(model, out);
            }
            mapper.writeValue(staging.resolve(METADATA_FILE).toFile(), metadata);
            Files.move(staging, versions.resolve(version), StandardCopyOption.ATOMIC_MOVE);
            writePointer(storeId, version);
        } catch (IOException e) {
            deleteRecursively(staging);
            throw new ModelStoreException("Failed to publish model " + version + " for store " + storeId, e);
        }
        log.info("Model published | store={} | version={}", storeId, version);
        prune(storeId);
    }

    public Optional<String> currentVersion(String storeId) {
        Path pointer = storeDir(storeId).resolve(CURRENT_POINTER);
        if (!Files.isRegularFile(pointer)) {
            return Optional.empty();
        }
        try {
            String version = Files.readString(pointer, StandardCharsets.UTF_8).trim();
            return version.isEmpty() ? Optional.empty() : Optional.of(version);
        } catch (IOException e) {
            log.error("Cannot read model pointer | store={}", storeId, e);
            return Optional.empty();
        }
    }

    /**
     * The current artifact with its metadata, or empty when there is none or the pair is not
     * consistent.
     */
    public Optional<TrainedModel> load(String storeId) {
        Optional<ModelMetadata> metadata = loadMetadata(storeId);
        if (metadata.isEmpty()) {
            return Optional.empty();
        }
        String version = metadata.get().getModelVersion();
        Path artifact = versionsDir(storeId).resolve(version).resolve(ARTIFACT_FILE);
        try (InputStream in = Files.newInputStream(artifact)) {
            return Optional.of(new TrainedModel(engine.read(in), metadata.get()));
        } catch (IOException e) {
            log.error("Cannot read model artifact | store={} | version={}", storeId, version, e);
            return Optional.empty();
        }
    }

    public Optional<ModelMetadata> loadMetadata(String storeId) {
        Optional<String> version = currentVersion(storeId);
        if (version.isEmpty()) {
            return Optional.empty();
        }
        Optional<ModelMetadata> metadata = readMetadata(storeId, version.get());
        if (metadata.isPresent() && !version.get().equals(metadata.get().getModelVersion())) {
            log.error("Model metadata version mismatch | store={} | pointer={} | metadata={}",
                storeId, version.get(), metadata.get().getModelVersion());
            return Optional.empty();
        }
        return metadata;
    }

    /** Archived metadata, newest first. */
    public List<ModelMetadata> history(String storeId, int limit) {
        String current = currentVersion(storeId).orElse("");
        List<ModelMetadata> result = new ArrayList<>();
        for (String version : HistoryRetention.archived(listVersions(storeId), current)) {
            if (result.size() >= limit) {
                break;
            }
            readMetadata(storeId, version).ifPresent(result::add);
        }
        return result;
    }

    List<String> listVersions(String storeId) {
        Path versions = versionsDir(storeId);
        if (!Files.isDirectory(versions)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(versions, Files::isDirectory)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                if (!name.startsWith(".")) {
                    ids.add(name);
                }
            }
        } catch (IOException e) {
            throw new ModelStoreException("Cannot list model versions for store " + storeId, e);
        }
        return ids;
    }

    void prune(String storeId) {
        String current = currentVersion(storeId).orElse("");
        for (String version : HistoryRetention.selectForDeletion(listVersions(storeId), current, keepHistory)) {
            deleteRecursively(versionsDir(storeId).resolve(version));
            log.info("Archived model pruned | store={} | version={}", storeId, version);
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(versionsDir(storeId), STAGING_PREFIX + "*")) {
            for (Path leftover : stream) {
                deleteRecursively(leftover);
                log.warn("Removed incomplete model version | store={} | path={}", storeId, leftover.getFileName());
            }
        } catch (IOException e) {
            log.warn("Cannot scan for incomplete versions | store={}", storeId, e);
        }
    }

    private Optional<ModelMetadata> readMetadata(String storeId, String version) {
        Path file = versionsDir(storeId).resolve(version).resolve(METADATA_FILE);
        if (!Files.isRegularFile(file)) {
            log.error("Model metadata missing | store={} | version={}", storeId, version);
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), ModelMetadata.class));
        } catch (IOException e) {
            log.error("Cannot parse model metadata | store={} | version={}", storeId, version, e);
            return Optional.empty();
        }
    }

    private void writePointer(String storeId, String version) throws IOException {
        Path dir = storeDir(storeId);
        Path tmp = dir.resolve(CURRENT_POINTER + ".tmp-" + UUID.randomUUID());
        Files.writeString(tmp, version, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, dir.resolve(CURRENT_POINTER),
                StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private Path storeDir(String storeId) {
        return root.resolve(storeDirectoryName(storeId));
    }

    private Path versionsDir(String storeId) {
        return storeDir(storeId).resolve(VERSIONS_DIR);
    }

    private static void deleteRecursively(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("Failed to delete {}", path, e);
        }
    }
}
