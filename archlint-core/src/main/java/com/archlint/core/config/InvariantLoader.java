package com.archlint.core.config;

import com.archlint.core.model.Invariant;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads invariants from a YAML configuration file.
 *
 * <p>Uses Jackson to deserialize the file into an {@link InvariantConfig}. Parsed results are
 * cached in memory keyed by absolute path and last-modified time, so repeated scans of an
 * unchanged file do not parse it again. When a cache directory is configured, the parsed
 * invariants are also written there as JSON together with the source's last-modified time and
 * size, and later processes reuse them only while both still match the YAML source exactly.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * InvariantLoader loader = new InvariantLoader(projectRoot.resolve(".archlint"));
 * List<Invariant> invariants = loader.load(projectRoot.resolve(".archlint/invariants.yml"));
 * }</pre>
 */
public class InvariantLoader {

    /** Default location of the invariants file, relative to the project root. */
    public static final String DEFAULT_CONFIG_PATH = ".archlint/invariants.yml";

    static final String CACHE_FILE_NAME = "invariants-cache.json";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final Logger log;
    private final Path cacheDirectory;
    private final Map<Path, CachedConfig> memoryCache = new ConcurrentHashMap<>();

    /**
     * Creates a loader with an in-memory cache only.
     */
    public InvariantLoader() {
        this(null);
    }

    /**
     * Creates a loader that also persists parsed invariants in the given directory.
     *
     * @param cacheDirectory cache directory, or null to disable the file cache
     */
    public InvariantLoader(Path cacheDirectory) {
        this(cacheDirectory, LoggerFactory.getLogger(InvariantLoader.class));
    }

    InvariantLoader(Path cacheDirectory, Logger log) {
        this.cacheDirectory = cacheDirectory;
        this.log = log;
    }

    /**
     * Loads the invariants declared in a YAML file.
     *
     * @param configPath path to the invariants YAML file
     * @return declared invariants in file order
     * @throws InvariantConfigException if the file is missing, unreadable or not valid YAML
     */
    public List<Invariant> load(Path configPath) {
        Path absolutePath = configPath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(absolutePath)) {
            throw new InvariantConfigException("Invariants file not found: " + configPath);
        }

        FileTime modified = lastModified(absolutePath);
        CachedConfig cached = memoryCache.get(absolutePath);
        if (cached != null && cached.modified().equals(modified)) {
            log.debug("Using in-memory invariants for: {}", absolutePath);
            return cached.invariants();
        }

        long size = size(absolutePath);
        List<Invariant> invariants = readFileCache(absolutePath, modified, size);
        if (invariants == null) {
            invariants = parse(absolutePath);
            writeFileCache(absolutePath, modified, size, invariants);
        }

        memoryCache.put(absolutePath, new CachedConfig(modified, invariants));
        return invariants;
    }

    private List<Invariant> parse(Path configPath) {
        try {
            log.debug("Loading invariants from: {}", configPath);
            String yaml = Files.readString(configPath);
            InvariantConfig config = yaml.isBlank() ? null : YAML_MAPPER.readValue(yaml, InvariantConfig.class);
            if (config == null) {
                log.warn("Invariants file is empty: {}", configPath);
                return List.of();
            }
            log.info("Loaded {} invariants from: {}", config.invariants().size(), configPath);
            return config.invariants();
        } catch (IOException e) {
            throw new InvariantConfigException(
                "Failed to parse invariants file: " + configPath + ": " + e.getMessage(), e);
        }
    }

    private List<Invariant> readFileCache(Path configPath, FileTime sourceModified, long sourceSize) {
        if (cacheDirectory == null) {
            return null;
        }
        Path cacheFile = cacheDirectory.resolve(CACHE_FILE_NAME);
        if (!Files.isRegularFile(cacheFile)) {
            return null;
        }
        try {
            CacheFile cache = JSON_MAPPER.readValue(cacheFile.toFile(), CacheFile.class);
            if (!configPath.toString().equals(cache.source())) {
                log.debug("Invariants cache belongs to another file: {}", cache.source());
                return null;
            }
            if (cache.sourceModified() != sourceModified.toMillis() || cache.sourceSize() != sourceSize) {
                log.debug("Invariants cache is stale: {}", cacheFile);
                return null;
            }
            log.debug("Using cached invariants from: {}", cacheFile);
            return cache.invariants() != null ? cache.invariants() : List.of();
        } catch (IOException e) {
            log.debug("Ignoring unreadable invariants cache {}: {}", cacheFile, e.getMessage());
            return null;
        }
    }

    private void writeFileCache(Path configPath, FileTime sourceModified, long sourceSize,
                                List<Invariant> invariants) {
        if (cacheDirectory == null) {
            return;
        }
        Path cacheFile = cacheDirectory.resolve(CACHE_FILE_NAME);
        try {
            Files.createDirectories(cacheDirectory);
            JSON_MAPPER.writeValue(cacheFile.toFile(), new CacheFile(configPath.toString(), sourceModified.toMillis(), sourceSize, invariants));
        } catch (IOException e) {
            log.warn("Could not write invariants cache {}: {}", cacheFile, e.getMessage());
        }
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new InvariantConfigException("Cannot read invariants file: " + path, e);
        }
    }

    private static long size(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new InvariantConfigException("Cannot read invariants file: " + path, e);
        }
    }

    private record CachedConfig(FileTime modified, List<Invariant> invariants) {}

    record CacheFile(
        @JsonProperty("source") String source,
        @JsonProperty("source_modified") long sourceModified,
        @JsonProperty("source_size") long sourceSize,
        @JsonProperty("invariants") List<Invariant> invariants
    ) {}
}
