package com.eyelevel.extractionpipeline.service.export;

import com.eyelevel.extractionpipeline.config.PipelineConfig;
import com.eyelevel.extractionpipeline.dto.export.StorageStats;
import com.eyelevel.extractionpipeline.exception.PipelineException;
import com.eyelevel.extractionpipeline.model.CompressionType;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;

/**
 * Lays out export artifacts on disk: raw CSV files under {@code <base>/raw} and compressed derivatives
 * under {@code <base>/compressed}.
 */
@Slf4j
@Component
public class ArtifactStorage {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final String DEFAULT_NAME = "export";

    @Getter
    private final Path baseDir;
    private final Path rawDir;
    private final Path compressedDir;

    public ArtifactStorage(PipelineConfig pipelineConfig) {
        this.baseDir = Paths.get(pipelineConfig.getExport().getBaseDir()).toAbsolutePath();
        this.rawDir = baseDir.resolve("raw");
        this.compressedDir = baseDir.resolve("compressed");
    }

    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(rawDir);
            Files.createDirectories(compressedDir);
            log.info("Export storage initialised at {}", baseDir);
        } catch (IOException e) {
            throw new PipelineException("Unable to create export directories under " + baseDir, e);
        }
    }

    /**
     * @return the location for a new raw CSV artifact.
     */
    public Path rawArtifactPath(String filename, String sessionId, String jobId, LocalDateTime createdAt) {
        return rawDir.resolve(String.format("%s_%s_%s_%s.csv", sanitize(filename), sessionId, jobId,
                                            STAMP.format(createdAt)));
    }

    public Path compressedArtifactPath(Path rawArtifact, CompressionType compressionType) {
        return compressedDir.resolve(rawArtifact.getFileName().toString() + compressionType.getExtension());
    }

    /**
     * Reduces a user supplied name to a safe file name stem.
     */
    public String sanitize(String filename) {
        String base = FilenameUtils.getBaseName(filename == null ? "" : filename.trim());
        String cleaned = base.replaceAll("[^A-Za-z0-9._-]", "_");
        return StringUtils.hasText(cleaned) ? cleaned : DEFAULT_NAME;
    }

    public long sizeOf(Path path) throws IOException {
        return Files.size(path);
    }

    /**
     * Deletes the file if present. Failures are logged, never thrown.
     */
    public void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            if (!Files.deleteIfExists(path)) {
                log.debug("Artifact {} was already gone.", path);
            }
        } catch (IOException e) {
            log.warn("Failed to delete artifact {}", path, e);
        }
    }

    public StorageStats stats(int activeJobs) {
        File root = baseDir.toFile();
        if (!root.isDirectory()) {
            return new StorageStats(0, 0.0, 0, activeJobs, baseDir.toString());
        }
        Collection<File> files = FileUtils.listFiles(root, null, true);
        long totalSize = files.stream().mapToLong(File::length).sum();
        return new StorageStats(totalSize, totalSize / (1024.0 * 1024.0), files.size(), activeJobs,
                                baseDir.toString());
    }
}
