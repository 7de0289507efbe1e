package com.eyelevel.extractionpipeline.service.export;

import com.eyelevel.extractionpipeline.model.CompressionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Produces compressed derivatives of finished CSV artifacts.
 */
@Slf4j
@Component
public class CompressionService {

    /**
     * Compresses {@code source} into {@code target}. A partially written target is removed on failure.
     *
     * @param entryName Name of the single entry inside a ZIP archive; ignored for GZIP.
     */
    public void compress(Path source, Path target, CompressionType compressionType, String entryName)
            throws IOException {
        if (compressionType == CompressionType.NONE) {
            throw new IllegalArgumentException("No compression requested for " + source);
        }
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = Files.newOutputStream(target)) {
            if (compressionType == CompressionType.GZIP) {
                try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
                    in.transferTo(gzip);
                }
            } else {
                try (ZipOutputStream zip = new ZipOutputStream(out)) {
                    zip.putNextEntry(new ZipEntry(entryName));
                    in.transferTo(zip);
                    zip.closeEntry();
                }
            }
        } catch (IOException e) {
            cleanupTargetOnError(target, e);
            throw e;
        }
        log.debug("Compressed {} to {} using {}", source.getFileName(), target.getFileName(), compressionType);
    }

    private void cleanupTargetOnError(Path target, IOException originalException) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException cleanupEx) {
            log.error("Failed to clean up partial archive {}", target, cleanupEx);
            originalException.addSuppressed(cleanupEx);
        }
    }
}
