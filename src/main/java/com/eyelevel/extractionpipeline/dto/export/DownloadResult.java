package com.eyelevel.extractionpipeline.dto.export;

import com.eyelevel.extractionpipeline.model.DownloadDenialReason;

import java.nio.file.Path;

/**
 * Outcome of presenting a download token.
 *
 * @param authorized Whether one download was recorded and may proceed.
 * @param message    "Download authorized" or the denial message.
 * @param path       The artifact to stream, present only when authorized.
 * @param reason     Why the token was refused, {@code null} when authorized.
 */
public record DownloadResult(boolean authorized, String message, Path path, DownloadDenialReason reason) {

    public static DownloadResult granted(Path path) {
        return new DownloadResult(true, "Download authorized", path, null);
    }

    public static DownloadResult denied(DownloadDenialReason reason) {
        return new DownloadResult(false, reason.getMessage(), null, reason);
    }
}
