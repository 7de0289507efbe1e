package com.eyelevel.extractionpipeline.service.export;

import com.eyelevel.extractionpipeline.config.PipelineConfig;
import com.eyelevel.extractionpipeline.dto.export.DownloadResult;
import com.eyelevel.extractionpipeline.model.DownloadDenialReason;
import com.eyelevel.extractionpipeline.model.DownloadLink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues and validates unguessable download tokens. Validation and counting happen under the link's
 * own monitor, so concurrent requests can never exceed the download cap.
 */
@Slf4j
@Component
public class DownloadLinkService {

    static final String DOWNLOAD_PATH = "/api/v1/downloads/";
    private static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom = new SecureRandom();
    private final Map<String, DownloadLink> links = new ConcurrentHashMap<>();
    private final String baseUrl;

    public DownloadLinkService(PipelineConfig pipelineConfig) {
        String configured = pipelineConfig.getExport().getBaseUrl();
        this.baseUrl = configured == null ? "" : configured.replaceAll("/+$", "");
    }

    /**
     * Mints a token for {@code artifact}. An expiry of zero hours yields a link that is already expired.
     */
    public String createLink(Path artifact, long expiryHours, int maxDownloads, long fileSize) {
        String token = newToken();
        LocalDateTime now = LocalDateTime.now();
        links.put(token, new DownloadLink(token, artifact, now, now.plusHours(expiryHours), maxDownloads, fileSize));
        log.debug("Created download link for {} (expires in {}h, max {} downloads)", artifact.getFileName(),
                  expiryHours, maxDownloads);
        return token;
    }

    /**
     * Checks the token and, when valid, records one download.
     */
    public DownloadResult authorize(String token) {
        DownloadLink link = token == null ? null : links.get(token);
        if (link == null) {
            return DownloadResult.denied(DownloadDenialReason.INVALID_TOKEN);
        }
        DownloadDenialReason denial = link.tryConsume(LocalDateTime.now());
        if (denial != null) {
            log.warn("Download refused for {}: {}", link.getArtifactPath().getFileName(), denial.getMessage());
            return DownloadResult.denied(denial);
        }
        return DownloadResult.granted(link.getArtifactPath());
    }

    public Optional<DownloadLink> find(String token) {
        return token == null ? Optional.empty() : Optional.ofNullable(links.get(token));
    }

    public String downloadUrl(String token) {
        return baseUrl + DOWNLOAD_PATH + token;
    }

    public void revoke(String token) {
        if (token != null) {
            links.remove(token);
        }
    }

    /**
     * Drops links whose expiry time has passed.
     *
     * @return the number of links removed.
     */
    public int cleanupExpired() {
        LocalDateTime now = LocalDateTime.now();
        int removed = 0;
        Iterator<DownloadLink> iterator = links.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isExpired(now)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    public int activeLinks() {
        return links.size();
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
