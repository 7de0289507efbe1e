package com.eyelevel.extractionpipeline.service.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * Process-local {@link JobStore} for development and tests. Mirrors the Redis layout: ids are pushed at
 * the head and popped from the tail, and hashes expire lazily once their TTL has passed.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.pipeline.queue.store", havingValue = "memory")
public class InMemoryJobStore implements JobStore {

    private final Map<String, StoredJob> jobs = new ConcurrentHashMap<>();
    private final BlockingDeque<String> pending = new LinkedBlockingDeque<>();

    @Override
    public void create(String jobId, Map<String, String> fields, Duration ttl) {
        synchronized (this) {
            jobs.put(jobId, new StoredJob(new LinkedHashMap<>(fields), Instant.now().plus(ttl)));
            pending.offerFirst(jobId);
        }
    }

    @Override
    public Optional<String> popNext(Duration timeout) {
        try {
            return Optional.ofNullable(pending.pollLast(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public synchronized Map<String, String> findFields(String jobId) {
        StoredJob job = live(jobId);
        return job != null ? new LinkedHashMap<>(job.fields()) : Collections.emptyMap();
    }

    @Override
    public synchronized boolean updateFields(String jobId, @Nullable String expectedStatus,
                                             Map<String, String> fields) {
        StoredJob job = live(jobId);
        if (job == null) {
            return false;
        }
        if (expectedStatus != null && !expectedStatus.equals(job.fields().get(JobHashMapper.STATUS))) {
            String token = fields.get(JobHashMapper.WRITE_TOKEN);
            return token != null && token.equals(job.fields().get(JobHashMapper.WRITE_TOKEN));
        }
        job.fields().putAll(fields);
        return true;
    }

    @Override
    public boolean removeFromQueue(String jobId) {
        return pending.removeFirstOccurrence(jobId);
    }

    @Override
    public long queueLength() {
        return pending.size();
    }

    @Override
    public synchronized List<String> findAllJobIds() {
        List<String> ids = new ArrayList<>();
        for (String id : new ArrayList<>(jobs.keySet())) {
            if (live(id) != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    @Override
    public synchronized boolean delete(String jobId) {
        pending.removeFirstOccurrence(jobId);
        return jobs.remove(jobId) != null;
    }

    private StoredJob live(String jobId) {
        StoredJob job = jobs.get(jobId);
        if (job != null && !Instant.now().isBefore(job.expiresAt())) {
            log.debug("Job {} expired from the in-memory store", jobId);
            jobs.remove(jobId);
            return null;
        }
        return job;
    }

    private record StoredJob(Map<String, String> fields, Instant expiresAt) {
    }
}
