package com.eyelevel.extractionpipeline.service.queue;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence seam for the job queue: a hash of string fields per job plus a FIFO list of pending ids.
 * Field values are already encoded by {@link JobHashMapper}.
 */
public interface JobStore {

    /**
     * Atomically writes the job fields, applies the retention TTL and pushes the id onto the queue.
     */
    void create(String jobId, Map<String, String> fields, Duration ttl);

    /**
     * Pops the oldest pending id, waiting up to {@code timeout}.
     *
     * @return the id, or empty when nothing arrived in time.
     */
    Optional<String> popNext(Duration timeout);

    /**
     * @return the stored fields, or an empty map when the job does not exist or has expired.
     */
    Map<String, String> findFields(String jobId);

    /**
     * Writes the given fields only if the job exists and its current status equals {@code expectedStatus}.
     * A {@code null} expected status accepts any existing job. When the status no longer matches but the
     * stored {@link JobHashMapper#WRITE_TOKEN} equals the one in {@code fields}, the same write already
     * landed and the call reports success without writing again.
     *
     * @return {@code true} when the fields were written, now or by an earlier attempt of the same write.
     */
    boolean updateFields(String jobId, @Nullable String expectedStatus, Map<String, String> fields);

    /**
     * @return {@code true} when the id was present in the pending list.
     */
    boolean removeFromQueue(String jobId);

    long queueLength();

    List<String> findAllJobIds();

    /**
     * Deletes the job hash and any pending entry for it.
     *
     * @return {@code true} when a hash was removed.
     */
    boolean delete(String jobId);
}
