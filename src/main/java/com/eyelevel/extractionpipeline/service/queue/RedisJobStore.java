package com.eyelevel.extractionpipeline.service.queue;

import com.eyelevel.extractionpipeline.config.PipelineConfig;
import com.eyelevel.extractionpipeline.exception.PipelineException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.lang.Nullable;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Redis implementation of {@link JobStore}. Each job is a hash at {@code {queue}:job:{id}} carrying the
 * retention TTL; pending ids are LPUSHed onto the list {@code {queue}} and popped from the right, so
 * dispatch order is FIFO.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.pipeline.queue.store", havingValue = "redis", matchIfMissing = true)
public class RedisJobStore implements JobStore {

    private static final String ANY_STATUS = "*";

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> jobFieldUpdateScript;
    private final String queueKey;
    private final String jobKeyPrefix;

    public RedisJobStore(StringRedisTemplate redisTemplate, RedisScript<Long> jobFieldUpdateScript,
                         PipelineConfig pipelineConfig) {
        this.redisTemplate = redisTemplate;
        this.jobFieldUpdateScript = jobFieldUpdateScript;
        this.queueKey = pipelineConfig.getQueue().getName();
        this.jobKeyPrefix = queueKey + ":job:";
    }

    /**
     * Fails application startup when Redis cannot be reached.
     */
    @PostConstruct
    public void verifyConnection() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            log.info("Connected to Redis job store (queue '{}', ping: {}).", queueKey, pong);
        } catch (DataAccessException e) {
            throw new PipelineException("Unable to connect to Redis for job queue '" + queueKey + "'", e);
        }
    }

    @Override
    @Retryable(retryFor = DataAccessException.class,
            maxAttemptsExpression = "#{${app.pipeline.queue.write-retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.pipeline.queue.write-retry.delay-ms:200}}"),
            listeners = "jobStoreRetryListener")
    public void create(String jobId, Map<String, String> fields, Duration ttl) {
        String key = jobKey(jobId);
        List<Object> results = redisTemplate.execute(new SessionCallback<>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForHash().putAll(key, fields);
                ops.expire(key, ttl);
                ops.opsForList().leftPush(queueKey, jobId);
                return ops.exec();
            }
        });
        if (results == null || results.isEmpty()) {
            throw new PipelineException("Redis transaction for job " + jobId + " was discarded");
        }
    }

    @Override
    public Optional<String> popNext(Duration timeout) {
        // A zero timeout would block forever in BRPOP.
        if (timeout.isZero() || timeout.isNegative()) {
            return Optional.ofNullable(redisTemplate.opsForList().rightPop(queueKey));
        }
        return Optional.ofNullable(redisTemplate.opsForList().rightPop(queueKey, timeout));
    }

    @Override
    public Map<String, String> findFields(String jobId) {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(jobKey(jobId));
        if (entries.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> fields = new LinkedHashMap<>();
        entries.forEach((field, value) -> fields.put(String.valueOf(field), String.valueOf(value)));
        return fields;
    }

    @Override
    @Retryable(retryFor = DataAccessException.class,
            maxAttemptsExpression = "#{${app.pipeline.queue.write-retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.pipeline.queue.write-retry.delay-ms:200}}"),
            listeners = "jobStoreRetryListener")
    public boolean updateFields(String jobId, @Nullable String expectedStatus, Map<String, String> fields) {
        List<String> args = new ArrayList<>(1 + fields.size() * 2);
        args.add(expectedStatus != null ? expectedStatus : ANY_STATUS);
        fields.forEach((field, value) -> {
            args.add(field);
            args.add(value);
        });
        Long applied = redisTemplate.execute(jobFieldUpdateScript, List.of(jobKey(jobId)), args.toArray());
        return applied != null && applied == 1L;
    }

    @Override
    public boolean removeFromQueue(String jobId) {
        Long removed = redisTemplate.opsForList().remove(queueKey, 0, jobId);
        return removed != null && removed > 0;
    }

    @Override
    public long queueLength() {
        Long size = redisTemplate.opsForList().size(queueKey);
        return size != null ? size : 0L;
    }

    @Override
    public List<String> findAllJobIds() {
        Set<String> keys = redisTemplate.keys(jobKeyPrefix + "*");
        if (keys == null || keys.isEmpty()) {
            return Collections.emptyList();
        }
        return keys.stream().map(key -> key.substring(jobKeyPrefix.length())).toList();
    }

    @Override
    public boolean delete(String jobId) {
        removeFromQueue(jobId);
        return Boolean.TRUE.equals(redisTemplate.delete(jobKey(jobId)));
    }

    private String jobKey(String jobId) {
        return jobKeyPrefix + jobId;
    }
}
