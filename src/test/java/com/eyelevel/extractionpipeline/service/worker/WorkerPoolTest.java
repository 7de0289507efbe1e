package com.eyelevel.extractionpipeline.service.worker;

import com.eyelevel.extractionpipeline.common.json.jackson.JacksonJsonParser;
import com.eyelevel.extractionpipeline.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.extractionpipeline.config.PipelineConfig;
import com.eyelevel.extractionpipeline.dto.worker.PoolStatus;
import com.eyelevel.extractionpipeline.dto.worker.WorkerStatus;
import com.eyelevel.extractionpipeline.exception.apiclient.BadRequestException;
import com.eyelevel.extractionpipeline.model.JobStatus;
import com.eyelevel.extractionpipeline.service.queue.InMemoryJobStore;
import com.eyelevel.extractionpipeline.service.queue.JobHashMapper;
import com.eyelevel.extractionpipeline.service.queue.JobQueueService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerPoolTest {

    private PipelineConfig config;
    private JobQueueService queue;
    private ThreadPoolTaskExecutor executor;
    private WorkerPool workerPool;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        JobHashMapper mapper = new JobHashMapper(new JacksonJsonSerializer(objectMapper),
                                                 new JacksonJsonParser(objectMapper));
        config = new PipelineConfig();
        config.getQueue().setDequeueTimeoutSeconds(1);
        config.getWorker().setConcurrency(2);
        config.getWorker().setMaxConcurrency(4);
        config.getWorker().setStopTimeoutSeconds(5);
        config.getWorker().setAutoStart(false);
        queue = new JobQueueService(new InMemoryJobStore(), mapper, config);
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(0);
        executor.initialize();
        workerPool = new WorkerPool(queue, (job, progress) -> Map.of(), config, executor);
    }

    @AfterEach
    void tearDown() {
        workerPool.stop();
        executor.shutdown();
    }

    @Test
    @DisplayName("auto-start disabled leaves the pool stopped until started explicitly")
    void doesNotAutoStart() {
        workerPool.onApplicationReady();

        PoolStatus status = workerPool.poolStatus();
        assertThat(status.running()).isFalse();
        assertThat(status.workers()).isEmpty();
        assertThat(status.desiredWorkers()).isEqualTo(2);
    }

    @Test
    @DisplayName("start launches the configured number of workers")
    void startLaunchesWorkers() {
        workerPool.start();

        PoolStatus status = workerPool.poolStatus();
        assertThat(status.running()).isTrue();
        assertThat(status.workers()).extracting(WorkerStatus::workerId)
                                    .containsExactly("queue-worker-1", "queue-worker-2");
        assertThat(status.workers()).allMatch(WorkerStatus::running);
    }

    @Test
    @DisplayName("scaling up adds workers and scaling down stops the newest ones")
    void scaleUpAndDown() {
        // given
        workerPool.start();

        // when
        workerPool.scaleTo(3);
        PoolStatus grown = workerPool.poolStatus();
        workerPool.scaleTo(1);
        PoolStatus shrunk = workerPool.poolStatus();

        // then
        assertThat(grown.workers()).hasSize(3);
        assertThat(shrunk.desiredWorkers()).isEqualTo(1);
        assertThat(shrunk.workers()).extracting(WorkerStatus::workerId).containsExactly("queue-worker-1");
    }

    @Test
    @DisplayName("scaling a stopped pool only changes the size used on the next start")
    void scaleWhileStopped() {
        workerPool.scaleTo(1);
        assertThat(workerPool.poolStatus().workers()).isEmpty();

        workerPool.start();
        assertThat(workerPool.poolStatus().workers()).hasSize(1);
    }

    @Test
    @DisplayName("a negative size is rejected")
    void negativeSizeRejected() {
        assertThatThrownBy(() -> workerPool.scaleTo(-1)).isInstanceOf(BadRequestException.class);
    }

    @Test
    @DisplayName("a size above the configured maximum is rejected")
    void sizeAboveMaximumRejected() {
        assertThatThrownBy(() -> workerPool.scaleTo(5)).isInstanceOf(BadRequestException.class);
        assertThat(workerPool.poolStatus().desiredWorkers()).isEqualTo(2);
    }

    @Test
    @DisplayName("scaling down while a worker is busy lets its job complete")
    void scaleDownDuringJobFinishesInFlightJob() throws Exception {
        // given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        config.getWorker().setConcurrency(1);
        WorkerPool pool = new WorkerPool(queue, (job, progress) -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Map.of("ok", true);
        }, config, executor);
        String jobId = queue.enqueue("slow.pdf", "s1", null);
        pool.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        CompletableFuture<Void> scaling = CompletableFuture.runAsync(() -> pool.scaleTo(0));
        Thread.sleep(100);
        boolean finishedBeforeRelease = scaling.isDone();
        release.countDown();
        scaling.get(10, TimeUnit.SECONDS);

        // then
        assertThat(finishedBeforeRelease).isFalse();
        assertThat(queue.get(jobId).orElseThrow().getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(pool.poolStatus().workers()).isEmpty();
        pool.stop();
    }

    @Test
    @DisplayName("stop drains every worker")
    void stopDrainsWorkers() {
        workerPool.start();

        workerPool.stop();

        PoolStatus status = workerPool.poolStatus();
        assertThat(status.running()).isFalse();
        assertThat(status.workers()).isEmpty();
    }
}
