package com.eyelevel.extractionpipeline.service.queue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryJobStoreTest {

    private final InMemoryJobStore store = new InMemoryJobStore();

    @Test
    @DisplayName("records disappear once their TTL has passed")
    void expiresRecords() throws InterruptedException {
        store.create("j1", Map.of("status", "pending"), Duration.ofMillis(5));
        Thread.sleep(20);

        assertThat(store.findFields("j1")).isEmpty();
        assertThat(store.findAllJobIds()).isEmpty();
        assertThat(store.updateFields("j1", null, Map.of("progress", "5"))).isFalse();
    }

    @Test
    @DisplayName("guarded update only applies when the expected status matches")
    void guardedUpdate() {
        store.create("j1", Map.of("status", "pending"), Duration.ofMinutes(1));

        assertThat(store.updateFields("j1", "processing", Map.of("status", "completed"))).isFalse();
        assertThat(store.updateFields("j1", "pending", Map.of("status", "processing"))).isTrue();
        assertThat(store.findFields("j1")).containsEntry("status", "processing");
        assertThat(store.updateFields("j1", null, Map.of("progress", "10"))).isTrue();
    }

    @Test
    @DisplayName("replaying a status write that already landed succeeds without a second write")
    void replayedWriteIsIdempotent() {
        store.create("j1", Map.of("status", "pending"), Duration.ofMinutes(1));
        Map<String, String> claim = Map.of("status", "processing", "started_at", "2024-01-01T10:00",
                                           "write_token", "t-1");

        assertThat(store.updateFields("j1", "pending", claim)).isTrue();
        assertThat(store.updateFields("j1", "pending", claim)).isTrue();
        assertThat(store.updateFields("j1", "pending", Map.of("status", "processing", "write_token", "t-2")))
                .isFalse();
        assertThat(store.findFields("j1")).containsEntry("write_token", "t-1");
    }

    @Test
    @DisplayName("removing from the queue and deleting are reflected in the queue length")
    void removeAndDelete() {
        store.create("j1", Map.of("status", "pending"), Duration.ofMinutes(1));
        store.create("j2", Map.of("status", "pending"), Duration.ofMinutes(1));

        assertThat(store.removeFromQueue("j1")).isTrue();
        assertThat(store.removeFromQueue("j1")).isFalse();
        assertThat(store.queueLength()).isEqualTo(1);
        assertThat(store.delete("j2")).isTrue();
        assertThat(store.queueLength()).isZero();
        assertThat(store.findAllJobIds()).containsExactly("j1");
    }
}
