package com.eyelevel.extractionpipeline.service.export;

import com.eyelevel.extractionpipeline.model.ExportJob;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Live export jobs indexed by id. All access goes through one lock; readers receive copies and writers
 * mutate inside {@link #update(String, Function)}.
 */
@Component
public class ExportJobRegistry {

    private final Map<String, ExportJob> jobs = new HashMap<>();
    private final Object lock = new Object();

    public void register(ExportJob job) {
        synchronized (lock) {
            jobs.put(job.getJobId(), job.copy());
        }
    }

    public Optional<ExportJob> snapshot(String jobId) {
        synchronized (lock) {
            ExportJob job = jobs.get(jobId);
            return job == null ? Optional.empty() : Optional.of(job.copy());
        }
    }

    /**
     * Applies {@code mutation} to the live job while holding the lock.
     *
     * @return the mutation's result, or empty if the job is unknown.
     */
    public <T> Optional<T> update(String jobId, Function<ExportJob, T> mutation) {
        synchronized (lock) {
            ExportJob job = jobs.get(jobId);
            return job == null ? Optional.empty() : Optional.ofNullable(mutation.apply(job));
        }
    }

    public List<ExportJob> snapshots(Predicate<ExportJob> filter) {
        synchronized (lock) {
            return jobs.values().stream().filter(filter).map(ExportJob::copy).toList();
        }
    }

    /**
     * Removes and returns every job matching {@code filter}.
     */
    public List<ExportJob> removeIf(Predicate<ExportJob> filter) {
        synchronized (lock) {
            List<ExportJob> removed = new ArrayList<>();
            Iterator<ExportJob> iterator = jobs.values().iterator();
            while (iterator.hasNext()) {
                ExportJob job = iterator.next();
                if (filter.test(job)) {
                    removed.add(job.copy());
                    iterator.remove();
                }
            }
            return removed;
        }
    }

    public int size() {
        synchronized (lock) {
            return jobs.size();
        }
    }
}
