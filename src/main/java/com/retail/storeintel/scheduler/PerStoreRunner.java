package com.retail.storeintel.scheduler;

import com.retail.storeintel.entity.Store;
import com.retail.storeintel.exception.SchedulerJobException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Fans a per-store task out over the bounded worker pool. A failing store is
 * logged and left out of the result; it never fails the whole job.
 */
@Slf4j
public class PerStoreRunner {

    private final AsyncTaskExecutor workers;

    public PerStoreRunner(AsyncTaskExecutor workers) {
        this.workers = workers;
    }

    /**
     * @return store id to result, in input order; stores that failed, returned null
     * or were not started because a stop was requested are absent
     */
    public <T> Map<String, T> forEachStore(String jobName, List<Store> stores,
                                           Function<Store, T> task, JobContext context) {
        Map<String, Future<T>> futures = new LinkedHashMap<>();
        for (Store store : stores) {
            futures.put(store.getId(), workers.submit(() -> context.isStopRequested() ? null : task.apply(store)));
        }

        Map<String, T> results = new LinkedHashMap<>();
        for (Map.Entry<String, Future<T>> entry : futures.entrySet()) {
            try {
                T value = entry.getValue().get();
                if (value != null) {
                    results.put(entry.getKey(), value);
                }
            } catch (ExecutionException e) {
                SchedulerJobException failure = new SchedulerJobException(jobName, entry.getKey(), e.getCause());
                log.warn("SCHEDULER: {}", failure.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(future -> future.cancel(true));
                throw new SchedulerJobException(jobName, entry.getKey(), e);
            }
        }
        return results;
    }
}
