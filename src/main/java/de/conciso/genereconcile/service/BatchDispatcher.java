package de.conciso.genereconcile.service;

import de.conciso.genereconcile.config.ReconcilerProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Schickt Batches fester Größe über einen begrenzten Pool an einen externen Service.
 * Bei transienten Fehlern wird jeder Batch mit exponentiellem Backoff wiederholt; scheitert
 * er weiterhin, wird er geloggt und übersprungen. Ergebnisse kommen in Batch-Reihenfolge.
 */
@Component
public class BatchDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    private final ExecutorService executor;
    private final Retry retry;

    @Autowired
    public BatchDispatcher(ReconcilerProperties properties) {
        this(properties.batch().maxConcurrency(), properties.retry());
    }

    BatchDispatcher(int maxConcurrency, ReconcilerProperties.Retry retryProperties) {
        this.executor = Executors.newFixedThreadPool(maxConcurrency, daemonThreads());
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retryProperties.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        retryProperties.initialBackoff(), retryProperties.multiplier()))
                .retryOnException(BatchDispatcher::isTransient)
                .build();
        this.retry = Retry.of("gene-lookup", config);
        this.retry.getEventPublisher().onRetry(event ->
                log.debug("Retry #{} after {}: {}", event.getNumberOfRetryAttempts(),
                        event.getWaitInterval(), String.valueOf(event.getLastThrowable())));
    }

    public <I, R> BatchOutcome<I, R> dispatch(String operation, List<I> items, int batchSize,
                                              Function<List<I>, R> call) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batch size must be positive, was " + batchSize);
        }
        if (items.isEmpty()) {
            return BatchOutcome.empty();
        }

        List<Integer> offsets = new ArrayList<>();
        List<List<I>> batches = new ArrayList<>();
        for (int offset = 0; offset < items.size(); offset += batchSize) {
            offsets.add(offset);
            batches.add(List.copyOf(items.subList(offset, Math.min(offset + batchSize, items.size()))));
        }

        List<CompletableFuture<R>> futures = new ArrayList<>();
        for (List<I> batch : batches) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> Retry.decorateSupplier(retry, () -> call.apply(batch)).get(), executor));
        }

        List<BatchOutcome.Completed<I, R>> completed = new ArrayList<>();
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            List<I> batch = batches.get(i);
            int offset = offsets.get(i);
            try {
                completed.add(new BatchOutcome.Completed<>(offset, batch, futures.get(i).join()));
            } catch (CompletionException e) {
                failed++;
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("{}: batch at offset {} ({} items) failed, skipping: {}",
                        operation, offset, batch.size(), cause.toString());
            }
            if ((i + 1) % 5 == 0 || i + 1 == futures.size()) {
                log.info("{}: {}/{} batches done", operation, i + 1, futures.size());
            }
        }
        return new BatchOutcome<>(List.copyOf(completed), batches.size(), failed);
    }

    static boolean isTransient(Throwable t) {
        return t instanceof ResourceAccessException
                || t instanceof HttpServerErrorException
                || t instanceof HttpClientErrorException.TooManyRequests
                || t instanceof UncheckedIOException
                || t instanceof IOException;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "gene-lookup-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
