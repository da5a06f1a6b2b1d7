package com.canvaslink.matchAndTransform;

import com.canvaslink.exception.DetectorUnavailableException;
import com.canvaslink.imageOperator.CanvasImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds each match call by a deadline. Native detector code cannot be interrupted, so a timed out
 * call keeps running on the worker and its result is dropped.
 */
public class DeadlineCorrespondenceEngine implements CorrespondenceEngine, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DeadlineCorrespondenceEngine.class);

    private final CorrespondenceEngine delegate;
    private final ExecutorService executor;
    private final long timeoutMillis;

    public DeadlineCorrespondenceEngine(CorrespondenceEngine delegate, ExecutorService executor, long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be positive: " + timeoutMillis);
        }
        this.delegate = delegate;
        this.executor = executor;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public List<FeatureMatch> match(CanvasImage imageA, CanvasImage imageB) {
        Future<List<FeatureMatch>> future = executor.submit(() -> delegate.match(imageA, imageB));
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Matching exceeded {} ms, result discarded", timeoutMillis);
            throw DetectorUnavailableException.timedOut(timeoutMillis);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DetectorUnavailableException) {
                throw (DetectorUnavailableException) cause;
            }
            throw new DetectorUnavailableException("Matching failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new DetectorUnavailableException("Interrupted while matching", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
