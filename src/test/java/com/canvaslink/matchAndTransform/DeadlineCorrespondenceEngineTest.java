package com.canvaslink.matchAndTransform;

import com.canvaslink.exception.DetectorUnavailableException;
import com.canvaslink.imageOperator.CanvasImage;
import com.canvaslink.imageOperator.FakeImage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DeadlineCorrespondenceEngineTest {

    private final CanvasImage a = new FakeImage(10, 10);
    private final CanvasImage b = new FakeImage(20, 20);
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testMatch_ReturnsDelegateResultWithinDeadline() {
        CorrespondenceEngine delegate = mock(CorrespondenceEngine.class);
        List<FeatureMatch> matches = List.of(new FeatureMatch(new ImagePoint(1, 2), new ImagePoint(3, 4), 0.5));
        when(delegate.match(a, b)).thenReturn(matches);

        DeadlineCorrespondenceEngine engine = new DeadlineCorrespondenceEngine(delegate, executor, 5000);

        assertEquals(matches, engine.match(a, b));
    }

    @Test
    void testMatch_SlowDelegateTimesOut() {
        CountDownLatch release = new CountDownLatch(1);
        CorrespondenceEngine slow = (x, y) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        };
        DeadlineCorrespondenceEngine engine = new DeadlineCorrespondenceEngine(slow, executor, 50);

        DetectorUnavailableException e = assertThrows(DetectorUnavailableException.class, () -> engine.match(a, b));

        assertTrue(e.isTimeout());
        release.countDown();
    }

    @Test
    void testMatch_DelegateFailureIsPassedThrough() {
        CorrespondenceEngine delegate = mock(CorrespondenceEngine.class);
        DetectorUnavailableException failure = new DetectorUnavailableException("no descriptors engine");
        when(delegate.match(any(), any())).thenThrow(failure);

        DeadlineCorrespondenceEngine engine = new DeadlineCorrespondenceEngine(delegate, executor, 5000);

        DetectorUnavailableException e = assertThrows(DetectorUnavailableException.class, () -> engine.match(a, b));
        assertSame(failure, e);
        assertFalse(e.isTimeout());
    }

    @Test
    void testConstructor_RejectsNonPositiveTimeout() {
        CorrespondenceEngine delegate = mock(CorrespondenceEngine.class);

        assertThrows(IllegalArgumentException.class, () -> new DeadlineCorrespondenceEngine(delegate, executor, 0));
    }
}
