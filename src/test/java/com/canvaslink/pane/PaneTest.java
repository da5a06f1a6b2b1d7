package com.canvaslink.pane;

import com.canvaslink.exception.InvalidGeometryException;
import com.canvaslink.imageOperator.CanvasImage;
import com.canvaslink.imageOperator.FakeImage;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PaneTest {

    @Test
    void testAssign_StoresFittedImageAndGeometry() {
        Pane pane = new Pane("capture-0", new PaneRect(800, 0, 1200, 300));
        CanvasImage capture = new FakeImage(1280, 720);

        FitGeometry fit = pane.assign(capture, FakeImage.scaler());

        assertTrue(pane.hasImage());
        assertSame(fit, pane.getFit());
        assertSame(capture, pane.getSourceImage());
        assertEquals(400, pane.getImage().getWidth());
        assertEquals(225, pane.getImage().getHeight());
        assertEquals(400.0 / 1280, pane.displayScaleX(), 1e-12);
    }

    @Test
    void testAssign_ReplacesPreviousImageWholesale() {
        Pane pane = new Pane("capture-0", new PaneRect(0, 0, 100, 100));
        pane.assign(new FakeImage(200, 100), FakeImage.scaler());

        CanvasImage second = new FakeImage(100, 200);
        pane.assign(second, FakeImage.scaler());

        assertSame(second, pane.getSourceImage());
        assertEquals(50, pane.getImage().getWidth());
        assertEquals(100, pane.getImage().getHeight());
        assertEquals(25.0, pane.getFit().getOffsetX(), 1e-9);
    }

    @Test
    void testAssign_InvalidImageLeavesPaneUntouched() {
        Pane pane = new Pane("capture-0", new PaneRect(0, 0, 100, 100));
        CanvasImage first = new FakeImage(100, 100);
        pane.assign(first, FakeImage.scaler());
        FitGeometry before = pane.getFit();

        assertThrows(InvalidGeometryException.class, () -> pane.assign(new FakeImage(0, 10), FakeImage.scaler()));

        assertSame(first, pane.getSourceImage());
        assertSame(before, pane.getFit());
    }

    @Test
    void testEmptyPane_HasNoFit() {
        Pane pane = new Pane("feed", new PaneRect(0, 0, 10, 10));

        assertFalse(pane.hasImage());
        assertNull(pane.getFit());
        assertEquals(1.0, pane.displayScaleX());
    }

    @Test
    void testRasterSize_NeverBelowOnePixel() {
        Pane pane = new Pane("capture-0", new PaneRect(0, 0, 10, 10));

        pane.assign(new FakeImage(5000, 1), FakeImage.scaler());

        assertEquals(10, pane.getImage().getWidth());
        assertEquals(1, pane.getImage().getHeight());
    }

    @Test
    void testContent_ReaderNeverSeesImageFromOtherAssignment() throws InterruptedException {
        Pane pane = new Pane("feed", new PaneRect(0, 0, 1280, 1080));
        CanvasImage wide = new FakeImage(1280, 720);
        CanvasImage narrow = new FakeImage(300, 720);
        AtomicBoolean done = new AtomicBoolean(false);
        AtomicInteger mismatches = new AtomicInteger();

        Thread writer = new Thread(() -> {
            for (int i = 0; i < 20000; i++) {
                pane.assign(i % 2 == 0 ? wide : narrow, FakeImage.scaler());
            }
            done.set(true);
        });
        writer.start();
        while (!done.get()) {
            Pane.Content content = pane.content();
            if (content == null) continue;
            if (content.getImage().getWidth() != content.getFit().rasterWidth()
                    || content.getSourceImage().getWidth() == 1280 != (content.getFit().getScaledWidth() == 1280)) {
                mismatches.incrementAndGet();
            }
        }
        writer.join();

        assertEquals(0, mismatches.get());
    }
}
