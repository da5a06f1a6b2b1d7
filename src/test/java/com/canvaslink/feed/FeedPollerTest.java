package com.canvaslink.feed;

import com.canvaslink.API.CanvasService;
import com.canvaslink.imageOperator.CanvasImage;
import com.canvaslink.imageOperator.FakeImage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedPollerTest {

    @Mock
    private FrameSource frameSource;

    @Mock
    private CanvasService canvasService;

    @InjectMocks
    private FeedPoller feedPoller;

    @Test
    void testPoll_PushesGrabbedFrame() {
        CanvasImage frame = new FakeImage(640, 480);
        when(frameSource.grab()).thenReturn(Optional.of(frame));

        feedPoller.poll();

        verify(canvasService).pushFrame(frame);
    }

    @Test
    void testPoll_NoFrameNoPush() {
        when(frameSource.grab()).thenReturn(Optional.empty());

        feedPoller.poll();

        verify(canvasService, never()).pushFrame(any(CanvasImage.class));
    }

    @Test
    void testPoll_FailureDropsFrame() {
        when(frameSource.grab()).thenReturn(Optional.of(new FakeImage(640, 480)));
        when(canvasService.pushFrame(any(CanvasImage.class))).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> feedPoller.poll());
    }
}
