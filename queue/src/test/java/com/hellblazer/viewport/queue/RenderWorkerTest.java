package com.hellblazer.viewport.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Pass-by-pass behavior of {@link RenderWorker#renderGeneration}, driven synchronously with a mocked renderer.
 */
class RenderWorkerTest {

    private static final CameraPose P1 = CameraPose.of(new double[] { 1, 0, 0 }, new double[] { 0, 0, 0 });
    private static final CameraPose P2 = CameraPose.of(new double[] { 2, 0, 0 }, new double[] { 0, 0, 0 });

    private PoseStore poseStore;
    private ResultArbiter arbiter;
    private PassRenderer renderer;

    @BeforeEach
    void setUp() {
        poseStore = new PoseStore();
        arbiter = new ResultArbiter();
        renderer = mock(PassRenderer.class);
        when(renderer.qualityLevels()).thenReturn(3);
        when(renderer.isConverged(anyInt())).thenCallRealMethod();
        when(renderer.renderPass(any(), anyInt())).thenAnswer(
            invocation -> new ImageBuffer(1, 1, new byte[] { (byte) (int) invocation.getArgument(1), 0, 0 }));
    }

    private RenderWorker worker(int maxQualityLevels) {
        return new RenderWorker("test", poseStore, arbiter, renderer, maxQualityLevels);
    }

    @Test
    void testRendersEveryLevelInOrder() {
        poseStore.update(P1);
        var worker = worker(Integer.MAX_VALUE);

        worker.renderGeneration(poseStore.snapshot());

        var order = inOrder(renderer);
        order.verify(renderer).renderPass(P1, 0);
        order.verify(renderer).renderPass(P1, 1);
        order.verify(renderer).renderPass(P1, 2);
        assertEquals(3, worker.passesRendered());
        assertEquals(3, arbiter.acceptedCount());
        assertEquals(2, arbiter.slotQualityLevel());
    }

    @Test
    void testStopsAtConvergenceSignal() {
        when(renderer.isConverged(1)).thenReturn(true);
        poseStore.update(P1);

        worker(Integer.MAX_VALUE).renderGeneration(poseStore.snapshot());

        verify(renderer, never()).renderPass(any(), eq(2));
        assertEquals(1, arbiter.slotQualityLevel());
    }

    @Test
    void testConfiguredMaximumCapsLadder() {
        poseStore.update(P1);

        worker(2).renderGeneration(poseStore.snapshot());

        verify(renderer, times(2)).renderPass(any(), anyInt());
        assertEquals(1, arbiter.slotQualityLevel());
    }

    @Test
    void testFailedPassIsSkipped() {
        when(renderer.renderPass(P1, 1)).thenThrow(new RenderPassException("out of memory"));
        poseStore.update(P1);
        var worker = worker(Integer.MAX_VALUE);

        worker.renderGeneration(poseStore.snapshot());

        assertEquals(1, worker.passesFailed());
        assertEquals(2, worker.passesRendered());
        assertEquals(2, arbiter.acceptedCount(), "Levels 0 and 2 still published");
        assertEquals(2, arbiter.slotQualityLevel());
    }

    @Test
    void testUnexpectedRendererExceptionIsContained() {
        when(renderer.renderPass(P1, 0)).thenThrow(new IllegalStateException("renderer bug"));
        poseStore.update(P1);
        var worker = worker(Integer.MAX_VALUE);

        assertDoesNotThrow(() -> worker.renderGeneration(poseStore.snapshot()));
        assertEquals(1, worker.passesFailed());
        assertEquals(2, arbiter.slotQualityLevel());
    }

    @Test
    void testSupersededPassIsOfferedThenAbandoned() {
        poseStore.update(P1);
        var snapshot = poseStore.snapshot();
        when(renderer.renderPass(P1, 1)).thenAnswer(invocation -> {
            poseStore.update(P2);
            return new ImageBuffer(1, 1, new byte[] { 1, 0, 0 });
        });
        var worker = worker(Integer.MAX_VALUE);

        worker.renderGeneration(snapshot);

        verify(renderer, never()).renderPass(P1, 2);
        assertEquals(1, arbiter.slotGeneration());
        assertEquals(1, arbiter.slotQualityLevel(), "The completed pass is still offered to the arbiter");
        assertEquals(1, worker.generationsSuperseded());
    }

    @Test
    void testSupersededDuringFailedPass() {
        poseStore.update(P1);
        var snapshot = poseStore.snapshot();
        when(renderer.renderPass(P1, 0)).thenAnswer(invocation -> {
            poseStore.update(P2);
            throw new RenderPassException("lost device");
        });
        var worker = worker(Integer.MAX_VALUE);

        worker.renderGeneration(snapshot);

        verify(renderer, times(1)).renderPass(any(), anyInt());
        assertFalse(arbiter.isReady(), "Superseded before any pass was accepted, nothing visible");
        assertEquals(1, worker.generationsSuperseded());
    }

    @Test
    void testStaleGenerationIsRejectedAndAbandoned() {
        poseStore.update(P1);
        poseStore.update(P2);
        arbiter.publish(new RenderResult(2, 0, ImageBuffer.blank(1, 1)));
        arbiter.consume();

        // A stale generation 1 snapshot can no longer be published
        var stale = new PoseSnapshot(1, P1);
        worker(Integer.MAX_VALUE).renderGeneration(stale);

        verify(renderer, times(1)).renderPass(any(), anyInt());
        assertEquals(1, arbiter.rejectedCount());
    }

    @Test
    void testMissingImageCountsAsFailedPass() {
        when(renderer.renderPass(P1, 0)).thenReturn(null);
        poseStore.update(P1);
        var worker = worker(Integer.MAX_VALUE);

        assertDoesNotThrow(() -> worker.renderGeneration(poseStore.snapshot()));

        assertEquals(1, worker.passesFailed());
        assertEquals(2, worker.passesRendered(), "Only passes with an image count as rendered");
        assertEquals(2, arbiter.acceptedCount());
        assertEquals(2, arbiter.slotQualityLevel());
    }

    @Test
    void testMissingImageWhenSupersededAbandonsGeneration() {
        poseStore.update(P1);
        var snapshot = poseStore.snapshot();
        when(renderer.renderPass(P1, 0)).thenAnswer(invocation -> {
            poseStore.update(P2);
            return null;
        });
        var worker = worker(Integer.MAX_VALUE);

        worker.renderGeneration(snapshot);

        verify(renderer, times(1)).renderPass(any(), anyInt());
        assertEquals(1, worker.passesFailed());
        assertEquals(1, worker.generationsSuperseded());
        assertFalse(arbiter.isReady());
    }

    @Test
    @Timeout(20)
    void testWorkerSurvivesRendererFaultOutsidePass() throws Exception {
        when(renderer.isConverged(0)).thenThrow(new IllegalStateException("renderer bug")).thenCallRealMethod();
        var worker = worker(1);
        var executor = Executors.newSingleThreadExecutor();
        try {
            executor.execute(worker);
            poseStore.update(P1);
            verify(renderer, timeout(5_000)).isConverged(0);

            poseStore.update(P2);
            verify(renderer, timeout(5_000)).renderPass(P2, 0);
            verify(renderer, timeout(5_000).times(2)).isConverged(0);
            assertEquals(2, arbiter.slotGeneration(), "Generation 2 is still rendered and published");
        } finally {
            executor.shutdownNow();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }
    }
}
