/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.viewport.queue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the progressive render queue with a live worker thread.
 * <p>
 * The {@link GatedRenderer} holds every pass until the test releases it, so camera updates can be placed before or
 * after a pass boundary deterministically.
 *
 * @author hal.hildebrand
 */
class ProgressiveRenderQueueTest {

    private static final double[] ORIGIN = { 0, 0, 0 };

    private ProgressiveRenderQueue queue;

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.close();
        }
    }

    private ProgressiveRenderQueue start(PassRenderer renderer) {
        return start(renderer, RenderQueueConfiguration.defaults().withShutdownTimeout(Duration.ofSeconds(2)));
    }

    private ProgressiveRenderQueue start(PassRenderer renderer, RenderQueueConfiguration configuration) {
        queue = new ProgressiveRenderQueue("test", renderer, configuration);
        queue.start();
        return queue;
    }

    private static double[] at(double x) {
        return new double[] { x, 0, 0 };
    }

    private static CameraPose pose(double x) {
        return CameraPose.of(at(x), ORIGIN);
    }

    /**
     * Poll until an image is delivered.
     */
    private DeliveredImage awaitImage() throws InterruptedException {
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            Optional<DeliveredImage> image = queue.getImage();
            if (image.isPresent()) {
                return image.get();
            }
            Thread.sleep(2);
        }
        throw new AssertionError("No image delivered within 5s");
    }

    @Test
    void testNoImageBeforeFirstUpdate() {
        start(new GatedRenderer(3));
        assertTrue(queue.getImage().isEmpty(), "Empty is the normal answer, not an error");
        assertEquals(0, queue.generation());
    }

    @Test
    @Timeout(20)
    void testProgressiveRefinementOfOneGeneration() throws Exception {
        var renderer = new GatedRenderer(3);
        start(renderer);

        assertEquals(1, queue.updateCamera(at(1), ORIGIN));
        assertEquals(new GatedRenderer.Pass(pose(1), 0), renderer.awaitStarted());
        renderer.release(1);

        var first = awaitImage();
        assertEquals(1, first.generation());
        assertEquals(0, first.qualityLevel());

        assertEquals(new GatedRenderer.Pass(pose(1), 1), renderer.awaitStarted());
        renderer.release(1);

        var second = awaitImage();
        assertEquals(1, second.generation());
        assertEquals(1, second.qualityLevel(), "Same generation, higher quality");
        assertEquals(1, second.image().rgb()[0]);
    }

    @Test
    @Timeout(20)
    void testConsumeOnce() throws Exception {
        var renderer = new GatedRenderer(2);
        start(renderer);

        queue.updateCamera(at(1), ORIGIN);
        renderer.awaitStarted();
        renderer.release(1);
        assertNotNull(awaitImage());

        // Level 1 is now held inside the renderer, so nothing new can be published
        renderer.awaitStarted();
        assertTrue(queue.getImage().isEmpty());
    }

    @Test
    @Timeout(20)
    void testUpdateDuringPassSupersedesGeneration() throws Exception {
        var renderer = new GatedRenderer(3);
        start(renderer);

        queue.updateCamera(at(1), ORIGIN);
        renderer.awaitStarted();
        renderer.release(1);
        assertEquals(0, awaitImage().qualityLevel());

        assertEquals(new GatedRenderer.Pass(pose(1), 1), renderer.awaitStarted());
        assertEquals(2, queue.updateCamera(at(2), ORIGIN));
        renderer.release(1);

        // The superseded pass was still offered; the next pass belongs to generation 2
        assertEquals(new GatedRenderer.Pass(pose(2), 0), renderer.awaitStarted());
        var offered = queue.getImage().orElseThrow();
        assertEquals(1, offered.generation());
        assertEquals(1, offered.qualityLevel());

        renderer.release(1);
        var fresh = awaitImage();
        assertEquals(2, fresh.generation());

        renderer.open();
        var later = awaitImage();
        assertEquals(2, later.generation(), "Never reverts to generation 1");
        assertTrue(renderer.history().stream().noneMatch(p -> p.pose().equals(pose(1)) && p.qualityLevel() == 2),
                   "No generation 1 pass after the update was observed");
    }

    @Test
    @Timeout(20)
    void testRapidUpdatesCollapseToLatestPose() throws Exception {
        var renderer = new GatedRenderer(2);
        start(renderer);

        queue.updateCamera(at(1), ORIGIN);
        renderer.awaitStarted();
        for (int x = 2; x <= 6; x++) {
            queue.updateCamera(at(x), ORIGIN);
        }
        assertEquals(6, queue.generation());
        renderer.release(1);

        assertEquals(new GatedRenderer.Pass(pose(6), 0), renderer.awaitStarted());
        renderer.open();
        while (renderer.pollStarted(200) != null) {
            // drain remaining passes for the final pose
        }

        var rendered = renderer.history().stream().map(p -> p.pose().position()[0]).collect(Collectors.toSet());
        assertEquals(java.util.Set.of(1.0, 6.0), rendered, "Intermediate poses are never rendered");
        assertEquals(6, awaitImage().generation());
    }

    @Test
    @Timeout(20)
    void testInvalidUpdateLeavesGenerationUnchanged() throws Exception {
        var renderer = new GatedRenderer(1);
        start(renderer);
        queue.updateCamera(at(1), ORIGIN);

        assertThrows(PoseValidationException.class,
                     () -> queue.updateCamera(at(2), new double[] { 0, Double.NaN, 0 }));
        assertEquals(1, queue.generation());

        renderer.open();
        var image = awaitImage();
        assertEquals(1, image.generation());
        assertTrue(renderer.history().stream().allMatch(p -> p.pose().equals(pose(1))));
    }

    @Test
    @Timeout(20)
    void testWorkerSurvivesRenderFailure() throws Exception {
        var renderer = new GatedRenderer(3);
        renderer.failOnce(0);
        start(renderer);

        queue.updateCamera(at(1), ORIGIN);
        assertEquals(0, renderer.awaitStarted().qualityLevel());
        renderer.release(1);

        assertEquals(1, renderer.awaitStarted().qualityLevel(), "Worker moves on to the next quality level");
        renderer.release(1);
        var image = awaitImage();
        assertEquals(1, image.qualityLevel());

        var stats = queue.statistics();
        assertEquals(1, stats.passesFailed());
        assertEquals(1, stats.passesRendered());
    }

    @Test
    @Timeout(20)
    void testWorkerSurvivesRendererReturningNoImage() throws Exception {
        var calls = new AtomicInteger();
        start(new PassRenderer() {
            @Override
            public ImageBuffer renderPass(CameraPose pose, int qualityLevel) {
                calls.incrementAndGet();
                if (pose.position()[0] == 1) {
                    return null;
                }
                return new ImageBuffer(1, 1, new byte[] { (byte) pose.position()[0], 0, 0 });
            }

            @Override
            public int qualityLevels() {
                return 1;
            }
        });

        queue.updateCamera(at(1), ORIGIN);
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (queue.statistics().passesFailed() < 1 && System.nanoTime() < deadline) {
            Thread.sleep(1);
        }
        assertEquals(1, queue.statistics().passesFailed());
        assertTrue(queue.getImage().isEmpty(), "A pass without an image publishes nothing");

        queue.updateCamera(at(2), ORIGIN);
        var image = awaitImage();
        assertEquals(2, image.generation());
        assertEquals(2, image.image().rgb()[0]);

        var stats = queue.statistics();
        assertEquals(2, calls.get());
        assertEquals(1, stats.passesRendered(), "The failed pass is not counted as rendered");
        assertEquals(1, stats.passesFailed());
    }

    @Test
    @Timeout(20)
    void testWorkerIdlesAfterConvergence() throws Exception {
        var renderer = new GatedRenderer(2);
        start(renderer);
        renderer.open();

        queue.updateCamera(at(1), ORIGIN);
        renderer.awaitStarted();
        renderer.awaitStarted();
        assertNull(renderer.pollStarted(200), "Ladder exhausted, worker waits for a new pose");

        queue.updateCamera(at(2), ORIGIN);
        assertEquals(new GatedRenderer.Pass(pose(2), 0), renderer.awaitStarted());
    }

    @Test
    @Timeout(20)
    void testDuplicatePoseSuppression() throws Exception {
        var renderer = new GatedRenderer(1);
        start(renderer, RenderQueueConfiguration.defaults()
                                                .withSuppressDuplicatePoses(true)
                                                .withShutdownTimeout(Duration.ofSeconds(2)));
        renderer.open();

        assertEquals(1, queue.updateCamera(at(1), ORIGIN));
        renderer.awaitStarted();
        assertEquals(1, queue.updateCamera(at(1), ORIGIN));
        assertNull(renderer.pollStarted(200), "A repeated pose does not trigger another render");
    }

    @Test
    @Timeout(30)
    void testMonotonicDeliveryUnderContinuousUpdates() throws Exception {
        PassRenderer renderer = new PassRenderer() {
            @Override
            public ImageBuffer renderPass(CameraPose pose, int qualityLevel) {
                try {
                    Thread.sleep(1 + qualityLevel);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RenderPassException("interrupted", e);
                }
                return ImageBuffer.blank(1, 1);
            }

            @Override
            public int qualityLevels() {
                return 4;
            }
        };
        start(renderer);

        var running = new AtomicBoolean(true);
        var delivered = new ArrayList<DeliveredImage>();
        var executor = Executors.newFixedThreadPool(3);
        for (int p = 0; p < 2; p++) {
            executor.submit(() -> {
                var x = 0.0;
                while (running.get()) {
                    queue.updateCamera(at(x++), ORIGIN);
                    Thread.sleep(1);
                }
                return null;
            });
        }
        var consumer = executor.submit(() -> {
            var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (System.nanoTime() < deadline) {
                queue.getImage().ifPresent(delivered::add);
            }
            running.set(false);
        });
        consumer.get(10, TimeUnit.SECONDS);
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertFalse(delivered.isEmpty());
        for (int i = 1; i < delivered.size(); i++) {
            var previous = delivered.get(i - 1);
            var current = delivered.get(i);
            assertTrue(current.generation() >= previous.generation(), "Generation went backwards");
            if (current.generation() == previous.generation()) {
                assertTrue(current.qualityLevel() > previous.qualityLevel(), "Quality went backwards");
            }
        }
        assertTrue(queue.highWatermark() >= delivered.get(delivered.size() - 1).generation());
    }

    @Test
    @Timeout(20)
    void testCloseStopsWorkerBlockedInRenderer() throws Exception {
        var renderer = new GatedRenderer(2);
        start(renderer);
        queue.updateCamera(at(1), ORIGIN);
        renderer.awaitStarted();

        queue.close();
        assertThrows(IllegalStateException.class, queue::start);
        assertEquals(1, queue.statistics().passesFailed(), "Interrupted pass is reported as failed");
    }
}
