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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Progressive render queue for one camera stream.
 * <p>
 * Producers call {@link #updateCamera} whenever the camera moves; a consumer polls {@link #getImage()} for the
 * freshest image. Neither call waits on rendering. A single background {@link RenderWorker} renders the latest pose
 * at increasing quality levels, abandoning a pose as soon as a newer one is seen between passes, and the
 * {@link ResultArbiter} guarantees that delivered images never go back in generation.
 * <p>
 * Usage:
 * <pre>
 * try (var queue = new ProgressiveRenderQueue("viewport", renderer, RenderQueueConfiguration.defaults())) {
 *     queue.start();
 *     queue.updateCamera(new double[] { 0, 0, 0.17 }, new double[] { 0, -152, 0 });
 *     queue.getImage().ifPresent(display::show);
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class ProgressiveRenderQueue implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressiveRenderQueue.class);

    private final String name;
    private final RenderQueueConfiguration configuration;
    private final PoseStore poseStore;
    private final ResultArbiter arbiter;
    private final RenderWorker worker;
    private final ExecutorService executor;

    private boolean started;
    private boolean closed;

    public ProgressiveRenderQueue(String name, PassRenderer renderer, RenderQueueConfiguration configuration) {
        this.name = Objects.requireNonNull(name, "name");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(renderer, "renderer");
        if (renderer.qualityLevels() < 1) {
            throw new IllegalArgumentException("Renderer must offer at least one quality level");
        }
        this.poseStore = new PoseStore(configuration.suppressDuplicatePoses());
        this.arbiter = new ResultArbiter();
        this.worker = new RenderWorker(name, poseStore, arbiter, renderer, configuration.maxQualityLevels());
        this.executor = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "render-worker-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Launch the render worker. Calling it again is a no-op.
     *
     * @throws IllegalStateException if the queue has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Render queue " + name + " is closed");
        }
        if (started) {
            return;
        }
        executor.execute(worker);
        started = true;
        log.info("Render queue {} started (maxQualityLevels={}, suppressDuplicatePoses={})", name,
                 configuration.maxQualityLevels(), configuration.suppressDuplicatePoses());
    }

    /**
     * Accept a new camera pose. Returns immediately.
     *
     * @param position 3 finite components
     * @param rotation 3 finite Euler angles, in degrees
     * @return the generation now current
     * @throws PoseValidationException if the pose is malformed; the generation is unchanged
     */
    public long updateCamera(double[] position, double[] rotation) {
        var pose = CameraPose.of(position, rotation);
        var generation = poseStore.update(pose);
        log.trace("Camera update on {}: generation {} {}", name, generation, pose);
        return generation;
    }

    /**
     * Take the most recent image rendered since the last retrieval.
     *
     * @return the image, or empty when nothing new has been accepted since the previous call
     */
    public Optional<DeliveredImage> getImage() {
        return arbiter.consume();
    }

    public long generation() {
        return poseStore.generation();
    }

    public long highWatermark() {
        return arbiter.highWatermark();
    }

    public String name() {
        return name;
    }

    public RenderQueueConfiguration configuration() {
        return configuration;
    }

    public RenderQueueStatistics statistics() {
        return new RenderQueueStatistics(poseStore.generation(), arbiter.highWatermark(), worker.passesRendered(),
                                         worker.passesFailed(), arbiter.acceptedCount(), arbiter.rejectedCount(),
                                         worker.generationsSuperseded(), arbiter.deliveredCount());
    }

    /**
     * Stop the render worker. A pass already inside the renderer is given {@code shutdownTimeout} to return.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        executor.shutdownNow();
        try {
            var timeout = configuration.shutdownTimeout();
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Render worker {} did not stop within {}; renderer still busy", name, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Render queue {} closed", name);
    }
}
