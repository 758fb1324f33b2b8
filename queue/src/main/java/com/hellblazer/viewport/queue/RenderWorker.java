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

import java.util.concurrent.atomic.AtomicLong;

/**
 * The single background task that turns the latest pose into progressively refined images.
 * <p>
 * For each generation the worker renders quality levels in increasing order:
 * <ol>
 *   <li>Take the latest (generation, pose) snapshot, parking until one newer than the last handled generation
 *   exists</li>
 *   <li>Render the next quality level. The call is opaque and is never interrupted</li>
 *   <li>Re-read the pose generation; a newer one supersedes the current generation</li>
 *   <li>Offer the result to the arbiter, even when superseded</li>
 *   <li>Continue only if the arbiter accepted and nothing newer arrived; stop once the renderer reports
 *   convergence or the ladder is exhausted</li>
 * </ol>
 * A failed pass is logged and counted, publishes nothing, and never stops the worker.
 *
 * @author hal.hildebrand
 */
public class RenderWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(RenderWorker.class);

    private final String name;
    private final PoseStore poseStore;
    private final ResultArbiter arbiter;
    private final PassRenderer renderer;
    private final int maxQualityLevels;

    private final AtomicLong passesRendered = new AtomicLong();
    private final AtomicLong passesFailed = new AtomicLong();
    private final AtomicLong generationsSuperseded = new AtomicLong();

    public RenderWorker(String name, PoseStore poseStore, ResultArbiter arbiter, PassRenderer renderer,
                        int maxQualityLevels) {
        this.name = name;
        this.poseStore = poseStore;
        this.arbiter = arbiter;
        this.renderer = renderer;
        this.maxQualityLevels = maxQualityLevels;
    }

    @Override
    public void run() {
        log.info("Render worker {} started", name);
        var handled = 0L;
        try {
            while (!Thread.currentThread().isInterrupted()) {
                var snapshot = poseStore.awaitNewer(handled);
                try {
                    renderGeneration(snapshot);
                } catch (RuntimeException e) {
                    log.error("Render worker {} abandoned generation {}", name, snapshot.generation(), e);
                }
                handled = snapshot.generation();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Render worker {} stopped after {} passes ({} failed)", name, passesRendered.get(),
                 passesFailed.get());
    }

    /**
     * Render one generation until it converges, is superseded, or stops improving.
     */
    void renderGeneration(PoseSnapshot snapshot) {
        var generation = snapshot.generation();
        var levels = Math.min(renderer.qualityLevels(), maxQualityLevels);
        log.debug("Rendering generation {} over {} quality levels", generation, levels);

        for (int level = 0; level < levels && !Thread.currentThread().isInterrupted(); level++) {
            var result = renderPass(snapshot, level);
            if (result == null) {
                if (isSuperseded(generation)) {
                    return;
                }
                continue;
            }
            passesRendered.incrementAndGet();

            var superseded = poseStore.generation() > generation;
            var accepted = arbiter.publish(result);
            log.debug("Generation {} quality {} rendered: {}", generation, level, accepted ? "accepted" : "rejected");

            if (superseded) {
                markSuperseded(generation, level);
                return;
            }
            if (!accepted) {
                return;
            }
            if (renderer.isConverged(level)) {
                log.debug("Generation {} converged at quality {}", generation, level);
                return;
            }
        }
    }

    /**
     * Run one pass. A thrown exception or a missing image counts as a failed pass.
     *
     * @return the result, or null if the pass failed
     */
    private RenderResult renderPass(PoseSnapshot snapshot, int level) {
        var generation = snapshot.generation();
        try {
            var image = renderer.renderPass(snapshot.pose(), level);
            if (image == null) {
                throw new RenderPassException("Renderer returned no image");
            }
            return new RenderResult(generation, level, image);
        } catch (RuntimeException e) {
            passesFailed.incrementAndGet();
            log.warn("Render pass failed for generation {} at quality {}: {}", generation, level, e.getMessage(), e);
            return null;
        }
    }

    private boolean isSuperseded(long generation) {
        if (poseStore.generation() > generation) {
            markSuperseded(generation, -1);
            return true;
        }
        return false;
    }

    private void markSuperseded(long generation, int level) {
        generationsSuperseded.incrementAndGet();
        log.debug("Generation {} superseded after quality {}", generation, level);
    }

    public long passesRendered() {
        return passesRendered.get();
    }

    public long passesFailed() {
        return passesFailed.get();
    }

    public long generationsSuperseded() {
        return generationsSuperseded.get();
    }
}
