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
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single result slot and the delivery high watermark.
 * <p>
 * A candidate is installed only when it is not older than anything already delivered and is strictly fresher than
 * the slot: a newer generation, or the same generation at a higher quality level. Consumption hands the image out,
 * drops the slot's reference to it and raises the high watermark, so a consumer can never be shown an older
 * generation afterwards.
 * <p>
 * Both operations run under one short lock, which also makes {@link #publish} safe for concurrent publishers.
 *
 * @author hal.hildebrand
 */
public class ResultArbiter {
    private static final Logger log = LoggerFactory.getLogger(ResultArbiter.class);

    /** Generation sentinel meaning "nothing yet". */
    public static final long NONE = -1L;

    private final ReentrantLock lock = new ReentrantLock();

    // Slot
    private long slotGeneration = NONE;
    private int slotQuality = -1;
    private ImageBuffer slotImage;
    private boolean ready;

    private long highWatermark = NONE;

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();

    /**
     * Offer a completed pass.
     *
     * @return true if the candidate replaced the slot contents
     */
    public boolean publish(RenderResult candidate) {
        Objects.requireNonNull(candidate, "candidate");
        lock.lock();
        try {
            if (!isFresher(candidate)) {
                rejected.incrementAndGet();
                log.debug("Rejected generation {} quality {}: slot {}/{}, high watermark {}", candidate.generation(),
                          candidate.qualityLevel(), slotGeneration, slotQuality, highWatermark);
                return false;
            }
            slotGeneration = candidate.generation();
            slotQuality = candidate.qualityLevel();
            slotImage = candidate.image();
            ready = true;
            accepted.incrementAndGet();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the slot's image if one is ready. An empty result is the normal "nothing new" answer.
     */
    public Optional<DeliveredImage> consume() {
        lock.lock();
        try {
            if (!ready) {
                return Optional.empty();
            }
            var image = new DeliveredImage(slotGeneration, slotQuality, slotImage);
            ready = false;
            slotImage = null;
            highWatermark = Math.max(highWatermark, slotGeneration);
            delivered.incrementAndGet();
            return Optional.of(image);
        } finally {
            lock.unlock();
        }
    }

    private boolean isFresher(RenderResult candidate) {
        if (candidate.generation() < highWatermark) {
            return false;
        }
        if (candidate.generation() > slotGeneration) {
            return true;
        }
        return candidate.generation() == slotGeneration && candidate.qualityLevel() > slotQuality;
    }

    public long highWatermark() {
        lock.lock();
        try {
            return highWatermark;
        } finally {
            lock.unlock();
        }
    }

    public long slotGeneration() {
        lock.lock();
        try {
            return slotGeneration;
        } finally {
            lock.unlock();
        }
    }

    public int slotQualityLevel() {
        lock.lock();
        try {
            return slotQuality;
        } finally {
            lock.unlock();
        }
    }

    public boolean isReady() {
        lock.lock();
        try {
            return ready;
        } finally {
            lock.unlock();
        }
    }

    public long acceptedCount() {
        return accepted.get();
    }

    public long rejectedCount() {
        return rejected.get();
    }

    public long deliveredCount() {
        return delivered.get();
    }
}
