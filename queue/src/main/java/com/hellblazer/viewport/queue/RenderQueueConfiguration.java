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

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a {@link ProgressiveRenderQueue}.
 *
 * @param maxQualityLevels       upper bound on passes per generation; the renderer's own ladder may be shorter
 * @param suppressDuplicatePoses when true, an update repeating the latest pose is ignored and does not start a
 *                               new generation
 * @param shutdownTimeout        how long {@code close()} waits for an in-flight pass to return
 */
public record RenderQueueConfiguration(int maxQualityLevels, boolean suppressDuplicatePoses,
                                       Duration shutdownTimeout) {

    public RenderQueueConfiguration {
        if (maxQualityLevels < 1) {
            throw new IllegalArgumentException("maxQualityLevels must be at least 1: " + maxQualityLevels);
        }
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        if (shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
            throw new IllegalArgumentException("shutdownTimeout must be positive: " + shutdownTimeout);
        }
    }

    public static RenderQueueConfiguration defaults() {
        return new RenderQueueConfiguration(Integer.MAX_VALUE, false, Duration.ofSeconds(5));
    }

    public RenderQueueConfiguration withMaxQualityLevels(int maxQualityLevels) {
        return new RenderQueueConfiguration(maxQualityLevels, suppressDuplicatePoses, shutdownTimeout);
    }

    public RenderQueueConfiguration withSuppressDuplicatePoses(boolean suppressDuplicatePoses) {
        return new RenderQueueConfiguration(maxQualityLevels, suppressDuplicatePoses, shutdownTimeout);
    }

    public RenderQueueConfiguration withShutdownTimeout(Duration shutdownTimeout) {
        return new RenderQueueConfiguration(maxQualityLevels, suppressDuplicatePoses, shutdownTimeout);
    }
}
