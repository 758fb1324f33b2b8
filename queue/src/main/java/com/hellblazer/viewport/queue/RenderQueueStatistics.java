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

/**
 * Point-in-time counters for a {@link ProgressiveRenderQueue}.
 *
 * @param currentGeneration     latest accepted pose generation
 * @param highWatermark         highest generation delivered to a consumer, -1 before the first delivery
 * @param passesRendered        render passes that produced an image
 * @param passesFailed          render passes that failed in the renderer
 * @param publishesAccepted     results installed into the slot
 * @param publishesRejected     results discarded as stale or non-improving
 * @param generationsSuperseded generations abandoned because a newer pose arrived
 * @param imagesDelivered       non-empty results returned from {@code getImage}
 */
public record RenderQueueStatistics(long currentGeneration, long highWatermark, long passesRendered,
                                    long passesFailed, long publishesAccepted, long publishesRejected,
                                    long generationsSuperseded, long imagesDelivered) {
}
