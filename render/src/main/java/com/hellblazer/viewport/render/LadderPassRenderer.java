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
package com.hellblazer.viewport.render;

import com.hellblazer.viewport.queue.CameraPose;
import com.hellblazer.viewport.queue.ImageBuffer;
import com.hellblazer.viewport.queue.PassRenderer;
import com.hellblazer.viewport.queue.RenderPassException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Pass renderer that refines by resolution: quality level <i>n</i> renders the pose with the <i>n</i>th camera of a
 * {@link QualityLadder}. The last rung is the converged image.
 *
 * @author hal.hildebrand
 */
public class LadderPassRenderer implements PassRenderer {
    private static final Logger log = LoggerFactory.getLogger(LadderPassRenderer.class);

    private final QualityLadder ladder;
    private final FrameSynthesizer synthesizer;

    public LadderPassRenderer(QualityLadder ladder, FrameSynthesizer synthesizer) {
        this.ladder = Objects.requireNonNull(ladder, "ladder");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
    }

    @Override
    public ImageBuffer renderPass(CameraPose pose, int qualityLevel) {
        if (qualityLevel < 0 || qualityLevel >= ladder.size()) {
            throw new RenderPassException(
                "Quality level " + qualityLevel + " outside ladder of " + ladder.size() + " levels");
        }
        var camera = ladder.profile(qualityLevel);
        var cameraToWorld = CameraTransforms.cameraToWorld(pose);

        var start = System.nanoTime();
        ImageBuffer image;
        try {
            image = synthesizer.renderAt(cameraToWorld, camera);
        } catch (RenderPassException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RenderPassException(
                String.format("Synthesis failed at quality %d (%dx%d)", qualityLevel, camera.width(),
                              camera.height()), e);
        }
        if (image == null) {
            throw new RenderPassException("Synthesizer returned no image at quality " + qualityLevel);
        }
        log.debug("Quality {} rendered at {}x{} in {} ms", qualityLevel, camera.width(), camera.height(),
                  (System.nanoTime() - start) / 1_000_000);
        return image;
    }

    @Override
    public int qualityLevels() {
        return ladder.size();
    }

    public QualityLadder ladder() {
        return ladder;
    }
}
