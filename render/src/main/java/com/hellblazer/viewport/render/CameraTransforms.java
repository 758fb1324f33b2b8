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

import javax.vecmath.Matrix3d;
import javax.vecmath.Matrix4d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * Camera pose to scene transforms.
 * <p>
 * Poses arrive in the viewer's frame (Y up, camera looking down its local -Z). Scenes are Z up, so both the rotation
 * and the position are carried through the axis change {@code (x, y, z) -> (z, -x, y)}.
 */
public final class CameraTransforms {

    /** Viewer (Y up) to scene (Z up) axis change. */
    private static final Matrix3d VIEWER_TO_SCENE = new Matrix3d(
        0, 0, 1,
        -1, 0, 0,
        0, 1, 0
    );

    private CameraTransforms() {
        // Utility class - no instantiation
    }

    /**
     * Build the camera-to-world matrix for a pose.
     * <p>
     * The rotation is Euler XYZ in degrees, applied about the fixed x, then y, then z axes.
     */
    public static Matrix4d cameraToWorld(CameraPose pose) {
        var angles = pose.rotation();
        var position = pose.position();

        var rx = new Matrix3d();
        rx.rotX(Math.toRadians(angles[0]));
        var ry = new Matrix3d();
        ry.rotY(Math.toRadians(angles[1]));
        var rz = new Matrix3d();
        rz.rotZ(Math.toRadians(angles[2]));

        var viewerRotation = new Matrix3d(rz);
        viewerRotation.mul(ry);
        viewerRotation.mul(rx);

        var rotation = new Matrix3d();
        rotation.mul(VIEWER_TO_SCENE, viewerRotation);

        var translation = new Vector3d(position[0], position[1], position[2]);
        VIEWER_TO_SCENE.transform(translation);

        return new Matrix4d(rotation, translation, 1.0);
    }

    /**
     * Camera origin in scene coordinates.
     */
    public static Point3d cameraPosition(Matrix4d cameraToWorld) {
        return new Point3d(cameraToWorld.m03, cameraToWorld.m13, cameraToWorld.m23);
    }

    /**
     * Normalized scene-space direction of the ray through the centre of pixel (px, py); (0, 0) is the top left.
     */
    public static Vector3d rayDirection(Matrix4d cameraToWorld, CameraProfile camera, int px, int py) {
        var focal = camera.focalLength();
        var direction = new Vector3d(
            (px + 0.5 - camera.width() / 2.0) / focal,
            -(py + 0.5 - camera.height() / 2.0) / focal,
            -1.0
        );
        cameraToWorld.transform(direction);
        direction.normalize();
        return direction;
    }
}
