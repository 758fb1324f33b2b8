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

import com.hellblazer.viewport.queue.ImageBuffer;

import javax.vecmath.Matrix4d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;

/**
 * CPU reference synthesizer: primary rays against a handful of spheres standing on a checkered ground plane
 * (z = 0), Lambert shading from one directional light, and a sky gradient for misses.
 * <p>
 * Stands in for a learned scene renderer so the viewport can run end to end without one. Cost grows linearly with
 * the camera's pixel count, which gives the quality ladder its progressive character.
 *
 * @author hal.hildebrand
 */
public class SphereFieldSynthesizer implements FrameSynthesizer {

    /**
     * @param albedo RGB reflectance, each component in [0, 1]
     */
    public record Sphere(Point3d center, double radius, Vector3d albedo) {
        public Sphere {
            if (!(radius > 0)) {
                throw new IllegalArgumentException("Sphere radius must be positive: " + radius);
            }
        }
    }

    private static final double EPSILON = 1e-6;
    private static final double AMBIENT = 0.15;
    private static final Vector3d HORIZON = new Vector3d(0.85, 0.9, 1.0);
    private static final Vector3d ZENITH = new Vector3d(0.3, 0.5, 0.9);

    private final List<Sphere> spheres;
    private final Vector3d toLight;

    public SphereFieldSynthesizer() {
        this(defaultScene());
    }

    public SphereFieldSynthesizer(List<Sphere> spheres) {
        this.spheres = List.copyOf(spheres);
        this.toLight = new Vector3d(0.4, -0.3, 0.85);
        toLight.normalize();
    }

    /**
     * Six spheres in a ring of radius 4 around the scene origin.
     */
    public static List<Sphere> defaultScene() {
        var scene = new ArrayList<Sphere>();
        for (int i = 0; i < 6; i++) {
            var angle = i * Math.PI / 3.0;
            var hue = i / 6.0;
            scene.add(new Sphere(new Point3d(4 * Math.cos(angle), 4 * Math.sin(angle), 0.8), 0.8,
                                 new Vector3d(0.5 + 0.5 * Math.cos(2 * Math.PI * hue),
                                              0.5 + 0.5 * Math.cos(2 * Math.PI * (hue + 1.0 / 3)),
                                              0.5 + 0.5 * Math.cos(2 * Math.PI * (hue + 2.0 / 3)))));
        }
        return scene;
    }

    @Override
    public ImageBuffer renderAt(Matrix4d cameraToWorld, CameraProfile camera) {
        var origin = CameraTransforms.cameraPosition(cameraToWorld);
        var rgb = new byte[camera.width() * camera.height() * 3];
        var i = 0;
        for (int y = 0; y < camera.height(); y++) {
            for (int x = 0; x < camera.width(); x++) {
                var color = shade(origin, CameraTransforms.rayDirection(cameraToWorld, camera, x, y));
                rgb[i++] = toByte(color.x);
                rgb[i++] = toByte(color.y);
                rgb[i++] = toByte(color.z);
            }
        }
        return new ImageBuffer(camera.width(), camera.height(), rgb);
    }

    Vector3d shade(Point3d origin, Vector3d direction) {
        var nearest = Double.POSITIVE_INFINITY;
        Sphere hitSphere = null;
        for (var sphere : spheres) {
            var t = intersect(sphere, origin, direction);
            if (t < nearest) {
                nearest = t;
                hitSphere = sphere;
            }
        }

        var groundT = direction.z < -EPSILON && origin.z > 0 ? -origin.z / direction.z : Double.POSITIVE_INFINITY;

        if (hitSphere != null && nearest <= groundT) {
            var normal = new Vector3d(origin.x + nearest * direction.x - hitSphere.center().x,
                                      origin.y + nearest * direction.y - hitSphere.center().y,
                                      origin.z + nearest * direction.z - hitSphere.center().z);
            normal.normalize();
            return lit(hitSphere.albedo(), normal.dot(toLight));
        }
        if (groundT < Double.POSITIVE_INFINITY) {
            var gx = origin.x + groundT * direction.x;
            var gy = origin.y + groundT * direction.y;
            var checker = ((int) Math.floor(gx) + (int) Math.floor(gy)) & 1;
            var gray = checker == 0 ? 0.35 : 0.6;
            return lit(new Vector3d(gray, gray, gray), toLight.z);
        }

        var blend = Math.max(0.0, Math.min(1.0, direction.z));
        var sky = new Vector3d();
        sky.interpolate(HORIZON, ZENITH, blend);
        return sky;
    }

    private static double intersect(Sphere sphere, Point3d origin, Vector3d direction) {
        var ox = origin.x - sphere.center().x;
        var oy = origin.y - sphere.center().y;
        var oz = origin.z - sphere.center().z;
        var b = ox * direction.x + oy * direction.y + oz * direction.z;
        var c = ox * ox + oy * oy + oz * oz - sphere.radius() * sphere.radius();
        var discriminant = b * b - c;
        if (discriminant < 0) {
            return Double.POSITIVE_INFINITY;
        }
        var root = Math.sqrt(discriminant);
        var t = -b - root;
        if (t > EPSILON) {
            return t;
        }
        t = -b + root;
        return t > EPSILON ? t : Double.POSITIVE_INFINITY;
    }

    private static Vector3d lit(Vector3d albedo, double cosine) {
        var intensity = AMBIENT + (1 - AMBIENT) * Math.max(0.0, cosine);
        var color = new Vector3d(albedo);
        color.scale(intensity);
        return color;
    }

    private static byte toByte(double channel) {
        return (byte) Math.round(Math.max(0.0, Math.min(1.0, channel)) * 255);
    }
}
