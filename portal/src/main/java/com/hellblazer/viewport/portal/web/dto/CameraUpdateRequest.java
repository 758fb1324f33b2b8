package com.hellblazer.viewport.portal.web.dto;

/**
 * Camera pose update message.
 *
 * @param position camera position, 3 components
 * @param rotation Euler rotation in degrees, 3 components
 */
public record CameraUpdateRequest(double[] position, double[] rotation) {
}
