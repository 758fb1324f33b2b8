package com.hellblazer.viewport.portal.web.dto;

/**
 * Acknowledges a camera update with the pose generation it produced.
 */
public record CameraUpdateResponse(long generation) {
}
