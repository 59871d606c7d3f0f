package com.wingman.core.model;

/**
 * One row of the {@code WindLayers} block: altitude (m), direction (deg), speed (m/s).
 */
public record WindLayer(double altitude, double direction, double speed) {
}
