package com.alchemist.util;

import com.alchemist.model.Waypoint;

import java.util.List;

/**
 * Supplies waypoint routes around static obstacles.
 */
public interface Pathfinder {

    /**
     * @return ordered waypoints from start towards goal; empty when no route was found
     *         within {@code maxSearchNodes} expanded nodes
     */
    List<Waypoint> findPath(double startX, double startY, double goalX, double goalY, int maxSearchNodes);
}
