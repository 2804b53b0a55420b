package com.alchemist.util;

import com.alchemist.model.Rect;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LineOfSightTest {

    private final ObstacleMap obstacles = new ObstacleMap(128);

    @Test
    void noObstaclesMeansAlwaysVisible() {
        assertThat(LineOfSight.hasLineOfSight(0, 0, 5000, 5000, obstacles, 16)).isTrue();
        assertThat(LineOfSight.hasLineOfSight(0, 0, 5000, 5000, null, 16)).isTrue();
    }

    @Test
    void wallOnTheSegmentBlocksSight() {
        obstacles.add(new Rect(100, -50, 20, 100));

        assertThat(LineOfSight.hasLineOfSight(0, 0, 300, 0, obstacles, 16)).isFalse();
    }

    @Test
    void wallBesideTheSegmentDoesNotBlock() {
        obstacles.add(new Rect(100, 100, 20, 20));

        assertThat(LineOfSight.hasLineOfSight(0, 0, 300, 0, obstacles, 16)).isTrue();
    }
}
