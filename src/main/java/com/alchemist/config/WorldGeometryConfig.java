package com.alchemist.config;

import com.alchemist.util.GridPathfinder;
import com.alchemist.util.ObstacleMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorldGeometryConfig {

    @Bean
    public ObstacleMap obstacleMap(CombatProperties properties) {
        return new ObstacleMap(properties.getTileSize() * 2);
    }

    // Without this bean enemies fall back to direct pursuit
    @Bean
    @ConditionalOnProperty(prefix = "alchemist.combat.pathfinding", name = "enabled", havingValue = "true", matchIfMissing = true)
    public GridPathfinder gridPathfinder(ObstacleMap obstacles, CombatProperties properties) {
        CombatProperties.Pathfinding grid = properties.getPathfinding();
        GridPathfinder pathfinder = new GridPathfinder(obstacles, properties.getTileSize(),
                grid.getOriginX(), grid.getOriginY(), grid.getColumns(), grid.getRows());
        obstacles.addChangeListener(pathfinder::rebuild);
        return pathfinder;
    }
}
