package com.alchemist.controller;

import com.alchemist.handler.WorldSnapshotWriter;
import com.alchemist.service.CombatWorldService;
import com.alchemist.service.EffectRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only views of the running simulation for debug overlays.
 */
@RestController
@RequestMapping("/api/debug")
public class DebugController {
    private final WorldSnapshotWriter snapshots;
    private final CombatWorldService world;
    private final EffectRegistry registry;

    public DebugController(WorldSnapshotWriter snapshots, CombatWorldService world, EffectRegistry registry) {
        this.snapshots = snapshots;
        this.world = world;
        this.registry = registry;
    }

    @GetMapping("/enemies")
    public JsonNode enemies() {
        return snapshots.enemies(world.getNow());
    }

    @GetMapping("/projectiles")
    public JsonNode projectiles() {
        return snapshots.projectiles();
    }

    @GetMapping("/effects")
    public JsonNode effects() {
        return snapshots.effects(world.getNow());
    }

    @GetMapping("/feedback")
    public JsonNode feedback() {
        return snapshots.feedback(world.getNow());
    }

    @GetMapping("/history")
    public JsonNode history(@RequestParam(defaultValue = "20") int limit) {
        return snapshots.history(limit);
    }

    @GetMapping("/combos")
    public List<String> combos() {
        return registry.availableCombinations();
    }
}
