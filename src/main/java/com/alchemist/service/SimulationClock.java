package com.alchemist.service;

import org.springframework.stereotype.Service;

/**
 * Monotonic simulation time in milliseconds, advanced once per frame.
 * Every cooldown, duration and debounce window in the core is measured against it.
 */
@Service
public class SimulationClock {
    private long now = 0;
    private double remainder = 0;
    private long frame = 0;

    public synchronized long advance(double dtSeconds) {
        if (dtSeconds < 0) {
            throw new IllegalArgumentException("Time cannot run backwards: " + dtSeconds);
        }
        remainder += dtSeconds * 1000.0;
        long whole = (long) remainder;
        now += whole;
        remainder -= whole;
        frame++;
        return now;
    }

    public synchronized long now() { return now; }
    public synchronized long getFrame() { return frame; }
}
