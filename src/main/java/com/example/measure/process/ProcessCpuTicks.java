package com.example.measure.process;

/**
 * CPU time a process has consumed since it started, in clock ticks.
 *
 * @param system ticks in kernel mode
 * @param user   ticks in user mode
 */
public record ProcessCpuTicks(long system, long user) {

    public long total() {
        return system + user;
    }
}
