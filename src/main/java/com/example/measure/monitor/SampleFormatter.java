package com.example.measure.monitor;

import com.example.measure.process.CommonProcessData;

import java.util.List;
import java.util.Optional;

/**
 * Turns monitor samples into output lines.
 */
public interface SampleFormatter {

    /**
     * Lines printed once before the first sample.
     *
     * @param process the monitored process, if any
     */
    List<String> header(Optional<CommonProcessData> process);

    String format(MonitorSample sample);
}
