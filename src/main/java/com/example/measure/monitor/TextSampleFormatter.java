package com.example.measure.monitor;

import com.example.measure.process.CommonProcessData;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed-width columns, one line per sample:
 * <pre>
 * System:                        25268 eclipse
 * used mem: change:  cpu%: freq:  clean:   dirty:  change:  cpu%:
 *  5849720     +824   8.3%   839   14300   112180       -4   0.1%
 * </pre>
 * Values that are not available are printed as {@code -}.
 */
public class TextSampleFormatter implements SampleFormatter {

    @Override
    public List<String> header(Optional<CommonProcessData> process) {
        if (process.isEmpty()) {
            return List.of("System:", "used mem: change:  cpu%: freq:  ");
        }
        CommonProcessData data = process.get();
        return List.of(
                "System:                        " + data.pid() + " " + data.name().orElse("?"),
                "used mem: change:  cpu%: freq:  clean:   dirty:  change:  cpu%:"
        );
    }

    @Override
    public String format(MonitorSample sample) {
        StringBuilder line = new StringBuilder();
        line.append(number(sample.memoryUsedKb(), "%8d", 8)).append(' ')
                .append(number(sample.memoryChangeKb(), "%+8d", 8)).append(' ')
                .append(percent(sample.cpuUsage())).append(' ')
                .append(number(megahertz(sample.cpuFrequencyKhz()), "%5d", 5));

        ProcessSample process = sample.process();
        if (process != null) {
            line.append(number(process.privateCleanKb(), "%8d", 8)).append(' ')
                    .append(number(process.privateDirtyKb(), "%8d", 8)).append(' ')
                    .append(number(process.memoryChangeKb(), "%+8d", 8)).append(' ')
                    .append(percent(process.cpuUsage()));
        }
        return line.toString();
    }

    private static Long megahertz(Long khz) {
        return khz == null ? null : khz / 1000;
    }

    private static String number(Long value, String format, int width) {
        if (value == null) {
            return String.format(Locale.ROOT, "%" + width + "s", "-");
        }
        return String.format(Locale.ROOT, format, value);
    }

    private static String percent(Long hundredths) {
        if (hundredths == null) {
            return "     -";
        }
        return String.format(Locale.ROOT, "%5.1f%%", hundredths / 100.0);
    }
}
