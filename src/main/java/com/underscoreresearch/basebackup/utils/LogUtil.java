package com.underscoreresearch.basebackup.utils;

import static com.underscoreresearch.basebackup.configuration.CommandLineModule.VERBOSE;

import java.text.NumberFormat;
import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.cli.CommandLine;

import com.underscoreresearch.basebackup.configuration.InstanceFactory;

@Slf4j
public final class LogUtil {
    private LogUtil() {
    }

    public static boolean isDebug() {
        if (!InstanceFactory.isInitialized()) {
            return true;
        }
        return InstanceFactory.getInstance(CommandLine.class).hasOption(VERBOSE);
    }

    public static void debug(Runnable log) {
        if (isDebug()) {
            log.run();
        }
    }

    public static String readableSize(long length) {
        if (length >= 1024 * 1024 * 1024) {
            return String.format("%s GB", formatNumber(((double) length) / 1024 / 1024 / 1024));
        }
        if (length >= 1024 * 1024) {
            return String.format("%s MB", formatNumber(((double) length) / 1024 / 1024));
        }
        if (length >= 1024) {
            return String.format("%s KB", formatNumber(((double) length) / 1024));
        }
        return String.format("%s B", formatNumber(length));
    }

    private static String formatNumber(double num) {
        return NumberFormat.getNumberInstance().format(Math.round(num * 10) / 10.0);
    }

    public static String readableDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (duration.toDays() > 0) {
            return String.format("%d days %d:%02d:%02d", duration.toDays(),
                    (seconds / 3600) % 24,
                    (seconds / 60) % 60,
                    seconds % 60);
        }
        if (seconds > 3600) {
            return String.format("%d:%02d:%02d",
                    (seconds / 3600) % 24,
                    (seconds / 60) % 60,
                    seconds % 60);
        }
        return String.format("%d:%02d",
                (seconds / 60) % 60,
                seconds % 60);
    }

    public static String readableProgress(long completed, long total, int tablespacesDone, int tablespaces) {
        int percent = total > 0 ? (int) Math.min(100, completed * 100 / total) : 100;
        return String.format("%d/%d kB (%d%%), %d/%d tablespace%s",
                completed / 1024, total / 1024, percent, tablespacesDone, tablespaces,
                tablespaces == 1 ? "" : "s");
    }
}
