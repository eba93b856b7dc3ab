package com.underscoreresearch.basebackup.cli;

import static com.underscoreresearch.basebackup.configuration.CommandLineModule.HELP;
import static com.underscoreresearch.basebackup.configuration.CommandLineModule.VERSION;

import java.io.IOException;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.google.common.base.MoreObjects;
import com.google.inject.ProvisionException;
import com.underscoreresearch.basebackup.configuration.InstanceFactory;
import com.underscoreresearch.basebackup.model.BackupOptions;
import com.underscoreresearch.basebackup.model.BackupPlan;
import com.underscoreresearch.basebackup.session.BackupResult;
import com.underscoreresearch.basebackup.session.BackupSessionController;
import com.underscoreresearch.basebackup.utils.BackupException;
import com.underscoreresearch.basebackup.utils.UsageException;

@Slf4j
public final class Main {
    public static final String PROGRAM_NAME = "underscore-basebackup";

    private Main() {
    }

    public static void help() {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(PROGRAM_NAME + " [OPTION]...\n ", InstanceFactory.getInstance(Options.class));
    }

    public static String version() {
        return PROGRAM_NAME + " " + MoreObjects.firstNonNull(Main.class.getPackage().getImplementationVersion(),
                "development");
    }

    public static void main(String[] argv) {
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                log.error("Uncaught exception from thread {} (Id {})", t.getName(), t.getId(), e));

        System.exit(run(argv));
    }

    /**
     * Runs one backup and returns the process exit code.
     */
    public static int run(String[] argv) {
        InstanceFactory.initialize(argv);

        try {
            CommandLine commandLine = InstanceFactory.getInstance(CommandLine.class);
            if (commandLine.hasOption(HELP)) {
                help();
                return 0;
            }
            if (commandLine.hasOption(VERSION)) {
                System.out.println(version());
                return 0;
            }

            ValidationResult validation = ConfigurationValidator.validate(
                    InstanceFactory.getInstance(BackupOptions.class));
            if (!validation.isValid()) {
                for (String violation : validation.getViolations()) {
                    log.error(violation);
                }
                log.error("Try \"{} --help\" for more information.", PROGRAM_NAME);
                return UsageException.EXIT_CODE;
            }
            BackupPlan plan = validation.getPlan();

            BackupResult result = InstanceFactory.getInstance(BackupSessionController.class).run(plan);
            if (result.getChecksumFailures() > 0) {
                log.error("checksum error occurred");
            }
            return result.getExitCode();
        } catch (Exception exc) {
            return handleFailure(unwrap(exc));
        }
    }

    private static int handleFailure(Throwable exc) {
        if (exc instanceof ParseException) {
            log.error(exc.getMessage());
            log.error("Try \"{} --help\" for more information.", PROGRAM_NAME);
            return UsageException.EXIT_CODE;
        }
        if (exc instanceof BackupException) {
            log.error(exc.getMessage());
            return ((BackupException) exc).getExitCode();
        }
        if (exc instanceof IOException) {
            log.error("Backup failed: {}", exc.getMessage());
            return BackupResult.FAILURE;
        }
        log.error("Fatal exception", exc);
        return BackupResult.FAILURE;
    }

    private static Throwable unwrap(Throwable exc) {
        Throwable current = exc;
        while (current instanceof ProvisionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
