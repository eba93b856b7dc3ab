package com.underscoreresearch.basebackup.configuration;

import java.util.Arrays;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.underscoreresearch.basebackup.model.BackupOptions;

@Slf4j
public class CommandLineModule extends AbstractModule {
    public static final String PGDATA = "pgdata";
    public static final String FORMAT = "format";
    public static final String WAL_METHOD = "wal-method";
    public static final String TARGET = "target";
    public static final String TABLESPACE_MAPPING = "tablespace-mapping";
    public static final String GZIP = "gzip";
    public static final String COMPRESS = "compress";
    public static final String SLOT = "slot";
    public static final String CREATE_SLOT = "create-slot";
    public static final String NO_SLOT = "no-slot";
    public static final String NO_VERIFY_CHECKSUMS = "no-verify-checksums";
    public static final String WRITE_RECOVERY_CONF = "write-recovery-conf";
    public static final String NO_MANIFEST = "no-manifest";
    public static final String MANIFEST_CHECKSUMS = "manifest-checksums";
    public static final String WALDIR = "waldir";
    public static final String NO_CLEAN = "no-clean";
    public static final String NO_SYNC = "no-sync";
    public static final String CHECKPOINT = "checkpoint";
    public static final String LABEL = "label";
    public static final String PROGRESS = "progress";
    public static final String VERBOSE = "verbose";
    public static final String HOST = "host";
    public static final String PORT = "port";
    public static final String USERNAME = "username";
    public static final String SOURCE_PGDATA = "source-pgdata";
    public static final String HELP = "help";
    public static final String VERSION = "version";

    private final String[] argv;

    public CommandLineModule(String[] argv) {
        this.argv = argv;
    }

    @Provides
    @Singleton
    public Options options() {
        Options options = new Options();

        options.addOption("D", PGDATA, true, "Receive base backup into directory");
        options.addOption("F", FORMAT, true, "Output format (plain (default), tar)");
        options.addOption("X", WAL_METHOD, true, "Include required WAL files with specified method (none, fetch, stream)");
        options.addOption("t", TARGET, true, "Backup target (if other than client)");
        options.addOption("T", TABLESPACE_MAPPING, true, "Relocate tablespace in OLDDIR to NEWDIR (OLDDIR=NEWDIR)");
        options.addOption("z", GZIP, false, "Compress tar output");
        options.addOption("Z", COMPRESS, true, "Compress on client or server as specified ([client-|server-]METHOD[:LEVEL])");
        options.addOption("S", SLOT, true, "Replication slot to use");
        options.addOption("C", CREATE_SLOT, false, "Create replication slot");
        options.addOption(null, NO_SLOT, false, "Prevent creation of temporary replication slot");
        options.addOption("k", NO_VERIFY_CHECKSUMS, false, "Do not verify checksums");
        options.addOption("R", WRITE_RECOVERY_CONF, false, "Write configuration for replication");
        options.addOption(null, NO_MANIFEST, false, "Suppress generation of backup manifest");
        options.addOption(null, MANIFEST_CHECKSUMS, true, "Use algorithm for manifest checksums");
        options.addOption(null, WALDIR, true, "Location for the write-ahead log directory");
        options.addOption("n", NO_CLEAN, false, "Do not clean up after errors");
        options.addOption("N", NO_SYNC, false, "Do not wait for changes to be written safely to disk");
        options.addOption("c", CHECKPOINT, true, "Set fast or spread checkpointing");
        options.addOption("l", LABEL, true, "Set backup label");
        options.addOption("P", PROGRESS, false, "Show progress information");
        options.addOption("v", VERBOSE, false, "Output verbose messages");
        options.addOption("h", HOST, true, "Database server host written to the recovery configuration");
        options.addOption("p", PORT, true, "Database server port written to the recovery configuration");
        options.addOption("U", USERNAME, true, "Database user name written to the recovery configuration");
        options.addOption(null, SOURCE_PGDATA, true, "Data directory to back up (default $PGDATA)");
        options.addOption("?", HELP, false, "Show this help, then exit");
        options.addOption("V", VERSION, false, "Output version information, then exit");

        return options;
    }

    @Provides
    @Singleton
    public CommandLine commandLine(Options options) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        CommandLine commandLine = parser.parse(options, argv);
        if (!commandLine.getArgList().isEmpty()) {
            throw new ParseException("too many command-line arguments (first is \""
                    + commandLine.getArgList().get(0) + "\")");
        }
        return commandLine;
    }

    @Provides
    @Singleton
    public BackupOptions backupOptions(CommandLine commandLine) {
        String[] mappings = commandLine.getOptionValues(TABLESPACE_MAPPING);
        return BackupOptions.builder()
                .directory(commandLine.getOptionValue(PGDATA))
                .format(commandLine.getOptionValue(FORMAT))
                .walMethod(commandLine.getOptionValue(WAL_METHOD))
                .target(commandLine.getOptionValue(TARGET))
                .tablespaceMappings(mappings != null ? Arrays.asList(mappings) : null)
                .gzip(commandLine.hasOption(GZIP))
                .compression(commandLine.getOptionValue(COMPRESS))
                .slot(commandLine.getOptionValue(SLOT))
                .createSlot(commandLine.hasOption(CREATE_SLOT))
                .noSlot(commandLine.hasOption(NO_SLOT))
                .noVerifyChecksums(commandLine.hasOption(NO_VERIFY_CHECKSUMS))
                .writeRecoveryConf(commandLine.hasOption(WRITE_RECOVERY_CONF))
                .noManifest(commandLine.hasOption(NO_MANIFEST))
                .manifestChecksums(commandLine.getOptionValue(MANIFEST_CHECKSUMS))
                .walDirectory(commandLine.getOptionValue(WALDIR))
                .noClean(commandLine.hasOption(NO_CLEAN))
                .noSync(commandLine.hasOption(NO_SYNC))
                .checkpoint(commandLine.getOptionValue(CHECKPOINT))
                .label(commandLine.getOptionValue(LABEL))
                .progress(commandLine.hasOption(PROGRESS))
                .host(commandLine.getOptionValue(HOST))
                .port(commandLine.getOptionValue(PORT))
                .username(commandLine.getOptionValue(USERNAME))
                .sourceDirectory(commandLine.getOptionValue(SOURCE_PGDATA))
                .build();
    }
}
