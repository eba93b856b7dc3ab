package com.underscoreresearch.basebackup.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import com.google.common.base.Strings;
import com.underscoreresearch.basebackup.model.BackupOptions;
import com.underscoreresearch.basebackup.model.BackupPlan;
import com.underscoreresearch.basebackup.model.BackupTarget;
import com.underscoreresearch.basebackup.model.CheckpointMode;
import com.underscoreresearch.basebackup.model.CompressionLocation;
import com.underscoreresearch.basebackup.model.CompressionSpec;
import com.underscoreresearch.basebackup.model.ManifestChecksumType;
import com.underscoreresearch.basebackup.model.OutputFormat;
import com.underscoreresearch.basebackup.model.TablespaceMapping;
import com.underscoreresearch.basebackup.model.WalMode;

/**
 * Turns user options into a {@link BackupPlan}. Collects every problem instead of stopping at
 * the first one and never touches the file system or the data source.
 */
public final class ConfigurationValidator {
    private ConfigurationValidator() {
    }

    public static ValidationResult validate(BackupOptions options) {
        List<String> violations = new ArrayList<>();

        BackupTarget target = null;
        if (options.getTarget() != null) {
            target = parse(options.getTarget(), BackupTarget::parse, violations);
            if (target != null) {
                validateTarget(target, violations);
            }
        }
        boolean hasTarget = options.getTarget() != null;

        String directory = options.getDirectory();
        if (Strings.isNullOrEmpty(directory) && !hasTarget) {
            violations.add("no target directory specified");
        }

        OutputFormat explicitFormat = parse(options.getFormat(), OutputFormat::fromOption, violations);
        WalMode explicitWalMode = parse(options.getWalMethod(), WalMode::fromOption, violations);
        CheckpointMode checkpoint = parse(options.getCheckpoint(), CheckpointMode::fromOption, violations);
        TablespaceMapping mapping = parse(options.getTablespaceMappings(), TablespaceMapping::parse, violations);

        CompressionSpec compression = CompressionSpec.NONE;
        if (options.getCompression() != null) {
            compression = parse(options.getCompression(), CompressionSpec::parse, violations);
        } else if (options.isGzip()) {
            compression = CompressionSpec.gzipDefault();
        }

        if (hasTarget) {
            if (!Strings.isNullOrEmpty(directory)) {
                violations.add("cannot specify both output directory and backup target");
            }
            if (options.getFormat() != null) {
                violations.add("cannot specify both format and backup target");
            }
            if (options.getWalMethod() == null || explicitWalMode == WalMode.STREAM) {
                violations.add("WAL cannot be streamed when a backup target is specified");
            }
            if (compression != null && compression.isCompressed()
                    && compression.getLocation() == CompressionLocation.CLIENT) {
                violations.add("client-side compression is not possible when a backup target is specified");
            }
            if (options.isWriteRecoveryConf()) {
                violations.add("recovery configuration cannot be written when a backup target is specified");
            }
        }

        OutputFormat format = hasTarget ? OutputFormat.TAR
                : explicitFormat != null ? explicitFormat : OutputFormat.PLAIN;
        WalMode walMode = explicitWalMode != null ? explicitWalMode : WalMode.STREAM;

        if (format == OutputFormat.PLAIN && compression != null && compression.isCompressed()
                && compression.getLocation() == CompressionLocation.CLIENT) {
            violations.add("only tar mode backups can be compressed");
        }

        validateSlots(options, walMode, violations);

        Path walDirectory = null;
        if (!Strings.isNullOrEmpty(options.getWalDirectory())) {
            if (format != OutputFormat.PLAIN) {
                violations.add("WAL directory location can only be specified in plain mode");
            }
            walDirectory = Paths.get(options.getWalDirectory());
            if (!walDirectory.isAbsolute()) {
                violations.add("WAL directory location must be an absolute path");
            }
        }

        ManifestChecksumType manifestChecksums = null;
        if (options.isNoManifest()) {
            if (options.getManifestChecksums() != null) {
                violations.add("--no-manifest and --manifest-checksums are incompatible options");
            }
        } else {
            manifestChecksums = parse(options.getManifestChecksums(), ManifestChecksumType::fromOption,
                    violations);
        }

        if (!violations.isEmpty()) {
            return ValidationResult.invalid(violations);
        }

        return ValidationResult.valid(BackupPlan.builder()
                .directory(Strings.isNullOrEmpty(directory) ? null : Paths.get(directory))
                .format(format)
                .walMode(walMode)
                .target(target)
                .tablespaceMapping(mapping)
                .compression(compression)
                .slot(Strings.emptyToNull(options.getSlot()))
                .createSlot(options.isCreateSlot())
                .noSlot(options.isNoSlot())
                .verifyChecksums(!options.isNoVerifyChecksums())
                .writeRecoveryConf(options.isWriteRecoveryConf())
                .manifest(!options.isNoManifest())
                .manifestChecksums(manifestChecksums)
                .walDirectory(walDirectory)
                .noClean(options.isNoClean())
                .noSync(options.isNoSync())
                .checkpoint(checkpoint)
                .label(options.getLabel() != null ? options.getLabel() : BackupPlan.DEFAULT_LABEL)
                .progress(options.isProgress())
                .host(options.getHost())
                .port(options.getPort())
                .username(options.getUsername())
                .build());
    }

    private static void validateTarget(BackupTarget target, List<String> violations) {
        switch (target.getType()) {
            case SERVER -> {
                if (Strings.isNullOrEmpty(target.getDetail())) {
                    violations.add("target \"server\" requires a target detail");
                }
            }
            case BLACKHOLE -> {
                if (target.getDetail() != null) {
                    violations.add("target \"blackhole\" does not accept a target detail");
                }
            }
        }
    }

    private static void validateSlots(BackupOptions options, WalMode walMode, List<String> violations) {
        boolean hasSlot = !Strings.isNullOrEmpty(options.getSlot());
        if (options.isNoSlot()) {
            if (hasSlot) {
                violations.add("--slot and --no-slot are incompatible options");
            }
            if (options.isCreateSlot()) {
                violations.add("--create-slot and --no-slot are incompatible options");
            }
        }
        if (options.isCreateSlot() && !hasSlot) {
            violations.add("--create-slot needs a slot to be specified using --slot");
        }
        if (hasSlot && walMode != WalMode.STREAM) {
            violations.add("replication slots can only be used with WAL streaming");
        }
    }

    private static <S, T> T parse(S value, Function<S, T> parser, List<String> violations) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException exc) {
            violations.add(exc.getMessage());
            return null;
        }
    }
}
