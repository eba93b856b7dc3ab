package com.underscoreresearch.basebackup.configuration;

import static com.underscoreresearch.basebackup.utils.LogUtil.debug;

import java.nio.file.Paths;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.lang3.SystemUtils;

import com.google.common.base.Strings;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.underscoreresearch.basebackup.file.FileTreeScanner;
import com.underscoreresearch.basebackup.file.implementation.FileTreeScannerImpl;
import com.underscoreresearch.basebackup.model.BackupOptions;
import com.underscoreresearch.basebackup.source.DataSource;
import com.underscoreresearch.basebackup.source.implementation.LocalDataSource;
import com.underscoreresearch.basebackup.utils.UsageException;

@Slf4j
public class BackupModule extends AbstractModule {
    public static final String PGDATA_ENVIRONMENT = "PGDATA";

    @Provides
    @Singleton
    public DataSource dataSource(BackupOptions options) {
        String directory = options.getSourceDirectory();
        if (Strings.isNullOrEmpty(directory)) {
            directory = SystemUtils.getEnvironmentVariable(PGDATA_ENVIRONMENT, null);
        }
        if (Strings.isNullOrEmpty(directory)) {
            throw new UsageException("no source data directory specified, use --source-pgdata or set "
                    + PGDATA_ENVIRONMENT);
        }
        String sourceDirectory = directory;
        debug(() -> log.debug("Backing up data directory \"{}\"", sourceDirectory));
        return new LocalDataSource(Paths.get(directory).toAbsolutePath());
    }

    @Provides
    @Singleton
    public FileTreeScanner fileTreeScanner() {
        return new FileTreeScannerImpl();
    }
}
