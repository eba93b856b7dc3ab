package com.underscoreresearch.basebackup.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.underscoreresearch.basebackup.manifest.ManifestFileEntry;
import com.underscoreresearch.basebackup.manifest.ManifestWalRange;
import com.underscoreresearch.basebackup.model.ReplicationSlot;

public class SerializationUtils {
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL);

    public static final ObjectReader REPLICATION_SLOT_READER = MAPPER
            .readerFor(ReplicationSlot.class);
    public static final ObjectWriter REPLICATION_SLOT_WRITER = MAPPER
            .writerFor(ReplicationSlot.class);

    public static final ObjectReader MANIFEST_FILE_ENTRY_READER = MAPPER
            .readerFor(ManifestFileEntry.class);
    public static final ObjectWriter MANIFEST_FILE_ENTRY_WRITER = MAPPER
            .writerFor(ManifestFileEntry.class);
    public static final ObjectReader MANIFEST_WAL_RANGE_READER = MAPPER
            .readerFor(ManifestWalRange.class);
    public static final ObjectWriter MANIFEST_WAL_RANGE_WRITER = MAPPER
            .writerFor(ManifestWalRange.class);
}
