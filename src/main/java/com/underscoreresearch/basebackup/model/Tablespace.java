package com.underscoreresearch.basebackup.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class Tablespace {
    private final String oid;
    private final Path location;
}
