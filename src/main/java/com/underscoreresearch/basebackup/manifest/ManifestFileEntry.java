package com.underscoreresearch.basebackup.manifest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"Path", "Size", "Last-Modified", "Checksum-Algorithm", "Checksum"})
public class ManifestFileEntry {
    @JsonProperty("Path")
    private String path;
    @JsonProperty("Size")
    private long size;
    @JsonProperty("Last-Modified")
    private String lastModified;
    @JsonProperty("Checksum-Algorithm")
    private String checksumAlgorithm;
    @JsonProperty("Checksum")
    private String checksum;
}
