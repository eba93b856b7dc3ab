package com.underscoreresearch.basebackup.manifest;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.underscoreresearch.basebackup.model.Lsn;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"Timeline", "Start-LSN", "End-LSN"})
public class ManifestWalRange {
    @JsonProperty("Timeline")
    private int timeline;
    @JsonProperty("Start-LSN")
    private Lsn startLsn;
    @JsonProperty("End-LSN")
    private Lsn endLsn;
}
