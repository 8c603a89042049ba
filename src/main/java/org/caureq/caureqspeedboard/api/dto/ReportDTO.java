package org.caureq.caureqspeedboard.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Body of POST /api/v1/report. Field names follow the node agent's snake_case payload;
 * camelCase is accepted too. Unknown fields (the node's own status label) are ignored.
 */
public record ReportDTO(
        @JsonProperty("node_id") @JsonAlias("nodeId") @NotBlank @Size(max = 64) String nodeId,
        @JsonProperty("download_mbps") @JsonAlias("downloadMbps") @NotNull @DecimalMin("0.0") Double downloadMbps,
        @JsonProperty("upload_mbps") @JsonAlias("uploadMbps") @NotNull @DecimalMin("0.0") Double uploadMbps,
        @JsonProperty("ping_ms") @JsonAlias("pingMs") @NotNull @DecimalMin("0.0") Double pingMs,
        @JsonProperty("isp") @Size(max = 256) String isp,
        @JsonProperty("location") @Size(max = 256) String location,
        @JsonProperty("os_info") @JsonAlias("osInfo") @Size(max = 256) String osInfo,
        @JsonProperty("test_server") @JsonAlias("testServer") @Size(max = 256) String testServer,
        @JsonProperty("description") @Size(max = 512) String description,
        @JsonProperty("timestamp") String timestamp // node clock, informational only
) {}
