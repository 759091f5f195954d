package com.di.extractflow.controller.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Runs the standard rebinning → calibration (→ imaging) chain over a partitioned dataset.
 * {@code runId} is generated when absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunRequest {
    @NotBlank
    private String container;
    @NotBlank
    private String sourceKey;
    @Min(1)
    private int partitions;
    @NotBlank
    private String destinationKey;
    private String runId;
    private boolean imaging;
    private Integer limit;
}
