package com.di.extractflow.controller.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partition every dataset archive under {@code sourceKey} into {@code partitions} slices
 * written below {@code destinationKey}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartitionRequest {
    @NotBlank
    private String container;
    @NotBlank
    private String sourceKey;
    @Min(1)
    private int partitions;
    @NotBlank
    private String destinationKey;
}
