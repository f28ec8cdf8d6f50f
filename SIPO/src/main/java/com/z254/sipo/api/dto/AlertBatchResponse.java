package com.z254.sipo.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.z254.sipo.domain.model.AlertRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for parsed or generated alert batches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertBatchResponse {
    private String message;
    private List<AlertRecord> alerts;
    private String file;
    private Integer count;
    private String error;
}
