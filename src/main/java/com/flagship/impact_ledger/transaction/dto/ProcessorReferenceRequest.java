package com.flagship.impact_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProcessorReferenceRequest {

    @NotBlank(message = "Processor reference is required")
    @JsonProperty("processor_reference")
    private String processorReference;
}
