package com.flagship.impact_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Payment processor callback. {@code status} is the processor's vocabulary
 * (succeeded, completed, payment_failed, failed, canceled).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaymentWebhookRequest {

    @NotBlank(message = "Processor reference is required")
    @JsonProperty("processor_reference")
    private String processorReference;

    @NotBlank(message = "Status is required")
    @JsonProperty("status")
    private String status;

    @JsonProperty("transaction_id")
    private UUID transactionId;
}
