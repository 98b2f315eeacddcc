package com.flagship.impact_ledger.transaction;

import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import com.flagship.impact_ledger.transaction.dto.PaymentWebhookRequest;
import com.flagship.impact_ledger.transaction.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * Receives payment processor callbacks. Signature verification happens upstream.
 *
 * Safe to call repeatedly: a replayed outcome answers 200 with the unchanged transaction.
 */
@RestController
@RequestMapping("/api/webhooks/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentWebhookController {

    private final PaymentStatusService paymentStatusService;

    @PostMapping
    public ResponseEntity<TransactionResponse> onPaymentEvent(@Valid @RequestBody PaymentWebhookRequest request) {
        PaymentStatus target = toPaymentStatus(request.getStatus());
        log.info("Payment webhook received: status={}, mappedTo={}", request.getStatus(), target.getWireValue());

        ImpactTransaction transaction = paymentStatusService.onProcessorEvent(
                request.getProcessorReference(), target, request.getTransactionId());
        return ResponseEntity.ok(TransactionResponse.from(transaction));
    }

    /**
     * Processor vocabulary to ledger status. Cancellation is a failure for the ledger.
     */
    static PaymentStatus toPaymentStatus(String processorStatus) {
        String normalized = processorStatus.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "succeeded", "completed", "paid" -> PaymentStatus.COMPLETED;
            case "failed", "payment_failed", "canceled", "cancelled" -> PaymentStatus.FAILED;
            default -> {
                try {
                    yield PaymentStatus.fromWireValue(normalized);
                } catch (IllegalArgumentException e) {
                    throw new ValidationFailedException("Unknown processor status: " + processorStatus);
                }
            }
        };
    }
}
