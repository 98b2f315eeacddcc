package com.flagship.impact_ledger.transaction;

import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import com.flagship.impact_ledger.observability.LedgerMetrics;
import com.flagship.impact_ledger.transaction.dto.CreateTransactionRequest;
import com.flagship.impact_ledger.transaction.dto.ProcessorReferenceRequest;
import com.flagship.impact_ledger.transaction.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Transaction creation and read access for clients and downstream collaborators.
 *
 * Creation honours an optional {@code Idempotency-Key} header: a repeated key returns
 * the transaction it created the first time with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TransactionManager transactionManager;
    private final IdempotencyService idempotencyService;
    private final LedgerMetrics metrics;

    @PostMapping
    public ResponseEntity<TransactionResponse> createTransaction(
            @Valid @RequestBody CreateTransactionRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();
        if (keyed) {
            Optional<UUID> existing = idempotencyService.findTransactionId(idempotencyKey);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key already used, returning transaction {}", existing.get());
                return ResponseEntity.ok(TransactionResponse.from(transactionManager.getTransaction(existing.get())));
            }
            metrics.recordIdempotencyMiss();
        }

        ImpactTransaction created = transactionManager.createTransaction(CreateTransactionCommand.builder()
                .holderId(request.getUserId())
                .skuId(request.getSkuId())
                .skuCode(request.getSkuCode())
                .amount(request.getAmount())
                .merchantId(request.getMerchantId())
                .partnerId(request.getPartnerId())
                .orderId(request.getOrderId())
                .giftCode(request.getGiftCode())
                .idempotencyKey(keyed ? idempotencyKey : null)
                .build());

        if (keyed) {
            idempotencyService.remember(idempotencyKey, created.getId());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(created));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(TransactionResponse.from(transactionManager.getTransaction(id)));
    }

    /**
     * Exactly one of the three filters must be given.
     */
    @GetMapping
    public ResponseEntity<List<TransactionResponse>> listTransactions(
            @RequestParam(value = "user_id", required = false) UUID userId,
            @RequestParam(value = "merchant_id", required = false) UUID merchantId,
            @RequestParam(value = "partner_id", required = false) UUID partnerId) {

        long filters = Stream.of(userId, merchantId, partnerId).filter(Objects::nonNull).count();
        if (filters != 1) {
            throw new ValidationFailedException("Exactly one of user_id, merchant_id or partner_id is required");
        }

        List<ImpactTransaction> transactions = userId != null
                ? transactionManager.listForHolder(userId)
                : merchantId != null
                ? transactionManager.listForMerchant(merchantId)
                : transactionManager.listForPartner(partnerId);

        return ResponseEntity.ok(transactions.stream().map(TransactionResponse::from).toList());
    }

    @GetMapping("/credited-impact")
    public ResponseEntity<Map<String, Object>> getCreditedImpact(@RequestParam("user_id") UUID userId) {
        BigDecimal total = transactionManager.sumCreditedImpact(userId);
        return ResponseEntity.ok(Map.of("user_id", userId, "credited_impact", total));
    }

    @PutMapping("/{id}/processor-reference")
    public ResponseEntity<TransactionResponse> attachProcessorReference(
            @PathVariable("id") UUID id,
            @Valid @RequestBody ProcessorReferenceRequest request) {
        return ResponseEntity.ok(TransactionResponse.from(
                transactionManager.attachProcessorReference(id, request.getProcessorReference())));
    }
}
