package com.flagship.impact_ledger.admin;

import com.flagship.impact_ledger.admin.dto.GiftCodeBatchRequest;
import com.flagship.impact_ledger.admin.dto.GiftCodeResponse;
import com.flagship.impact_ledger.admin.dto.ManualTransactionRequest;
import com.flagship.impact_ledger.admin.dto.RegisterPartyRequest;
import com.flagship.impact_ledger.admin.dto.RegisterSkuRequest;
import com.flagship.impact_ledger.admin.dto.SetRateRequest;
import com.flagship.impact_ledger.admin.dto.WalletAdjustmentRequest;
import com.flagship.impact_ledger.catalog.CatalogService;
import com.flagship.impact_ledger.catalog.Sku;
import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import com.flagship.impact_ledger.giftcard.GiftCardCode;
import com.flagship.impact_ledger.giftcard.GiftCardService;
import com.flagship.impact_ledger.pricing.ConfigAuditEntry;
import com.flagship.impact_ledger.pricing.ConfigEntry;
import com.flagship.impact_ledger.pricing.ConfigKeys;
import com.flagship.impact_ledger.pricing.GlobalConfigService;
import com.flagship.impact_ledger.pricing.PricingOracle;
import com.flagship.impact_ledger.transaction.ManualTransactionCommand;
import com.flagship.impact_ledger.transaction.TransactionManager;
import com.flagship.impact_ledger.transaction.dto.TransactionResponse;
import com.flagship.impact_ledger.wallet.Holder;
import com.flagship.impact_ledger.wallet.HolderService;
import com.flagship.impact_ledger.wallet.HolderType;
import com.flagship.impact_ledger.wallet.WalletLedger;
import com.flagship.impact_ledger.wallet.dto.AdjustmentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Administrative entry points. Authentication is handled in front of this service;
 * the acting administrator is named in each request and recorded in the audit trails.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final PricingOracle pricingOracle;
    private final GlobalConfigService configService;
    private final WalletLedger walletLedger;
    private final TransactionManager transactionManager;
    private final GiftCardService giftCardService;
    private final CatalogService catalogService;
    private final HolderService holderService;

    // Pricing and configuration

    @GetMapping("/config/rate")
    public ResponseEntity<Map<String, Object>> getRate() {
        return ResponseEntity.ok(Map.of("rate", pricingOracle.getRate()));
    }

    @PutMapping("/config/rate")
    public ResponseEntity<Map<String, Object>> setRate(@Valid @RequestBody SetRateRequest request) {
        BigDecimal previous = pricingOracle.setRate(request.getRate(), request.getActor());

        Map<String, Object> body = new HashMap<>();
        body.put("previous_rate", previous);
        body.put("rate", request.getRate());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/config")
    public ResponseEntity<List<ConfigEntry>> getConfig() {
        return ResponseEntity.ok(configService.getAll());
    }

    @GetMapping("/config/audit")
    public ResponseEntity<List<ConfigAuditEntry>> getAudit(
            @RequestParam(value = "key", defaultValue = ConfigKeys.CURRENT_CSR_PRICE) String key) {
        return ResponseEntity.ok(configService.getAuditHistory(key));
    }

    // Wallets and manual transactions

    @PostMapping("/wallets/adjustments")
    public ResponseEntity<AdjustmentResponse> adjustWallet(@Valid @RequestBody WalletAdjustmentRequest request) {
        Holder holder = request.getHolderType() == HolderType.MERCHANT
                ? Holder.merchant(request.getHolderId())
                : Holder.user(request.getHolderId());

        return ResponseEntity.status(HttpStatus.CREATED).body(AdjustmentResponse.from(walletLedger.adjust(
                holder, request.getImpactDelta(), request.getAmountDelta(),
                request.getReason(), request.getActor(), null)));
    }

    @PostMapping("/transactions/manual")
    public ResponseEntity<TransactionResponse> createManualTransaction(
            @Valid @RequestBody ManualTransactionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(
                transactionManager.createManualTransaction(ManualTransactionCommand.builder()
                        .holderId(request.getUserId())
                        .skuCode(request.getSkuCode())
                        .amount(request.getAmount())
                        .merchantId(request.getMerchantId())
                        .partnerId(request.getPartnerId())
                        .orderId(request.getOrderId())
                        .justification(request.getJustification())
                        .actor(request.getActor())
                        .build())));
    }

    // Gift card codes

    @PostMapping("/gift-codes")
    public ResponseEntity<List<GiftCodeResponse>> createGiftCodes(@Valid @RequestBody GiftCodeBatchRequest request) {
        boolean hasCodes = request.getCodes() != null && !request.getCodes().isEmpty();
        if (hasCodes == (request.getQuantity() != null)) {
            throw new ValidationFailedException("Give either codes or a quantity to generate");
        }

        List<GiftCardCode> created = hasCodes
                ? giftCardService.createCodes(request.getSkuId(), request.getCodes())
                : giftCardService.generateCodes(request.getSkuId(), request.getQuantity());
        return ResponseEntity.status(HttpStatus.CREATED).body(created.stream().map(GiftCodeResponse::from).toList());
    }

    @GetMapping("/gift-codes")
    public ResponseEntity<List<GiftCodeResponse>> listGiftCodes(
            @RequestParam("sku_id") UUID skuId,
            @RequestParam(value = "redeemed", required = false) Boolean redeemed) {
        return ResponseEntity.ok(giftCardService.listBySku(skuId, redeemed).stream()
                .map(GiftCodeResponse::from)
                .toList());
    }

    @GetMapping("/gift-codes/{code}")
    public ResponseEntity<GiftCodeResponse> getGiftCode(@PathVariable("code") String code) {
        return ResponseEntity.ok(GiftCodeResponse.from(giftCardService.getStatus(code)));
    }

    @PostMapping("/gift-codes/{code}/invalidate")
    public ResponseEntity<GiftCodeResponse> invalidateGiftCode(@PathVariable("code") String code) {
        return ResponseEntity.ok(GiftCodeResponse.from(giftCardService.invalidate(code)));
    }

    // Seeding the parties the ledger references

    @PostMapping("/skus")
    public ResponseEntity<Sku> registerSku(@Valid @RequestBody RegisterSkuRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.registerSku(
                request.getCode(), request.getName(), request.getPrice(), request.getAcquisitionMode(),
                request.getImpactMultiplier(), request.getConnectThreshold()));
    }

    @PostMapping("/users")
    public ResponseEntity<Map<String, UUID>> registerUser(@RequestBody RegisterPartyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", holderService.registerUser(request.getEmail())));
    }

    @PostMapping("/merchants")
    public ResponseEntity<Map<String, UUID>> registerMerchant(@RequestBody RegisterPartyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", holderService.registerMerchant(request.getName())));
    }

    @PostMapping("/partners")
    public ResponseEntity<Map<String, UUID>> registerPartner(@RequestBody RegisterPartyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", holderService.registerPartner(request.getName())));
    }
}
