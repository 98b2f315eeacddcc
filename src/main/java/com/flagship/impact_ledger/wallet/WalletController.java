package com.flagship.impact_ledger.wallet;

import com.flagship.impact_ledger.wallet.dto.AdjustmentResponse;
import com.flagship.impact_ledger.wallet.dto.RedeemImpactRequest;
import com.flagship.impact_ledger.wallet.dto.WalletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Wallet balances and impact redemption.
 */
@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
public class WalletController {

    private final WalletLedger walletLedger;

    @GetMapping("/users/{userId}")
    public ResponseEntity<WalletResponse> getUserWallet(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(WalletResponse.from(walletLedger.getWallet(Holder.user(userId))));
    }

    @GetMapping("/merchants/{merchantId}")
    public ResponseEntity<WalletResponse> getMerchantWallet(@PathVariable("merchantId") UUID merchantId) {
        return ResponseEntity.ok(WalletResponse.from(walletLedger.getWallet(Holder.merchant(merchantId))));
    }

    @PostMapping("/users/{userId}/redemptions")
    public ResponseEntity<WalletResponse> redeem(@PathVariable("userId") UUID userId,
                                                 @Valid @RequestBody RedeemImpactRequest request) {
        return ResponseEntity.ok(WalletResponse.from(walletLedger.debit(Holder.user(userId), request.getImpact())));
    }

    @GetMapping("/users/{userId}/adjustments")
    public ResponseEntity<List<AdjustmentResponse>> getUserAdjustments(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(walletLedger.getAdjustmentHistory(Holder.user(userId)).stream()
                .map(AdjustmentResponse::from)
                .toList());
    }
}
