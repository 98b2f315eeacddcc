package com.flagship.impact_ledger.transaction;

import com.flagship.impact_ledger.catalog.AcquisitionMode;
import com.flagship.impact_ledger.catalog.CatalogService;
import com.flagship.impact_ledger.catalog.Sku;
import com.flagship.impact_ledger.common.exception.AlreadyRedeemedException;
import com.flagship.impact_ledger.common.exception.InvalidTransitionException;
import com.flagship.impact_ledger.common.exception.InvalidValueException;
import com.flagship.impact_ledger.common.exception.NotFoundException;
import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import com.flagship.impact_ledger.giftcard.GiftCardCode;
import com.flagship.impact_ledger.giftcard.GiftCardService;
import com.flagship.impact_ledger.observability.LedgerMetrics;
import com.flagship.impact_ledger.outbox.OutboxService;
import com.flagship.impact_ledger.pricing.PricingOracle;
import com.flagship.impact_ledger.transaction.event.TransactionCreditedEvent;
import com.flagship.impact_ledger.wallet.Holder;
import com.flagship.impact_ledger.wallet.HolderService;
import com.flagship.impact_ledger.wallet.WalletLedger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Creation rules per acquisition mode, with the persistence and wallet collaborators mocked.
 * The database-backed behaviour is covered by {@code TransactionLifecycleTest}.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TransactionManagerTest {

    private static final BigDecimal RATE = new BigDecimal("0.11");

    @Mock
    private CatalogService catalogService;
    @Mock
    private HolderService holderService;
    @Mock
    private GiftCardService giftCardService;
    @Mock
    private PricingOracle pricingOracle;
    @Mock
    private WalletLedger walletLedger;
    @Mock
    private ImpactTransactionRepository repository;
    @Mock
    private OutboxService outboxService;

    private TransactionManager manager;
    private UUID userId;

    @BeforeEach
    void setUp() {
        manager = new TransactionManager(catalogService, holderService, giftCardService, pricingOracle,
                new ImpactCalculator(), walletLedger, repository, outboxService,
                new LedgerMetrics(new SimpleMeterRegistry()));
        userId = UUID.randomUUID();

        when(pricingOracle.getRate()).thenReturn(RATE);
        when(repository.saveAndFlush(any(ImpactTransactionEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private Sku sku(String code, String price, AcquisitionMode mode) {
        Sku sku = new Sku(UUID.randomUUID(), code, code + " lot", new BigDecimal(price), mode,
                BigDecimal.ONE, new BigDecimal("10.00"), true);
        when(catalogService.getActiveByCode(code)).thenReturn(sku);
        when(catalogService.getActiveById(sku.getId())).thenReturn(sku);
        return sku;
    }

    private CreateTransactionCommand.CreateTransactionCommandBuilder command(String skuCode) {
        return CreateTransactionCommand.builder().holderId(userId).skuCode(skuCode);
    }

    @Nested
    @DisplayName("Acquisition modes")
    class Modes {

        @Test
        @DisplayName("Claim takes the SKU price, is n/a and credits the wallet at once")
        void testClaim_CreditsImmediately() {
            sku("CLAIM-01", "1.10", AcquisitionMode.CLAIM);

            // GIVEN a caller-supplied amount that must be ignored
            ImpactTransaction tx = manager.createTransaction(command("CLAIM-01").amount(new BigDecimal("99")).build());

            assertEquals(new BigDecimal("1.1000"), tx.getAmount());
            assertEquals(new BigDecimal("10.00"), tx.getCalculatedImpact());
            assertEquals(RATE, tx.getRateApplied());
            assertEquals(PaymentStatus.NOT_APPLICABLE, tx.getPaymentStatus());
            assertTrue(tx.isWalletCredited());
            assertFalse(tx.isConnectFlag());

            verify(walletLedger).credit(Holder.user(userId), new BigDecimal("10.00"), new BigDecimal("1.1000"));
            verify(outboxService).saveEvent(eq(TransactionManager.AGGREGATE_TYPE), eq(tx.getId()),
                    eq(TransactionCreditedEvent.EVENT_TYPE), any(TransactionCreditedEvent.class));
        }

        @Test
        @DisplayName("Pay takes the SKU price, stays pending and defers the credit")
        void testPay_DefersCredit() {
            sku("PAY-01", "25.00", AcquisitionMode.PAY);

            ImpactTransaction tx = manager.createTransaction(command("PAY-01").build());

            assertEquals(new BigDecimal("25.0000"), tx.getAmount());
            assertEquals(new BigDecimal("227.27"), tx.getCalculatedImpact());
            assertEquals(PaymentStatus.PENDING, tx.getPaymentStatus());
            assertFalse(tx.isWalletCredited());
            assertTrue(tx.isConnectFlag());

            verify(walletLedger, never()).credit(any(), any(), any());
            verify(outboxService, never()).saveEvent(anyString(), any(), anyString(), any());
        }

        @Test
        @DisplayName("Pay ignores an amount sent by the client")
        void testPay_ClientAmountIgnored() {
            sku("PAY-02", "5.00", AcquisitionMode.PAY);

            ImpactTransaction tx = manager.createTransaction(command("PAY-02").amount(new BigDecimal("1000")).build());

            assertEquals(new BigDecimal("5.0000"), tx.getAmount());
            assertEquals(new BigDecimal("45.45"), tx.getCalculatedImpact());
            assertFalse(tx.isConnectFlag(), "Connect threshold judged on the price, not the request");
        }

        @Test
        @DisplayName("Pay of a zero-priced SKU is rejected")
        void testPay_ZeroRejected() {
            sku("PAY-03", "0.00", AcquisitionMode.PAY);

            assertThrows(InvalidValueException.class,
                    () -> manager.createTransaction(command("PAY-03").build()));
            verify(repository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Allocation needs an explicit amount and credits at once while pending")
        void testAllocation() {
            sku("ALLOC-01", "0.00", AcquisitionMode.ALLOCATION);

            assertThrows(InvalidValueException.class, () -> manager.createTransaction(command("ALLOC-01").build()));

            ImpactTransaction tx = manager.createTransaction(command("ALLOC-01").amount(new BigDecimal("2.20")).build());
            assertEquals(PaymentStatus.PENDING, tx.getPaymentStatus());
            assertTrue(tx.isWalletCredited());
            assertEquals(new BigDecimal("20.00"), tx.getCalculatedImpact());
            verify(walletLedger).credit(Holder.user(userId), new BigDecimal("20.00"), new BigDecimal("2.2000"));
            verify(holderService, never()).markConnected(any());
        }

        @Test
        @DisplayName("Credit above the connect threshold sets the user's flag and reports the first crossing")
        void testCredit_ConnectThreshold_MarksUser() {
            sku("ALLOC-02", "0.00", AcquisitionMode.ALLOCATION);
            when(holderService.markConnected(userId)).thenReturn(true);

            ImpactTransaction tx = manager.createTransaction(command("ALLOC-02").amount(new BigDecimal("12.00")).build());

            assertTrue(tx.isConnectFlag());
            verify(holderService).markConnected(userId);
            verify(outboxService).saveEvent(eq(TransactionManager.AGGREGATE_TYPE), eq(tx.getId()),
                    eq(TransactionCreditedEvent.EVENT_TYPE),
                    argThat((TransactionCreditedEvent e) -> e.isConnectFlag() && e.isUserNewlyConnected()));
        }

        @Test
        @DisplayName("Gift card without a code is a validation error and consumes nothing")
        void testGiftCard_CodeRequired() {
            sku("GIFT-01", "1.10", AcquisitionMode.GIFT_CARD);

            assertThrows(ValidationFailedException.class, () -> manager.createTransaction(command("GIFT-01").build()));
            assertThrows(ValidationFailedException.class,
                    () -> manager.createTransaction(command("GIFT-01").giftCode("  ").build()));

            verify(giftCardService, never()).redeem(any(), any(), any());
            verify(repository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Gift card redemption links the consumed code")
        void testGiftCard_LinksCode() {
            Sku sku = sku("GIFT-02", "1.10", AcquisitionMode.GIFT_CARD);
            GiftCardCode redeemed = new GiftCardCode(UUID.randomUUID(), "ABC123", sku.getId(), true, userId,
                    Instant.now(), Instant.now());
            when(giftCardService.redeem("ABC123", userId, sku.getId())).thenReturn(redeemed);

            ImpactTransaction tx = manager.createTransaction(command("GIFT-02").giftCode("ABC123").build());

            assertEquals(redeemed.getId(), tx.getGiftCardCodeId());
            assertEquals(PaymentStatus.NOT_APPLICABLE, tx.getPaymentStatus());
            assertEquals(new BigDecimal("10.00"), tx.getCalculatedImpact());
        }

        @Test
        @DisplayName("Already redeemed code propagates and nothing is persisted")
        void testGiftCard_AlreadyRedeemed() {
            Sku sku = sku("GIFT-03", "1.10", AcquisitionMode.GIFT_CARD);
            when(giftCardService.redeem("ABC123", userId, sku.getId())).thenThrow(new AlreadyRedeemedException("ABC123"));

            assertThrows(AlreadyRedeemedException.class,
                    () -> manager.createTransaction(command("GIFT-03").giftCode("ABC123").build()));
            verify(repository, never()).saveAndFlush(any());
            verify(walletLedger, never()).credit(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Attribution and failures")
    class Attribution {

        @Test
        @DisplayName("Attributed merchant wallet is credited with the same impact")
        void testMerchantCredited() {
            sku("CLAIM-02", "1.10", AcquisitionMode.CLAIM);
            UUID merchantId = UUID.randomUUID();

            manager.createTransaction(command("CLAIM-02").merchantId(merchantId).build());

            verify(walletLedger).credit(Holder.user(userId), new BigDecimal("10.00"), new BigDecimal("1.1000"));
            verify(walletLedger).credit(Holder.merchant(merchantId), new BigDecimal("10.00"), new BigDecimal("1.1000"));
            verify(holderService).requireExists(Holder.merchant(merchantId));
        }

        @Test
        @DisplayName("Unknown SKU is not found")
        void testUnknownSku() {
            when(catalogService.getActiveByCode("NOPE")).thenThrow(new NotFoundException("SKU", "NOPE"));

            assertThrows(NotFoundException.class, () -> manager.createTransaction(command("NOPE").build()));
        }

        @Test
        @DisplayName("Neither SKU id nor code is a validation error")
        void testSkuRequired() {
            assertThrows(ValidationFailedException.class,
                    () -> manager.createTransaction(CreateTransactionCommand.builder().holderId(userId).build()));
        }

        @Test
        @DisplayName("Unknown holder is not found")
        void testUnknownHolder() {
            sku("CLAIM-03", "1.10", AcquisitionMode.CLAIM);
            doThrow(new NotFoundException("User", userId)).when(holderService).requireExists(Holder.user(userId));

            assertThrows(NotFoundException.class, () -> manager.createTransaction(command("CLAIM-03").build()));
        }

        @Test
        @DisplayName("Unusable rate aborts creation")
        void testBadRate_AbortsCreation() {
            sku("CLAIM-04", "1.10", AcquisitionMode.CLAIM);
            when(pricingOracle.getRate()).thenThrow(new InvalidValueException("Configured impact rate must be a positive decimal: 0"));

            assertThrows(InvalidValueException.class, () -> manager.createTransaction(command("CLAIM-04").build()));
            verify(repository, never()).saveAndFlush(any());
        }
    }

    @Nested
    @DisplayName("Manual transactions")
    class Manual {

        private ManualTransactionCommand.ManualTransactionCommandBuilder manual() {
            return ManualTransactionCommand.builder()
                    .holderId(userId)
                    .skuCode("CLAIM-05")
                    .amount(new BigDecimal("3.30"))
                    .justification("Offline event attendance")
                    .actor("admin@example.com");
        }

        @Test
        @DisplayName("Justification and actor are required")
        void testManual_RequiresJustification() {
            assertThrows(ValidationFailedException.class, () -> manager.createManualTransaction(manual().justification(" ").build()));
            assertThrows(ValidationFailedException.class, () -> manager.createManualTransaction(manual().actor(null).build()));
            assertThrows(InvalidValueException.class,
                    () -> manager.createManualTransaction(manual().amount(BigDecimal.ZERO).build()));
        }

        @Test
        @DisplayName("Manual transaction is completed, credited and traceable")
        void testManual_CompletedAndCredited() {
            sku("CLAIM-05", "1.10", AcquisitionMode.CLAIM);

            ImpactTransaction tx = manager.createManualTransaction(manual().build());

            assertTrue(tx.isManual());
            assertTrue(tx.isWalletCredited());
            assertEquals(PaymentStatus.COMPLETED, tx.getPaymentStatus());
            assertEquals(new BigDecimal("30.00"), tx.getCalculatedImpact());
            assertEquals("admin@example.com", tx.getCreatedBy());
            assertTrue(tx.getOrderId().startsWith(TransactionManager.MANUAL_ORDER_PREFIX));
            verify(walletLedger).credit(Holder.user(userId), new BigDecimal("30.00"), new BigDecimal("3.3000"));
        }
    }

    @Nested
    @DisplayName("Processor reference binding")
    class ProcessorReference {

        private ImpactTransaction stored(PaymentStatus status, String reference) {
            ImpactTransaction tx = ImpactTransaction.builder()
                    .id(UUID.randomUUID())
                    .userId(userId)
                    .skuId(UUID.randomUUID())
                    .amount(new BigDecimal("25.0000"))
                    .calculatedImpact(new BigDecimal("227.27"))
                    .rateApplied(RATE)
                    .paymentStatus(status)
                    .processorReference(reference)
                    .build();
            when(repository.findById(tx.getId()))
                    .thenReturn(Optional.of(ImpactTransactionEntity.fromDomain(tx, null)));
            return tx;
        }

        @Test
        @DisplayName("Binding the same reference again is a no-op")
        void testBind_SameReferenceNoOp() {
            ImpactTransaction tx = stored(PaymentStatus.PENDING, "pi_123");

            assertEquals("pi_123", manager.attachProcessorReference(tx.getId(), "pi_123").getProcessorReference());
            verify(repository, never()).bindProcessorReference(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Rebinding to a different reference is rejected")
        void testBind_DifferentReferenceRejected() {
            ImpactTransaction tx = stored(PaymentStatus.PENDING, "pi_123");

            assertThrows(InvalidTransitionException.class, () -> manager.attachProcessorReference(tx.getId(), "pi_999"));
        }

        @Test
        @DisplayName("Terminal transactions cannot be bound")
        void testBind_TerminalRejected() {
            ImpactTransaction tx = stored(PaymentStatus.NOT_APPLICABLE, null);

            assertThrows(InvalidTransitionException.class, () -> manager.attachProcessorReference(tx.getId(), "pi_123"));
        }
    }
}
