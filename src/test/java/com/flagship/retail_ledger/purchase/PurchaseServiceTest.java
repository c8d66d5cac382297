package com.flagship.retail_ledger.purchase;

import com.flagship.retail_ledger.balance.BalanceLedger;
import com.flagship.retail_ledger.catalog.CounterpartyKind;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.common.PaymentType;
import com.flagship.retail_ledger.exception.NotFoundException;
import com.flagship.retail_ledger.exception.ValidationException;
import com.flagship.retail_ledger.support.LedgerIntegrationSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PurchaseServiceTest extends LedgerIntegrationSupport {

    @Autowired
    private PurchaseService purchaseService;

    @Autowired
    private BalanceLedger balanceLedger;

    @Test
    @DisplayName("Credit purchase increases stock and what the shop owes the supplier")
    void testCreditPurchase() {
        printTestHeader("Credit Purchase");
        UUID itemId = createItem("Cooking Oil 5L", "2", "100.00");
        UUID supplierId = createSupplier("Accra Distributors");

        Purchase purchase = purchaseService.createPurchase(CreatePurchaseCommand.builder()
            .tenantId(tenantId)
            .userId(userId)
            .supplierId(supplierId)
            .line(PurchaseLineCommand.builder().itemId(itemId).quantity(new BigDecimal("10")).build())
            .paymentType(PaymentType.CREDIT)
            .paymentMethod(PaymentMethod.BANK)
            .paidAmount(new BigDecimal("200"))
            .build());

        printOutput("Total", purchase.getTotalAmount());
        assertAmount("600", purchase.getTotalAmount());
        assertAmount("60", purchase.getLines().get(0).getUnitCost());
        assertAmount("12", stockOf(itemId));
        assertAmount("400", balanceLedger.getBalance(tenantId, CounterpartyKind.SUPPLIER, supplierId));

        Purchase loaded = purchaseService.getPurchase(tenantId, purchase.getId());
        assertEquals(1, loaded.getLines().size());
        assertAmount("200", loaded.getPaidAmount());
        printSuccess("Stock 2 -> 12, supplier balance 400");
    }

    @Test
    @DisplayName("A per-line unit cost overrides the catalog cost price")
    void testUnitCostOverride() {
        UUID itemId = createItem("Sardines", "0", "10.00");
        UUID supplierId = createSupplier("Tema Foods");

        Purchase purchase = purchaseService.createPurchase(CreatePurchaseCommand.builder()
            .tenantId(tenantId).userId(userId).supplierId(supplierId)
            .line(PurchaseLineCommand.builder().itemId(itemId).quantity(new BigDecimal("24"))
                .unitCost(new BigDecimal("5.50")).build())
            .paymentType(PaymentType.CASH).paymentMethod(PaymentMethod.CASH)
            .build());

        assertAmount("132", purchase.getTotalAmount());
        assertAmount("132", purchase.getPaidAmount());
        assertAmount("0", balanceLedger.getBalance(tenantId, CounterpartyKind.SUPPLIER, supplierId));
        assertAmount("24", stockOf(itemId));
    }

    @Test
    @DisplayName("A purchase needs a known supplier")
    void testSupplierRequired() {
        UUID itemId = createItem("Candles", "0", "2.00");

        assertThrows(ValidationException.class, () -> purchaseService.createPurchase(CreatePurchaseCommand.builder()
            .tenantId(tenantId).userId(userId)
            .line(PurchaseLineCommand.builder().itemId(itemId).quantity(BigDecimal.ONE).build())
            .paymentType(PaymentType.CASH).paymentMethod(PaymentMethod.CASH)
            .build()));
        assertThrows(NotFoundException.class, () -> purchaseService.createPurchase(CreatePurchaseCommand.builder()
            .tenantId(tenantId).userId(userId).supplierId(UUID.randomUUID())
            .line(PurchaseLineCommand.builder().itemId(itemId).quantity(BigDecimal.ONE).build())
            .paymentType(PaymentType.CASH).paymentMethod(PaymentMethod.CASH)
            .build()));
        assertAmount("0", stockOf(itemId));
    }
}
