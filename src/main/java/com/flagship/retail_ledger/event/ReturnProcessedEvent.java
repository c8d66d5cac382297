package com.flagship.retail_ledger.event;

import com.flagship.retail_ledger.returns.CustomerReturn;
import com.flagship.retail_ledger.returns.SupplierReturn;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A customer or supplier return. The event type tells the two apart.
 */
@Value
public class ReturnProcessedEvent implements LedgerEvent {
    UUID eventId;
    String tenantId;
    String eventType;
    UUID returnId;
    UUID documentId;     // sale or purchase
    UUID lineId;
    UUID itemId;
    BigDecimal quantity;
    String returnType;
    BigDecimal amount;
    Instant occurredAt;

    public static final String CUSTOMER_EVENT_TYPE = "CustomerReturnProcessed";
    public static final String SUPPLIER_EVENT_TYPE = "SupplierReturnProcessed";

    @Override
    public UUID getAggregateId() {
        return documentId;
    }

    @Override
    public String getAggregateType() {
        return CUSTOMER_EVENT_TYPE.equals(eventType) ? SaleCreatedEvent.AGGREGATE_TYPE : PurchaseCreatedEvent.AGGREGATE_TYPE;
    }

    public static ReturnProcessedEvent fromCustomerReturn(CustomerReturn customerReturn) {
        return new ReturnProcessedEvent(
            UUID.randomUUID(),
            customerReturn.getTenantId(),
            CUSTOMER_EVENT_TYPE,
            customerReturn.getId(),
            customerReturn.getSaleId(),
            customerReturn.getSaleLineId(),
            customerReturn.getItemId(),
            customerReturn.getQuantity(),
            customerReturn.getType().name(),
            customerReturn.getAmount(),
            Instant.now()
        );
    }

    public static ReturnProcessedEvent fromSupplierReturn(SupplierReturn supplierReturn) {
        return new ReturnProcessedEvent(
            UUID.randomUUID(),
            supplierReturn.getTenantId(),
            SUPPLIER_EVENT_TYPE,
            supplierReturn.getId(),
            supplierReturn.getPurchaseId(),
            supplierReturn.getPurchaseLineId(),
            supplierReturn.getItemId(),
            supplierReturn.getQuantity(),
            supplierReturn.getType().name(),
            supplierReturn.getAmount(),
            Instant.now()
        );
    }
}
