package com.copytrader.domain.model;

import com.copytrader.domain.enums.OrderSide;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * A top-up order waiting to be submitted. Created once per admitted event, consumed once
 * by the execution worker and never re-queued.
 */
@Data
@Builder
public class TopUpJob {

    /** Trade id, {@code ord_<orderId>}, or a generated {@code ut_} id when the fill had none. */
    private String auditId;

    private String symbol;

    private Long productId;

    private OrderSide side;

    private long size;

    /** Reference price used to derive a limit price. */
    private String priceHint;

    public Map<String, Object> toContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("audit_id", auditId);
        context.put("symbol", symbol);
        context.put("product_id", productId);
        context.put("side", side != null ? side.getWireValue() : null);
        context.put("size", size);
        context.put("price", priceHint);
        return context;
    }
}
