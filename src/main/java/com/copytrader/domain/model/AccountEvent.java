package com.copytrader.domain.model;

import com.copytrader.domain.enums.AccountEventKind;
import com.copytrader.domain.enums.OrderSide;
import lombok.Builder;
import lombok.Data;

/**
 * One fill or order update reported for the account on a private channel.
 *
 * <p>Built by {@link com.copytrader.broker.mapper.AccountEventMapper} from whatever keys
 * the exchange happened to send; every field is optional. Numeric fields are null when
 * the source value was absent or could not be read as a whole number.
 */
@Data
@Builder
public class AccountEvent {

    private AccountEventKind kind;

    /** Upper-cased product symbol, e.g. "BTCUSD". */
    private String symbol;

    private Long productId;

    private OrderSide side;

    /** Filled contracts on a trade fill. */
    private Long quantity;

    /** Cumulative filled contracts on an order update. */
    private Long cumulativeFilled;

    private Long unfilledSize;

    /** Lower-cased order state, e.g. "open", "closed". */
    private String state;

    /** Reference price as a decimal string; used only for limit top-ups. */
    private String price;

    private String fillId;

    private String tradeId;

    private String orderId;

    private String clientOrderId;

    private String text;

    public boolean isTradeFill() {
        return kind == AccountEventKind.TRADE_FILL;
    }

    /** An order update is terminal when the order is closed or nothing remains unfilled. */
    public boolean isTerminal() {
        return "closed".equals(state) || (unfilledSize != null && unfilledSize == 0L);
    }
}
