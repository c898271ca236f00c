package com.copytrader.broker.mapper;

import com.copytrader.domain.enums.AccountEventKind;
import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.model.AccountEvent;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Maps raw {@code user_trades} and {@code orders} payload objects to {@link AccountEvent}.
 *
 * <p>The exchange does not use the same key for a field across channels and API versions,
 * so every field is read from the first of several candidate keys that is present and
 * non-blank. Values of the wrong shape become null rather than failing the event; the
 * decision engine turns a missing required field into a skip.
 *
 * <p>For trade quantity and cumulative fill a numeric zero also counts as absent, so
 * {@code "size":0} falls through to {@code fill_size}. A zero string does not.
 *
 * <p>Mapping per field:
 * <ul>
 *   <li>symbol -- {@code symbol}, {@code product_symbol}, {@code product_symbol_name} (upper-cased)</li>
 *   <li>product -- {@code product_id}, {@code instrument_id}</li>
 *   <li>side -- {@code side}, {@code order_side} (by first letter)</li>
 *   <li>trade quantity -- {@code size}, {@code fill_size}, {@code quantity}, {@code filled_quantity}</li>
 *   <li>cumulative fill -- {@code filled_size}, {@code total_filled}, {@code cumulative_qty}</li>
 *   <li>self tag -- {@code client_order_id}, {@code client_id}, {@code text}</li>
 * </ul>
 */
@Component
public class AccountEventMapper {

    public AccountEvent toTradeFill(JsonNode node) {
        return common(node, AccountEventKind.TRADE_FILL)
                .tradeId(text(node, "id", "trade_id"))
                .quantity(nonZeroWholeNumber(node, "size", "fill_size", "quantity", "filled_quantity"))
                .price(decimalText(node, "price"))
                .build();
    }

    public AccountEvent toOrderUpdate(JsonNode node) {
        String state = text(node, "state");
        return common(node, AccountEventKind.ORDER_UPDATE)
                .orderId(text(node, "id", "order_id"))
                .cumulativeFilled(nonZeroWholeNumber(node, "filled_size", "total_filled", "cumulative_qty"))
                .unfilledSize(wholeNumber(node, "unfilled_size"))
                .state(state != null ? state.toLowerCase(Locale.ROOT) : null)
                .price(decimalText(node, "average_fill_price", "price"))
                .build();
    }

    private AccountEvent.AccountEventBuilder common(JsonNode node, AccountEventKind kind) {
        String symbol = text(node, "symbol", "product_symbol", "product_symbol_name");
        return AccountEvent.builder()
                .kind(kind)
                .symbol(symbol != null ? symbol.toUpperCase(Locale.ROOT) : null)
                .productId(wholeNumber(node, "product_id", "instrument_id"))
                .side(OrderSide.fromText(text(node, "side", "order_side")))
                .fillId(text(node, "fill_id"))
                .clientOrderId(text(node, "client_order_id", "client_id", "text"))
                .text(text(node, "text"));
    }

    // ---- Tolerant field readers ----

    /** First candidate that is present, not JSON null and not a blank string. */
    static JsonNode firstPresent(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull() || value.isMissingNode()) {
                continue;
            }
            if (value.isTextual() && value.asText().isBlank()) {
                continue;
            }
            return value;
        }
        return null;
    }

    static String text(JsonNode node, String... keys) {
        JsonNode value = firstPresent(node, keys);
        if (value == null || value.isContainerNode()) {
            return null;
        }
        return value.asText().strip();
    }

    /**
     * Reads an integral value. Accepts JSON integers, floats with no fractional part, and
     * strings holding an integer. Anything else is null.
     */
    static Long wholeNumber(JsonNode node, String... keys) {
        JsonNode value = firstPresent(node, keys);
        if (value == null) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.canConvertToLong() ? value.asLong() : null;
        }
        if (value.isFloatingPointNumber()) {
            return toLongExact(value.decimalValue());
        }
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** {@link #wholeNumber} over the keys whose value is not a numeric zero or {@code false}. */
    static Long nonZeroWholeNumber(JsonNode node, String... keys) {
        String[] candidates = Arrays.stream(keys)
                .filter(key -> !isZeroOrFalse(node.get(key)))
                .toArray(String[]::new);
        return wholeNumber(node, candidates);
    }

    private static boolean isZeroOrFalse(JsonNode value) {
        if (value == null) {
            return false;
        }
        if (value.isNumber()) {
            return value.decimalValue().signum() == 0;
        }
        return value.isBoolean() && !value.booleanValue();
    }

    /** Decimal as a plain string, from a JSON number or a numeric string. */
    static String decimalText(JsonNode node, String... keys) {
        JsonNode value = firstPresent(node, keys);
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue().toPlainString();
        }
        return value.isTextual() ? value.asText().strip() : null;
    }

    private static Long toLongExact(BigDecimal decimal) {
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }
}
