package com.copytrader.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of an order submission. Status 200 is success; status 0 means the request never
 * produced an HTTP response (transport failure after all retries), in which case the body
 * is a text node holding the error message.
 */
@Getter
@ToString
@AllArgsConstructor
public class OrderSubmitResult {

    public static final int TRANSPORT_FAILURE = 0;

    private final int status;

    private final JsonNode body;

    public boolean isSuccess() {
        return status == 200;
    }
}
