package com.copytrader.broker;

import com.copytrader.config.DeltaConfig;
import com.copytrader.config.ReplicationConfig;
import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.enums.OrderType;
import com.copytrader.domain.enums.SkipReason;
import com.copytrader.domain.enums.TimeInForce;
import com.copytrader.domain.model.OrderSubmitResult;
import com.copytrader.domain.model.TopUpJob;
import com.copytrader.exception.BrokerException;
import com.copytrader.observability.DecisionLogger;
import com.copytrader.oms.ClientOrderIdGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.event.RetryOnRetryEvent;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Submits top-up orders to {@code POST /v2/orders}.
 *
 * <p>Request body fields, in order: {@code side}, {@code order_type}, {@code time_in_force},
 * {@code size}, {@code reduce_only}, {@code client_order_id}, {@code product_id} (when known)
 * and {@code limit_price} (limit orders only). Every attempt is freshly signed with
 * {@link DeltaRequestSigner}.
 *
 * <p>Transport errors, 429 and 5xx responses are retried up to {@code delta.http-retries}
 * attempts through a Resilience4j {@link Retry} with capped, jittered exponential backoff; other
 * statuses are returned as-is. A request that never got a response ends as status 0 with the
 * error message as body.
 *
 * <p>A limit IOC order the exchange cancels for lack of book depth is resubmitted once as a
 * market order under a new client order id when {@code limit-ioc-fallback-market} is on.
 */
@Service
public class DeltaOrderClient {

    private static final Logger log = LoggerFactory.getLogger(DeltaOrderClient.class);

    static final String ORDERS_PATH = "/v2/orders";

    static final String NO_DEPTH_CANCELLATION = "order_size_not_available_in_orderbook";

    private static final BigDecimal BPS_DIVISOR = BigDecimal.valueOf(10_000);

    private final RestClient restClient;
    private final DeltaRequestSigner signer;
    private final ObjectMapper objectMapper;
    private final DeltaConfig deltaConfig;
    private final ReplicationConfig replicationConfig;
    private final ClientOrderIdGenerator clientOrderIdGenerator;
    private final DecisionLogger decisionLogger;
    private final RetryConfig retryConfig;

    public DeltaOrderClient(
            @Qualifier("deltaRestClient") RestClient restClient,
            DeltaRequestSigner signer,
            ObjectMapper objectMapper,
            DeltaConfig deltaConfig,
            ReplicationConfig replicationConfig,
            ClientOrderIdGenerator clientOrderIdGenerator,
            DecisionLogger decisionLogger) {
        this.restClient = restClient;
        this.signer = signer;
        this.objectMapper = objectMapper;
        this.deltaConfig = deltaConfig;
        this.replicationConfig = replicationConfig;
        this.clientOrderIdGenerator = clientOrderIdGenerator;
        this.decisionLogger = decisionLogger;
        this.retryConfig = buildRetryConfig(deltaConfig, (attempt, outcome) -> retryPause(attempt).toMillis());
    }

    public OrderSubmitResult submit(TopUpJob job) {
        if (job.getSize() <= 0) {
            return new OrderSubmitResult(200, objectMapper.createObjectNode().put("skipped", "non_positive_size"));
        }

        OrderType orderType = replicationConfig.getOrderType();
        if (replicationConfig.isDryRun()) {
            decisionLogger.action("dry_run_order", job.toContext());
            log.info(
                    "DRY_RUN place {} {} on {} ({}, {})",
                    job.getSide().getWireValue(),
                    job.getSize(),
                    describeInstrument(job),
                    orderType.getWireValue(),
                    job.getPriceHint());
            return new OrderSubmitResult(200, objectMapper.createObjectNode().put("dry_run", true));
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("side", job.getSide().getWireValue());
        body.put("order_type", orderType.getWireValue());
        body.put("time_in_force", replicationConfig.getTimeInForce().getWireValue());
        body.put("size", job.getSize());
        body.put("reduce_only", false);
        body.put("client_order_id", clientOrderIdGenerator.generate());
        if (job.getProductId() != null) {
            body.put("product_id", job.getProductId());
        }

        if (orderType == OrderType.LIMIT_ORDER) {
            String limitPrice = limitPrice(job.getSide(), job.getPriceHint(), replicationConfig.getLimitSlippageBps());
            if (limitPrice == null) {
                Map<String, Object> context = new LinkedHashMap<>();
                context.put("symbol", job.getSymbol());
                context.put("side", job.getSide().getWireValue());
                context.put("size", job.getSize());
                decisionLogger.skip(SkipReason.MISSING_LIMIT_PRICE, context);
                return new OrderSubmitResult(
                        400, objectMapper.createObjectNode().put("error", SkipReason.MISSING_LIMIT_PRICE.getCode()));
            }
            body.put("limit_price", limitPrice);
        }

        OrderSubmitResult result = postAndRecord(job, body);

        if (isNoDepthCancellation(result) && fallbackApplies()) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("symbol", job.getSymbol());
            context.put("side", job.getSide().getWireValue());
            context.put("size", job.getSize());
            context.put("limit_price", body.path("limit_price").asText(null));
            decisionLogger.action("limit_ioc_cancel_fallback", context);
            log.warn(
                    "IOC top-up cancelled for depth: {} {} {} @ {}, resubmitting as market",
                    job.getSide().getWireValue(),
                    job.getSize(),
                    describeInstrument(job),
                    body.path("limit_price").asText());

            ObjectNode marketBody = body.deepCopy();
            marketBody.put("order_type", OrderType.MARKET_ORDER.getWireValue());
            marketBody.put("client_order_id", clientOrderIdGenerator.generate());
            marketBody.remove("limit_price");
            return postAndRecord(job, marketBody);
        }
        return result;
    }

    /**
     * Shifts the reference price by {@code slippageBps}: up for buys, down for sells.
     * Formatted with at most 8 decimals and no trailing zeros.
     *
     * @return the limit price, or null when the reference price is missing or not a number
     */
    public static String limitPrice(OrderSide side, String reference, double slippageBps) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        BigDecimal price;
        try {
            price = new BigDecimal(reference.strip());
        } catch (NumberFormatException e) {
            return null;
        }
        if (slippageBps > 0) {
            BigDecimal slip = BigDecimal.valueOf(slippageBps).divide(BPS_DIVISOR);
            BigDecimal factor = side == OrderSide.SELL ? BigDecimal.ONE.subtract(slip) : BigDecimal.ONE.add(slip);
            price = price.multiply(factor);
        }
        return price.setScale(8, RoundingMode.HALF_EVEN).stripTrailingZeros().toPlainString();
    }

    // ---- Internal ----

    private OrderSubmitResult postAndRecord(TopUpJob job, ObjectNode body) {
        OrderSubmitResult result = postWithRetry(serialize(body));

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("status", result.getStatus());
        context.put("resp", result.getBody());
        context.put("req", body);
        decisionLogger.action("order_submit", context);

        if (result.isSuccess()) {
            log.info(
                    "Placed top-up: {} {} {} ({} @ {})",
                    job.getSide().getWireValue(),
                    job.getSize(),
                    describeInstrument(job),
                    body.path("order_type").asText(),
                    body.path("limit_price").asText("market"));
        } else {
            log.error("ORDER ERROR status={} resp={}", result.getStatus(), result.getBody());
        }
        return result;
    }

    private OrderSubmitResult postWithRetry(String json) {
        AtomicReference<OrderSubmitResult> lastResult = new AtomicReference<>();
        Retry retry = Retry.of("deltaOrders", retryConfig);
        retry.getEventPublisher().onRetry(event -> recordRetry(event, lastResult.get()));

        Supplier<OrderSubmitResult> attempt = Retry.decorateSupplier(retry, () -> {
            OrderSubmitResult result = post(json);
            lastResult.set(result);
            return result;
        });
        try {
            return attempt.get();
        } catch (RestClientException e) {
            log.error("Order request failed after {} attempts: {}", deltaConfig.getHttpRetries(), e.getMessage());
            return new OrderSubmitResult(OrderSubmitResult.TRANSPORT_FAILURE, TextNode.valueOf(e.getMessage()));
        }
    }

    private void recordRetry(RetryOnRetryEvent event, OrderSubmitResult lastResult) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (event.getLastThrowable() != null) {
            context.put("attempt", event.getNumberOfRetryAttempts());
            context.put("sleep", event.getWaitInterval().toMillis() / 1000.0);
            context.put("err", event.getLastThrowable().getMessage());
            decisionLogger.action("rest_exc_retry", context);
        } else {
            context.put("status", lastResult != null ? lastResult.getStatus() : null);
            context.put("attempt", event.getNumberOfRetryAttempts());
            context.put("sleep", event.getWaitInterval().toMillis() / 1000.0);
            decisionLogger.action("rest_retry", context);
        }
    }

    private static RetryConfig buildRetryConfig(DeltaConfig deltaConfig, IntervalBiFunction<OrderSubmitResult> pause) {
        return RetryConfig.<OrderSubmitResult>custom()
                .maxAttempts(deltaConfig.getHttpRetries())
                .retryOnResult(DeltaOrderClient::isRetryableStatus)
                .retryExceptions(RestClientException.class)
                .intervalBiFunction(pause)
                .build();
    }

    static boolean isRetryableStatus(OrderSubmitResult result) {
        int status = result.getStatus();
        return status == 429 || (status >= 500 && status < 600);
    }

    private OrderSubmitResult post(String json) {
        String timestamp = signer.timestamp();
        String signature = signer.sign("POST", timestamp, ORDERS_PATH, json);
        return restClient
                .post()
                .uri(ORDERS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .header("api-key", signer.getApiKey())
                .header("timestamp", timestamp)
                .header("signature", signature)
                .body(json)
                .exchange((request, response) -> new OrderSubmitResult(
                        response.getStatusCode().value(),
                        parseBody(StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8))));
    }

    /** {@code min(base * 2^(attempt-1), max) * (1 + U(0, 0.25))}. */
    public Duration retryPause(int attempt) {
        Duration base = deltaConfig.getRetryBackoffBase();
        Duration max = deltaConfig.getRetryBackoffMax();
        Duration exponential = base.multipliedBy(1L << Math.min(attempt - 1, 30));
        Duration capped = exponential.compareTo(max) > 0 ? max : exponential;
        double factor = 1.0 + ThreadLocalRandom.current().nextDouble() * 0.25;
        return Duration.ofNanos((long) (capped.toNanos() * factor));
    }

    private boolean isNoDepthCancellation(OrderSubmitResult result) {
        if (!result.isSuccess() || result.getBody() == null) {
            return false;
        }
        JsonNode orderResult = result.getBody().path("result");
        return "cancelled".equals(orderResult.path("state").asText())
                && NO_DEPTH_CANCELLATION.equals(orderResult.path("cancellation_reason").asText());
    }

    private boolean fallbackApplies() {
        return replicationConfig.getOrderType() == OrderType.LIMIT_ORDER
                && replicationConfig.getTimeInForce() == TimeInForce.IOC
                && replicationConfig.isLimitIocFallbackMarket()
                && !replicationConfig.isDryRun();
    }

    private JsonNode parseBody(String text) {
        if (text == null || text.isBlank()) {
            return TextNode.valueOf("");
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(text);
        }
    }

    private String serialize(ObjectNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new BrokerException("Failed to serialize order body", e);
        }
    }

    private static String describeInstrument(TopUpJob job) {
        return job.getSymbol() != null ? job.getSymbol() : String.valueOf(job.getProductId());
    }
}
