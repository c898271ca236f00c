package com.copytrader.broker;

import com.copytrader.exception.BrokerException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds the outbound control frames of the private socket protocol:
 * <ul>
 *   <li>{@code {"type":"auth","payload":{"api-key":..,"signature":..,"timestamp":..}}}</li>
 *   <li>{@code {"type":"subscribe","payload":{"channels":[{"name":..,"symbols":["all"]}]}}}</li>
 *   <li>{@code {"type":"enable_heartbeat"}}</li>
 * </ul>
 */
@Component
public class DeltaSocketFrames {

    static final String AUTH_PATH = "/live";

    /** Private channels subscribed after authentication, in order. */
    public static final List<String> PRIVATE_CHANNELS = List.of("orders", "positions", "user_trades");

    private final DeltaRequestSigner signer;
    private final ObjectMapper objectMapper;

    public DeltaSocketFrames(DeltaRequestSigner signer, ObjectMapper objectMapper) {
        this.signer = signer;
        this.objectMapper = objectMapper;
    }

    public String auth() {
        String timestamp = signer.timestamp();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("api-key", signer.getApiKey());
        payload.put("signature", signer.sign("GET", timestamp, AUTH_PATH, ""));
        payload.put("timestamp", timestamp);
        return frame("auth", payload);
    }

    public String subscribe(String channel, List<String> symbols) {
        Map<String, Object> channelSpec = new LinkedHashMap<>();
        channelSpec.put("name", channel);
        channelSpec.put("symbols", symbols);
        return frame("subscribe", Map.of("channels", List.of(channelSpec)));
    }

    public String enableHeartbeat() {
        return frame("enable_heartbeat", null);
    }

    private String frame(String type, Map<String, Object> payload) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type);
        if (payload != null) {
            frame.put("payload", payload);
        }
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new BrokerException("Failed to serialize " + type + " frame", e);
        }
    }
}
