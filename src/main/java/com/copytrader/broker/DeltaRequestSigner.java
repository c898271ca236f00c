package com.copytrader.broker;

import com.copytrader.config.DeltaConfig;
import com.copytrader.exception.SigningException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * HMAC-SHA256 request signing for the Delta Exchange API.
 *
 * <p>Signature payload: {@code method + timestamp + path + body}, hex-encoded. The
 * timestamp is unix seconds as a decimal string. The socket auth frame uses the same
 * scheme over {@code "GET" + timestamp + "/live"}.
 */
@Component
public class DeltaRequestSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final String apiKey;
    private final SecretKeySpec secretKey;
    private final Clock clock;

    public DeltaRequestSigner(DeltaConfig deltaConfig, Clock clock) {
        this.apiKey = deltaConfig.getApiKey();
        this.secretKey = new SecretKeySpec(deltaConfig.getApiSecret().getBytes(StandardCharsets.UTF_8), ALGORITHM);
        this.clock = clock;
    }

    public String sign(String method, String timestamp, String path, String body) {
        String payload = method + timestamp + path + (body != null ? body : "");
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(secretKey);
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new SigningException("Failed to compute " + ALGORITHM + " signature", e);
        }
    }

    /** Current unix time in seconds, as sent in the {@code timestamp} header. */
    public String timestamp() {
        return String.valueOf(clock.instant().getEpochSecond());
    }

    public String getApiKey() {
        return apiKey;
    }
}
