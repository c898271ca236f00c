package com.copytrader.oms;

import com.copytrader.config.ReplicationConfig;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Generates client order ids for top-up orders and recognises them on the way back.
 *
 * <p>Format: {@code <selfTagPrefix><10 hex chars>}, e.g. "BOTMULT_3f9a0c21de". The exchange
 * echoes the id on fills and order updates for that order, which is how the replication
 * pipeline tells its own orders apart from externally placed ones.
 */
@Component
public class ClientOrderIdGenerator {

    static final int SUFFIX_LENGTH = 10;

    private final String prefix;

    public ClientOrderIdGenerator(ReplicationConfig replicationConfig) {
        this.prefix = replicationConfig.getSelfTagPrefix();
    }

    public String generate() {
        String hex = UUID.randomUUID().toString().replace("-", "");
        return prefix + hex.substring(0, SUFFIX_LENGTH);
    }

    /** True when either value starts with the self-tag prefix. */
    public boolean isSelfTagged(String clientOrderId, String text) {
        return startsWithPrefix(clientOrderId) || startsWithPrefix(text);
    }

    public String getPrefix() {
        return prefix;
    }

    private boolean startsWithPrefix(String value) {
        return value != null && value.startsWith(prefix);
    }
}
