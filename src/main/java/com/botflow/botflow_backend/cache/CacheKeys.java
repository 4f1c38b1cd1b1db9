package com.botflow.botflow_backend.cache;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Cache keys are {@code namespace:botId:md5(args)} so every entry derived from a bot can be
 * cleared with {@link #botPrefix(String, Long)}.
 */
public final class CacheKeys {

    public static final String FLOW_NAMESPACE = "flow";

    private CacheKeys() {}

    public static String forBot(String namespace, Long botId, Object... args) {
        String argsText = Arrays.deepToString(args);
        String hash = DigestUtils.md5DigestAsHex(argsText.getBytes(StandardCharsets.UTF_8));
        return botPrefix(namespace, botId) + hash;
    }

    // Trailing separator keeps bot 4 from matching bot 42
    public static String botPrefix(String namespace, Long botId) {
        return namespace + ":" + botId + ":";
    }
}
