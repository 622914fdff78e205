package com.codepartition.core.util;

import com.codepartition.core.ConfigurationException;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;

import java.util.List;

/**
 * {@link TokenCounter} backed by a JTokkit byte-pair encoding ({@code cl100k_base} by default).
 */
public class JtokkitTokenCounter implements TokenCounter {

    public static final String DEFAULT_ENCODING = "cl100k_base";

    private static final EncodingRegistry REGISTRY = Encodings.newLazyEncodingRegistry();

    private final Encoding encoding;

    public JtokkitTokenCounter() {
        this(DEFAULT_ENCODING);
    }

    /**
     * Creates a counter for a named encoding.
     *
     * @param encodingName encoding name such as {@code cl100k_base}
     * @throws ConfigurationException if the encoding is unknown
     */
    public JtokkitTokenCounter(String encodingName) {
        this.encoding = REGISTRY.getEncoding(encodingName)
            .orElseThrow(() -> new ConfigurationException(
                List.of("extraction.encoding: unknown tokenizer encoding '" + encodingName + "'")));
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }
}
