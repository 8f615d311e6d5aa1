package com.resonanceloop.engine.transport;

import com.resonanceloop.common.model.UsageMetadata;

/**
 * One raw request/response exchange with the Oracle, before classification.
 *
 * @param statusCode HTTP status code
 * @param content    extracted text; empty when absent
 * @param usage      token usage reported by the Oracle, or {@link UsageMetadata#none()}
 * @param detail     error message returned by the Oracle for non-2xx responses
 */
public record RawExchange(
    int statusCode,
    String content,
    UsageMetadata usage,
    String detail
) {
    public static RawExchange ok(String content, UsageMetadata usage) {
        return new RawExchange(200, content, usage, null);
    }

    public static RawExchange status(int statusCode, String detail) {
        return new RawExchange(statusCode, "", UsageMetadata.none(), detail);
    }
}
