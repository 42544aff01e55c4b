package io.healing.util;

import java.util.Map;

/**
 * Encodes job data ({@code Map<String, String>}) to and from the JSON text stored by a
 * {@link io.healing.spi.JobStore}.
 *
 * <p>The default implementation handles flat string-to-string objects only, which is all a
 * healing job carries ({@code {"runId": "..."}}). Applications that already ship Jackson or
 * Gson can plug their own implementation in through the queue builder.
 *
 * @see #getDefault()
 */
public interface PayloadCodec {

    /**
     * Returns the shared zero-dependency codec.
     *
     * @return the default codec
     */
    static PayloadCodec getDefault() {
        return DefaultPayloadCodec.INSTANCE;
    }

    /**
     * Encodes job data as a JSON object. An empty or {@code null} map encodes as {@code "{}"}.
     *
     * @param data the job data
     * @return JSON object text, never {@code null}
     */
    String encode(Map<String, String> data);

    /**
     * Decodes a JSON object into job data. {@code null}, blank and {@code "null"} input decode
     * to an empty map.
     *
     * @param json JSON object text
     * @return the decoded map, never {@code null}
     * @throws IllegalArgumentException if the text is not a flat JSON object of strings
     */
    Map<String, String> decode(String json);
}
