package com.repolink.core.codec;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Converts text to and from the base64 form used for staged file content
 * and for blob payloads sent to the object store.
 */
public final class ContentCodec {

    private ContentCodec() {}

    public static String encode(String text) {
        return Base64.getEncoder().encodeToString(toBytes(text));
    }

    public static String decode(String encoded) {
        return new String(decodeBytes(encoded), StandardCharsets.UTF_8);
    }

    /**
     * Decodes base64 that may be wrapped at 60 or 76 columns, as the GitHub
     * contents API returns it.
     */
    public static byte[] decodeBytes(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return new byte[0];
        }
        return Base64.getMimeDecoder().decode(encoded);
    }

    public static byte[] toBytes(String text) {
        return text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    }

    /** UTF-8 byte length of {@code text}; 0 for null. */
    public static int byteLength(String text) {
        return toBytes(text).length;
    }
}
