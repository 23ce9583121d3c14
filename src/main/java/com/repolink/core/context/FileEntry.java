package com.repolink.core.context;

import com.repolink.core.codec.ContentCodec;

import java.time.Instant;

/**
 * One staged file inside a {@link Context}.
 *
 * @param path           repository-relative path, unique within the context
 * @param encodedContent base64 of the UTF-8 text
 * @param size           UTF-8 byte length of the original text
 * @param addedAt        time of the last create or overwrite
 */
public record FileEntry(
    String path,
    String encodedContent,
    int size,
    Instant addedAt
) {

    /** Builds an entry from raw text, computing size from the live value. */
    public static FileEntry of(String path, String content, Instant addedAt) {
        String text = content != null ? content : "";
        return new FileEntry(path, ContentCodec.encode(text), ContentCodec.byteLength(text), addedAt);
    }

    public String content() {
        return ContentCodec.decode(encodedContent);
    }
}
