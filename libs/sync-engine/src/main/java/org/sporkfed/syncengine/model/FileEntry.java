package org.sporkfed.syncengine.model;

/**
 * A regular file.
 *
 * @param content  body as returned by the contents API (base64 with line breaks)
 * @param encoding declared encoding of {@code content}; {@code none} when the blob is too large
 *                 to be inlined
 */
public record FileEntry(
        String sha,
        String content,
        String encoding,
        String name,
        String path
) implements LeafEntry {

    public static final String BASE64_ENCODING = "base64";

    @Override
    public EntryType type() {
        return EntryType.FILE;
    }

    public boolean hasInlineContent() {
        return BASE64_ENCODING.equalsIgnoreCase(encoding) && content != null;
    }
}
