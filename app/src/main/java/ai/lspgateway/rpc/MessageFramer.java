package ai.lspgateway.rpc;

import ai.lspgateway.config.FramingMode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Reassembles JSON-RPC records from a byte stream that arrives in arbitrary chunks.
 *
 * <p>Each record is either a {@code Content-Length}-headed frame (the LSP base protocol) or a single line of JSON;
 * the two are told apart by the first non-blank byte, so a stream may mix them. Not thread-safe: one framer per
 * stream, fed by the stream's reader.
 */
public final class MessageFramer {
    private static final Logger logger = LogManager.getLogger(MessageFramer.class);
    private static final String CONTENT_LENGTH = "content-length";
    private static final int MAX_HEADER_BYTES = 8 * 1024;

    private byte[] buffer = new byte[8 * 1024];
    private int start;
    private int end;

    /** Appends {@code length} bytes and returns every record completed by them, in stream order. */
    public List<String> feed(byte[] chunk, int offset, int length) {
        append(chunk, offset, length);
        var records = new ArrayList<String>();
        while (true) {
            skipBlank();
            if (start == end) {
                break;
            }
            var record = buffer[start] == '{' || buffer[start] == '[' ? nextLine() : nextFrame();
            if (record == null) {
                break;
            }
            if (!record.isEmpty()) {
                records.add(record);
            }
        }
        compact();
        return records;
    }

    /** Number of buffered bytes that do not yet form a complete record. */
    public int pending() {
        return end - start;
    }

    public static byte[] frame(String json, FramingMode mode) {
        var body = json.getBytes(StandardCharsets.UTF_8);
        if (mode == FramingMode.LINE_DELIMITED) {
            var line = Arrays.copyOf(body, body.length + 1);
            line[body.length] = '\n';
            return line;
        }
        var header = ("Content-Length: " + body.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
        var framed = Arrays.copyOf(header, header.length + body.length);
        System.arraycopy(body, 0, framed, header.length, body.length);
        return framed;
    }

    private @Nullable String nextLine() {
        int newline = indexOf((byte) '\n', start);
        if (newline < 0) {
            return null;
        }
        int lineEnd = newline > start && buffer[newline - 1] == '\r' ? newline - 1 : newline;
        var line = new String(buffer, start, lineEnd - start, StandardCharsets.UTF_8);
        start = newline + 1;
        return line;
    }

    /**
     * Returns the next frame body, {@code null} if incomplete, or an empty string for dropped input. A line that is
     * not a {@code Name: value} header is stray server output: it is dropped on its own, or together with the header
     * lines before it, so the records after it still get through.
     */
    private @Nullable String nextFrame() {
        int lineStart = start;
        while (true) {
            int newline = indexOf((byte) '\n', lineStart);
            if (newline < 0) {
                if (end - start > MAX_HEADER_BYTES) {
                    logger.warn("Discarding {} bytes without a header terminator", end - start);
                    start = end;
                    return "";
                }
                return null;
            }
            int lineEnd = newline > lineStart && buffer[newline - 1] == '\r' ? newline - 1 : newline;
            if (lineEnd == lineStart) {
                return frameBody(lineStart, newline + 1);
            }
            if (!isHeaderLine(lineStart, lineEnd)) {
                int dropEnd = lineStart == start ? newline + 1 : lineStart;
                logger.warn(
                        "Dropping non-protocol output: {}",
                        new String(buffer, start, dropEnd - start, StandardCharsets.UTF_8).strip());
                start = dropEnd;
                return "";
            }
            lineStart = newline + 1;
        }
    }

    private @Nullable String frameBody(int headerEnd, int bodyStart) {
        var headers = new String(buffer, start, headerEnd - start, StandardCharsets.US_ASCII);
        int contentLength = parseContentLength(headers);
        if (contentLength < 0) {
            logger.warn("Dropping frame with invalid headers: {}", headers.strip());
            start = bodyStart;
            return "";
        }
        if (end - bodyStart < contentLength) {
            return null;
        }
        var body = new String(buffer, bodyStart, contentLength, StandardCharsets.UTF_8);
        start = bodyStart + contentLength;
        return body;
    }

    private boolean isHeaderLine(int from, int to) {
        int colon = from;
        while (colon < to && buffer[colon] != ':') {
            colon++;
        }
        if (colon == from || colon == to) {
            return false;
        }
        for (int i = from; i < colon; i++) {
            byte b = buffer[i];
            boolean token = (b >= 'A' && b <= 'Z') || (b >= 'a' && b <= 'z') || (b >= '0' && b <= '9') || b == '-';
            if (!token) {
                return false;
            }
        }
        return true;
    }

    private static int parseContentLength(String headers) {
        for (var line : headers.split("\r?\n")) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            var name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            if (name.equals(CONTENT_LENGTH)) {
                try {
                    return Integer.parseInt(line.substring(colon + 1).trim());
                } catch (NumberFormatException e) {
                    return -1;
                }
            }
        }
        return -1;
    }

    private void skipBlank() {
        while (start < end) {
            byte b = buffer[start];
            if (b != ' ' && b != '\t' && b != '\r' && b != '\n') {
                return;
            }
            start++;
        }
    }

    private int indexOf(byte target, int from) {
        for (int i = from; i < end; i++) {
            if (buffer[i] == target) {
                return i;
            }
        }
        return -1;
    }

    private void append(byte[] chunk, int offset, int length) {
        if (end + length > buffer.length) {
            compact();
            if (end + length > buffer.length) {
                buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, end + length));
            }
        }
        System.arraycopy(chunk, offset, buffer, end, length);
        end += length;
    }

    private void compact() {
        if (start == 0) {
            return;
        }
        System.arraycopy(buffer, start, buffer, 0, end - start);
        end -= start;
        start = 0;
    }
}
