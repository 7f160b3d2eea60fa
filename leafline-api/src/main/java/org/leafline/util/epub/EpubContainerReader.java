package org.leafline.util.epub;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Minimal PKZIP reader for EPUB containers. Only Store (0) and DEFLATE (8) entries are
 * extracted; every read is bounds-checked against the buffer.
 */
@Slf4j
public final class EpubContainerReader {

    static final int EOCD_SIGNATURE = 0x06054b50;
    static final int CENTRAL_HEADER_SIGNATURE = 0x02014b50;
    static final int LOCAL_HEADER_SIGNATURE = 0x04034b50;

    static final int EOCD_MIN_SIZE = 22;
    static final int CENTRAL_HEADER_SIZE = 46;
    static final int LOCAL_HEADER_SIZE = 30;

    static final int METHOD_STORE = 0;
    static final int METHOD_DEFLATE = 8;

    /** Upper bound for a single extracted entry. */
    static final long MAX_ENTRY_SIZE = 256L * 1024 * 1024;

    private static final int INFLATE_CHUNK = 8192;

    private EpubContainerReader() {
    }

    public static EpubContainer read(byte[] buffer) {
        if (buffer == null || buffer.length < EOCD_MIN_SIZE) {
            return EpubContainer.empty();
        }

        int eocdOffset = findEndOfCentralDirectory(buffer);
        if (eocdOffset < 0) {
            log.debug("No end-of-central-directory record in {} byte buffer", buffer.length);
            return EpubContainer.empty();
        }

        int entryCount = u16(buffer, eocdOffset + 10);
        long centralDirOffset = u32(buffer, eocdOffset + 16);

        Map<String, byte[]> entries = new LinkedHashMap<>();
        long offset = centralDirOffset;
        for (int i = 0; i < entryCount; i++) {
            if (!fits(buffer, offset, CENTRAL_HEADER_SIZE)) {
                log.debug("Central directory truncated after {} of {} entries", i, entryCount);
                break;
            }
            int header = (int) offset;
            if (s32(buffer, header) != CENTRAL_HEADER_SIGNATURE) {
                log.debug("Bad central header signature at offset {}", header);
                break;
            }

            int method = u16(buffer, header + 10);
            long compressedSize = u32(buffer, header + 20);
            long uncompressedSize = u32(buffer, header + 24);
            int nameLength = u16(buffer, header + 28);
            int extraLength = u16(buffer, header + 30);
            int commentLength = u16(buffer, header + 32);
            long localHeaderOffset = u32(buffer, header + 42);

            if (!fits(buffer, header + CENTRAL_HEADER_SIZE, nameLength)) {
                log.debug("Entry name runs past buffer at offset {}", header);
                break;
            }
            String name = new String(buffer, header + CENTRAL_HEADER_SIZE, nameLength, StandardCharsets.UTF_8);
            offset = header + (long) CENTRAL_HEADER_SIZE + nameLength + extraLength + commentLength;

            if (name.endsWith("/")) {
                continue;
            }

            byte[] data = readEntry(buffer, name, method, localHeaderOffset, compressedSize, uncompressedSize);
            if (data != null) {
                entries.put(name, data);
            }
        }

        return EpubContainer.of(entries);
    }

    static int findEndOfCentralDirectory(byte[] buffer) {
        for (int i = buffer.length - EOCD_MIN_SIZE; i >= 0; i--) {
            if (s32(buffer, i) == EOCD_SIGNATURE) {
                return i;
            }
        }
        return -1;
    }

    private static byte[] readEntry(byte[] buffer, String name, int method, long localHeaderOffset,
                                    long compressedSize, long uncompressedSize) {
        if (!fits(buffer, localHeaderOffset, LOCAL_HEADER_SIZE)) {
            log.debug("Local header for '{}' runs past buffer", name);
            return null;
        }
        int local = (int) localHeaderOffset;
        if (s32(buffer, local) != LOCAL_HEADER_SIGNATURE) {
            log.debug("Bad local header signature for '{}'", name);
            return null;
        }

        long dataOffset = local + (long) LOCAL_HEADER_SIZE + u16(buffer, local + 26) + u16(buffer, local + 28);
        if (!fits(buffer, dataOffset, compressedSize)) {
            log.debug("Data for '{}' runs past buffer", name);
            return null;
        }
        int start = (int) dataOffset;
        int length = (int) compressedSize;

        switch (method) {
            case METHOD_STORE:
                return Arrays.copyOfRange(buffer, start, start + length);
            case METHOD_DEFLATE:
                return inflateRaw(buffer, start, length, uncompressedSize, name);
            default:
                log.debug("Skipping '{}': unsupported compression method {}", name, method);
                return null;
        }
    }

    /**
     * Inflates at most {@code expectedSize} bytes, the size the central directory declares. An
     * entry that inflates past it, or declares more than {@link #MAX_ENTRY_SIZE}, is dropped.
     */
    private static byte[] inflateRaw(byte[] buffer, int start, int length, long expectedSize, String name) {
        if (expectedSize > MAX_ENTRY_SIZE) {
            log.debug("Skipping '{}': declared size {} exceeds limit", name, expectedSize);
            return null;
        }
        // nowrap inflation may need one trailing byte past the deflate stream
        byte[] input = new byte[length + 1];
        System.arraycopy(buffer, start, input, 0, length);

        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(input);
            int initial = (int) Math.min(Math.max(expectedSize, 64), 16L * 1024 * 1024);
            ByteArrayOutputStream out = new ByteArrayOutputStream(initial);
            byte[] chunk = new byte[INFLATE_CHUNK];
            while (!inflater.finished()) {
                int n = inflater.inflate(chunk);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    log.debug("Deflate stream for '{}' is truncated", name);
                    return null;
                }
                if (out.size() + (long) n > expectedSize) {
                    log.debug("Deflate stream for '{}' inflates past its declared size {}", name, expectedSize);
                    return null;
                }
                out.write(chunk, 0, n);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            log.debug("Failed to inflate '{}': {}", name, e.getMessage());
            return null;
        } finally {
            inflater.end();
        }
    }

    static boolean fits(byte[] buffer, long offset, long length) {
        return offset >= 0 && length >= 0 && offset + length <= buffer.length;
    }

    static int u16(byte[] b, int offset) {
        return (b[offset] & 0xff) | (b[offset + 1] & 0xff) << 8;
    }

    static long u32(byte[] b, int offset) {
        return s32(b, offset) & 0xffffffffL;
    }

    static int s32(byte[] b, int offset) {
        return (b[offset] & 0xff)
                | (b[offset + 1] & 0xff) << 8
                | (b[offset + 2] & 0xff) << 16
                | (b[offset + 3] & 0xff) << 24;
    }
}
