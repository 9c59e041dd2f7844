package com.williamcallahan.book_archive_engine.inpx;

import com.williamcallahan.book_archive_engine.exception.MalformedContainerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Recovers ZIP members from a buffer whose end-of-central-directory record is missing or
 * corrupt.
 *
 * <p>Central directory headers are self-describing, so the scan walks the buffer for every
 * header signature whose local-header offset leads to a local header with the same name
 * (first pass), then follows each header's local-header offset to the data
 * and decompresses it (second pass). The source buffer is never modified.</p>
 *
 * <p>Entries stored with a method other than stored (0) or deflate (8), entries whose local
 * header cannot be located and entries whose data fails to inflate are dropped individually;
 * only the total absence of central directory headers fails the scan.</p>
 */
public final class CentralDirectoryScanner {

    private static final Logger logger = LoggerFactory.getLogger(CentralDirectoryScanner.class);

    static final int CENTRAL_HEADER_SIGNATURE = 0x02014b50;
    static final int LOCAL_HEADER_SIGNATURE = 0x04034b50;
    static final int CENTRAL_HEADER_LENGTH = 46;
    static final int LOCAL_HEADER_LENGTH = 30;

    static final int METHOD_STORED = 0;
    static final int METHOD_DEFLATED = 8;

    private CentralDirectoryScanner() {
    }

    /**
     * One fixed-size central directory record plus its file name.
     */
    record CentralDirectoryEntry(String name, int method, long compressedSize, long uncompressedSize,
                                 long localHeaderOffset) {

        boolean isDirectory() {
            return name.endsWith("/");
        }
    }

    /**
     * Members recovered from the buffer, in central directory order, and the names of
     * entries that had to be dropped.
     */
    public record RecoveryResult(Map<String, byte[]> members, List<String> droppedEntries) {

        public RecoveryResult {
            members = Collections.unmodifiableMap(members);
            droppedEntries = List.copyOf(droppedEntries);
        }
    }

    /**
     * Recover every file member described by the central directory headers in {@code data}.
     *
     * @throws MalformedContainerException if the buffer holds no central directory header
     */
    public static RecoveryResult scan(byte[] data) {
        List<CentralDirectoryEntry> entries = readCentralDirectory(data);
        if (entries.isEmpty()) {
            throw new MalformedContainerException(null, "Central directory not found, cannot recover container");
        }

        Map<String, byte[]> members = new LinkedHashMap<>();
        List<String> dropped = new ArrayList<>();
        for (CentralDirectoryEntry entry : entries) {
            if (entry.isDirectory()) {
                continue;
            }
            byte[] content = readEntryData(data, entry);
            if (content == null) {
                dropped.add(entry.name());
            } else {
                members.put(entry.name(), content);
            }
        }
        logger.debug("Recovered {} of {} central directory entries", members.size(), entries.size());
        return new RecoveryResult(members, dropped);
    }

    /**
     * First pass: locate and decode every central directory header.
     */
    static List<CentralDirectoryEntry> readCentralDirectory(byte[] data) {
        List<CentralDirectoryEntry> entries = new ArrayList<>();
        int offset = 0;
        while (true) {
            int pos = indexOfSignature(data, CENTRAL_HEADER_SIGNATURE, offset);
            if (pos < 0 || pos + CENTRAL_HEADER_LENGTH > data.length) {
                break;
            }
            int method = readUnsignedShort(data, pos + 10);
            long compressedSize = readUnsignedInt(data, pos + 20);
            long uncompressedSize = readUnsignedInt(data, pos + 24);
            int nameLength = readUnsignedShort(data, pos + 28);
            long localHeaderOffset = readUnsignedInt(data, pos + 42);

            int nameStart = pos + CENTRAL_HEADER_LENGTH;
            if (!pointsAtMatchingLocalHeader(data, nameStart, nameLength, localHeaderOffset)) {
                // signature bytes inside member data, or a header cut off by truncation
                offset = pos + 4;
                continue;
            }
            String name = new String(data, nameStart, nameLength, StandardCharsets.UTF_8);
            entries.add(new CentralDirectoryEntry(name, method, compressedSize, uncompressedSize, localHeaderOffset));
            // extra and comment fields are not trusted to skip ahead; the next search starts after the name
            offset = nameStart + nameLength;
        }
        return entries;
    }

    /**
     * A central header is accepted only when its local-header offset lands on a local header
     * carrying the same file name.
     */
    static boolean pointsAtMatchingLocalHeader(byte[] data, int nameStart, int nameLength, long localHeaderOffset) {
        if (nameStart + nameLength > data.length || localHeaderOffset + LOCAL_HEADER_LENGTH > data.length) {
            return false;
        }
        int local = (int) localHeaderOffset;
        if (readInt(data, local) != LOCAL_HEADER_SIGNATURE || readUnsignedShort(data, local + 26) != nameLength) {
            return false;
        }
        int localNameStart = local + LOCAL_HEADER_LENGTH;
        if (localNameStart + nameLength > data.length) {
            return false;
        }
        return Arrays.equals(data, nameStart, nameStart + nameLength, data, localNameStart, localNameStart + nameLength);
    }

    /**
     * Second pass for one entry: follow the local header and decompress.
     *
     * @return the member bytes, or null when the entry cannot be recovered
     */
    static byte[] readEntryData(byte[] data, CentralDirectoryEntry entry) {
        long headerPos = entry.localHeaderOffset();
        if (headerPos + LOCAL_HEADER_LENGTH > data.length
                || readInt(data, (int) headerPos) != LOCAL_HEADER_SIGNATURE) {
            logger.warn("Dropping entry '{}': no local header at offset {}", entry.name(), headerPos);
            return null;
        }
        int localNameLength = readUnsignedShort(data, (int) headerPos + 26);
        int localExtraLength = readUnsignedShort(data, (int) headerPos + 28);
        long dataStart = headerPos + LOCAL_HEADER_LENGTH + localNameLength + localExtraLength;
        long dataEnd = dataStart + entry.compressedSize();
        if (dataEnd > data.length || entry.uncompressedSize() > Integer.MAX_VALUE) {
            logger.warn("Dropping entry '{}': data range {}-{} exceeds container", entry.name(), dataStart, dataEnd);
            return null;
        }

        switch (entry.method()) {
            case METHOD_STORED: {
                int length = (int) Math.min(entry.compressedSize(), entry.uncompressedSize());
                byte[] copy = new byte[length];
                System.arraycopy(data, (int) dataStart, copy, 0, length);
                return copy;
            }
            case METHOD_DEFLATED:
                return inflate(data, (int) dataStart, (int) entry.compressedSize(), (int) entry.uncompressedSize(), entry.name());
            default:
                logger.warn("Dropping entry '{}': unsupported compression method {}", entry.name(), entry.method());
                return null;
        }
    }

    private static byte[] inflate(byte[] data, int start, int length, int expectedSize, String name) {
        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(data, start, length);
            byte[] out = new byte[expectedSize];
            int written = 0;
            while (written < expectedSize && !inflater.finished()) {
                int n = inflater.inflate(out, written, expectedSize - written);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                written += n;
            }
            if (written != expectedSize) {
                logger.warn("Dropping entry '{}': inflated {} of {} bytes", name, written, expectedSize);
                return null;
            }
            return out;
        } catch (DataFormatException e) {
            logger.warn("Dropping entry '{}': corrupt deflate data ({})", name, e.getMessage());
            return null;
        } finally {
            inflater.end();
        }
    }

    static int indexOfSignature(byte[] data, int signature, int from) {
        byte b0 = (byte) signature;
        byte b1 = (byte) (signature >>> 8);
        byte b2 = (byte) (signature >>> 16);
        byte b3 = (byte) (signature >>> 24);
        for (int i = Math.max(0, from); i + 3 < data.length; i++) {
            if (data[i] == b0 && data[i + 1] == b1 && data[i + 2] == b2 && data[i + 3] == b3) {
                return i;
            }
        }
        return -1;
    }

    private static int readUnsignedShort(byte[] data, int pos) {
        return (data[pos] & 0xff) | ((data[pos + 1] & 0xff) << 8);
    }

    private static int readInt(byte[] data, int pos) {
        return (data[pos] & 0xff)
            | ((data[pos + 1] & 0xff) << 8)
            | ((data[pos + 2] & 0xff) << 16)
            | ((data[pos + 3] & 0xff) << 24);
    }

    private static long readUnsignedInt(byte[] data, int pos) {
        return readInt(data, pos) & 0xffffffffL;
    }
}
