package com.williamcallahan.book_archive_engine.testutil;

import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZOutputFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds zip, 7z and INPX fixtures on disk for archive tests.
 */
public final class ArchiveFixtures {

    public static final char SEP = '\u0004';

    private ArchiveFixtures() {
    }

    public static Map<String, byte[]> members(Object... nameAndContent) {
        Map<String, byte[]> members = new LinkedHashMap<>();
        for (int i = 0; i < nameAndContent.length; i += 2) {
            Object content = nameAndContent[i + 1];
            members.put((String) nameAndContent[i], content instanceof byte[] bytes
                ? bytes
                : content.toString().getBytes(StandardCharsets.UTF_8));
        }
        return members;
    }

    public static byte[] zipBytes(Map<String, byte[]> members, int method) throws IOException {
        return zipBytes(members, name -> method == ZipEntry.STORED);
    }

    /**
     * Zip with a per-entry choice between stored and deflated.
     */
    public static byte[] zipBytes(Map<String, byte[]> members, Predicate<String> stored) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
            for (Map.Entry<String, byte[]> member : members.entrySet()) {
                ZipEntry entry = new ZipEntry(member.getKey());
                if (stored.test(member.getKey())) {
                    CRC32 crc = new CRC32();
                    crc.update(member.getValue());
                    entry.setMethod(ZipEntry.STORED);
                    entry.setSize(member.getValue().length);
                    entry.setCompressedSize(member.getValue().length);
                    entry.setCrc(crc.getValue());
                } else {
                    entry.setMethod(ZipEntry.DEFLATED);
                }
                zip.putNextEntry(entry);
                zip.write(member.getValue());
                zip.closeEntry();
            }
        }
        return buffer.toByteArray();
    }

    public static Path writeZip(Path file, Map<String, byte[]> members) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, zipBytes(members, ZipEntry.DEFLATED));
        return file;
    }

    public static Path write7z(Path file, Map<String, byte[]> members) throws IOException {
        Files.createDirectories(file.getParent());
        try (SevenZOutputFile sevenZ = new SevenZOutputFile(file.toFile())) {
            for (Map.Entry<String, byte[]> member : members.entrySet()) {
                SevenZArchiveEntry entry = new SevenZArchiveEntry();
                entry.setName(member.getKey());
                entry.setDirectory(false);
                sevenZ.putArchiveEntry(entry);
                sevenZ.write(member.getValue());
                sevenZ.closeArchiveEntry();
            }
        }
        return file;
    }

    /**
     * Drop the end-of-central-directory record so standard zip readers reject the file.
     */
    public static byte[] stripEndOfCentralDirectory(byte[] zip) {
        for (int i = zip.length - 22; i >= 0; i--) {
            if (zip[i] == 'P' && zip[i + 1] == 'K' && zip[i + 2] == 5 && zip[i + 3] == 6) {
                return Arrays.copyOf(zip, i);
            }
        }
        throw new IllegalArgumentException("No end-of-central-directory record");
    }

    /**
     * Overwrite the compression method of the named entry in both its local and central headers.
     */
    public static byte[] patchMethod(byte[] zip, String entryName, int method) {
        byte[] patched = zip.clone();
        byte[] name = entryName.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i + 46 <= patched.length; i++) {
            if (matches(patched, i, 0x02014b50) && nameAt(patched, i + 46, readShort(patched, i + 28), name)) {
                writeShort(patched, i + 10, method);
                int local = readInt(patched, i + 42);
                writeShort(patched, local + 8, method);
            }
        }
        return patched;
    }

    public static String inpLine(String... fields) {
        StringBuilder sb = new StringBuilder();
        for (String field : fields) {
            sb.append(field).append(SEP);
        }
        return sb.toString();
    }

    public static Path writeFile(Path file, byte[] content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, content);
        return file;
    }

    private static boolean matches(byte[] data, int pos, int signature) {
        return readInt(data, pos) == signature;
    }

    private static boolean nameAt(byte[] data, int pos, int length, byte[] name) {
        if (length != name.length || pos + length > data.length) {
            return false;
        }
        return Arrays.equals(Arrays.copyOfRange(data, pos, pos + length), name);
    }

    private static int readShort(byte[] data, int pos) {
        return (data[pos] & 0xff) | ((data[pos + 1] & 0xff) << 8);
    }

    private static int readInt(byte[] data, int pos) {
        if (pos + 4 > data.length) {
            return 0;
        }
        return (data[pos] & 0xff) | ((data[pos + 1] & 0xff) << 8)
            | ((data[pos + 2] & 0xff) << 16) | ((data[pos + 3] & 0xff) << 24);
    }

    private static void writeShort(byte[] data, int pos, int value) {
        data[pos] = (byte) value;
        data[pos + 1] = (byte) (value >>> 8);
    }
}
