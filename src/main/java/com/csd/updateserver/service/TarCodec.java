package com.csd.updateserver.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Streaming TAR (USTAR header layout) writer and reader, with gzip wrappers. This is the format
 * device updaters unpack, so headers must stay readable by standard tar tooling.
 *
 * <p>Both directions check the thread's interrupt flag between files and between chunks and abort
 * with {@link InterruptedIOException}.</p>
 */
@Slf4j
@Service
public class TarCodec {

    public static final int BLOCK_SIZE = 512;

    private static final int NAME_OFFSET = 0;
    private static final int NAME_LENGTH = 100;
    private static final int MODE_OFFSET = 100;
    private static final int UID_OFFSET = 108;
    private static final int GID_OFFSET = 116;
    private static final int SIZE_OFFSET = 124;
    private static final int SIZE_LENGTH = 12;
    private static final int MTIME_OFFSET = 136;
    private static final int CHECKSUM_OFFSET = 148;
    private static final int CHECKSUM_LENGTH = 8;
    private static final int TYPEFLAG_OFFSET = 156;
    private static final int MAGIC_OFFSET = 257;
    private static final int VERSION_OFFSET = 263;

    private static final String REGULAR_MODE = "0000644 ";
    private static final String EXECUTABLE_MODE = "0000755 ";
    private static final String ZERO_ID = "0000000 ";

    /** Largest size that fits the 11 octal digits of the size field, 8 GiB minus one. */
    static final long MAX_ENTRY_SIZE = 077777777777L;

    public void createTarGz(Path sourceDir, Path archive) throws IOException {
        log.debug("Creating tar.gz archive: {}", archive);
        try (OutputStream file = Files.newOutputStream(archive);
             GZIPOutputStream gzip = new GZIPOutputStream(new BufferedOutputStream(file))) {
            encode(sourceDir, gzip);
        }
    }

    public int extractTarGz(Path archive, Path destRoot) throws IOException {
        log.debug("Extracting {} to {}", archive, destRoot);
        try (InputStream file = Files.newInputStream(archive);
             GZIPInputStream gzip = new GZIPInputStream(new BufferedInputStream(file))) {
            return decode(gzip, destRoot);
        }
    }

    /**
     * Writes every regular file below {@code rootDir} as a tar stream. Entries are sorted by their
     * relative path. The stream is not closed.
     */
    public void encode(Path rootDir, OutputStream out) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(rootDir)) {
            files = walk.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        }

        byte[] buffer = new byte[8192];
        for (Path file : files) {
            checkInterrupted();
            String relativePath = rootDir.relativize(file).toString().replace('\\', '/');
            long size = Files.size(file);
            long mtime = Files.getLastModifiedTime(file).toMillis() / 1000L;

            out.write(header(relativePath, size, mtime, Files.isExecutable(file)));

            long written = 0;
            try (InputStream in = Files.newInputStream(file)) {
                int read;
                while (written < size && (read = in.read(buffer, 0, (int) Math.min(buffer.length, size - written))) != -1) {
                    checkInterrupted();
                    out.write(buffer, 0, read);
                    written += read;
                }
            }
            if (written != size) {
                throw new IOException("File changed while archiving: " + file);
            }
            int padding = padding(size);
            if (padding > 0) {
                out.write(new byte[padding]);
            }
        }

        out.write(new byte[BLOCK_SIZE]);
        out.write(new byte[BLOCK_SIZE]);
        out.flush();
    }

    /**
     * Extracts a tar stream into {@code destRoot}. Entries that would land outside of it are skipped
     * while their content is still consumed, so later entries stay aligned.
     *
     * @return the number of files written
     */
    public int decode(InputStream in, Path destRoot) throws IOException {
        Files.createDirectories(destRoot);
        Path root = destRoot.toAbsolutePath().normalize();
        byte[] header = new byte[BLOCK_SIZE];
        byte[] buffer = new byte[8192];
        int extracted = 0;

        while (true) {
            checkInterrupted();
            if (!readBlock(in, header) || isZeroBlock(header)) {
                break;
            }
            String name = parseName(header);
            long size = parseOctal(header, SIZE_OFFSET, SIZE_LENGTH);
            char type = (char) header[TYPEFLAG_OFFSET];

            String sanitized = name.replace('\\', '/').replaceAll("^/+", "");
            Path target = root.resolve(sanitized).normalize();
            boolean regularFile = type == '0' || type == '\0';

            if (sanitized.isEmpty() || !target.startsWith(root) || target.equals(root)) {
                log.warn("Skipping file with suspicious path: {}", name);
                skip(in, size + padding(size), buffer);
                continue;
            }
            if (!regularFile) {
                if (type == '5') {
                    Files.createDirectories(target);
                }
                skip(in, size + padding(size), buffer);
                continue;
            }

            Files.createDirectories(target.getParent());
            try (OutputStream file = Files.newOutputStream(target)) {
                long remaining = size;
                while (remaining > 0) {
                    checkInterrupted();
                    int read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining));
                    if (read == -1) {
                        throw new EOFException("Unexpected end of archive in entry " + name);
                    }
                    file.write(buffer, 0, read);
                    remaining -= read;
                }
            }
            skip(in, padding(size), buffer);
            extracted++;
        }
        return extracted;
    }

    byte[] header(String name, long size, long mtimeSeconds, boolean executable) throws IOException {
        if (size < 0 || size > MAX_ENTRY_SIZE) {
            throw new IOException("Tar entry " + name + " is too large (" + size + " bytes, limit " + MAX_ENTRY_SIZE + ")");
        }
        byte[] header = new byte[BLOCK_SIZE];

        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        int nameLength = nameBytes.length;
        if (nameLength > NAME_LENGTH) {
            nameLength = NAME_LENGTH;
            // do not split a multi-byte character
            while (nameLength > 0 && (nameBytes[nameLength] & 0xC0) == 0x80) {
                nameLength--;
            }
            log.warn("Tar entry name truncated to {} bytes: {}", nameLength, name);
        }
        System.arraycopy(nameBytes, 0, header, NAME_OFFSET, nameLength);

        putAscii(header, MODE_OFFSET, executable ? EXECUTABLE_MODE : REGULAR_MODE);
        putAscii(header, UID_OFFSET, ZERO_ID);
        putAscii(header, GID_OFFSET, ZERO_ID);
        putAscii(header, SIZE_OFFSET, octal(size, 11) + " ");
        putAscii(header, MTIME_OFFSET, octal(mtimeSeconds, 11) + " ");
        header[TYPEFLAG_OFFSET] = '0';
        putAscii(header, MAGIC_OFFSET, "ustar");
        putAscii(header, VERSION_OFFSET, "00");

        putAscii(header, CHECKSUM_OFFSET, octal(checksum(header), 6) + " \0");
        return header;
    }

    /**
     * Sum of all header bytes with the checksum field counted as ASCII spaces.
     */
    static long checksum(byte[] header) {
        long sum = 0;
        for (int i = 0; i < BLOCK_SIZE; i++) {
            if (i >= CHECKSUM_OFFSET && i < CHECKSUM_OFFSET + CHECKSUM_LENGTH) {
                sum += 0x20;
            } else {
                sum += header[i] & 0xFF;
            }
        }
        return sum;
    }

    static int padding(long size) {
        return (int) ((BLOCK_SIZE - (size % BLOCK_SIZE)) % BLOCK_SIZE);
    }

    private static String parseName(byte[] header) {
        int end = NAME_OFFSET;
        while (end < NAME_OFFSET + NAME_LENGTH && header[end] != 0) {
            end++;
        }
        return new String(header, NAME_OFFSET, end - NAME_OFFSET, StandardCharsets.UTF_8);
    }

    static long parseOctal(byte[] header, int offset, int length) {
        long value = 0;
        for (int i = offset; i < offset + length; i++) {
            byte b = header[i];
            if (b == 0 || b == ' ') {
                if (value == 0 && b == ' ') continue; // leading spaces
                break;
            }
            if (b < '0' || b > '7') {
                return 0;
            }
            value = (value << 3) + (b - '0');
        }
        return value;
    }

    private static String octal(long value, int width) {
        String digits = Long.toOctalString(value);
        if (digits.length() >= width) {
            return digits;
        }
        return "0".repeat(width - digits.length()) + digits;
    }

    private static void putAscii(byte[] header, int offset, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(bytes, 0, header, offset, bytes.length);
    }

    // false on a clean end of stream
    private static boolean readBlock(InputStream in, byte[] block) throws IOException {
        int total = 0;
        while (total < block.length) {
            int read = in.read(block, total, block.length - total);
            if (read == -1) {
                if (total == 0) return false;
                throw new EOFException("Truncated tar header");
            }
            total += read;
        }
        return true;
    }

    private static boolean isZeroBlock(byte[] block) {
        for (byte b : block) {
            if (b != 0) return false;
        }
        return true;
    }

    private static void skip(InputStream in, long count, byte[] buffer) throws IOException {
        long remaining = count;
        while (remaining > 0) {
            int read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining));
            if (read == -1) {
                throw new EOFException("Unexpected end of archive");
            }
            remaining -= read;
        }
    }

    private static void checkInterrupted() throws InterruptedIOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("Archive streaming cancelled");
        }
    }
}
