package com.sqldumpextract;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary table file codec (header + row values).
 * Format:
 *  - magic "SQDR" (4 bytes)
 *  - version u32 LE (2)
 *  - column count u32 LE
 *  - columns: [len u32 LE][bytes]...
 *  - rows: [val count u32 LE]([len i32 LE][bytes])..., len -1 is NULL
 */
public final class TableBinIO {
    private static final byte[] MAGIC = new byte[] { 'S', 'Q', 'D', 'R' };
    private static final int VERSION = 2;
    private static final int NULL_LENGTH = -1;
    private static final int MAX_COLUMNS = 65_536;

    private TableBinIO() {}

    public static TableBinWriter openWriter(Path path, List<String> columns) throws IOException {
        OutputStream out = new BufferedOutputStream(Files.newOutputStream(path));
        writeHeader(out, columns);
        return new TableBinWriter(out, columns.size());
    }

    public static TableBinReader openReader(Path path) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(path));
        try {
            List<String> columns = readHeader(in);
            return new TableBinReader(in, columns);
        } catch (IOException e) {
            in.close();
            throw e;
        }
    }

    private static void writeHeader(OutputStream out, List<String> columns) throws IOException {
        out.write(MAGIC);
        writeU32(out, VERSION);
        writeU32(out, columns.size());
        for (String col : columns) {
            writeValue(out, col);
        }
    }

    private static List<String> readHeader(InputStream in) throws IOException {
        byte[] magic = in.readNBytes(4);
        if (magic.length < 4 || magic[0] != MAGIC[0] || magic[1] != MAGIC[1] || magic[2] != MAGIC[2]
                || magic[3] != MAGIC[3]) {
            throw new IOException("invalid table file magic");
        }
        int version = readU32(in);
        if (version != VERSION) {
            throw new IOException("unsupported table file version: " + version);
        }
        int colCount = readCount(in);
        List<String> columns = new ArrayList<>(colCount);
        for (int i = 0; i < colCount; i++) {
            String col = readValue(in);
            columns.add(col == null ? "" : col);
        }
        return columns;
    }

    private static void writeU32(OutputStream out, int value) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(value);
        out.write(buf.array());
    }

    private static int readU32(InputStream in) throws IOException {
        byte[] b = in.readNBytes(4);
        if (b.length < 4) {
            throw new EOFException();
        }
        return ByteBuffer.wrap(b).order(ByteOrder.LITTLE_ENDIAN).getInt();
    }

    private static int readCount(InputStream in) throws IOException {
        int count = readU32(in);
        if (count < 0 || count > MAX_COLUMNS) {
            throw new IOException("invalid count: " + count);
        }
        return count;
    }

    private static void writeValue(OutputStream out, String value) throws IOException {
        if (value == null) {
            writeU32(out, NULL_LENGTH);
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeU32(out, bytes.length);
        if (bytes.length > 0) {
            out.write(bytes);
        }
    }

    private static String readValue(InputStream in) throws IOException {
        int len = readU32(in);
        if (len == NULL_LENGTH) {
            return null;
        }
        if (len < 0) {
            throw new IOException("invalid length: " + len);
        }
        byte[] b = in.readNBytes(len);
        if (b.length < len) {
            throw new EOFException();
        }
        return new String(b, StandardCharsets.UTF_8);
    }

    public static final class TableBinWriter implements Closeable {
        private final OutputStream out;
        private final int columnCount;

        private TableBinWriter(OutputStream out, int columnCount) {
            this.out = out;
            this.columnCount = columnCount;
        }

        public void writeRow(List<String> values) throws IOException {
            if (values.size() != columnCount) {
                throw new IOException("row has " + values.size() + " values, table has " + columnCount + " columns");
            }
            writeU32(out, columnCount);
            for (String val : values) {
                writeValue(out, val);
            }
        }

        @Override
        public void close() throws IOException {
            out.close();
        }
    }

    public static final class TableBinReader implements Closeable {
        private final InputStream in;
        private final List<String> columns;

        private TableBinReader(InputStream in, List<String> columns) {
            this.in = in;
            this.columns = columns;
        }

        public List<String> columns() {
            return columns;
        }

        /**
         * Next row, or null at end of file. Values may be null.
         */
        public List<String> readRow() throws IOException {
            int count;
            try {
                count = readCount(in);
            } catch (EOFException eof) {
                return null;
            }
            List<String> values = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                values.add(readValue(in));
            }
            return values;
        }

        @Override
        public void close() throws IOException {
            in.close();
        }
    }
}
