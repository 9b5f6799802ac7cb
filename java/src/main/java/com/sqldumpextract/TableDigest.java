package com.sqldumpextract;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.Blake3;

/**
 * Running BLAKE3 fingerprint of a table's rows, in write order.
 * <p>
 * Each value is length-prefixed and NULL has its own marker, so {@code NULL}
 * and {@code ''} hash differently.
 */
public final class TableDigest {
    private static final byte NULL_MARKER = 0;
    private static final byte VALUE_MARKER = 1;
    private static final byte ROW_END = '\n';

    private final Blake3 hasher = Blake3.initHash();

    public void update(List<String> values) {
        for (String value : values) {
            if (value == null) {
                hasher.update(new byte[] { NULL_MARKER });
                continue;
            }
            byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
            ByteBuffer header = ByteBuffer.allocate(5).order(ByteOrder.LITTLE_ENDIAN);
            header.put(VALUE_MARKER);
            header.putInt(bytes.length);
            hasher.update(header.array());
            hasher.update(bytes);
        }
        hasher.update(new byte[] { ROW_END });
    }

    public String hex() {
        return Hex.encodeHexString(hasher.doFinalize(32));
    }
}
