package io.instancegate.util;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.util.Locale;
import java.util.Optional;

public final class HexCodec {
    private HexCodec() {
    }

    public static String encode(byte[] bytes) {
        return bytes == null ? "" : Hex.toHexString(bytes);
    }

    public static Optional<byte[]> decode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.isEmpty() || (value.length() % 2) != 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(Hex.decode(value));
        } catch (DecoderException e) {
            return Optional.empty();
        }
    }

    public static Optional<byte[]> decodeExact(String raw, int length) {
        return decode(raw).filter(bytes -> bytes.length == length);
    }

    public static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }
}
