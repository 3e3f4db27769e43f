package org.operaton.fedlink.security;

import java.math.BigInteger;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Multibase encodings: a one character prefix naming the base, followed by the
 * encoded bytes. Only the bases found in ActivityPub key and proof material are
 * supported.
 */
public enum Multibase {

    BASE16('f') {
        @Override
        String encodeBody(byte[] data) {
            return HexFormat.of().formatHex(data);
        }

        @Override
        byte[] decodeBody(String body) {
            return HexFormat.of().parseHex(body.toLowerCase());
        }
    },

    BASE58_BTC('z') {
        @Override
        String encodeBody(byte[] data) {
            return Base58.encode(data);
        }

        @Override
        byte[] decodeBody(String body) {
            return Base58.decode(body);
        }
    },

    BASE64('m') {
        @Override
        String encodeBody(byte[] data) {
            return Base64.getEncoder().withoutPadding().encodeToString(data);
        }

        @Override
        byte[] decodeBody(String body) {
            return Base64.getDecoder().decode(body);
        }
    },

    BASE64_URL('u') {
        @Override
        String encodeBody(byte[] data) {
            return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
        }

        @Override
        byte[] decodeBody(String body) {
            return Base64.getUrlDecoder().decode(body);
        }
    };

    private final char prefix;

    Multibase(char prefix) {
        this.prefix = prefix;
    }

    public char getPrefix() {
        return prefix;
    }

    public String encode(byte[] data) {
        return prefix + encodeBody(data);
    }

    abstract String encodeBody(byte[] data);

    abstract byte[] decodeBody(String body);

    /**
     * Decodes a multibase string, choosing the base by its prefix.
     *
     * @throws IllegalArgumentException if the prefix is unknown or the body is malformed
     */
    public static byte[] decode(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            throw new IllegalArgumentException("Empty multibase string");
        }
        char first = encoded.charAt(0);
        for (Multibase base : values()) {
            if (base.prefix == first) {
                return base.decodeBody(encoded.substring(1));
            }
        }
        throw new IllegalArgumentException("Unsupported multibase prefix: " + first);
    }

    /**
     * Bitcoin base58 alphabet. Leading zero bytes map to leading '1' characters.
     */
    private static final class Base58 {

        private static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
        private static final BigInteger RADIX = BigInteger.valueOf(58);

        static String encode(byte[] data) {
            int zeros = 0;
            while (zeros < data.length && data[zeros] == 0) {
                zeros++;
            }
            StringBuilder sb = new StringBuilder();
            BigInteger value = new BigInteger(1, data);
            while (value.signum() > 0) {
                BigInteger[] divmod = value.divideAndRemainder(RADIX);
                sb.append(ALPHABET.charAt(divmod[1].intValue()));
                value = divmod[0];
            }
            for (int i = 0; i < zeros; i++) {
                sb.append(ALPHABET.charAt(0));
            }
            return sb.reverse().toString();
        }

        static byte[] decode(String text) {
            BigInteger value = BigInteger.ZERO;
            int zeros = 0;
            while (zeros < text.length() && text.charAt(zeros) == ALPHABET.charAt(0)) {
                zeros++;
            }
            for (int i = 0; i < text.length(); i++) {
                int digit = ALPHABET.indexOf(text.charAt(i));
                if (digit < 0) {
                    throw new IllegalArgumentException("Invalid base58 character: " + text.charAt(i));
                }
                value = value.multiply(RADIX).add(BigInteger.valueOf(digit));
            }
            byte[] magnitude = value.toByteArray();
            // BigInteger adds a sign byte when the high bit is set
            int offset = magnitude.length > 1 && magnitude[0] == 0 ? 1 : 0;
            if (value.signum() == 0) {
                offset = magnitude.length;
            }
            byte[] result = new byte[zeros + magnitude.length - offset];
            System.arraycopy(magnitude, offset, result, zeros, magnitude.length - offset);
            return result;
        }
    }
}
