// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.covenant.primitives;

import java.util.Arrays;
import java.util.Optional;

/**
 * Base58 codec using the Bitcoin alphabet.
 *
 * <p>The alphabet is the digits and mixed-case letters without {@code 0}, {@code O},
 * {@code I} and {@code l}. Each leading {@code '1'} in the text maps to one leading
 * zero byte, independently of the numeric conversion of the remaining symbols.
 *
 * <p>Decoding runs a big-endian multiply-accumulate over a fixed scratch buffer of
 * {@link #MAX_DECODED_LENGTH} bytes. Input whose value does not fit the buffer is
 * rejected rather than truncated.
 *
 * @since 0.1.0
 */
public final class Base58 {

    /** Upper bound on decoded output, leading zero bytes included. */
    public static final int MAX_DECODED_LENGTH = 64;

    private static final char[] ALPHABET =
            "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();
    private static final char ZERO_SYMBOL = ALPHABET[0];
    private static final int[] INDEXES = new int[128];

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length; i++) {
            INDEXES[ALPHABET[i]] = i;
        }
    }

    private Base58() {
        // Utility class
    }

    /**
     * Decodes base58 text.
     *
     * @param input the base58 text (may be empty)
     * @return the decoded bytes, or empty if the text contains a symbol outside the
     *         alphabet or the value overflows the scratch buffer
     * @throws NullPointerException if input is null
     */
    public static Optional<byte[]> decode(final String input) {
        if (input == null) {
            throw new NullPointerException("input");
        }

        int zeros = 0;
        while (zeros < input.length() && input.charAt(zeros) == ZERO_SYMBOL) {
            zeros++;
        }
        if (zeros > MAX_DECODED_LENGTH) {
            return Optional.empty();
        }

        // buffer[MAX - used .. MAX) holds the big-endian value of the symbols seen so far
        final byte[] buffer = new byte[MAX_DECODED_LENGTH];
        int used = 0;

        for (int i = zeros; i < input.length(); i++) {
            final char c = input.charAt(i);
            final int digit = c < INDEXES.length ? INDEXES[c] : -1;
            if (digit < 0) {
                return Optional.empty();
            }

            int carry = digit;
            int j = MAX_DECODED_LENGTH - 1;
            for (int k = 0; (carry != 0 || k < used) && j >= 0; k++, j--) {
                carry += 58 * (buffer[j] & 0xFF);
                buffer[j] = (byte) carry;
                carry >>>= 8;
            }
            if (carry != 0) {
                return Optional.empty();
            }
            used = MAX_DECODED_LENGTH - 1 - j;
        }

        if (zeros + used > MAX_DECODED_LENGTH) {
            return Optional.empty();
        }

        final byte[] result = new byte[zeros + used];
        System.arraycopy(buffer, MAX_DECODED_LENGTH - used, result, zeros, used);
        return Optional.of(result);
    }

    /**
     * Encodes bytes as base58 text.
     *
     * @param input the bytes to encode
     * @return the base58 text ({@code ""} for an empty array)
     * @throws NullPointerException if input is null
     */
    public static String encode(final byte[] input) {
        if (input == null) {
            throw new NullPointerException("input");
        }
        if (input.length == 0) {
            return "";
        }

        int zeros = 0;
        while (zeros < input.length && input[zeros] == 0) {
            zeros++;
        }

        // base58 needs at most log(256)/log(58) ~ 1.37 symbols per byte
        final byte[] digits = new byte[input.length * 138 / 100 + 1];
        int used = 0;

        for (int i = zeros; i < input.length; i++) {
            int carry = input[i] & 0xFF;
            int j = digits.length - 1;
            for (int k = 0; (carry != 0 || k < used) && j >= 0; k++, j--) {
                carry += 256 * digits[j];
                digits[j] = (byte) (carry % 58);
                carry /= 58;
            }
            used = digits.length - 1 - j;
        }

        final StringBuilder sb = new StringBuilder(zeros + used);
        for (int i = 0; i < zeros; i++) {
            sb.append(ZERO_SYMBOL);
        }
        for (int i = digits.length - used; i < digits.length; i++) {
            sb.append(ALPHABET[digits[i]]);
        }
        return sb.toString();
    }
}
