package software.amazon.ahocorasick;

import java.util.Arrays;

/**
 * Compresses the 256 possible byte values into a dense code space holding only the bytes that appear in the
 * dictionary. Codes are handed out in order of first appearance and never change once the map is frozen, so a code
 * can be used directly as a column index into an edge table row of width {@link #size()}.
 */
class AlphabetMap {

    public static final int NO_CODE = -1;

    static final int MAX_ALPHABET_SIZE = 256;

    private final int[] codes = new int[MAX_ALPHABET_SIZE];
    private final int maxSize;
    private int size;
    private boolean frozen;

    AlphabetMap() {
        this(MAX_ALPHABET_SIZE);
    }

    AlphabetMap(final int maxSize) {
        if (maxSize <= 0 || maxSize > MAX_ALPHABET_SIZE) {
            throw new IllegalArgumentException("maxSize must be in [1, " + MAX_ALPHABET_SIZE + "]");
        }
        this.maxSize = maxSize;
        Arrays.fill(codes, NO_CODE);
    }

    /**
     * Returns the code for {@code b}, assigning the next free one if {@code b} has not been seen before.
     *
     * @param b the raw byte
     * @return the code for {@code b}
     * @throws IllegalStateException if the map is frozen and {@code b} is new
     * @throws AlphabetOverflowException if assigning a code would exceed the configured alphabet size
     */
    int register(final byte b) {
        final int index = b & 0xFF;
        int code = codes[index];
        if (code != NO_CODE) {
            return code;
        }
        if (frozen) {
            throw new IllegalStateException("Alphabet is frozen, cannot register byte " + index);
        }
        if (size == maxSize) {
            throw new AlphabetOverflowException(maxSize, index);
        }
        code = size++;
        codes[index] = code;
        return code;
    }

    /**
     * @param b the raw byte
     * @return the code assigned to {@code b}, or {@link #NO_CODE} if the byte never appeared in the dictionary
     */
    int codeOf(final byte b) {
        return codes[b & 0xFF];
    }

    boolean contains(final byte b) {
        return codeOf(b) != NO_CODE;
    }

    int size() {
        return size;
    }

    void freeze() {
        frozen = true;
    }

    boolean isFrozen() {
        return frozen;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("AlphabetMap{size=").append(size).append(", codes=[");
        boolean first = true;
        for (int i = 0; i < codes.length; i++) {
            if (codes[i] != NO_CODE) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(i).append("->").append(codes[i]);
                first = false;
            }
        }
        return sb.append("]}").toString();
    }
}
