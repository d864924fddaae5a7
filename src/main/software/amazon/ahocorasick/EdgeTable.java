package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * A growable table of int cells organised in fixed-width rows, one column per alphabet code. Rows are appended on
 * demand and addressed by the offset of their first cell; they are never removed or moved relative to one another.
 * A cell holds a node index, or {@link #ABSENT} if it has not been filled in.
 */
class EdgeTable {

    private static final Logger LOG = LoggerFactory.getLogger(EdgeTable.class);

    public static final int ABSENT = -1;
    public static final int NO_ROW = -1;

    /**
     * Below this many cells the table doubles when it runs out of room. Past it, it grows by a quarter so a large,
     * mostly-resolved table doesn't overshoot by hundreds of megabytes.
     */
    private static final int DOUBLING_THRESHOLD = 1 << 20;

    private final String name;
    private final int width;
    private final IntArrayList cells;

    EdgeTable(final String name, final int width) {
        this(name, width, 1);
    }

    EdgeTable(final String name, final int width, final int expectedRows) {
        if (width < 0) {
            throw new IllegalArgumentException("width cannot be negative");
        }
        if (expectedRows < 0) {
            throw new IllegalArgumentException("expectedRows cannot be negative");
        }
        this.name = name;
        this.width = width;
        // an estimate only; anything past the doubling threshold is left to the growth policy
        final long expectedCells = Math.min((long) width * expectedRows, DOUBLING_THRESHOLD);
        this.cells = new IntArrayList((int) Math.max(1, expectedCells));
    }

    /**
     * Appends a row with every cell set to {@link #ABSENT}.
     *
     * @return the offset of the new row
     */
    int allocateRow() {
        final int offset = cells.size();
        final int newSize = offset + width;
        if (newSize < 0) {
            throw new IllegalStateException(name + " edge table cannot grow past " + offset + " cells");
        }
        final int capacity = capacity();
        if (newSize > capacity) {
            final int newCapacity = grownCapacity(capacity, newSize);
            LOG.debug("Growing {} edge table from {} to {} cells", name, capacity, newCapacity);
            cells.ensureCapacity(newCapacity);
        }
        cells.size(newSize);
        Arrays.fill(cells.elements(), offset, newSize, ABSENT);
        return offset;
    }

    int get(final int row, final int code) {
        return cells.getInt(row + code);
    }

    void set(final int row, final int code, final int value) {
        cells.set(row + code, value);
    }

    int width() {
        return width;
    }

    int rowCount() {
        return width == 0 ? 0 : cells.size() / width;
    }

    int cellCount() {
        return cells.size();
    }

    /**
     * @return how many cells fit before the table has to grow
     */
    int capacity() {
        return cells.elements().length;
    }

    /**
     * @return how many cells hold something other than {@link #ABSENT}
     */
    int filledCellCount() {
        final int[] elements = cells.elements();
        final int size = cells.size();
        int filled = 0;
        for (int i = 0; i < size; i++) {
            if (elements[i] != ABSENT) {
                filled++;
            }
        }
        return filled;
    }

    /**
     * Releases slack capacity once no more rows will be added.
     */
    void trim() {
        cells.trim();
    }

    private static int grownCapacity(final int capacity, final int minimum) {
        long grown;
        if (capacity < DOUBLING_THRESHOLD) {
            grown = Math.max(capacity, 1) * 2L;
        } else {
            grown = capacity + capacity / 4L;
        }
        // cap at what an array can hold
        grown = Math.min(grown, Integer.MAX_VALUE - 8);
        return (int) Math.max(grown, minimum);
    }

    @Override
    public String toString() {
        return "EdgeTable{" + name + ", width=" + width + ", rows=" + rowCount() + "}";
    }
}
