package software.amazon.ahocorasick;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * One occurrence of a dictionary pattern in a scanned text.
 */
@Immutable
@ThreadSafe
public final class Match {

    private final int endPosition;
    private final int patternIndex;

    public Match(int endPosition, int patternIndex) {
        this.endPosition = endPosition;
        this.patternIndex = patternIndex;
    }

    /**
     * @return the offset just past the last byte of the occurrence, i.e. the 1-based position of its last byte
     */
    public int getEndPosition() {
        return endPosition;
    }

    /**
     * @return the index of the pattern in the dictionary the automaton was built from
     */
    public int getPatternIndex() {
        return patternIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Match match = (Match) o;
        return endPosition == match.endPosition && patternIndex == match.patternIndex;
    }

    @Override
    public int hashCode() {
        return 31 * endPosition + patternIndex;
    }

    @Override
    public String toString() {
        return "(" + endPosition + ", " + patternIndex + ")";
    }
}
