package software.amazon.ahocorasick;

/**
 * Receives matches as a scan finds them, in increasing end position.
 */
@FunctionalInterface
public interface MatchConsumer {

    /**
     * @param endPosition the offset just past the last byte of the occurrence
     * @param patternIndex the index of the pattern in the dictionary
     */
    void accept(int endPosition, int patternIndex);
}
