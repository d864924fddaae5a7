package software.amazon.ahocorasick;

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * Configuration for an AhoCorasickAutomaton.
 */
@Immutable
public class AutomatonConfiguration {

    /**
     * How the goto function gets filled in.
     */
    public enum Resolution {
        /**
         * Transitions and suffix links are resolved the first time a query needs them and remembered afterwards.
         * Queries serialize on the automaton because they write to shared tables.
         */
        LAZY,
        /**
         * Every transition is resolved once when the automaton is built. This costs a full row per node but queries
         * no longer write anything, so they run without locking.
         */
        EAGER
    }

    /**
     * Which patterns a scan reports at a given text position.
     */
    public enum MatchReporting {
        /**
         * Only the pattern, if any, that ends at the current automaton node.
         */
        TERMINAL_ONLY,
        /**
         * The pattern at the current node plus every pattern reachable by following suffix links from it, i.e.
         * every non-empty dictionary entry ending at that position, longest first. An allowed empty pattern is
         * reported along with them, but not at position 0 and not after a byte that occurs in no pattern, since
         * such a byte resets the scan to a state that carries no pattern.
         */
        ALL_SUFFIXES
    }

    private static final AutomatonConfiguration DEFAULT = new Builder().build();

    /**
     * A zero-length pattern makes the root terminal, which means it "matches" wherever the automaton falls back to
     * the root. Off by default, in which case building with an empty pattern fails.
     */
    private final boolean emptyPatternsAllowed;
    private final int maxAlphabetSize;
    private final Resolution resolution;
    private final MatchReporting matchReporting;

    private AutomatonConfiguration(boolean emptyPatternsAllowed, int maxAlphabetSize, Resolution resolution,
                                   MatchReporting matchReporting) {
        this.emptyPatternsAllowed = emptyPatternsAllowed;
        this.maxAlphabetSize = maxAlphabetSize;
        this.resolution = resolution;
        this.matchReporting = matchReporting;
    }

    public static AutomatonConfiguration defaults() {
        return DEFAULT;
    }

    public boolean isEmptyPatternsAllowed() {
        return emptyPatternsAllowed;
    }

    public int getMaxAlphabetSize() {
        return maxAlphabetSize;
    }

    public Resolution getResolution() {
        return resolution;
    }

    public MatchReporting getMatchReporting() {
        return matchReporting;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AutomatonConfiguration that = (AutomatonConfiguration) o;
        return emptyPatternsAllowed == that.emptyPatternsAllowed && maxAlphabetSize == that.maxAlphabetSize
                && resolution == that.resolution && matchReporting == that.matchReporting;
    }

    @Override
    public int hashCode() {
        return Objects.hash(emptyPatternsAllowed, maxAlphabetSize, resolution, matchReporting);
    }

    @Override
    public String toString() {
        return "AutomatonConfiguration{emptyPatternsAllowed=" + emptyPatternsAllowed
                + ", maxAlphabetSize=" + maxAlphabetSize
                + ", resolution=" + resolution
                + ", matchReporting=" + matchReporting + "}";
    }

    public static class Builder {

        private boolean emptyPatternsAllowed = false;
        private int maxAlphabetSize = AlphabetMap.MAX_ALPHABET_SIZE;
        private Resolution resolution = Resolution.LAZY;
        private MatchReporting matchReporting = MatchReporting.TERMINAL_ONLY;

        public Builder withEmptyPatternsAllowed(boolean emptyPatternsAllowed) {
            this.emptyPatternsAllowed = emptyPatternsAllowed;
            return this;
        }

        public Builder withMaxAlphabetSize(int maxAlphabetSize) {
            if (maxAlphabetSize <= 0 || maxAlphabetSize > AlphabetMap.MAX_ALPHABET_SIZE) {
                throw new IllegalArgumentException("maxAlphabetSize must be in [1, "
                        + AlphabetMap.MAX_ALPHABET_SIZE + "]");
            }
            this.maxAlphabetSize = maxAlphabetSize;
            return this;
        }

        public Builder withResolution(Resolution resolution) {
            this.resolution = Objects.requireNonNull(resolution, "resolution");
            return this;
        }

        public Builder withMatchReporting(MatchReporting matchReporting) {
            this.matchReporting = Objects.requireNonNull(matchReporting, "matchReporting");
            return this;
        }

        public AutomatonConfiguration build() {
            return new AutomatonConfiguration(emptyPatternsAllowed, maxAlphabetSize, resolution, matchReporting);
        }
    }
}
