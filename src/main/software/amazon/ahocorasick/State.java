package software.amazon.ahocorasick;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A position in an AhoCorasickAutomaton: the node reached, its depth (the length of the longest dictionary prefix
 * that ends here) and the pattern that terminates at it, if any.
 * <p>
 * Only the automaton creates states, and a state is only meaningful to the automaton that produced it.
 */
@Immutable
@ThreadSafe
public final class State {

    private final int node;
    private final int depth;
    private final int patternIndex;

    State(int node, int depth, int patternIndex) {
        this.node = node;
        this.depth = depth;
        this.patternIndex = patternIndex;
    }

    public boolean isRoot() {
        return node == NodeArena.ROOT;
    }

    public boolean isTerminal() {
        return patternIndex != NodeArena.NO_PATTERN;
    }

    /**
     * @return the index, in dictionary order, of the pattern ending at this state
     * @throws IllegalStateException if no pattern ends here
     */
    public int getPatternIndex() {
        if (!isTerminal()) {
            throw new IllegalStateException("No pattern terminates at " + this);
        }
        return patternIndex;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * True if this state is exactly one symbol deeper than {@code previous}, meaning the step between them followed an
     * edge of the trie rather than falling back through a suffix link.
     *
     * @param previous the state before the step
     * @return whether this state directly extends {@code previous}
     */
    public boolean isDirectExtensionOf(State previous) {
        return depth == previous.depth + 1;
    }

    int node() {
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State state = (State) o;
        return node == state.node && depth == state.depth && patternIndex == state.patternIndex;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * node + depth) + patternIndex;
    }

    @Override
    public String toString() {
        return "State{node=" + node + ", depth=" + depth
                + (isTerminal() ? ", pattern=" + patternIndex : "") + "}";
    }
}
