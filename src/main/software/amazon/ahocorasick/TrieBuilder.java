package software.amazon.ahocorasick;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Turns a list of byte-string patterns into a trie keyed by compressed alphabet codes.
 * <p>
 * The alphabet has to be complete before the first node is created because its size is the width of every edge table
 * row, so the build makes two passes over the patterns: one registering bytes, one inserting paths.
 */
final class TrieBuilder {

    private final AutomatonConfiguration configuration;

    TrieBuilder(@Nonnull final AutomatonConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    Trie build(@Nonnull final List<byte[]> patterns) {
        final AlphabetMap alphabet = buildAlphabet(patterns);
        final NodeArena nodes = new NodeArena();
        // only nodes with children get a row, and a pattern of n bytes adds at most n - 1 of those besides the root
        final EdgeTable trieEdges = new EdgeTable("trie", alphabet.size(), expectedTrieRows(patterns));

        int maxDepth = 0;
        for (int patternIndex = 0; patternIndex < patterns.size(); patternIndex++) {
            final byte[] pattern = patterns.get(patternIndex);
            int node = NodeArena.ROOT;
            for (byte b : pattern) {
                node = childOf(node, alphabet.codeOf(b), nodes, trieEdges);
            }
            // duplicates land on the same node; the later index wins
            nodes.setTerminal(node, patternIndex);
            maxDepth = Math.max(maxDepth, pattern.length);
        }
        nodes.trim();
        trieEdges.trim();
        return new Trie(alphabet, nodes, trieEdges, patterns.size(), maxDepth);
    }

    private static int expectedTrieRows(final List<byte[]> patterns) {
        long rows = 1;
        for (byte[] pattern : patterns) {
            rows += Math.max(0, pattern.length - 1);
        }
        return (int) Math.min(rows, Integer.MAX_VALUE);
    }

    private AlphabetMap buildAlphabet(final List<byte[]> patterns) {
        final AlphabetMap alphabet = new AlphabetMap(configuration.getMaxAlphabetSize());
        for (int patternIndex = 0; patternIndex < patterns.size(); patternIndex++) {
            final byte[] pattern = Objects.requireNonNull(patterns.get(patternIndex),
                    "pattern at index " + patternIndex);
            if (pattern.length == 0 && !configuration.isEmptyPatternsAllowed()) {
                throw new EmptyPatternException(patternIndex);
            }
            for (byte b : pattern) {
                alphabet.register(b);
            }
        }
        alphabet.freeze();
        return alphabet;
    }

    // returns the child of node over code, creating it (and node's trie row) if needed
    private static int childOf(final int node, final int code, final NodeArena nodes, final EdgeTable trieEdges) {
        int row = nodes.trieRow(node);
        if (row == EdgeTable.NO_ROW) {
            row = trieEdges.allocateRow();
            nodes.setTrieRow(node, row);
        }
        int child = trieEdges.get(row, code);
        if (child == EdgeTable.ABSENT) {
            child = nodes.addChild(node, code);
            trieEdges.set(row, code, child);
        }
        return child;
    }

    /**
     * The output of a build: the frozen alphabet, the nodes, and the edges that were actually inserted.
     */
    static final class Trie {
        final AlphabetMap alphabet;
        final NodeArena nodes;
        final EdgeTable trieEdges;
        final int patternCount;
        final int maxDepth;

        private Trie(AlphabetMap alphabet, NodeArena nodes, EdgeTable trieEdges, int patternCount, int maxDepth) {
            this.alphabet = alphabet;
            this.nodes = nodes;
            this.trieEdges = trieEdges;
            this.patternCount = patternCount;
            this.maxDepth = maxDepth;
        }

        /**
         * @return the child of {@code node} over {@code code} along an inserted pattern, or {@link NodeArena#NO_NODE}
         */
        int trieChild(final int node, final int code) {
            final int row = nodes.trieRow(node);
            if (row == EdgeTable.NO_ROW) {
                return NodeArena.NO_NODE;
            }
            final int child = trieEdges.get(row, code);
            return child == EdgeTable.ABSENT ? NodeArena.NO_NODE : child;
        }
    }
}
