package software.amazon.ahocorasick;

import static software.amazon.ahocorasick.NodeArena.NO_NODE;
import static software.amazon.ahocorasick.NodeArena.NO_PATTERN;
import static software.amazon.ahocorasick.NodeArena.ROOT;

/**
 * The traversals behind the automaton's queries. They walk node indexes rather than State objects so that a scan
 * allocates nothing per byte.
 */
final class MatchFinder {

    private MatchFinder() { }

    /**
     * @return true if {@code sequence} spells a path in the trie that ends on a pattern
     */
    static boolean hasExactMatch(final TrieBuilder.Trie trie, final TransitionResolver resolver,
                                 final byte[] sequence) {
        final int node = descend(trie, resolver, sequence);
        return node != NO_NODE && trie.nodes.terminal(node) != NO_PATTERN;
    }

    /**
     * @return true if {@code sequence} spells a path in the trie, i.e. is a prefix of some pattern
     */
    static boolean hasPrefix(final TrieBuilder.Trie trie, final TransitionResolver resolver,
                             final byte[] sequence) {
        return descend(trie, resolver, sequence) != NO_NODE;
    }

    /**
     * Runs {@code text} through the automaton and hands every match to {@code consumer}.
     *
     * @param reporting whether to report only the pattern at the current node or also those on its suffix-link chain
     */
    static void scan(final TrieBuilder.Trie trie, final TransitionResolver resolver, final byte[] text,
                     final AutomatonConfiguration.MatchReporting reporting, final MatchConsumer consumer) {
        final NodeArena nodes = trie.nodes;
        final boolean allSuffixes = reporting == AutomatonConfiguration.MatchReporting.ALL_SUFFIXES;
        int node = ROOT;
        for (int i = 0; i < text.length; i++) {
            final int code = trie.alphabet.codeOf(text[i]);
            if (code == AlphabetMap.NO_CODE) {
                // a byte outside the alphabet resets to a root state that carries no pattern
                node = ROOT;
                continue;
            }
            node = resolver.transition(node, code);
            final int pattern = nodes.terminal(node);
            if (pattern != NO_PATTERN) {
                consumer.accept(i + 1, pattern);
            }
            if (allSuffixes) {
                for (int out = resolver.outputLink(node); out != NO_NODE; out = resolver.outputLink(out)) {
                    consumer.accept(i + 1, nodes.terminal(out));
                }
            }
        }
    }

    // follows sequence along trie edges only; NO_NODE as soon as a step needs a suffix-link fallback
    private static int descend(final TrieBuilder.Trie trie, final TransitionResolver resolver,
                               final byte[] sequence) {
        final NodeArena nodes = trie.nodes;
        int node = ROOT;
        for (byte b : sequence) {
            final int next = resolver.transition(node, trie.alphabet.codeOf(b));
            if (nodes.depth(next) != nodes.depth(node) + 1) {
                return NO_NODE;
            }
            node = next;
        }
        return node;
    }
}
