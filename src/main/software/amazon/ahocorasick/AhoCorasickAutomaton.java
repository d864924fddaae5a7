package software.amazon.ahocorasick;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Matches a fixed dictionary of byte strings against input, Aho-Corasick style. It answers three questions: is a
 * sequence one of the patterns, is it a prefix of one of them, and where in a text does each pattern occur.
 * <p>
 * The dictionary is compiled into a trie over a compressed alphabet holding only the bytes the patterns use. The
 * automaton's transition function is NOT computed up front: each (node, byte) transition and each node's suffix link
 * is worked out the first time a query needs it, then remembered, so memory grows with the part of the automaton
 * the inputs actually exercise rather than with nodes times alphabet size.
 * <p>
 * Strings are matched as their UTF-8 bytes; every byte is one symbol.
 * <p>
 * The automaton is thread safe. With {@link AutomatonConfiguration.Resolution#LAZY} resolution, queries write to
 * shared tables and are serialized by synchronizing on the automaton. With
 * {@link AutomatonConfiguration.Resolution#EAGER} resolution, everything is resolved while building and queries
 * don't lock.
 */
@ThreadSafe
public class AhoCorasickAutomaton {

    private static final Logger LOG = LoggerFactory.getLogger(AhoCorasickAutomaton.class);

    private final AutomatonConfiguration configuration;
    private final TrieBuilder.Trie trie;
    private final TransitionResolver resolver;
    private final boolean lockFree;
    private final State rootState;

    private AhoCorasickAutomaton(final AutomatonConfiguration configuration, final List<byte[]> patterns) {
        this.configuration = configuration;
        this.trie = new TrieBuilder(configuration).build(patterns);
        this.resolver = new TransitionResolver(trie);
        this.lockFree = configuration.getResolution() == AutomatonConfiguration.Resolution.EAGER;
        if (lockFree) {
            resolver.resolveAll();
        }
        this.rootState = stateOf(NodeArena.ROOT);
        LOG.debug("Built automaton: {} patterns, {} nodes, {} symbols, max depth {}, {}", trie.patternCount,
                trie.nodes.size(), trie.alphabet.size(), trie.maxDepth, configuration);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds an automaton with the default configuration.
     *
     * @param patterns the dictionary; a pattern's index in this list is the index reported when it matches
     * @return the automaton
     * @throws BuildException if the dictionary can't be compiled
     */
    public static AhoCorasickAutomaton build(@Nonnull final List<byte[]> patterns) {
        return builder().addPatterns(patterns).build();
    }

    public AutomatonConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * @return the state before any input has been consumed
     */
    public State rootState() {
        return rootState;
    }

    /**
     * Equivalent to {@code stepState(c, rootState())}.
     */
    public State stateFromByte(final byte c) {
        return stepState(c, rootState);
    }

    /**
     * Moves the automaton one byte forward. A byte that appears in no pattern leads back to a root state that carries
     * no pattern.
     *
     * @param c the next input byte
     * @param state a state produced by this automaton
     * @return the state after consuming {@code c}
     */
    public State stepState(final byte c, @Nonnull final State state) {
        final int code = trie.alphabet.codeOf(c);
        if (code == AlphabetMap.NO_CODE) {
            return new State(NodeArena.ROOT, 0, NodeArena.NO_PATTERN);
        }
        if (lockFree) {
            return stateOf(resolver.transition(state.node(), code));
        }
        synchronized (this) {
            return stateOf(resolver.transition(state.node(), code));
        }
    }

    /**
     * @param state a state produced by this automaton
     * @return the state for the longest proper suffix of {@code state}'s path that is also a path in the trie; the root
     * is its own suffix link
     */
    public State suffixLinkOf(@Nonnull final State state) {
        if (lockFree) {
            return stateOf(resolver.suffixLink(state.node()));
        }
        synchronized (this) {
            return stateOf(resolver.suffixLink(state.node()));
        }
    }

    /**
     * Returns true if {@code sequence} is exactly one of the patterns. Any step that can't be taken along a trie edge
     * rules the sequence out immediately.
     */
    public boolean hasExactMatch(@Nonnull final byte[] sequence) {
        Objects.requireNonNull(sequence, "sequence");
        if (lockFree) {
            return MatchFinder.hasExactMatch(trie, resolver, sequence);
        }
        synchronized (this) {
            return MatchFinder.hasExactMatch(trie, resolver, sequence);
        }
    }

    public boolean hasExactMatch(@Nonnull final String sequence) {
        return hasExactMatch(utf8(sequence));
    }

    /**
     * Returns true if {@code sequence} is a prefix of at least one pattern, the patterns themselves and the empty
     * sequence included.
     */
    public boolean hasPrefix(@Nonnull final byte[] sequence) {
        Objects.requireNonNull(sequence, "sequence");
        if (lockFree) {
            return MatchFinder.hasPrefix(trie, resolver, sequence);
        }
        synchronized (this) {
            return MatchFinder.hasPrefix(trie, resolver, sequence);
        }
    }

    public boolean hasPrefix(@Nonnull final String sequence) {
        return hasPrefix(utf8(sequence));
    }

    /**
     * Finds pattern occurrences in {@code text}. Which occurrences are reported at each position depends on the
     * configured {@link AutomatonConfiguration.MatchReporting}.
     *
     * @param text the text to scan
     * @return the matches in increasing end position. The list may be empty but never null.
     */
    public List<Match> scanForMatches(@Nonnull final byte[] text) {
        final List<Match> matches = new ArrayList<>();
        scanForMatches(text, (endPosition, patternIndex) -> matches.add(new Match(endPosition, patternIndex)));
        return matches;
    }

    public List<Match> scanForMatches(@Nonnull final String text) {
        return scanForMatches(utf8(text));
    }

    /**
     * Streaming form of {@link #scanForMatches(byte[])}. With lazy resolution the consumer is called while the
     * automaton's lock is held, so it must not hand the automaton to another thread and wait on it.
     */
    public void scanForMatches(@Nonnull final byte[] text, @Nonnull final MatchConsumer consumer) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(consumer, "consumer");
        final AutomatonConfiguration.MatchReporting reporting = configuration.getMatchReporting();
        if (lockFree) {
            MatchFinder.scan(trie, resolver, text, reporting, consumer);
            return;
        }
        synchronized (this) {
            MatchFinder.scan(trie, resolver, text, reporting, consumer);
        }
    }

    public int patternCount() {
        return trie.patternCount;
    }

    public int nodeCount() {
        return trie.nodes.size();
    }

    public int alphabetSize() {
        return trie.alphabet.size();
    }

    /**
     * @return the length of the longest pattern
     */
    public int maxDepth() {
        return trie.maxDepth;
    }

    /**
     * @return how many goto cells have been filled in so far
     */
    public int resolvedTransitionCount() {
        if (lockFree) {
            return resolver.resolvedTransitionCount();
        }
        synchronized (this) {
            return resolver.resolvedTransitionCount();
        }
    }

    private State stateOf(final int node) {
        return new State(node, trie.nodes.depth(node), trie.nodes.terminal(node));
    }

    private static byte[] utf8(final String s) {
        return Objects.requireNonNull(s, "sequence").getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "AhoCorasickAutomaton{patterns=" + trie.patternCount + ", nodes=" + trie.nodes.size()
                + ", alphabet=" + trie.alphabet.size() + "}";
    }

    /**
     * Collects the dictionary. Patterns are copied as they are added, so the caller is free to reuse its arrays.
     */
    public static class Builder {

        private AutomatonConfiguration configuration = AutomatonConfiguration.defaults();
        private final List<byte[]> patterns = new ArrayList<>();

        public Builder withConfiguration(@Nonnull AutomatonConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration");
            return this;
        }

        public Builder addPattern(@Nonnull byte[] pattern) {
            patterns.add(Objects.requireNonNull(pattern, "pattern").clone());
            return this;
        }

        public Builder addPattern(@Nonnull String pattern) {
            patterns.add(Objects.requireNonNull(pattern, "pattern").getBytes(StandardCharsets.UTF_8));
            return this;
        }

        public Builder addPatterns(@Nonnull Collection<byte[]> patterns) {
            for (byte[] pattern : patterns) {
                addPattern(pattern);
            }
            return this;
        }

        public Builder addPatterns(@Nonnull String... patterns) {
            for (String pattern : patterns) {
                addPattern(pattern);
            }
            return this;
        }

        /**
         * Adds every pattern of a dictionary in the form read by {@link JsonDictionaryCompiler}.
         *
         * @throws IOException if the dictionary isn't syntactically valid
         */
        public Builder addPatternsFromJson(@Nonnull String json) throws IOException {
            patterns.addAll(JsonDictionaryCompiler.compile(json));
            return this;
        }

        /**
         * @throws EmptyPatternException if a pattern is empty and the configuration doesn't allow that
         * @throws AlphabetOverflowException if the patterns use more distinct bytes than the configuration allows
         */
        public AhoCorasickAutomaton build() {
            return new AhoCorasickAutomaton(configuration, new ArrayList<>(patterns));
        }
    }
}
