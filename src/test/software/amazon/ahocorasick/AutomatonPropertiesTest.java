package software.amazon.ahocorasick;

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Checks the automaton against brute-force answers on random dictionaries and texts.
 */
public class AutomatonPropertiesTest {

    private static final int ROUNDS = 40;

    private static String randomString(Random random, String alphabet, int minLength, int maxLength) {
        int length = minLength + random.nextInt(maxLength - minLength + 1);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }

    private static List<String> randomDictionary(Random random) {
        List<String> dictionary = new ArrayList<>();
        int size = 1 + random.nextInt(25);
        for (int i = 0; i < size; i++) {
            dictionary.add(randomString(random, "abc", 1, 6));
        }
        return dictionary;
    }

    private static AhoCorasickAutomaton build(List<String> dictionary, AutomatonConfiguration configuration) {
        AhoCorasickAutomaton.Builder builder = AhoCorasickAutomaton.builder().withConfiguration(configuration);
        for (String pattern : dictionary) {
            builder.addPattern(pattern);
        }
        return builder.build();
    }

    private static AutomatonConfiguration configuration(AutomatonConfiguration.Resolution resolution,
                                                        AutomatonConfiguration.MatchReporting reporting) {
        return new AutomatonConfiguration.Builder()
                .withResolution(resolution)
                .withMatchReporting(reporting)
                .build();
    }

    // duplicated patterns report the index of their last occurrence
    private static Map<String, Integer> reportedIndexes(List<String> dictionary) {
        Map<String, Integer> indexes = new HashMap<>();
        for (int i = 0; i < dictionary.size(); i++) {
            indexes.put(dictionary.get(i), i);
        }
        return indexes;
    }

    private static boolean isPrefixOfAny(List<String> dictionary, String s) {
        for (String pattern : dictionary) {
            if (pattern.startsWith(s)) {
                return true;
            }
        }
        return false;
    }

    private static Set<Match> bruteForceAllMatches(List<String> dictionary, String text) {
        Map<String, Integer> indexes = reportedIndexes(dictionary);
        Set<Match> matches = new HashSet<>();
        for (int end = 1; end <= text.length(); end++) {
            for (Map.Entry<String, Integer> entry : indexes.entrySet()) {
                String pattern = entry.getKey();
                if (end >= pattern.length() && text.startsWith(pattern, end - pattern.length())) {
                    matches.add(new Match(end, entry.getValue()));
                }
            }
        }
        return matches;
    }

    // the automaton's node after each position is the longest suffix of the text read so far that is a trie path
    private static List<Match> bruteForceTerminalMatches(List<String> dictionary, String text) {
        Map<String, Integer> indexes = reportedIndexes(dictionary);
        List<Match> matches = new ArrayList<>();
        for (int end = 1; end <= text.length(); end++) {
            for (int start = 0; start < end; start++) {
                String suffix = text.substring(start, end);
                if (isPrefixOfAny(dictionary, suffix)) {
                    Integer index = indexes.get(suffix);
                    if (index != null) {
                        matches.add(new Match(end, index));
                    }
                    break;
                }
            }
        }
        return matches;
    }

    @Test
    public void everyPatternIsAnExactMatchAndEveryStrictPrefixIsOnlyAPrefix() {
        Random random = new Random(1);
        for (int round = 0; round < ROUNDS; round++) {
            List<String> dictionary = randomDictionary(random);
            AhoCorasickAutomaton automaton = AhoCorasickAutomaton.builder()
                    .addPatterns(dictionary.toArray(new String[0]))
                    .build();
            Set<String> patterns = new HashSet<>(dictionary);
            for (String pattern : dictionary) {
                assertTrue(pattern, automaton.hasExactMatch(pattern));
                for (int length = 1; length < pattern.length(); length++) {
                    String prefix = pattern.substring(0, length);
                    assertTrue(prefix, automaton.hasPrefix(prefix));
                    assertEquals(prefix, patterns.contains(prefix), automaton.hasExactMatch(prefix));
                }
            }
        }
    }

    @Test
    public void randomSequencesAgreeWithTheDictionary() {
        Random random = new Random(2);
        for (int round = 0; round < ROUNDS; round++) {
            List<String> dictionary = randomDictionary(random);
            Set<String> patterns = new HashSet<>(dictionary);
            AhoCorasickAutomaton automaton = build(dictionary, AutomatonConfiguration.defaults());
            for (int i = 0; i < 200; i++) {
                String s = randomString(random, "abcd", 0, 7);
                assertEquals(s, patterns.contains(s), automaton.hasExactMatch(s));
                assertEquals(s, isPrefixOfAny(dictionary, s), automaton.hasPrefix(s));
            }
        }
    }

    @Test
    public void terminalOnlyScanReportsThePatternAtTheCurrentNode() {
        Random random = new Random(3);
        for (int round = 0; round < ROUNDS; round++) {
            List<String> dictionary = randomDictionary(random);
            for (AutomatonConfiguration.Resolution resolution : AutomatonConfiguration.Resolution.values()) {
                AhoCorasickAutomaton automaton = build(dictionary,
                        configuration(resolution, AutomatonConfiguration.MatchReporting.TERMINAL_ONLY));
                for (int i = 0; i < 20; i++) {
                    String text = randomString(random, "abcd", 0, 40);
                    assertEquals(dictionary + " / " + text, bruteForceTerminalMatches(dictionary, text),
                            automaton.scanForMatches(text));
                }
            }
        }
    }

    @Test
    public void allSuffixesScanFindsEveryOccurrence() {
        Random random = new Random(4);
        for (int round = 0; round < ROUNDS; round++) {
            List<String> dictionary = randomDictionary(random);
            for (AutomatonConfiguration.Resolution resolution : AutomatonConfiguration.Resolution.values()) {
                AhoCorasickAutomaton automaton = build(dictionary,
                        configuration(resolution, AutomatonConfiguration.MatchReporting.ALL_SUFFIXES));
                for (int i = 0; i < 20; i++) {
                    String text = randomString(random, "abcd", 0, 40);
                    List<Match> found = automaton.scanForMatches(text);
                    Set<Match> expected = bruteForceAllMatches(dictionary, text);
                    assertEquals(dictionary + " / " + text, expected, new HashSet<>(found));
                    assertEquals("no match is reported twice", expected.size(), found.size());
                }
            }
        }
    }

    @Test
    public void allSuffixesReportsLongestFirstAtEachPosition() {
        AhoCorasickAutomaton automaton = build(listOf("a", "aa", "aaa"),
                configuration(AutomatonConfiguration.Resolution.LAZY, AutomatonConfiguration.MatchReporting.ALL_SUFFIXES));
        List<Match> found = automaton.scanForMatches("aaa");
        List<Match> expected = new ArrayList<>();
        expected.add(new Match(1, 0));
        expected.add(new Match(2, 1));
        expected.add(new Match(2, 0));
        expected.add(new Match(3, 2));
        expected.add(new Match(3, 1));
        expected.add(new Match(3, 0));
        assertEquals(expected, found);
    }

    @Test
    public void longPatternsScanWithoutExhaustingTheStack() {
        int n = 100_000;
        StringBuilder sb = new StringBuilder(n + 1);
        for (int i = 0; i < n; i++) {
            sb.append('a');
        }
        String pattern = sb.append('b').toString();
        AhoCorasickAutomaton automaton = build(listOf(pattern), AutomatonConfiguration.defaults());
        assertTrue(automaton.hasExactMatch(pattern));
        assertFalse(automaton.hasExactMatch(pattern.substring(1)));

        String text = "a" + pattern;
        List<Match> found = automaton.scanForMatches(text.getBytes(StandardCharsets.UTF_8));
        assertEquals(1, found.size());
        assertEquals(new Match(n + 2, 0), found.get(0));
    }

    private static List<String> listOf(String... values) {
        List<String> list = new ArrayList<>();
        for (String value : values) {
            list.add(value);
        }
        return list;
    }
}
