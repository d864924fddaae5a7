package software.amazon.ahocorasick;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ConcurrentQueriesTest {

    private static final int THREADS = 8;

    private static List<String> words(Random random, int count) {
        return words(random, count, 12, 2, 9);
    }

    private static List<String> words(Random random, int count, int letters, int minLength, int maxLength) {
        List<String> words = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            StringBuilder sb = new StringBuilder();
            int length = minLength + random.nextInt(maxLength - minLength + 1);
            for (int j = 0; j < length; j++) {
                sb.append((char) ('a' + random.nextInt(letters)));
            }
            words.add(sb.toString());
        }
        return words;
    }

    private static AhoCorasickAutomaton build(List<String> dictionary, AutomatonConfiguration.Resolution resolution) {
        return AhoCorasickAutomaton.builder()
                .withConfiguration(new AutomatonConfiguration.Builder()
                        .withResolution(resolution)
                        .withMatchReporting(AutomatonConfiguration.MatchReporting.ALL_SUFFIXES)
                        .build())
                .addPatterns(dictionary.toArray(new String[0]))
                .build();
    }

    private static void queryFromManyThreads(AutomatonConfiguration.Resolution resolution) throws Exception {
        Random random = new Random(42);
        List<String> dictionary = words(random, 2000);
        List<String> texts = words(random, 500);
        for (int i = 0; i < texts.size(); i++) {
            texts.set(i, texts.get(i) + dictionary.get(i) + texts.get((i + 1) % texts.size()));
        }
        queryFromManyThreads(dictionary, texts, resolution, 1);
    }

    private static void queryFromManyThreads(final List<String> dictionary, final List<String> texts,
                                             AutomatonConfiguration.Resolution resolution,
                                             final int passes) throws Exception {
        // answers from a single-threaded automaton that has seen nothing else
        AhoCorasickAutomaton reference = build(dictionary, AutomatonConfiguration.Resolution.LAZY);
        final List<List<Match>> expected = new ArrayList<>();
        for (String text : texts) {
            expected.add(reference.scanForMatches(text));
        }

        final AhoCorasickAutomaton shared = build(dictionary, resolution);
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                final int offset = t * 37;
                futures.add(executor.submit(new Callable<Integer>() {
                    @Override
                    public Integer call() {
                        int checked = 0;
                        for (int pass = 0; pass < passes; pass++) {
                            for (int i = 0; i < texts.size(); i++) {
                                int index = (i + offset) % texts.size();
                                assertEquals(expected.get(index), shared.scanForMatches(texts.get(index)));
                                assertTrue(shared.hasExactMatch(dictionary.get(index)));
                                checked++;
                            }
                        }
                        return checked;
                    }
                }));
            }
            for (Future<Integer> future : futures) {
                assertEquals(texts.size() * passes, future.get(60, TimeUnit.SECONDS).intValue());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void lazyAutomatonGivesConsistentAnswersAcrossThreads() throws Exception {
        queryFromManyThreads(AutomatonConfiguration.Resolution.LAZY);
    }

    @Test
    public void eagerAutomatonGivesConsistentAnswersAcrossThreads() throws Exception {
        queryFromManyThreads(AutomatonConfiguration.Resolution.EAGER);
    }

    @Test
    public void eagerAutomatonScansLongSuffixChainsWithoutTerminalsAcrossThreads() throws Exception {
        // over three letters most nodes have long suffix chains that never reach a pattern end
        Random random = new Random(3000);
        List<String> dictionary = words(random, 3000, 3, 3, 22);
        List<String> texts = words(random, 400, 3, 20, 60);
        queryFromManyThreads(dictionary, texts, AutomatonConfiguration.Resolution.EAGER, 20);
    }
}
