package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Arrays;

import static software.amazon.ahocorasick.NodeArena.NO_NODE;
import static software.amazon.ahocorasick.NodeArena.ROOT;

/**
 * Computes the automaton's goto function and suffix links on demand, remembering every answer.
 * <p>
 * The two are defined in terms of each other:
 * <pre>
 *   link(root) = root
 *   link(v)    = root                          if parent(v) is root
 *              = goto(link(parent(v)), code(v)) otherwise
 *
 *   goto(v, c) = trie child of v over c        if there is one
 *              = root                          if v is root
 *              = goto(link(v), c)              otherwise
 * </pre>
 * Rather than recursing, which would need a call stack as deep as the longest pattern, pending work is kept on an
 * explicit stack of (node, code) frames, where a code of {@link #LINK} asks for the node's suffix link. A frame only
 * ever pushes a frame for the same node or a shallower one, so the stack never holds more than about twice the depth
 * of the deepest node.
 * <p>
 * Goto rows are allocated the first time a node is asked for a transition. Every cell is written at most once.
 */
@NotThreadSafe
class TransitionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TransitionResolver.class);

    // frame code meaning "resolve the suffix link of this node"
    private static final int LINK = -2;
    private static final int UNRESOLVED = -1;
    // distinct from NO_NODE, which is a legitimate cached answer
    private static final int UNRESOLVED_OUTPUT = -2;

    private final TrieBuilder.Trie trie;
    private final NodeArena nodes;
    private final EdgeTable gotoEdges;
    private final IntArrayList work = new IntArrayList();

    // nearest terminal node strictly down the suffix-link chain; UNRESOLVED_OUTPUT until asked, NO_NODE if there is none
    private final int[] outputLinks;

    TransitionResolver(final TrieBuilder.Trie trie) {
        this.trie = trie;
        this.nodes = trie.nodes;
        this.gotoEdges = new EdgeTable("goto", trie.alphabet.size());
        this.outputLinks = new int[nodes.size()];
        Arrays.fill(outputLinks, UNRESOLVED_OUTPUT);
    }

    /**
     * @param node the node to move from
     * @param code an alphabet code, or {@link AlphabetMap#NO_CODE}
     * @return the node the automaton moves to on {@code code}; the root for {@link AlphabetMap#NO_CODE}
     */
    int transition(final int node, final int code) {
        if (code == AlphabetMap.NO_CODE) {
            // unmapped bytes are never written into a row
            return ROOT;
        }
        final int resolved = immediateTransition(node, code);
        if (resolved != UNRESOLVED) {
            return resolved;
        }
        resolve(node, code);
        return gotoEdges.get(nodes.gotoRow(node), code);
    }

    int suffixLink(final int node) {
        final int link = immediateSuffixLink(node);
        if (link != UNRESOLVED) {
            return link;
        }
        resolve(node, LINK);
        return nodes.suffixLink(node);
    }

    /**
     * @return the deepest node that is a proper suffix of {@code node}'s path and terminates a pattern, or
     * {@link NodeArena#NO_NODE} if there is none
     */
    int outputLink(final int node) {
        if (node == ROOT) {
            return NO_NODE;
        }
        final int cached = outputLinks[node];
        if (cached != UNRESOLVED_OUTPUT) {
            return cached;
        }
        // walk down the chain until something answers, then fill in everything passed on the way
        final int start = work.size();
        int current = node;
        int answer;
        while (true) {
            final int link = suffixLink(current);
            if (nodes.terminal(link) != NodeArena.NO_PATTERN) {
                answer = link;
                break;
            }
            if (link == ROOT) {
                answer = NO_NODE;
                break;
            }
            if (outputLinks[link] != UNRESOLVED_OUTPUT) {
                answer = outputLinks[link];
                break;
            }
            work.add(current);
            current = link;
        }
        outputLinks[current] = answer;
        for (int i = work.size() - 1; i >= start; i--) {
            outputLinks[work.getInt(i)] = answer;
        }
        work.size(start);
        return answer;
    }

    /**
     * Fills in every suffix link and every goto cell, shallowest nodes first so that each one is answered straight
     * from already-resolved cells.
     */
    void resolveAll() {
        final long started = System.nanoTime();
        final int[] byDepth = nodesByDepth();
        final int width = gotoEdges.width();
        for (int node : byDepth) {
            suffixLink(node);
            for (int code = 0; code < width; code++) {
                transition(node, code);
            }
        }
        for (int node : byDepth) {
            outputLink(node);
        }
        gotoEdges.trim();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Resolved {} transitions for {} nodes in {} us", gotoEdges.filledCellCount(), nodes.size(),
                    (System.nanoTime() - started) / 1000);
        }
    }

    boolean hasOutputLink(final int node) {
        return node == ROOT || outputLinks[node] != UNRESOLVED_OUTPUT;
    }

    int resolvedTransitionCount() {
        return gotoEdges.filledCellCount();
    }

    private void resolve(final int node, final int code) {
        final int base = work.size();
        push(node, code);
        while (work.size() > base) {
            final int frameCode = work.getInt(work.size() - 1);
            final int frameNode = work.getInt(work.size() - 2);
            if (frameCode == LINK ? stepLink(frameNode) : stepTransition(frameNode, frameCode)) {
                work.size(work.size() - 2);
            }
        }
    }

    /**
     * Makes progress on a suffix-link frame.
     *
     * @return true if the link is now resolved and the frame can be popped
     */
    private boolean stepLink(final int node) {
        if (immediateSuffixLink(node) != UNRESOLVED) {
            return true;
        }
        final int parentLink = immediateSuffixLink(nodes.parent(node));
        if (parentLink == UNRESOLVED) {
            push(nodes.parent(node), LINK);
            return false;
        }
        final int code = nodes.parentCode(node);
        final int target = immediateTransition(parentLink, code);
        if (target == UNRESOLVED) {
            push(parentLink, code);
            return false;
        }
        nodes.setSuffixLink(node, target);
        return true;
    }

    /**
     * Makes progress on a goto frame.
     *
     * @return true if the transition is now resolved and the frame can be popped
     */
    private boolean stepTransition(final int node, final int code) {
        if (immediateTransition(node, code) != UNRESOLVED) {
            return true;
        }
        final int link = immediateSuffixLink(node);
        if (link == UNRESOLVED) {
            push(node, LINK);
            return false;
        }
        final int target = immediateTransition(link, code);
        if (target == UNRESOLVED) {
            push(link, code);
            return false;
        }
        gotoEdges.set(nodes.gotoRow(node), code, target);
        return true;
    }

    // answers goto(node, code) if that needs no fallback, caching the answer; UNRESOLVED otherwise
    private int immediateTransition(final int node, final int code) {
        int row = nodes.gotoRow(node);
        if (row == EdgeTable.NO_ROW) {
            row = gotoEdges.allocateRow();
            nodes.setGotoRow(node, row);
        }
        final int cached = gotoEdges.get(row, code);
        if (cached != EdgeTable.ABSENT) {
            return cached;
        }
        final int child = trie.trieChild(node, code);
        if (child != NO_NODE) {
            gotoEdges.set(row, code, child);
            return child;
        }
        if (node == ROOT) {
            gotoEdges.set(row, code, ROOT);
            return ROOT;
        }
        return UNRESOLVED;
    }

    // answers link(node) if that needs no goto lookup, caching the answer; UNRESOLVED otherwise
    private int immediateSuffixLink(final int node) {
        if (nodes.hasSuffixLink(node)) {
            return nodes.suffixLink(node);
        }
        if (nodes.parent(node) == ROOT) {
            nodes.setSuffixLink(node, ROOT);
            return ROOT;
        }
        return UNRESOLVED;
    }

    private void push(final int node, final int code) {
        work.add(node);
        work.add(code);
    }

    // counting sort of node indexes by depth
    private int[] nodesByDepth() {
        final int size = nodes.size();
        final int[] counts = new int[trie.maxDepth + 2];
        for (int node = 0; node < size; node++) {
            counts[nodes.depth(node) + 1]++;
        }
        for (int d = 1; d < counts.length; d++) {
            counts[d] += counts[d - 1];
        }
        final int[] sorted = new int[size];
        for (int node = 0; node < size; node++) {
            sorted[counts[nodes.depth(node)]++] = node;
        }
        return sorted;
    }
}
