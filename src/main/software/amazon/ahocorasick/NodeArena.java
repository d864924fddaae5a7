package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Owns every trie node of one automaton. Nodes are addressed by a stable index, node 0 being the root, and their
 * fields are kept in parallel primitive lists rather than as one object per node.
 */
class NodeArena {

    static final int ROOT = 0;
    static final int NO_NODE = -1;
    static final int NO_PATTERN = -1;

    private final IntArrayList depth = new IntArrayList();
    private final IntArrayList parent = new IntArrayList();
    private final IntArrayList parentCode = new IntArrayList();
    private final IntArrayList terminal = new IntArrayList();
    private final IntArrayList trieRow = new IntArrayList();
    private final IntArrayList gotoRow = new IntArrayList();
    private final IntArrayList suffixLink = new IntArrayList();

    NodeArena() {
        add(NO_NODE, AlphabetMap.NO_CODE, 0);
        // the root is its own suffix link, and that is known up front
        suffixLink.set(ROOT, ROOT);
    }

    /**
     * Appends a node reached from {@code parentNode} over {@code code}.
     *
     * @return the index of the new node
     */
    int addChild(final int parentNode, final int code) {
        return add(parentNode, code, depth.getInt(parentNode) + 1);
    }

    private int add(final int parentNode, final int code, final int nodeDepth) {
        final int index = depth.size();
        depth.add(nodeDepth);
        parent.add(parentNode);
        parentCode.add(code);
        terminal.add(NO_PATTERN);
        trieRow.add(EdgeTable.NO_ROW);
        gotoRow.add(EdgeTable.NO_ROW);
        suffixLink.add(NO_NODE);
        return index;
    }

    int size() {
        return depth.size();
    }

    int depth(final int node) {
        return depth.getInt(node);
    }

    int parent(final int node) {
        return parent.getInt(node);
    }

    int parentCode(final int node) {
        return parentCode.getInt(node);
    }

    int terminal(final int node) {
        return terminal.getInt(node);
    }

    void setTerminal(final int node, final int patternIndex) {
        terminal.set(node, patternIndex);
    }

    int trieRow(final int node) {
        return trieRow.getInt(node);
    }

    void setTrieRow(final int node, final int row) {
        trieRow.set(node, row);
    }

    int gotoRow(final int node) {
        return gotoRow.getInt(node);
    }

    void setGotoRow(final int node, final int row) {
        gotoRow.set(node, row);
    }

    int suffixLink(final int node) {
        return suffixLink.getInt(node);
    }

    void setSuffixLink(final int node, final int link) {
        suffixLink.set(node, link);
    }

    boolean hasSuffixLink(final int node) {
        return suffixLink.getInt(node) != NO_NODE;
    }

    void trim() {
        depth.trim();
        parent.trim();
        parentCode.trim();
        terminal.trim();
        trieRow.trim();
        gotoRow.trim();
        suffixLink.trim();
    }
}
