package io.trielex.table.impl;

import static org.junit.jupiter.api.Assertions.*;

import io.trielex.table.api.ValueAlreadyDefinedException;
import io.trielex.table.internal_api.collections.AsciiSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TrieGraphTest {
    private static final AsciiSet ALPHABET = AsciiSet.of("abcdxyz");

    private TrieGraph<String> graph;

    @BeforeEach
    public void setUp() {
        graph = new TrieGraph<>(4);
    }

    private void insert(String pattern, String value) throws Exception {
        graph.insert(pattern, PatternParser.parse(pattern, ALPHABET), value);
    }

    private int walk(String s) {
        int node = TrieGraph.ROOT;
        for (int i = 0; i < s.length() && node != TrieGraph.NONE; i++) {
            node = graph.step(node, s.charAt(i));
        }
        return node;
    }

    @Test
    public void testFreshGraphHasOnlyRoot() {
        assertEquals(1, graph.nodeCount());
        assertFalse(graph.isAccepting(TrieGraph.ROOT));
        assertEquals(TrieGraph.NONE, graph.step(TrieGraph.ROOT, 'a'));
    }

    @Test
    public void testSharedPrefixReusesNodes() throws Exception {
        insert("abc", "v1");
        int afterFirst = graph.nodeCount();
        insert("abd", "v2");
        assertEquals(afterFirst + 1, graph.nodeCount());
        assertEquals("v1", graph.valueAt(walk("abc")));
        assertEquals("v2", graph.valueAt(walk("abd")));
    }

    @Test
    public void testClassMembersShareOneSuccessor() throws Exception {
        insert("x[abc]y", "v");
        // root, x, shared class node, y
        assertEquals(4, graph.nodeCount());
        int viaA = walk("xa");
        assertEquals(viaA, walk("xb"));
        assertEquals(viaA, walk("xc"));
    }

    @Test
    public void testRepetitionInstallsSelfLoop() throws Exception {
        insert("a+", "loop");
        int node = walk("a");
        assertEquals(2, graph.nodeCount());
        assertTrue(graph.hasSelfLoop(node, 'a'));
        assertEquals(node, graph.step(node, 'a'));
        assertEquals(node, walk("aaaa"));
    }

    @Test
    public void testRepeatedClassLoopsOnEveryMember() throws Exception {
        insert("[ab]+", "v");
        int node = walk("a");
        assertTrue(graph.hasSelfLoop(node, 'a'));
        assertTrue(graph.hasSelfLoop(node, 'b'));
        assertFalse(graph.hasSelfLoop(node, 'c'));
        assertEquals(node, walk("abba"));
    }

    @Test
    public void testReinsertingLoopIsIdempotent() throws Exception {
        insert("a+b", "v1");
        int nodes = graph.nodeCount();
        insert("a+c", "v2");
        assertEquals(nodes + 1, graph.nodeCount());
        assertEquals("v1", graph.valueAt(walk("aaab")));
        assertEquals("v2", graph.valueAt(walk("ac")));
    }

    @Test
    public void testExistingEdgesAreFollowedAndMissingOnesShareAFreshNode() throws Exception {
        insert("ax", "v1");
        insert("[abc]y", "v2");
        // 'a' keeps its node, 'b' and 'c' share a new one
        assertEquals(walk("b"), walk("c"));
        assertNotEquals(walk("a"), walk("b"));
        assertEquals("v2", graph.valueAt(walk("ay")));
        assertEquals("v2", graph.valueAt(walk("cy")));
        assertNull(graph.valueAt(walk("a")));
    }

    @Test
    public void testDuplicateValueKeepsFirstAndRollsBack() throws Exception {
        insert("a", "literal");
        int nodes = graph.nodeCount();
        ValueAlreadyDefinedException e =
            assertThrows(ValueAlreadyDefinedException.class, () -> insert("[abc]", "class"));
        assertEquals("literal", e.getCurrent());
        assertEquals("class", e.getRequested());
        assertEquals(nodes, graph.nodeCount());
        assertEquals(TrieGraph.NONE, walk("b"));
        assertEquals("literal", graph.valueAt(walk("a")));
    }

    @Test
    public void testRollbackRemovesLoopOnExistingNode() throws Exception {
        insert("ab", "v1");
        assertThrows(ValueAlreadyDefinedException.class, () -> insert("a+b", "v2"));
        assertFalse(graph.hasSelfLoop(walk("a"), 'a'));
        assertEquals(TrieGraph.NONE, walk("aab"));
        assertEquals("v1", graph.valueAt(walk("ab")));
    }

    @Test
    public void testRepetitionOverLongerLiteralConflicts() throws Exception {
        insert("aa", "v1");
        int nodes = graph.nodeCount();
        ValueAlreadyDefinedException e =
            assertThrows(ValueAlreadyDefinedException.class, () -> insert("a+", "v2"));
        assertEquals("v1", e.getCurrent());
        assertEquals(nodes, graph.nodeCount());
        assertFalse(graph.hasSelfLoop(walk("a"), 'a'));
        assertNull(graph.valueAt(walk("a")));
        assertEquals(TrieGraph.NONE, walk("aaa"));
    }

    @Test
    public void testPlusFollowedByOverlappingClassIsExact() throws Exception {
        insert("a+[ab]", "v");
        assertNull(graph.valueAt(walk("a")));
        assertEquals("v", graph.valueAt(walk("aa")));
        assertEquals("v", graph.valueAt(walk("ab")));
        assertEquals("v", graph.valueAt(walk("aab")));
        assertEquals("v", graph.valueAt(walk("aaaa")));
        assertEquals(TrieGraph.NONE, walk("aba"));
        assertEquals(TrieGraph.NONE, walk("b"));
    }

    @Test
    public void testSharedClassSuccessorIsCopiedBeforeExtending() throws Exception {
        insert("[ab]c", "v1");
        insert("ad", "v2");
        assertNotEquals(walk("a"), walk("b"));
        assertEquals("v1", graph.valueAt(walk("ac")));
        assertEquals("v1", graph.valueAt(walk("bc")));
        assertEquals("v2", graph.valueAt(walk("ad")));
        assertEquals(TrieGraph.NONE, walk("bd"));
    }

    @Test
    public void testRepetitionDoesNotLoopAnExistingNode() throws Exception {
        insert("ab", "v1");
        insert("a+", "v2");
        int a = walk("a");
        assertFalse(graph.hasSelfLoop(a, 'a'));
        assertEquals("v2", graph.valueAt(a));
        assertEquals("v2", graph.valueAt(walk("aaaa")));
        assertEquals("v1", graph.valueAt(walk("ab")));
        assertEquals(TrieGraph.NONE, walk("aab"));
    }

    @Test
    public void testClassTouchingPartOfSharedNodeIsCopied() throws Exception {
        insert("[ab]+", "v1");
        insert("ac", "v2");
        assertEquals("v1", graph.valueAt(walk("ab")));
        assertEquals("v2", graph.valueAt(walk("ac")));
        assertEquals(TrieGraph.NONE, walk("bc"));
        assertEquals(TrieGraph.NONE, walk("abc"));
    }

    @Test
    public void testSharedNodeReusedWhenEveryPathAgrees() throws Exception {
        insert("[ab]c", "v1");
        int nodes = graph.nodeCount();
        insert("[ab]d", "v2");
        assertEquals(nodes + 1, graph.nodeCount());
        assertEquals(walk("a"), walk("b"));
        assertEquals("v2", graph.valueAt(walk("bd")));
    }

    @Test
    public void testFailedCopyRestoresIncomingEdges() throws Exception {
        insert("[ab]+", "v1");
        int nodes = graph.nodeCount();
        assertThrows(ValueAlreadyDefinedException.class, () -> insert("a", "v2"));
        assertEquals(nodes, graph.nodeCount());
        assertEquals(walk("a"), walk("b"));
        // the loop node is still exclusive to its paths, so it is extended in place
        insert("[ab]+c", "v3");
        assertEquals(nodes + 1, graph.nodeCount());
        assertEquals("v3", graph.valueAt(walk("abbac")));
    }

    @Test
    public void testInsertReportsCreatedNodes() throws Exception {
        assertEquals(3, graph.insert("abc", PatternParser.parse("abc", ALPHABET), "v1"));
        assertEquals(1, graph.insert("abd", PatternParser.parse("abd", ALPHABET), "v2"));
        assertEquals(0, graph.insert("ab", PatternParser.parse("ab", ALPHABET), "v3"));
    }
}
