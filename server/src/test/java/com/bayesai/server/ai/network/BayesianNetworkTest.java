package com.bayesai.server.ai.network;

import com.bayesai.server.ai.TestNetworks;
import com.bayesai.server.ai.exception.StructuralException;
import com.bayesai.server.ai.exception.UnknownNodeException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.bayesai.server.ai.TestNetworks.TF;
import static com.bayesai.server.ai.TestNetworks.root;
import static com.bayesai.server.ai.TestNetworks.rows;
import static com.bayesai.server.ai.TestNetworks.tf;
import static org.junit.jupiter.api.Assertions.*;

class BayesianNetworkTest {

    private static NetworkNode child(String name, String parent) {
        return new NetworkNode(name, TF, List.of(tf(parent)), rows("(t,t)", 0.5, "(t,f)", 0.5, "(f,t)", 0.5, "(f,f)", 0.5));
    }

    @Test
    void testEmptyNetwork() {
        BayesianNetwork net = new BayesianNetwork(List.of());
        assertEquals(0, net.size());
        assertTrue(net.topologicalOrder().isEmpty());
        assertTrue(net.edges().isEmpty());
    }

    @Test
    void testAddThenRemoveRestoresNodesAndEdges() {
        BayesianNetwork net = TestNetworks.alarm();
        Set<String> nodesBefore = Set.copyOf(net.getNodeNames());
        Set<String> edgesBefore = Set.copyOf(net.edges());

        net.addNode(child("Neighbour", "JohnCalls"));
        assertEquals(6, net.size());
        assertTrue(net.edges().contains("JohnCalls->Neighbour"));

        assertEquals(List.of("Neighbour"), net.removeNode("Neighbour"));
        assertEquals(nodesBefore, Set.copyOf(net.getNodeNames()));
        assertEquals(edgesBefore, Set.copyOf(net.edges()));
    }

    @Test
    void testMissingParentRejectedWithoutChange() {
        BayesianNetwork net = TestNetworks.alarm();
        List<String> edgesBefore = net.edges();

        StructuralException e = assertThrows(StructuralException.class, () -> net.addNode(child("X", "Nowhere")));
        assertEquals("Nowhere", e.getIdentifier());
        assertFalse(net.contains("X"));
        assertEquals(edgesBefore, net.edges());
    }

    @Test
    void testSelfParentIsACycleAndRejected() {
        BayesianNetwork net = new BayesianNetwork();
        net.addNode(root("A", 0.5));

        StructuralException e = assertThrows(StructuralException.class, () -> net.addNode(child("G", "G")));
        assertEquals("G", e.getIdentifier());
        assertEquals(List.of("A"), net.getNodeNames());
        assertTrue(net.edges().isEmpty());
    }

    @Test
    void testDuplicateNodeRejected() {
        BayesianNetwork net = TestNetworks.alarm();
        assertThrows(StructuralException.class, () -> net.addNode(root("Burglary", 0.3)));
        assertEquals(0.001, net.getNode("Burglary").probability(java.util.Map.of(), "t"), 1e-12);
    }

    @Test
    void testParentDomainMismatchRejected() {
        BayesianNetwork net = new BayesianNetwork();
        net.addNode(root("A", 0.5));
        RandomVariable wrongA = new RandomVariable("A", List.of("yes", "no"));
        NetworkNode b = new NetworkNode("B", TF, List.of(wrongA),
                rows("(yes,t)", 0.5, "(yes,f)", 0.5, "(no,t)", 0.5, "(no,f)", 0.5));

        assertThrows(StructuralException.class, () -> net.addNode(b));
        assertFalse(net.contains("B"));
    }

    @Test
    void testRemoveWithDependentsRejected() {
        BayesianNetwork net = TestNetworks.alarm();
        StructuralException e = assertThrows(StructuralException.class, () -> net.removeNode("Alarm"));
        assertEquals("Alarm", e.getIdentifier());
        assertEquals(5, net.size());
        assertEquals(4, net.edges().size());
    }

    @Test
    void testCascadeRemovesDescendants() {
        BayesianNetwork net = TestNetworks.alarm();
        List<String> removed = net.removeNode("Alarm", RemovalPolicy.CASCADE);

        assertEquals(Set.of("Alarm", "JohnCalls", "MaryCalls"), Set.copyOf(removed));
        assertEquals("Alarm", removed.get(removed.size() - 1));
        assertEquals(List.of("Burglary", "Earthquake"), net.topologicalOrder());
        assertTrue(net.edges().isEmpty());
        assertTrue(net.children("Burglary").isEmpty());
    }

    @Test
    void testRemoveUnknownRejected() {
        BayesianNetwork net = TestNetworks.alarm();
        assertThrows(UnknownNodeException.class, () -> net.removeNode("Ghost"));
        assertThrows(UnknownNodeException.class, () -> net.getNode("Ghost"));
    }

    @Test
    void testTopologicalOrderBreaksTiesByName() {
        BayesianNetwork net = TestNetworks.alarm();
        assertEquals(List.of("Burglary", "Earthquake", "Alarm", "JohnCalls", "MaryCalls"), net.topologicalOrder());

        BayesianNetwork reversed = new BayesianNetwork();
        reversed.addNode(root("Zeta", 0.5));
        reversed.addNode(root("Alpha", 0.5));
        reversed.addNode(child("Mid", "Zeta"));
        assertEquals(List.of("Alpha", "Zeta", "Mid"), reversed.topologicalOrder());
    }

    @Test
    void testTopologicalOrderConsistentWithEdges() {
        BayesianNetwork net = TestNetworks.alarm();
        net.addNode(child("Neighbour", "JohnCalls"));
        List<String> order = net.topologicalOrder();
        for (String edge : net.edges()) {
            String[] ends = edge.split("->");
            assertTrue(order.indexOf(ends[0]) < order.indexOf(ends[1]), edge);
        }
    }

    @Test
    void testTopologicalOrderIsFixedByEachMutation() {
        BayesianNetwork net = TestNetworks.alarm();
        int[] afterAdd = net.topologicalIds();
        assertSame(afterAdd, net.topologicalIds(), "reads must not rebuild the order");
        assertEquals(5, afterAdd.length);

        net.addNode(child("Neighbour", "MaryCalls"));
        int[] afterSecondAdd = net.topologicalIds();
        assertNotSame(afterAdd, afterSecondAdd);
        assertEquals(6, afterSecondAdd.length);

        net.removeNode("Alarm", RemovalPolicy.CASCADE);
        assertSame(net.topologicalIds(), net.topologicalIds());
        assertEquals(List.of("Burglary", "Earthquake"), net.topologicalOrder());
    }

    @Test
    void testGraphQueries() {
        BayesianNetwork net = TestNetworks.alarm();

        assertEquals(List.of("Burglary", "Earthquake"), net.parents("Alarm"));
        assertEquals(List.of("JohnCalls", "MaryCalls"), net.children("Alarm"));
        assertEquals(Set.of("Alarm", "Burglary", "Earthquake"), net.ancestors("JohnCalls"));
        assertEquals(Set.of("Alarm", "JohnCalls", "MaryCalls"), net.descendants("Burglary"));
        assertTrue(net.ancestors("Burglary").isEmpty());
        assertThrows(StructuralException.class, () -> net.parents("Ghost"));
    }

    @Test
    void testCopyIsIndependent() {
        BayesianNetwork net = TestNetworks.alarm();
        BayesianNetwork copy = net.copy();

        copy.removeNode("MaryCalls");
        assertEquals(5, net.size());
        assertEquals(4, copy.size());
        assertNotSame(net.getNode("Alarm"), copy.getNode("Alarm"));
        assertEquals(net.getNode("Alarm").getCpt().toRows(), copy.getNode("Alarm").getCpt().toRows());
    }
}
