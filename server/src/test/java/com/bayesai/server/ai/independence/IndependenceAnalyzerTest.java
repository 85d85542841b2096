package com.bayesai.server.ai.independence;

import com.bayesai.server.ai.TestNetworks;
import com.bayesai.server.ai.exception.QuerySemanticException;
import com.bayesai.server.ai.network.BayesianNetwork;
import com.bayesai.server.ai.network.NetworkNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.bayesai.server.ai.TestNetworks.TF;
import static com.bayesai.server.ai.TestNetworks.root;
import static com.bayesai.server.ai.TestNetworks.rows;
import static com.bayesai.server.ai.TestNetworks.tf;
import static org.junit.jupiter.api.Assertions.*;

class IndependenceAnalyzerTest {

    private BayesianNetwork alarm;
    private IndependenceAnalyzer analyzer;

    @BeforeEach
    void setup() {
        alarm = TestNetworks.alarm();
        analyzer = new IndependenceAnalyzer(alarm);
    }

    @Test
    void testCommonCauseBlockedByEvidence() {
        assertFalse(analyzer.isIndependent(Set.of("JohnCalls"), Set.of("MaryCalls")));
        assertTrue(analyzer.isIndependent(Set.of("JohnCalls"), Set.of("MaryCalls"), Set.of("Alarm")));
    }

    @Test
    void testColliderOpenedByEvidenceOnItOrItsDescendant() {
        assertTrue(analyzer.isIndependent(Set.of("Burglary"), Set.of("Earthquake")));
        assertFalse(analyzer.isIndependent(Set.of("Burglary"), Set.of("Earthquake"), Set.of("Alarm")));
        assertFalse(analyzer.isIndependent(Set.of("Burglary"), Set.of("Earthquake"), Set.of("JohnCalls")));
    }

    @Test
    void testChainBlockedByMiddle() {
        assertFalse(analyzer.isIndependent(Set.of("Burglary"), Set.of("JohnCalls")));
        assertTrue(analyzer.isIndependent(Set.of("Burglary"), Set.of("JohnCalls"), Set.of("Alarm")));
        assertTrue(analyzer.isIndependent(Set.of("Burglary", "Earthquake"), Set.of("JohnCalls", "MaryCalls"),
                Set.of("Alarm")));
    }

    @Test
    void testDisconnectedComponentsAreIndependent() {
        alarm.addNode(root("Weather", 0.3));
        alarm.addNode(new NetworkNode("Umbrella", TF, List.of(tf("Weather")),
                rows("(t,t)", 0.8, "(t,f)", 0.2, "(f,t)", 0.1, "(f,f)", 0.9)));
        assertTrue(analyzer.isIndependent(Set.of("Umbrella"), Set.of("Alarm")));
        assertFalse(analyzer.isIndependent(Set.of("Umbrella"), Set.of("Weather")));
    }

    @Test
    void testSymmetry() {
        List<String> names = alarm.getNodeNames();
        for (String a : names) {
            for (String b : names) {
                for (String e : names) {
                    if (a.equals(b) || a.equals(e) || b.equals(e)) {
                        continue;
                    }
                    IndependenceQuery q = IndependenceQuery.of(a, b, e);
                    assertEquals(analyzer.isIndependent(q), analyzer.isIndependent(q.swapped()), q.toString());
                }
                if (!a.equals(b)) {
                    IndependenceQuery q = IndependenceQuery.of(a, b);
                    assertEquals(analyzer.isIndependent(q), analyzer.isIndependent(q.swapped()), q.toString());
                }
            }
        }
    }

    @Test
    void testInvalidQueriesRejected() {
        QuerySemanticException unknown = assertThrows(QuerySemanticException.class,
                () -> analyzer.isIndependent(Set.of("Ghost"), Set.of("Alarm")));
        assertEquals("Ghost", unknown.getIdentifier());

        QuerySemanticException overlap = assertThrows(QuerySemanticException.class,
                () -> analyzer.isIndependent(Set.of("Alarm"), Set.of("JohnCalls"), Set.of("Alarm")));
        assertEquals("Alarm", overlap.getIdentifier());

        assertThrows(QuerySemanticException.class,
                () -> analyzer.isIndependent(Set.of("Alarm", "Burglary"), Set.of("Burglary")));
        assertThrows(QuerySemanticException.class, () -> analyzer.isIndependent(Set.of(), Set.of("Alarm")));
    }
}
