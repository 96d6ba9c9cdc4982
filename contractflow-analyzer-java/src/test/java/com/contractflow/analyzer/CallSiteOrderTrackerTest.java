package com.contractflow.analyzer;

import com.contractflow.analyzer.callgraph.CallSiteOrderTracker;
import com.contractflow.analyzer.program.Contract;
import com.contractflow.analyzer.program.ContractKind;
import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.Node;
import com.contractflow.analyzer.program.NodeType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.contractflow.analyzer.TestPrograms.*;
import static org.junit.jupiter.api.Assertions.*;

class CallSiteOrderTrackerTest {

    private final Contract contract = new Contract("C", ContractKind.CONTRACT);

    @Test
    void nodesAreSortedByFirstLine() {
        Function f = contract.declareFunction("f", "f()", true);
        Node late = f.addNode(0, NodeType.EXPRESSION, "b()", line(9));
        Node early = f.addNode(1, NodeType.EXPRESSION, "a()", line(4));

        List<Node> order = new CallSiteOrderTracker().begin(f);
        assertEquals(List.of(early, late), order);
    }

    @Test
    void offsetIsUsedWhenLinesAreMissing() {
        Function f = contract.declareFunction("f", "f()", true);
        Node second = f.addNode(0, NodeType.EXPRESSION, "b()", offset(300));
        Node first = f.addNode(1, NodeType.EXPRESSION, "a()", offset(120));

        assertEquals(List.of(first, second), new CallSiteOrderTracker().begin(f));
    }

    @Test
    void nodesWithoutPositionSortLast() {
        Function f = contract.declareFunction("f", "f()", true);
        Node unknown = f.addNode(0, NodeType.EXPRESSION, "x()", null);
        Node known = f.addNode(1, NodeType.EXPRESSION, "y()", line(50));

        assertEquals(List.of(known, unknown), new CallSiteOrderTracker().begin(f));
    }

    @Test
    void equalKeysKeepFrontEndOrder() {
        Function f = contract.declareFunction("f", "f()", true);
        Node a = f.addNode(0, NodeType.IF_LOOP, "i < n", line(5));
        Node b = f.addNode(1, NodeType.EXPRESSION, "i ++", line(5));
        Node c = f.addNode(2, NodeType.EXPRESSION, "g()", line(5));

        assertEquals(List.of(a, b, c), new CallSiteOrderTracker().begin(f));
    }

    @Test
    void counterRestartsForEveryFunction() {
        Function f = contract.declareFunction("f", "f()", true);
        Function g = contract.declareFunction("g", "g()", true);
        CallSiteOrderTracker tracker = new CallSiteOrderTracker();

        tracker.begin(f);
        assertEquals(1, tracker.nextOrder());
        assertEquals(2, tracker.nextOrder());
        assertEquals(2, tracker.issued());

        tracker.begin(g);
        assertEquals(0, tracker.issued());
        assertEquals(1, tracker.nextOrder());
    }

    @Test
    void nextOrderBeforeBeginFails() {
        assertThrows(IllegalStateException.class, () -> new CallSiteOrderTracker().nextOrder());
    }
}
