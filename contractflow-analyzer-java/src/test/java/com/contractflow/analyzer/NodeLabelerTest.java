package com.contractflow.analyzer;

import com.contractflow.analyzer.icfg.NodeLabeler;
import com.contractflow.analyzer.program.Contract;
import com.contractflow.analyzer.program.ContractKind;
import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.Node;
import com.contractflow.analyzer.program.NodeType;
import org.junit.jupiter.api.Test;

import static com.contractflow.analyzer.TestPrograms.*;
import static org.junit.jupiter.api.Assertions.*;

class NodeLabelerTest {

    private final NodeLabeler labeler = new NodeLabeler(120, 80);
    private final Contract vault = new Contract("Vault", ContractKind.CONTRACT);
    private final Function withdraw = vault.declareFunction("withdraw", "withdraw(uint256)", true);

    private String role(Node node) {
        return labeler.label(node).split("\n")[1];
    }

    @Test
    void labelStartsWithOwningFunction() {
        Node node = entry(withdraw, 1);
        assertEquals("Vault.withdraw(uint256)\nENTRY_POINT", labeler.label(node));
    }

    @Test
    void rolesFollowNodeTypeAndExpression() {
        entry(withdraw, 1);
        assertEquals("RETURN", role(withdraw.addNode(1, NodeType.RETURN, "balance", line(2))));
        assertEquals("NEW VARIABLE", role(withdraw.addNode(2, NodeType.NEW_VARIABLE, "uint256 x = 1", line(3))));
        assertEquals("ASSIGNMENT", role(withdraw.addNode(3, NodeType.EXPRESSION, "balance -= amount", line(4))));
        assertEquals("ASSIGNMENT", role(withdraw.addNode(4, NodeType.EXPRESSION, "v = x", line(5))));
        assertEquals("EXPRESSION", role(withdraw.addNode(5, NodeType.EXPRESSION, "require(a == b)", line(6))));
        assertEquals("EXPRESSION", role(withdraw.addNode(6, NodeType.EXPRESSION, "require(a <= b && c != d)", line(7))));
        assertEquals("IF", role(withdraw.addNode(7, NodeType.IF, "amount > 0", line(8))));
    }

    @Test
    void longExpressionIsTruncated() {
        entry(withdraw, 1);
        String expression = "token.transfer(" + "x".repeat(200) + ")";
        Node node = withdraw.addNode(1, NodeType.EXPRESSION, expression, line(2));

        String text = labeler.label(node).split("\n")[2];
        assertEquals(120, text.length());
        assertTrue(text.endsWith("..."));
    }

    @Test
    void irTextIsUsedWhenThereIsNoExpression() {
        entry(withdraw, 1);
        Node node = withdraw.addNode(1, NodeType.EXPRESSION, null, line(2))
                .addOperation(other("TMP_0 = a"))
                .addOperation(other("y".repeat(100)));

        String text = labeler.label(node).split("\n")[2];
        assertEquals(80, text.length());
        assertTrue(text.startsWith("TMP_0 = a; yyy"));
    }
}
