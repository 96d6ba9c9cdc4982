package com.contractflow.analyzer.icfg;

import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.Node;
import com.contractflow.analyzer.program.NodeType;
import com.contractflow.analyzer.program.Operation;

import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the multi-line label of an ICFG node:
 * <pre>
 *   Contract.function(signature)
 *   ROLE
 *   expression (or IR text when there is no expression)
 * </pre>
 */
public class NodeLabeler {

    // "=", "+=", "<<=" ... but not "==", "!=", "<=", ">="
    private static final Pattern ASSIGNMENT =
            Pattern.compile("(?<![=!<>+\\-*/%|&^])(?:[+\\-*/%|&^]|<<|>>)?=(?!=)");

    private final int expressionLimit;
    private final int irLimit;

    public NodeLabeler(int expressionLimit, int irLimit) {
        this.expressionLimit = expressionLimit;
        this.irLimit = irLimit;
    }

    public String label(Node node) {
        Function function = node.getFunction();
        StringBuilder sb = new StringBuilder();
        sb.append(function.getCanonicalName()).append('\n').append(role(node));

        String expression = node.getExpression();
        if (expression != null && !expression.isBlank()) {
            sb.append('\n').append(truncate(expression, expressionLimit));
        } else {
            String ir = node.getOperations().stream()
                    .map(Operation::text)
                    .filter(t -> !t.isEmpty())
                    .collect(Collectors.joining("; "));
            if (!ir.isEmpty()) sb.append('\n').append(truncate(ir, irLimit));
        }
        return sb.toString();
    }

    static String role(Node node) {
        if (node.getType() == NodeType.ENTRY_POINT || node == node.getFunction().getEntryPoint()) {
            return "ENTRY_POINT";
        }
        return switch (node.getType()) {
            case RETURN -> "RETURN";
            case NEW_VARIABLE -> "NEW VARIABLE";
            case EXPRESSION -> isAssignment(node.getExpression()) ? "ASSIGNMENT" : "EXPRESSION";
            default -> node.getType().label();
        };
    }

    static boolean isAssignment(String expression) {
        return expression != null && ASSIGNMENT.matcher(expression).find();
    }

    static String truncate(String text, int limit) {
        if (text.length() <= limit) return text;
        if (limit <= 3) return text.substring(0, limit);
        return text.substring(0, limit - 3) + "...";
    }
}
