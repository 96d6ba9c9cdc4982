package com.contractflow.analyzer.program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A control-flow node of one function. Identity is object identity.
 *
 * Besides its IR operations a node carries the front end's legacy call
 * summaries (internal, high-level and low-level calls). They usually repeat what
 * the IR already says and are only consulted for calls the IR did not yield.
 */
public class Node {

    private final Function function;
    private final int id;
    private final NodeType type;
    private final String expression;
    private final SourceMapping sourceMapping;

    private final List<Operation> operations = new ArrayList<>();
    private final List<Operation> internalCalls = new ArrayList<>();
    private final List<Operation> highLevelCalls = new ArrayList<>();
    private final List<Operation> lowLevelCalls = new ArrayList<>();

    // insertion-ordered, may be cyclic
    private final Set<Node> successors = new LinkedHashSet<>();
    private final Set<Node> predecessors = new LinkedHashSet<>();

    Node(Function function, int id, NodeType type, String expression, SourceMapping sourceMapping) {
        this.function = function;
        this.id = id;
        this.type = type != null ? type : NodeType.OTHER;
        this.expression = expression;
        this.sourceMapping = sourceMapping;
    }

    public Function getFunction()           { return function; }
    public int getId()                      { return id; }
    public NodeType getType()               { return type; }
    public String getExpression()           { return expression; }
    public SourceMapping getSourceMapping() { return sourceMapping; }

    public List<Operation> getOperations()     { return Collections.unmodifiableList(operations); }
    public List<Operation> getInternalCalls()  { return Collections.unmodifiableList(internalCalls); }
    public List<Operation> getHighLevelCalls() { return Collections.unmodifiableList(highLevelCalls); }
    public List<Operation> getLowLevelCalls()  { return Collections.unmodifiableList(lowLevelCalls); }

    public Set<Node> getSuccessors()   { return Collections.unmodifiableSet(successors); }
    public Set<Node> getPredecessors() { return Collections.unmodifiableSet(predecessors); }

    public boolean hasCallSummaries() {
        return !internalCalls.isEmpty() || !highLevelCalls.isEmpty() || !lowLevelCalls.isEmpty();
    }

    public Node addOperation(Operation operation) {
        operations.add(operation);
        return this;
    }

    public Node addInternalCallSummary(Function target, String text) {
        internalCalls.add(new Operation(OperationType.INTERNAL_CALL, target, text));
        return this;
    }

    public Node addHighLevelCallSummary(Function target, String text) {
        highLevelCalls.add(new Operation(OperationType.HIGH_LEVEL_CALL, target, text));
        return this;
    }

    public Node addLowLevelCallSummary(String text) {
        lowLevelCalls.add(new Operation(OperationType.LOW_LEVEL_CALL, null, text));
        return this;
    }

    /** Adds a control-flow edge {@code this -> son}, keeping predecessors in sync. */
    public Node addSuccessor(Node son) {
        successors.add(son);
        son.predecessors.add(this);
        return this;
    }

    @Override
    public String toString() {
        return function.getCanonicalName() + "#" + id + " " + type.label()
                + (expression != null ? " " + expression : "");
    }
}
