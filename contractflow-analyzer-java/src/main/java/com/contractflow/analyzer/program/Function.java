package com.contractflow.analyzer.program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function as delivered by the front end.
 *
 * Identity is the pair (declaring contract name, signature-qualified name); see
 * {@link #getFullName()}. The signature is optional: front ends that do not
 * report one leave it null and the simple name is used instead.
 */
public class Function {

    private final Contract contract;
    private final String name;
    private final String signature;
    private final boolean implemented;

    private String visibility;
    private String stateMutability;
    private boolean constructor;
    private boolean fallback;
    private boolean receive;
    private List<Variable> parameters = Collections.emptyList();
    private List<Variable> returns = Collections.emptyList();
    private List<String> modifiers = Collections.emptyList();
    private List<String> stateVariablesRead = Collections.emptyList();
    private List<String> stateVariablesWritten = Collections.emptyList();
    private SourceMapping sourceMapping;

    private final List<Node> nodes = new ArrayList<>();
    private Node entryPoint;

    Function(Contract contract, String name, String signature, boolean implemented) {
        this.contract = contract;
        this.name = name;
        this.signature = signature;
        this.implemented = implemented;
    }

    public Contract getContract()  { return contract; }
    public String getName()        { return name; }
    public String getSignature()   { return signature; }
    public boolean isImplemented() { return implemented; }

    /** Signature when known, otherwise the simple name. */
    public String getFullName() {
        return signature != null ? signature : name;
    }

    /** {@code Contract.fullName}, the stable identity used across the pipeline. */
    public String getCanonicalName() {
        String contractName = contract != null ? contract.getName() : "?";
        return contractName + "." + getFullName();
    }

    public String getVisibility()            { return visibility; }
    public String getStateMutability()       { return stateMutability; }
    public boolean isConstructor()           { return constructor; }
    public boolean isFallback()              { return fallback; }
    public boolean isReceive()               { return receive; }
    public List<Variable> getParameters()    { return parameters; }
    public List<Variable> getReturns()       { return returns; }
    public List<String> getModifiers()       { return modifiers; }
    public List<String> getStateVariablesRead()    { return stateVariablesRead; }
    public List<String> getStateVariablesWritten() { return stateVariablesWritten; }
    public SourceMapping getSourceMapping()  { return sourceMapping; }

    public void setVisibility(String visibility)           { this.visibility = visibility; }
    public void setStateMutability(String stateMutability) { this.stateMutability = stateMutability; }
    public void setConstructor(boolean constructor)        { this.constructor = constructor; }
    public void setFallback(boolean fallback)              { this.fallback = fallback; }
    public void setReceive(boolean receive)                { this.receive = receive; }
    public void setSourceMapping(SourceMapping sourceMapping) { this.sourceMapping = sourceMapping; }

    public void setParameters(List<Variable> parameters) {
        this.parameters = parameters != null ? List.copyOf(parameters) : Collections.emptyList();
    }

    public void setReturns(List<Variable> returns) {
        this.returns = returns != null ? List.copyOf(returns) : Collections.emptyList();
    }

    public void setModifiers(List<String> modifiers) {
        this.modifiers = modifiers != null ? List.copyOf(modifiers) : Collections.emptyList();
    }

    public void setStateVariablesRead(List<String> read) {
        this.stateVariablesRead = read != null ? List.copyOf(read) : Collections.emptyList();
    }

    public void setStateVariablesWritten(List<String> written) {
        this.stateVariablesWritten = written != null ? List.copyOf(written) : Collections.emptyList();
    }

    /** Owned nodes in front-end order. */
    public List<Node> getNodes() { return Collections.unmodifiableList(nodes); }

    /** Entry node, or null for unimplemented functions. */
    public Node getEntryPoint() { return entryPoint; }

    public void setEntryPoint(Node entryPoint) { this.entryPoint = entryPoint; }

    public Node addNode(int id, NodeType type, String expression, SourceMapping sourceMapping) {
        Node node = new Node(this, id, type, expression, sourceMapping);
        nodes.add(node);
        return node;
    }

    @Override
    public String toString() { return getCanonicalName(); }
}
