package com.contractflow.analyzer.program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A contract together with the functions it declares, in declaration order.
 */
public class Contract {

    private final String name;
    private final ContractKind kind;
    private final List<Function> functions = new ArrayList<>();

    public Contract(String name, ContractKind kind) {
        this.name = name;
        this.kind = kind != null ? kind : ContractKind.CONTRACT;
    }

    public String getName()       { return name; }
    public ContractKind getKind() { return kind; }
    public boolean isInterface()  { return kind == ContractKind.INTERFACE; }
    public boolean isLibrary()    { return kind == ContractKind.LIBRARY; }

    public List<Function> getFunctions() { return Collections.unmodifiableList(functions); }

    /**
     * Declares a new function on this contract. The function is appended to the
     * declaration order.
     */
    public Function declareFunction(String name, String signature, boolean implemented) {
        Function function = new Function(this, name, signature, implemented);
        functions.add(function);
        return function;
    }

    @Override
    public String toString() { return name; }
}
