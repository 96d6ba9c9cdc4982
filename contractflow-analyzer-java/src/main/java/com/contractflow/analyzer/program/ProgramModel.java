package com.contractflow.analyzer.program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only view of everything the front end analyzed: contracts in the order
 * the front end reported them, each with its declared functions.
 */
public class ProgramModel {

    private final List<Contract> contracts;

    public ProgramModel(List<Contract> contracts) {
        this.contracts = contracts != null ? List.copyOf(contracts) : Collections.emptyList();
    }

    public static ProgramModel empty() {
        return new ProgramModel(Collections.emptyList());
    }

    public List<Contract> getContracts() { return contracts; }

    /** All declared functions, contract order first, then declaration order. */
    public List<Function> getFunctions() {
        List<Function> all = new ArrayList<>();
        for (Contract contract : contracts) {
            all.addAll(contract.getFunctions());
        }
        return all;
    }
}
