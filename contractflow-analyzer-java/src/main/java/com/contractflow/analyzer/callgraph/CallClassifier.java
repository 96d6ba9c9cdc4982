package com.contractflow.analyzer.callgraph;

import com.contractflow.analyzer.program.Contract;
import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.Operation;

/**
 * Decides what kind of call an IR operation (or a legacy call summary) is.
 *
 * A library-declared target wins over the syntactic form of the operation; an
 * operation without a target is always low-level.
 */
public class CallClassifier {

    /**
     * @return the call kind, or null when the operation is not a call at all
     */
    public CallKind classify(Operation operation) {
        if (operation == null || !operation.isCall()) return null;

        Function target = operation.target();
        if (target == null) return CallKind.LOW_LEVEL;

        return switch (operation.type()) {
            case LOW_LEVEL_CALL -> CallKind.LOW_LEVEL;
            case LIBRARY_CALL -> CallKind.LIBRARY;
            case INTERNAL_CALL -> isLibrary(target) ? CallKind.LIBRARY : CallKind.INTERNAL;
            case HIGH_LEVEL_CALL -> isLibrary(target) ? CallKind.LIBRARY : CallKind.HIGH_LEVEL;
            case OTHER -> null;
        };
    }

    private static boolean isLibrary(Function target) {
        Contract contract = target.getContract();
        return contract != null && contract.isLibrary();
    }
}
