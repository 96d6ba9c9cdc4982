package com.contractflow.analyzer.callgraph;

import com.contractflow.analyzer.program.Contract;
import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.ProgramModel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a call target that may be abstract (interface or unimplemented function)
 * to a concrete implementation.
 *
 * Candidates are the implemented functions of all non-interface contracts, in
 * contract order then declaration order. A candidate matches on simple name;
 * when both sides carry a signature the signatures must be equal too. The first
 * match wins. Without a match the input is returned unchanged.
 */
public class FunctionResolver {

    private final Map<String, List<Function>> implementedByName = new HashMap<>();
    private final Map<Function, Function> cache = new IdentityHashMap<>();

    public FunctionResolver(ProgramModel program) {
        for (Contract contract : program.getContracts()) {
            if (contract.isInterface()) continue;
            for (Function function : contract.getFunctions()) {
                if (!function.isImplemented() || function.getName() == null) continue;
                implementedByName.computeIfAbsent(function.getName(), k -> new ArrayList<>()).add(function);
            }
        }
    }

    /**
     * @return the best concrete implementation of {@code target}, or {@code target}
     *         itself when it is already implemented or nothing matches; null only
     *         for a null input
     */
    public Function resolve(Function target) {
        if (target == null || target.isImplemented()) return target;
        return cache.computeIfAbsent(target, this::lookup);
    }

    private Function lookup(Function target) {
        List<Function> candidates = implementedByName.getOrDefault(target.getName(), List.of());
        List<Function> matches = new ArrayList<>();
        for (Function candidate : candidates) {
            if (target.getSignature() != null && candidate.getSignature() != null
                    && !target.getSignature().equals(candidate.getSignature())) {
                continue;
            }
            matches.add(candidate);
        }
        if (matches.isEmpty()) return target;
        if (matches.size() > 1) {
            System.err.println("[contract-flow] WARNING: " + matches.size() + " implementations match "
                    + target.getCanonicalName() + ", using " + matches.get(0).getCanonicalName());
        }
        return matches.get(0);
    }
}
