package com.contractflow.analyzer.callgraph;

import com.contractflow.analyzer.program.Function;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Id table for the functions of one run. Ids are dense, start at 0 and follow
 * first registration order.
 *
 * Model functions are keyed by object identity, so two declarations that share a
 * canonical name (overloads dumped without signatures) still get distinct ids.
 * Synthetic callees are additionally keyed by canonical name: two objects
 * describing the same outside function share one id.
 */
public class FunctionRegistry {

    private final Map<Function, Integer> ids = new IdentityHashMap<>();
    private final Map<String, Integer> syntheticIdsByName = new HashMap<>();
    private final List<Function> functions = new ArrayList<>();
    private final List<Boolean> synthetic = new ArrayList<>();

    /** Registers a function of the program model. */
    public int register(Function function) {
        return registerOrLookup(function, false);
    }

    /**
     * Returns the id of {@code function}, registering it first if it was never seen.
     * {@code synthetic} marks callees that are not part of the analyzed model; it
     * only has an effect on first registration.
     */
    public int registerOrLookup(Function function, boolean synthetic) {
        Integer existing = ids.get(function);
        if (existing != null) return existing;
        if (synthetic) {
            Integer sameName = syntheticIdsByName.get(function.getCanonicalName());
            if (sameName != null) {
                ids.put(function, sameName);
                return sameName;
            }
        }
        int id = functions.size();
        ids.put(function, id);
        if (synthetic) syntheticIdsByName.put(function.getCanonicalName(), id);
        functions.add(function);
        this.synthetic.add(synthetic);
        return id;
    }

    /** Id of an already registered function, or null. */
    public Integer lookup(Function function) {
        return function == null ? null : ids.get(function);
    }

    public Function get(int id)         { return functions.get(id); }
    public boolean isSynthetic(int id)  { return synthetic.get(id); }
    public int size()                   { return functions.size(); }

    /** Registered functions in id order. */
    public List<Function> getFunctions() { return Collections.unmodifiableList(functions); }
}
