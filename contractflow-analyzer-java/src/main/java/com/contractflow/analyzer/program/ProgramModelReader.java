package com.contractflow.analyzer.program;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the front end's program dump and links it into a {@link ProgramModel}.
 *
 * Linking is done in two passes: every declared function is created first so that
 * operations can reference functions of contracts that appear later in the dump.
 * References to functions the dump never declares are bound to placeholder
 * functions (unimplemented, no nodes); successor ids that do not exist are
 * skipped with a warning.
 */
public class ProgramModelReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and links the dump at {@code dumpPath}.
     *
     * @throws ProgramReadException if the file is missing or malformed
     */
    public ProgramModel read(Path dumpPath) {
        if (!Files.exists(dumpPath)) {
            throw new ProgramReadException("Program dump not found: " + dumpPath);
        }
        try (Reader reader = Files.newBufferedReader(dumpPath, StandardCharsets.UTF_8)) {
            return read(reader, dumpPath.toString());
        } catch (IOException e) {
            throw new ProgramReadException("Failed to read program dump: " + dumpPath + ": " + e.getMessage(), e);
        }
    }

    public ProgramModel read(Reader reader, String origin) {
        ProgramDump.DumpRoot root;
        try {
            root = GSON.fromJson(reader, ProgramDump.DumpRoot.class);
        } catch (JsonParseException e) {
            throw new ProgramReadException("Malformed program dump: " + origin + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new ProgramReadException("Program dump is empty or invalid JSON: " + origin);
        }
        return link(root);
    }

    ProgramModel link(ProgramDump.DumpRoot root) {
        Linker linker = new Linker();
        List<Contract> contracts = new ArrayList<>();
        List<ProgramDump.DumpContract> dumpContracts = root.contracts != null ? root.contracts : List.of();

        // pass 1: contracts and function shells
        Map<Function, ProgramDump.DumpFunction> pending = new LinkedHashMap<>();
        for (ProgramDump.DumpContract dc : dumpContracts) {
            if (dc == null || dc.name == null) {
                System.err.println("[contract-flow] WARNING: contract without name ignored");
                continue;
            }
            Contract contract = new Contract(dc.name, dc.kind);
            contracts.add(contract);
            linker.declareContract(contract);
            if (dc.functions == null) continue;
            for (ProgramDump.DumpFunction df : dc.functions) {
                if (df == null || df.name == null) {
                    System.err.println("[contract-flow] WARNING: function without name ignored in " + dc.name);
                    continue;
                }
                boolean implemented = df.implemented != null
                        ? df.implemented
                        : df.nodes != null && !df.nodes.isEmpty();
                Function function = contract.declareFunction(df.name, df.signature, implemented);
                copyAttributes(df, function);
                linker.declare(function);
                pending.put(function, df);
            }
        }

        // pass 2: nodes, operations, edges
        for (Map.Entry<Function, ProgramDump.DumpFunction> entry : pending.entrySet()) {
            linkNodes(entry.getKey(), entry.getValue(), linker);
        }
        return new ProgramModel(contracts);
    }

    private void copyAttributes(ProgramDump.DumpFunction df, Function function) {
        function.setVisibility(df.visibility);
        function.setStateMutability(df.stateMutability);
        function.setConstructor(df.isConstructor);
        function.setFallback(df.isFallback);
        function.setReceive(df.isReceive);
        function.setParameters(df.parameters);
        function.setReturns(df.returns);
        function.setModifiers(df.modifiers);
        function.setStateVariablesRead(df.stateVariablesRead);
        function.setStateVariablesWritten(df.stateVariablesWritten);
        function.setSourceMapping(df.sourceMapping);
    }

    private void linkNodes(Function function, ProgramDump.DumpFunction df, Linker linker) {
        if (df.nodes == null) return;

        Map<Integer, Node> byId = new HashMap<>();
        for (ProgramDump.DumpNode dn : df.nodes) {
            if (dn == null) continue;
            if (byId.containsKey(dn.id)) {
                System.err.println("[contract-flow] WARNING: duplicate node id " + dn.id
                        + " in " + function.getCanonicalName() + " ignored");
                continue;
            }
            Node node = function.addNode(dn.id, NodeType.fromLabel(dn.type),
                    asText(dn.expression), dn.sourceMapping);
            byId.put(dn.id, node);

            if (dn.irs != null) {
                for (ProgramDump.DumpOperation op : dn.irs) {
                    if (op == null) continue;
                    node.addOperation(new Operation(op.type, linker.resolve(op.target), asText(op.text)));
                }
            }
            if (dn.internalCalls != null) {
                for (String ref : dn.internalCalls) {
                    node.addInternalCallSummary(linker.resolve(ref), ref);
                }
            }
            if (dn.highLevelCalls != null) {
                for (String ref : dn.highLevelCalls) {
                    node.addHighLevelCallSummary(linker.resolve(ref), ref);
                }
            }
            if (dn.lowLevelCalls != null) {
                for (JsonElement text : dn.lowLevelCalls) {
                    node.addLowLevelCallSummary(asText(text));
                }
            }
        }

        for (ProgramDump.DumpNode dn : df.nodes) {
            if (dn == null || dn.sons == null) continue;
            Node node = byId.get(dn.id);
            for (Integer sonId : dn.sons) {
                Node son = sonId != null ? byId.get(sonId) : null;
                if (son == null) {
                    System.err.println("[contract-flow] WARNING: unknown successor " + sonId
                            + " of node " + dn.id + " in " + function.getCanonicalName() + " skipped");
                    continue;
                }
                node.addSuccessor(son);
            }
        }

        if (df.entryPoint != null) {
            Node entry = byId.get(df.entryPoint);
            if (entry == null) {
                System.err.println("[contract-flow] WARNING: entry point " + df.entryPoint
                        + " of " + function.getCanonicalName() + " is not one of its nodes");
            }
            function.setEntryPoint(entry);
        } else if (!function.getNodes().isEmpty()) {
            function.setEntryPoint(function.getNodes().get(0));
        }
    }

    /**
     * Coerces any JSON value to text: strings as-is, other primitives via their
     * string form, arrays and objects as compact JSON. JSON null stays null.
     */
    static String asText(JsonElement element) {
        if (element == null || element.isJsonNull()) return null;
        if (element.isJsonPrimitive()) return element.getAsString();
        return element.toString();
    }

    /** Canonical-id table for one dump, with placeholder creation for unknown ids. */
    private static class Linker {
        private final Map<String, Function> byCanonicalName = new HashMap<>();
        private final Map<String, Contract> placeholderContracts = new HashMap<>();
        private final Map<String, ContractKind> declaredKinds = new HashMap<>();

        void declareContract(Contract contract) {
            declaredKinds.putIfAbsent(contract.getName(), contract.getKind());
        }

        void declare(Function function) {
            Function previous = byCanonicalName.putIfAbsent(function.getCanonicalName(), function);
            if (previous != null) {
                System.err.println("[contract-flow] WARNING: duplicate function id "
                        + function.getCanonicalName() + ", references bind to the first declaration");
            }
        }

        Function resolve(String ref) {
            if (ref == null || ref.isBlank()) return null;
            Function known = byCanonicalName.get(ref);
            if (known != null) return known;

            int paren = ref.indexOf('(');
            int dot = ref.lastIndexOf('.', paren >= 0 ? paren : ref.length());
            String contractName = dot > 0 ? ref.substring(0, dot) : "?";
            String fullName = dot >= 0 ? ref.substring(dot + 1) : ref;
            String simpleName = fullName.contains("(") ? fullName.substring(0, fullName.indexOf('(')) : fullName;
            String signature = fullName.contains("(") ? fullName : null;

            // a placeholder keeps the kind of a declared contract of the same name
            Contract placeholder = placeholderContracts.computeIfAbsent(
                    contractName, n -> new Contract(n, declaredKinds.getOrDefault(n, ContractKind.CONTRACT)));
            Function synthetic = placeholder.declareFunction(simpleName, signature, false);
            byCanonicalName.put(ref, synthetic);
            System.err.println("[contract-flow] WARNING: reference to undeclared function " + ref
                    + " bound to a placeholder");
            return synthetic;
        }
    }

    public static class ProgramReadException extends RuntimeException {
        public ProgramReadException(String message) { super(message); }
        public ProgramReadException(String message, Throwable cause) { super(message, cause); }
    }
}
