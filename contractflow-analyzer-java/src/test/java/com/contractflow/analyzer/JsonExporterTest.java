package com.contractflow.analyzer;

import com.contractflow.analyzer.config.AnalysisConfig;
import com.contractflow.analyzer.export.ExportAssembler;
import com.contractflow.analyzer.export.ExportModel;
import com.contractflow.analyzer.export.JsonExporter;
import com.contractflow.analyzer.program.Contract;
import com.contractflow.analyzer.program.ContractKind;
import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.NodeType;
import com.contractflow.analyzer.program.ProgramModel;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static com.contractflow.analyzer.TestPrograms.*;
import static org.junit.jupiter.api.Assertions.*;

class JsonExporterTest {

    private static ExportModel.ExportRoot assemble(ProgramModel program) {
        AnalysisResult result = new ContractAnalyzer(AnalysisConfig.defaults()).analyze(program);
        return new ExportAssembler().assemble(result.program(), result.callGraph(), result.icfg());
    }

    private static JsonObject parse(String json) {
        return JsonParser.parseString(json).getAsJsonObject();
    }

    @Test
    void documentHasTheThreeTopLevelSections() {
        JsonObject doc = parse(new JsonExporter().toJson(assemble(new TestPrograms.BaseCaller().program)));

        assertTrue(doc.has("functions"));
        JsonObject callGraph = doc.getAsJsonObject("call_graph");
        for (String key : new String[]{"nodes", "edges", "function_edges", "call_sites", "low_level_calls"}) {
            assertTrue(callGraph.has(key), "call_graph." + key + " missing");
        }
        JsonObject icfg = doc.getAsJsonObject("icfg");
        assertTrue(icfg.has("nodes"));
        assertTrue(icfg.has("edges"));
    }

    @Test
    void callGraphEdgeCarriesCallSiteMetadata() {
        JsonObject doc = parse(new JsonExporter().toJson(assemble(new TestPrograms.BaseCaller().program)));
        JsonArray edges = doc.getAsJsonObject("call_graph").getAsJsonArray("edges");

        assertEquals(1, edges.size());
        JsonObject edge = edges.get(0).getAsJsonObject();
        assertEquals(1, edge.get("src").getAsInt());
        assertEquals(0, edge.get("dst").getAsInt());
        assertEquals(1, edge.get("order").getAsInt());
        assertEquals("internal", edge.get("call_type").getAsString());
        assertEquals("set(5)", edge.get("call_site").getAsString());
        assertEquals(7, edge.getAsJsonObject("source_mapping").getAsJsonArray("lines").get(0).getAsInt());
    }

    @Test
    void functionDescriptorsListStateVariables() {
        JsonObject doc = parse(new JsonExporter().toJson(assemble(new TestPrograms.BaseCaller().program)));
        JsonObject set = doc.getAsJsonArray("functions").get(0).getAsJsonObject();

        assertEquals("set", set.get("name").getAsString());
        assertEquals("set(uint256)", set.get("full_name").getAsString());
        assertEquals("Base", set.get("contract").getAsString());
        assertEquals("v", set.getAsJsonArray("state_variables_written").get(0).getAsString());
        assertTrue(set.get("source_mapping").isJsonNull(), "missing location must be written as null");
    }

    @Test
    void icfgEdgesAreTyped() {
        JsonObject doc = parse(new JsonExporter().toJson(assemble(new TestPrograms.BaseCaller().program)));
        JsonArray edges = doc.getAsJsonObject("icfg").getAsJsonArray("edges");

        JsonObject intra = edges.get(0).getAsJsonObject();
        assertEquals("intra_procedural", intra.get("type").getAsString());
        assertTrue(intra.get("call_type").isJsonNull());
        JsonObject inter = edges.get(1).getAsJsonObject();
        assertEquals("inter_procedural", inter.get("type").getAsString());
        assertEquals("internal", inter.get("call_type").getAsString());
    }

    @Test
    void lowLevelCallsAreListedWithOrder() {
        Contract c = new Contract("Proxy", ContractKind.CONTRACT);
        Function f = c.declareFunction("fallback", "fallback()", true);
        entry(f, 1);
        f.addNode(1, NodeType.EXPRESSION, "impl.delegatecall(msg.data)", line(2))
                .addOperation(lowLevelCall("LOW_LEVEL_CALL impl"));

        JsonObject doc = parse(new JsonExporter().toJson(assemble(program(c))));
        JsonObject callGraph = doc.getAsJsonObject("call_graph");

        assertEquals(0, callGraph.getAsJsonArray("edges").size());
        JsonArray lows = callGraph.getAsJsonArray("low_level_calls");
        assertEquals(1, lows.size());
        assertEquals(1, lows.get(0).getAsJsonObject().get("order").getAsInt());
        assertEquals("Proxy.fallback()", lows.get(0).getAsJsonObject().get("function_name").getAsString());
    }

    @Test
    void identicalInputGivesByteIdenticalOutput(@TempDir Path tmp) throws Exception {
        TestPrograms.InterfaceImpl p = new TestPrograms.InterfaceImpl();
        JsonExporter exporter = new JsonExporter();

        Path first = exporter.write(assemble(p.program), tmp, "first.json");
        Path second = exporter.write(assemble(p.program), tmp, "second.json");

        assertEquals(Files.readString(first), Files.readString(second));
    }

    @Test
    void outputDirCreatedIfAbsent(@TempDir Path tmp) {
        Path nested = tmp.resolve("a/b/c");
        new JsonExporter().write(assemble(ProgramModel.empty()), nested, "callgraph.json");
        assertTrue(Files.exists(nested.resolve("callgraph.json")));
    }

    @Test
    void absoluteFileNameIsUsedAsGiven(@TempDir Path tmp) {
        Path absolute = tmp.resolve("elsewhere/result.json").toAbsolutePath();
        Path written = new JsonExporter().write(assemble(ProgramModel.empty()), tmp.resolve("out"), absolute.toString());

        assertEquals(absolute, written);
        assertTrue(Files.exists(absolute));
        assertFalse(Files.exists(tmp.resolve("out")));
    }

    @Test
    void emptyProgramGivesEmptySections() {
        JsonObject doc = parse(new JsonExporter().toJson(assemble(ProgramModel.empty())));
        assertEquals(0, doc.getAsJsonArray("functions").size());
        assertEquals(0, doc.getAsJsonObject("call_graph").getAsJsonArray("nodes").size());
        assertEquals(0, doc.getAsJsonObject("icfg").getAsJsonArray("nodes").size());
    }
}
