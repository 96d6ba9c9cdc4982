package com.contractflow.analyzer;

import com.contractflow.analyzer.config.AnalysisConfig;
import com.contractflow.analyzer.config.AnalysisConfigReader;
import com.contractflow.analyzer.program.ProgramModel;
import com.contractflow.analyzer.program.ProgramModelReader;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar contractflow-analyzer-java.jar analyze \
 *     --program <path-to-program.json> \
 *     [--output <output-dir>] [--config <config.json>] \
 *     [--json <file>] [--dot <file>] [--no-json] [--no-dot]
 */
public class AnalyzerMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[contract-flow] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar contractflow-analyzer-java.jar analyze " +
                               "--program <path> [--output <dir>] [--config <path>] " +
                               "[--json <file>] [--dot <file>] [--no-json] [--no-dot]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[contract-flow] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static List<Path> run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("analyze")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String programPath = null;
        String configPath = null;
        String outputDir = null;
        String jsonOutput = null;
        String dotOutput = null;
        boolean noJson = false;
        boolean noDot = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--program" -> programPath = requireNext(args, i++, "--program");
                case "--config"  -> configPath  = requireNext(args, i++, "--config");
                case "--output"  -> outputDir   = requireNext(args, i++, "--output");
                case "--json"    -> jsonOutput  = requireNext(args, i++, "--json");
                case "--dot"     -> dotOutput   = requireNext(args, i++, "--dot");
                case "--no-json" -> noJson = true;
                case "--no-dot"  -> noDot = true;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (programPath == null) throw new UsageException("--program is required");
        if (noJson && noDot)     throw new UsageException("--no-json and --no-dot leave nothing to write");

        // 1. Config: file first, flags override
        AnalysisConfig config = configPath != null
                ? new AnalysisConfigReader().read(Paths.get(configPath))
                : AnalysisConfig.defaults();
        if (outputDir != null)  config.setOutputDir(outputDir);
        if (jsonOutput != null) config.setJsonOutput(jsonOutput);
        if (dotOutput != null)  config.setDotOutput(dotOutput);
        if (noJson) config.setExportJson(false);
        if (noDot)  config.setExportDot(false);

        // 2. Program model
        Path program = Paths.get(programPath);
        System.err.println("[contract-flow] Reading program dump: " + program);
        ProgramModel model = new ProgramModelReader().read(program);

        // 3. Analysis
        ContractAnalyzer analyzer = new ContractAnalyzer(config);
        AnalysisResult result = analyzer.analyze(model);

        // 4. Export
        Path output = Paths.get(config.getOutputDir());
        System.err.println("[contract-flow] Writing output to: " + output);
        List<Path> written = analyzer.export(result, output);

        System.err.println("[contract-flow] Done.");
        return written;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
