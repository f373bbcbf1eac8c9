package com.solicfg.builder;

import com.solicfg.builder.config.BuildConfig;
import com.solicfg.builder.config.ConfigReader;
import com.solicfg.builder.export.DotExporter;
import com.solicfg.builder.export.IcfgJsonExporter;
import com.solicfg.builder.frontend.JsonModelFrontEnd;
import com.solicfg.builder.graph.Icfg;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar icfg-builder-java.jar build \
 *     --model       <project-model.json> \
 *     [--config      <config.json>] \
 *     [--export-json <path>] \
 *     [--export-dot  <path>]
 */
public class IcfgMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[icfg] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar icfg-builder-java.jar build " +
                               "--model <path> [--config <path>] [--export-json <path>] [--export-dot <path>]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[icfg] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static Icfg run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("build")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String modelPath = null;
        String configPath = null;
        String jsonOut = null;
        String dotOut = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--model"       -> modelPath  = requireNext(args, i++, "--model");
                case "--config"      -> configPath = requireNext(args, i++, "--config");
                case "--export-json" -> jsonOut    = requireNext(args, i++, "--export-json");
                case "--export-dot"  -> dotOut     = requireNext(args, i++, "--export-dot");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (modelPath == null) throw new UsageException("--model is required");

        BuildConfig config = configPath != null
                ? new ConfigReader().read(Paths.get(configPath))
                : BuildConfig.defaults();

        Path model = Paths.get(modelPath);
        System.err.println("[icfg] Reading project model: " + model);
        Icfg icfg = new IcfgAnalyzer(config).analyze(new JsonModelFrontEnd(model));

        if (jsonOut != null) {
            new IcfgJsonExporter(config.isJsonEdgeKinds()).write(icfg, Paths.get(jsonOut));
        }
        if (dotOut != null) {
            new DotExporter(config.getDotReprMaxLength()).write(icfg, Paths.get(dotOut));
        }

        System.err.println("[icfg] Done.");
        return icfg;
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
