package com.randomtable.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.randomtable.debug.Debug;
import com.randomtable.debug.DebugLevel;
import com.randomtable.engine.model.DocumentLoader;
import com.randomtable.engine.model.RandomTableDocument;
import com.randomtable.engine.validator.ValidationIssue;
import com.randomtable.engine.validator.ValidationResult;

/**
 * Rolls a table or template from a document file.
 *
 * Exit codes: 0 ok, 1 evaluation failure, 2 usage, 3 unreadable or invalid document.
 */
public final class RandomTableCli {

    private static final String USAGE =
            "Usage: RandomTableCli <document.json> <tableOrTemplateId> [--count N] [--seed S] [--trace] [--verbose]"
                    + " [--import <document.json>]...";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        if (args.length < 2) {
            System.err.println(USAGE);
            return 2;
        }

        final Path documentPath = Path.of(args[0]);
        final String targetId = args[1];
        int count = 1;
        Long seed = null;
        boolean trace = false;
        boolean verbose = false;
        List<Path> imports = new ArrayList<>();

        try {
            for (int i = 2; i < args.length; i++) {
                switch (args[i]) {
                    case "--count":
                        count = Integer.parseInt(args[++i]);
                        break;
                    case "--seed":
                        seed = Long.parseLong(args[++i]);
                        break;
                    case "--trace":
                        trace = true;
                        break;
                    case "--verbose":
                        verbose = true;
                        break;
                    case "--import":
                        imports.add(Path.of(args[++i]));
                        break;
                    default:
                        System.err.println("Unknown option: " + args[i]);
                        System.err.println(USAGE);
                        return 2;
                }
            }
        } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
            System.err.println(USAGE);
            return 2;
        }
        if (count < 1) {
            System.err.println("--count must be at least 1");
            return 2;
        }

        Debug.get().setSink(Debug.stderrSink(verbose ? DebugLevel.DEBUG : DebugLevel.WARN));

        final RandomTableEngine engine =
                new RandomTableEngine(new EngineConfig(), seed == null ? new Random() : new Random(seed));

        final String collectionId;
        try {
            collectionId = load(engine, documentPath);
            if (collectionId == null) return 3;
            for (Path p : imports) {
                if (load(engine, p) == null) return 3;
            }
        } catch (IOException e) {
            System.err.println("Failed to read document: " + e.getMessage());
            return 3;
        }
        engine.resolveImports();

        try {
            boolean isTable = engine.getTable(targetId, collectionId) != null;
            if (!isTable && engine.getTemplate(targetId, collectionId) == null) {
                System.err.println("No table or template '" + targetId + "' in " + documentPath);
                return 1;
            }

            RollOptions options = new RollOptions(trace);
            for (int i = 0; i < count; i++) {
                RollResult result = isTable
                        ? engine.roll(targetId, collectionId, options)
                        : engine.rollTemplate(targetId, collectionId, options);
                System.out.println(result.text);
                if (trace && result.trace != null) {
                    System.out.println(result.trace.toJson());
                }
            }
            return 0;
        } catch (TableEngineException e) {
            System.err.println("Roll failed [" + e.getType() + "]: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Roll failed:");
            e.printStackTrace(System.err);
            return 1;
        }
    }

    /** Loads one document under its namespace; null when it does not validate. */
    private static String load(RandomTableEngine engine, Path path) throws IOException {
        RandomTableDocument doc = DocumentLoader.fromFile(path);
        ValidationResult validation = engine.validate(doc);
        for (ValidationIssue issue : validation.issues) {
            System.err.println(path.getFileName() + ": " + issue);
        }
        if (!validation.valid) return null;

        String id = doc.metadata.namespace;
        engine.loadCollection(doc, id);
        return id;
    }

    private RandomTableCli() {}
}
