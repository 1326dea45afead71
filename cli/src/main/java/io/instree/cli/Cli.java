package io.instree.cli;

import io.instree.codec.ImportedTree;
import io.instree.codec.Instance;
import io.instree.codec.TreeFormatException;
import io.instree.codec.TreeJsonCodec;
import io.instree.core.InstanceId;
import io.instree.core.InstanceTree;
import io.instree.core.RootedInstance;
import io.instree.core.TraversalOrder;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line tool over JSON tree documents.
 *
 * Usage:
 *   instree --input tree.json [options] show
 *   instree --input tree.json [options] count
 *   instree --input tree.json [options] descendants <id>
 *   instree --input tree.json [options] extract <id>
 *   instree --input tree.json [options] move <id> <parentId|root>
 *
 * Ids on the command line and in show/descendants output are the ids written
 * in the input document. Documents printed by extract and move carry the
 * fresh ids assigned when the input was loaded.
 */
public final class Cli {
    private static final Logger log = Logger.getLogger(Cli.class.getName());

    // Held strongly so the configured level is not lost to logger GC.
    private static final Logger packageLogger = Logger.getLogger("io.instree");

    private static final String USAGE = """
            Usage:
              instree --input <file> [options] show
              instree --input <file> [options] count
              instree --input <file> [options] descendants <id>
              instree --input <file> [options] extract <id>
              instree --input <file> [options] move <id> <parentId|root>

            Options:
              --input,   -i   JSON tree document (required)
              --order,   -o   Sibling order for walks: reverse (default) or child
              --pretty        Pretty-print JSON output
              --verbose, -v   Log structural operations
              --help,    -h   Show this help message
            """;

    private final CliConfig config;
    private final PrintStream out;
    private final TreeJsonCodec<Instance> codec = TreeJsonCodec.forInstances();

    Cli(CliConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Run the tool and return its process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            CliConfig config = CliConfig.fromArgs(args);
            if (config.help()) {
                out.print(USAGE);
                return 0;
            }
            if (config.verbose()) {
                enableVerboseLogging();
            }
            new Cli(config, out).execute();
            return 0;
        } catch (CliException | IllegalArgumentException | TreeFormatException | UncheckedIOException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    void execute() {
        ImportedTree<Instance> imported = codec.read(config.input());
        log.log(Level.FINE, () -> "Loaded " + imported.tree().size() + " instances from " + config.input());

        switch (config.command()) {
            case "show" -> {
                expectArgs(0, "show takes no arguments");
                show(imported);
            }
            case "count" -> {
                expectArgs(0, "count takes no arguments");
                InstanceTree<Instance> tree = imported.tree();
                out.println("roots=" + tree.getRootIds().size() + " instances=" + tree.size());
            }
            case "descendants" -> {
                expectArgs(1, "descendants requires <id>");
                descendants(imported, resolve(imported, config.args().get(0)));
            }
            case "extract" -> {
                expectArgs(1, "extract requires <id>");
                InstanceId id = resolve(imported, config.args().get(0));
                InstanceTree<Instance> removed = imported.tree().removeInstance(id)
                        .orElseThrow(() -> new CliException("unknown instance: " + config.args().get(0)));
                log.log(Level.INFO, () -> "Extracted " + removed.size() + " instances");
                out.println(codec.writeString(removed, config.pretty()));
            }
            case "move" -> {
                expectArgs(2, "move requires <id> <parentId|root>");
                InstanceId id = resolve(imported, config.args().get(0));
                String target = config.args().get(1);
                InstanceId parent = "root".equals(target) ? null : resolve(imported, target);
                imported.tree().transplant(imported.tree(), id, parent);
                out.println(codec.writeString(imported.tree(), config.pretty()));
            }
            default -> throw new CliException("unknown command: " + config.command());
        }
    }

    private void show(ImportedTree<Instance> imported) {
        InstanceTree<Instance> tree = imported.tree();
        Map<InstanceId, InstanceId> documentIds = invert(imported.idMapping());
        Map<InstanceId, Integer> depth = new HashMap<>();

        for (InstanceId rootId : tree.getRootIds()) {
            tree.descendants(rootId, config.order()).forEachRemaining(inst -> {
                int d = inst.parentId().map(p -> depth.get(p) + 1).orElse(0);
                depth.put(inst.id(), d);
                out.println("  ".repeat(d) + describe(inst, documentIds));
            });
        }
    }

    private void descendants(ImportedTree<Instance> imported, InstanceId start) {
        Map<InstanceId, InstanceId> documentIds = invert(imported.idMapping());
        TraversalOrder order = config.order();
        imported.tree().descendants(start, order)
                .forEachRemaining(inst -> out.println(describe(inst, documentIds)));
    }

    private static String describe(RootedInstance<Instance> inst, Map<InstanceId, InstanceId> documentIds) {
        Instance payload = inst.payload();
        return payload.className() + " \"" + payload.name() + "\" [" + documentIds.get(inst.id()) + "]";
    }

    private static InstanceId resolve(ImportedTree<Instance> imported, String documentId) {
        InstanceId parsed;
        try {
            parsed = InstanceId.parse(documentId);
        } catch (IllegalArgumentException e) {
            throw new CliException("invalid instance id: " + documentId);
        }
        return imported.newId(parsed).orElseThrow(() -> new CliException("unknown instance: " + documentId));
    }

    private static Map<InstanceId, InstanceId> invert(Map<InstanceId, InstanceId> mapping) {
        Map<InstanceId, InstanceId> inverted = new HashMap<>(mapping.size() * 2);
        mapping.forEach((documentId, treeId) -> inverted.put(treeId, documentId));
        return inverted;
    }

    private void expectArgs(int count, String message) {
        if (config.args().size() != count) {
            throw new CliException(message);
        }
    }

    /** Idempotent: the FINE console handler is installed at most once per process. */
    static synchronized void enableVerboseLogging() {
        packageLogger.setLevel(Level.FINE);
        if (packageLogger.getHandlers().length > 0) {
            return;
        }
        var handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        packageLogger.addHandler(handler);
        // Records would otherwise be printed again by the root handler.
        packageLogger.setUseParentHandlers(false);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
