package io.instree.cli;

import io.instree.core.TraversalOrder;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line configuration parsed from CLI args.
 *
 * Supports:
 *  - input:   JSON tree document to operate on
 *  - order:   sibling order for descendant walks
 *  - pretty:  pretty-print JSON output
 *  - verbose: log structural operations at FINE level
 *  - command: one of show, count, descendants, extract, move
 *  - args:    positional arguments of the command
 */
public record CliConfig(
        Path input,
        TraversalOrder order,
        boolean pretty,
        boolean verbose,
        boolean help,
        String command,
        List<String> args
) {

    public CliConfig {
        args = List.copyOf(args);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --input,   -i   <file>
     *   --order,   -o   reverse|child
     *   --pretty
     *   --verbose, -v
     *   --help,    -h
     *
     * The first non-flag argument is the command; everything after it is
     * passed to the command.
     *
     * @throws IllegalArgumentException on unknown flags, missing values or a missing command
     */
    public static CliConfig fromArgs(String[] args) {
        // Defaults
        Path input = null;
        TraversalOrder order = TraversalOrder.REVERSE_CHILD_ORDER;
        boolean pretty = false;
        boolean verbose = false;
        String command = null;
        List<String> rest = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            if (command != null) {
                rest.add(args[i]);
                continue;
            }
            switch (args[i]) {
                case "--help", "-h" -> {
                    return new CliConfig(input, order, pretty, verbose, true, null, List.of());
                }

                case "--input", "-i" -> {
                    ensureValue(args, i);
                    input = Path.of(args[++i]);
                }

                case "--order", "-o" -> {
                    ensureValue(args, i);
                    order = parseOrder(args[++i]);
                }

                case "--pretty" -> pretty = true;

                case "--verbose", "-v" -> verbose = true;

                default -> {
                    if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    }
                    command = args[i];
                }
            }
        }

        if (command == null) throw new IllegalArgumentException("missing command");
        if (input == null) throw new IllegalArgumentException("--input is required");
        return new CliConfig(input, order, pretty, verbose, false, command, rest);
    }

    private static TraversalOrder parseOrder(String value) {
        return switch (value) {
            case "reverse" -> TraversalOrder.REVERSE_CHILD_ORDER;
            case "child" -> TraversalOrder.CHILD_ORDER;
            default -> throw new IllegalArgumentException("Invalid order: " + value + " (expected reverse or child)");
        };
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }
}
