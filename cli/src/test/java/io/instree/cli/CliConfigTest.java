package io.instree.cli;

import io.instree.core.TraversalOrder;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliConfigTest {

    @Test
    void defaults_and_positional_args() {
        var cfg = CliConfig.fromArgs(new String[]{"-i", "tree.json", "move", "a", "root"});

        assertEquals(Path.of("tree.json"), cfg.input());
        assertEquals(TraversalOrder.REVERSE_CHILD_ORDER, cfg.order());
        assertFalse(cfg.pretty());
        assertFalse(cfg.verbose());
        assertFalse(cfg.help());
        assertEquals("move", cfg.command());
        assertEquals(List.of("a", "root"), cfg.args());
    }

    @Test
    void all_flags() {
        var cfg = CliConfig.fromArgs(new String[]{"--input", "t.json", "--order", "child", "--pretty", "-v", "show"});

        assertEquals(TraversalOrder.CHILD_ORDER, cfg.order());
        assertTrue(cfg.pretty());
        assertTrue(cfg.verbose());
        assertEquals("show", cfg.command());
    }

    @Test
    void help_short_circuits() {
        assertTrue(CliConfig.fromArgs(new String[]{"-h"}).help());
    }

    @Test
    void invalid_input_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"show"}));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"-i", "t.json"}));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"-i"}));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"--bogus", "show"}));
        assertThrows(IllegalArgumentException.class,
                () -> CliConfig.fromArgs(new String[]{"-i", "t.json", "-o", "sideways", "show"}));
    }
}
