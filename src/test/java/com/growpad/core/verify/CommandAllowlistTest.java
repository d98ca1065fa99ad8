package com.growpad.core.verify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandAllowlistTest {

    private CommandAllowlist allowlist(String... patterns) {
        VerificationProperties properties = new VerificationProperties();
        properties.setAllowedCommands(List.of(patterns));
        return new CommandAllowlist(properties);
    }

    @Test
    @DisplayName("Default allowlist admits pytest with and without arguments")
    void defaults() {
        CommandAllowlist allowlist = new CommandAllowlist(new VerificationProperties());

        assertTrue(allowlist.isAllowed("pytest"));
        assertTrue(allowlist.isAllowed("pytest -k smoke"));
        assertTrue(allowlist.isAllowed("  pytest   tests/unit  "));
    }

    @Test
    @DisplayName("Anything else is denied")
    void denied() {
        CommandAllowlist allowlist = new CommandAllowlist(new VerificationProperties());

        assertFalse(allowlist.isAllowed("rm -rf /"));
        assertFalse(allowlist.isAllowed("pytestx"));
        assertFalse(allowlist.isAllowed(null));
    }

    @Test
    @DisplayName("Empty allowlist denies everything")
    void emptyAllowlist() {
        assertFalse(allowlist().isAllowed("pytest"));
    }

    @Test
    @DisplayName("Exact entries do not act as prefixes")
    void exactMatch() {
        CommandAllowlist allowlist = allowlist("make test");

        assertTrue(allowlist.isAllowed("make test"));
        assertFalse(allowlist.isAllowed("make test-all"));
    }
}
