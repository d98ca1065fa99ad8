package com.growpad.core.patch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ForbiddenPathGuardTest {

    private final ForbiddenPathGuard guard = new ForbiddenPathGuard();

    private static final String INFRA_DIFF = """
            diff --git a/infra/main.tf b/infra/main.tf
            --- a/infra/main.tf
            +++ b/infra/main.tf
            @@ -1 +1 @@
            -a
            +b
            """;

    @Test
    @DisplayName("Leading slash on the forbidden prefix is ignored")
    void leadingSlashIgnored() {
        List<String> violations = guard.violations(INFRA_DIFF, List.of("/infra"));

        assertEquals(List.of("infra/main.tf"), violations);
    }

    @Test
    @DisplayName("Prefix match is textual and errs toward rejection")
    void conservativePrefix() {
        String diff = "--- a/infrastructure/x.py\n+++ b/infrastructure/x.py\n";

        assertFalse(guard.violations(diff, List.of("infra")).isEmpty());
    }

    @Test
    @DisplayName("Renames into a forbidden directory are caught")
    void renameTarget() {
        String diff = """
                diff --git a/app.py b/secrets/app.py
                rename from app.py
                rename to secrets/app.py
                """;

        assertEquals(List.of("secrets/app.py"), guard.violations(diff, List.of("secrets/")));
    }

    @Test
    @DisplayName("No forbidden paths configured means no violations")
    void emptyList() {
        assertTrue(guard.violations(INFRA_DIFF, List.of()).isEmpty());
        assertTrue(guard.violations(INFRA_DIFF, null).isEmpty());
        assertTrue(guard.violations(INFRA_DIFF, List.of("  ", "/")).isEmpty());
    }

    @Test
    @DisplayName("Unrelated paths pass")
    void cleanDiff() {
        assertTrue(guard.violations(INFRA_DIFF, List.of("/billing", ".github")).isEmpty());
    }

    @Test
    @DisplayName("First path component is dropped whatever its name")
    void nonStandardPrefixes() {
        String diff = """
                --- x/infra/secret.tf
                +++ y/infra/secret.tf
                @@ -1 +1 @@
                -a
                +b
                """;

        assertEquals(List.of("infra/secret.tf"), guard.violations(diff, List.of("/infra")));
    }

    @Test
    @DisplayName("Quoted names are unquoted before matching")
    void quotedNames() {
        String diff = """
                diff --git "a/infra/s t.tf" "b/infra/s t.tf"
                --- "a/infra/s t.tf"
                +++ "b/infra/s t.tf"
                @@ -1 +1 @@
                -a
                +b
                """;

        assertEquals(List.of("infra/s t.tf"), guard.violations(diff, List.of("/infra")));
    }

    @Test
    @DisplayName("Octal escapes in quoted names are decoded")
    void octalEscapes() {
        String diff = "--- \"a/\\151nfra/x.tf\"\n+++ \"b/\\151nfra/x.tf\"\n";

        assertEquals(List.of("infra/x.tf"), guard.violations(diff, List.of("infra")));
    }

    @Test
    @DisplayName("Dot segments and doubled slashes are collapsed")
    void normalizesSegments() {
        String diff = "--- a/./infra//x.tf\n+++ b/src/../infra/x.tf\n";

        assertEquals(List.of("infra/x.tf"), guard.violations(diff, List.of("/infra")));
    }

    @Test
    @DisplayName("Paths are also checked before the first component is dropped")
    void unstrippedPath() {
        String diff = "--- infra/x.tf\t2026-01-01 00:00:00\n+++ infra/x.tf\t2026-01-01 00:00:00\n";

        assertEquals(List.of("infra/x.tf"), guard.violations(diff, List.of("infra")));
    }

    @Test
    @DisplayName("Copy targets and Index headers are checked")
    void copyAndIndexHeaders() {
        String copy = """
                diff --git a/app.py b/app_copy.py
                copy from app.py
                copy to infra/app.py
                """;
        String index = "Index: infra/x.tf\n";

        assertEquals(List.of("infra/app.py"), guard.violations(copy, List.of("infra")));
        assertEquals(List.of("infra/x.tf"), guard.violations(index, List.of("infra")));
    }

    @Test
    @DisplayName("Unparseable or escaping header paths are always reported")
    void unparseableHeaders() {
        String unterminated = "--- \"a/app.py\n+++ b/app.py\n";
        String escaping = "--- a/../../etc/passwd\n+++ b/../../etc/passwd\n";

        List<String> first = guard.violations(unterminated, List.of("infra"));
        List<String> second = guard.violations(escaping, List.of("infra"));

        assertEquals(1, first.size());
        assertTrue(first.get(0).startsWith(ForbiddenPathGuard.UNPARSEABLE));
        assertFalse(second.isEmpty());
        assertTrue(second.get(0).startsWith(ForbiddenPathGuard.UNPARSEABLE));
    }

    @Test
    @DisplayName("Hunk content lines that look like headers are ignored")
    void hunkBodyIgnored() {
        String diff = """
                diff --git a/db/schema.sql b/db/schema.sql
                --- a/db/schema.sql
                +++ b/db/schema.sql
                @@ -1,2 +1,2 @@
                --- infra/notes
                +++ infra/notes
                 select 1;
                """;

        assertTrue(guard.violations(diff, List.of("infra")).isEmpty());
    }
}
