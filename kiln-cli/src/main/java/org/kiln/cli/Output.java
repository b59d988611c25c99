package org.kiln.cli;

import org.kiln.error.SchemaException;
import org.kiln.migration.differs.DestructiveChange;

import java.util.List;

final class Output {

    private Output() {
    }

    static void printDestructive(List<DestructiveChange> changes) {
        if (changes.isEmpty()) return;
        System.err.println("⚠️ Potentially destructive changes:");
        changes.forEach(c -> System.err.println("   - " + c.describe()));
    }

    /**
     * Reports a failure and returns the exit code for it.
     */
    static int fail(String what, Exception e) {
        System.err.println(what + ": " + e.getMessage());
        if (!(e instanceof SchemaException) && Boolean.getBoolean("kiln.debug")) {
            e.printStackTrace();
        }
        return 1;
    }
}
