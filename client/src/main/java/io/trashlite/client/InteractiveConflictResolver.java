package io.trashlite.client;

import io.trashlite.storage.ConflictResolver;
import io.trashlite.storage.ConflictStrategy;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * {@code --conflict ask}: prompts once per conflicting entry.
 * <p>
 * Answers: s / o / r; the upper-case letter applies the answer to every remaining
 * conflict in the run. An empty answer means skip; end of input skips everything left.
 */
final class InteractiveConflictResolver implements ConflictResolver {
    private final BufferedReader in;
    private final PrintStream out;

    InteractiveConflictResolver(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public Decision resolve(Conflict conflict) {
        while (true) {
            out.printf("Destination exists: %s%n  [s]kip  [o]verwrite  [r]ename  (S/O/R = same for all remaining) > ",
                    conflict.originalPath());
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read answer from stdin", e);
            }
            if (line == null) {
                out.println();
                return new Decision(ConflictStrategy.SKIP, true);
            }
            String answer = line.trim();
            if (answer.isEmpty()) return new Decision(ConflictStrategy.SKIP, false);

            boolean all = Character.isUpperCase(answer.charAt(0));
            switch (Character.toLowerCase(answer.charAt(0))) {
                case 's' -> { return new Decision(ConflictStrategy.SKIP, all); }
                case 'o' -> { return new Decision(ConflictStrategy.OVERWRITE, all); }
                case 'r' -> { return new Decision(ConflictStrategy.RENAME, all); }
                default -> out.println("Please answer s, o or r.");
            }
        }
    }
}
