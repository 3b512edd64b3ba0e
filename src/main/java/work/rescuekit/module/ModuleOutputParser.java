package work.rescuekit.module;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the free-text output of a module into a {@link ModuleOutput}.
 *
 * <p>Lines are scanned in order. {@code [FAILURE]} wins immediately and ends the scan,
 * {@code [WARN]} is never downgraded by a later {@code [SUCCESS]}, and the {@code --} lines
 * directly after the matched line are its details.</p>
 */
public final class ModuleOutputParser {
    static final String UNKNOWN_SUMMARY = "[UNKNOWN] log missing SUCCESS, FAILURE, or WARN message.";

    private static final String SUCCESS_MARKER = "[SUCCESS]";
    private static final String WARN_MARKER = "[WARN]";
    private static final String FAILURE_MARKER = "[FAILURE]";
    private static final String DETAIL_MARKER = "--";

    private ModuleOutputParser() {}

    public static ModuleOutput parse(String output) {
        String[] lines = (output == null ? "" : output).strip().split("\n", -1);
        Verdict verdict = null;
        String summary = null;
        List<String> details = List.of();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].stripTrailing();
            if (line.startsWith(SUCCESS_MARKER) && verdict != Verdict.WARN) {
                verdict = Verdict.SUCCESS;
                summary = line;
                details = details(lines, i + 1);
            } else if (line.startsWith(FAILURE_MARKER)) {
                verdict = Verdict.FAILURE;
                summary = line;
                details = details(lines, i + 1);
                break;
            } else if (line.startsWith(WARN_MARKER)) {
                verdict = Verdict.WARN;
                summary = line;
                details = details(lines, i + 1);
            }
        }
        if (verdict == null) {
            return new ModuleOutput(Verdict.UNKNOWN, UNKNOWN_SUMMARY, List.of());
        }
        return new ModuleOutput(verdict, summary, details);
    }

    // First contiguous run of detail lines only.
    private static List<String> details(String[] lines, int start) {
        List<String> details = new ArrayList<>();
        for (int i = start; i < lines.length; i++) {
            String line = lines[i].stripTrailing();
            if (!line.startsWith(DETAIL_MARKER)) {
                break;
            }
            details.add(line);
        }
        return details;
    }
}
