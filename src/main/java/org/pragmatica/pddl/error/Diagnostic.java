package org.pragmatica.pddl.error;

import org.pragmatica.pddl.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Diagnostic message rendered in a compiler-like style.
 *
 * <p>Example output:
 * <pre>
 * error[P0001]: unmatched close bracket
 *   --> domain.pddl:3:15
 *    |
 *  3 |   (:predicates (p)))
 *    |                    ^ no open bracket to close
 *    |
 *    = help: remove the bracket or add the missing '('
 * </pre>
 * Spans are zero-based; rendering shows one-based line and column numbers.
 *
 * @param severity severity level
 * @param code     optional error code, may be {@code null}
 * @param message  primary message
 * @param span     source span the diagnostic points at
 * @param labels   additional labelled spans
 * @param notes    additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info"),
        HINT("hint");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labelled span. Primary labels are underlined with {@code ^}, secondary ones with {@code -}.
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, null, message, span, List.of(), List.of());
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, code, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, null, message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, labelMessage));
        return new Diagnostic(severity, code, message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelSpan, labelMessage));
        return new Diagnostic(severity, code, message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, span, labels, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Render the diagnostic with the affected source lines.
     *
     * @param source   text the span refers to
     * @param filename file name to display, may be {@code null}
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\r?\n", -1);
        sb.append(severity.display());
        if (code != null) {
            sb.append("[")
              .append(code)
              .append("]");
        }
        sb.append(": ")
          .append(message)
          .append("\n");
        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename)
              .append(":");
        }
        sb.append(loc.line() + 1)
          .append(":")
          .append(loc.column() + 1)
          .append("\n");
        int minLine = span.start()
                          .line();
        int maxLine = span.end()
                          .line();
        for (var label : labels) {
            minLine = Math.min(minLine,
                               label.span()
                                    .start()
                                    .line());
            maxLine = Math.max(maxLine,
                               label.span()
                                    .end()
                                    .line());
        }
        int gutterWidth = String.valueOf(maxLine + 1)
                                .length();
        sb.append(" ".repeat(gutterWidth + 1))
          .append("|\n");
        for (int line = minLine; line <= maxLine && line < lines.length; line++) {
            var content = lines[line];
            sb.append(String.format("%" + gutterWidth + "d", line + 1))
              .append(" | ")
              .append(content)
              .append("\n");
            var lineLabels = labelsOnLine(line);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth))
                  .append(" | ")
                  .append(underlines(line, content, lineLabels))
                  .append("\n");
            }
        }
        sb.append(" ".repeat(gutterWidth + 1))
          .append("|\n");
        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1))
              .append("= ")
              .append(note)
              .append("\n");
        }
        return sb.toString();
    }

    /**
     * Single line rendering: {@code file:line:column: severity: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: %s: %s",
                             filename == null ? "input" : filename,
                             loc.line() + 1,
                             loc.column() + 1,
                             severity.display(),
                             message);
    }

    private List<Label> labelsOnLine(int line) {
        var result = new ArrayList<Label>();
        if (labels.isEmpty() && covers(span, line)) {
            result.add(Label.primary(span, ""));
        }
        for (var label : labels) {
            if (covers(label.span(), line)) {
                result.add(label);
            }
        }
        return result;
    }

    private static boolean covers(SourceSpan span, int line) {
        return span.start()
                   .line() <= line && span.end()
                                          .line() >= line;
    }

    private static String underlines(int line, String content, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int column = 0;
        var sorted = lineLabels.stream()
                               .sorted(Comparator.comparingInt(label -> label.span()
                                                                             .start()
                                                                             .column()))
                               .toList();
        for (var label : sorted) {
            int startColumn = label.span()
                                   .start()
                                   .line() == line
                              ? label.span()
                                     .start()
                                     .column()
                              : 0;
            int endColumn = label.span()
                                 .end()
                                 .line() == line
                            ? label.span()
                                   .end()
                                   .column()
                            : content.length();
            while (column < startColumn) {
                sb.append(" ");
                column++ ;
            }
            int length = Math.max(1, endColumn - startColumn);
            sb.append(String.valueOf(label.primary()
                                     ? '^'
                                     : '-')
                            .repeat(length));
            column += length;
            if (!label.message()
                      .isEmpty()) {
                sb.append(" ")
                  .append(label.message());
            }
        }
        return sb.toString();
    }
}
