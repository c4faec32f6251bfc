package org.pragmatica.pddl.model;

import org.pragmatica.pddl.tree.SourceSpan;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Predicate or function declaration.
 *
 * @param declaredName  declaration as written, e.g. {@code at ?r - robot ?l - location}
 * @param parameters    typed parameters in declaration order
 * @param span          source range of the declaration
 * @param documentation comment lines describing the declaration
 */
public record Variable(
    String declaredName,
    List<Parameter> parameters,
    SourceSpan span,
    List<String> documentation
) {
    private static final Pattern TYPE_ANNOTATION = Pattern.compile("\\s+-\\s+[\\w-]+");
    private static final Pattern UNIT = Pattern.compile("\\[([^\\]]*)\\]");

    public Variable {
        parameters = List.copyOf(parameters);
        documentation = List.copyOf(documentation);
    }

    /**
     * Short name: the declaration up to the first whitespace.
     */
    public String name() {
        var trimmed = declaredName.trim();
        for (int i = 0; i < trimmed.length(); i++) {
            if (Character.isWhitespace(trimmed.charAt(i))) {
                return trimmed.substring(0, i);
            }
        }
        return trimmed;
    }

    public String fullName() {
        var sb = new StringBuilder(name());
        parameters.forEach(parameter -> sb.append(" ")
                                          .append(parameter.toPddlString()));
        return sb.toString();
    }

    public String declaredNameWithoutTypes() {
        return TYPE_ANNOTATION.matcher(declaredName)
                              .replaceAll("");
    }

    public boolean matchesShortName(String symbolName) {
        return name().equalsIgnoreCase(symbolName);
    }

    /**
     * Unit of measure given in square brackets in the documentation, e.g. {@code ; distance [km]}.
     */
    public Optional<String> unit() {
        var matcher = UNIT.matcher(String.join("\n", documentation));
        return matcher.find()
               ? Optional.of(matcher.group(1))
               : Optional.empty();
    }
}
