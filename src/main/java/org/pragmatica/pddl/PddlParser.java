package org.pragmatica.pddl;

import org.pragmatica.pddl.model.DomainModel;
import org.pragmatica.pddl.model.ProblemModel;
import org.pragmatica.pddl.parser.ParserConfig;
import org.pragmatica.pddl.parser.SyntaxTreeBuilder;
import org.pragmatica.pddl.parser.SyntaxTreeResult;
import org.pragmatica.pddl.structure.DomainModelBuilder;
import org.pragmatica.pddl.structure.ProblemModelBuilder;
import org.pragmatica.pddl.tree.LinePositionResolver;
import org.pragmatica.pddl.tree.PositionResolver;

import java.util.Optional;

/**
 * Entry point for analysing PDDL text.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = PddlParser.create();
 *
 * var tree = parser.parseTree(text).tree();
 * var node = tree.nodeAt(caretOffset);
 *
 * var domain = parser.parseDomain(text);
 * domain.actions().forEach(action -> System.out.println(action.nameOrEmpty()));
 * }</pre>
 *
 * Every call works on its own snapshot of the text and returns freshly built, immutable results, so one
 * parser may be shared between threads.
 */
public final class PddlParser {
    private final ParserConfig config;

    private PddlParser(ParserConfig config) {
        this.config = config;
    }

    /**
     * Create a parser with default configuration.
     */
    public static PddlParser create() {
        return new PddlParser(ParserConfig.DEFAULT);
    }

    public static PddlParser create(ParserConfig config) {
        return new PddlParser(config);
    }

    /**
     * Create a builder for custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * Build the syntax tree of the whole text.
     */
    public SyntaxTreeResult parseTree(String text) {
        return SyntaxTreeBuilder.build(text);
    }

    /**
     * Build the syntax tree of the text up to the cutoff offset.
     *
     * @throws IllegalArgumentException if the cutoff is negative
     */
    public SyntaxTreeResult parseTree(String text, int cutoff) {
        return SyntaxTreeBuilder.build(text, cutoff);
    }

    /**
     * Build the domain model, resolving positions against the text itself.
     *
     * @throws org.pragmatica.pddl.error.PddlParseException if the text has no {@code (define (domain ...) ...)}
     */
    public DomainModel parseDomain(String text) {
        return parseDomain(text, LinePositionResolver.of(text));
    }

    /**
     * Build the domain model, resolving positions with the given resolver.
     *
     * @throws org.pragmatica.pddl.error.PddlParseException if the text has no {@code (define (domain ...) ...)}
     */
    public DomainModel parseDomain(String text, PositionResolver resolver) {
        return DomainModelBuilder.build(parseTree(text).tree(), resolver, config);
    }

    /**
     * @throws org.pragmatica.pddl.error.PddlParseException if the text has no {@code (define (problem ...) ...)}
     */
    public ProblemModel parseProblem(String text) {
        return parseProblem(text, LinePositionResolver.of(text));
    }

    public ProblemModel parseProblem(String text, PositionResolver resolver) {
        return ProblemModelBuilder.build(parseTree(text).tree(), resolver);
    }

    /**
     * Build the domain model if the text is a domain.
     */
    public Optional<DomainModel> tryDomain(String text) {
        var tree = parseTree(text).tree();
        if (!DomainModelBuilder.isDomain(tree)) {
            return Optional.empty();
        }
        return Optional.of(DomainModelBuilder.build(tree, LinePositionResolver.of(text), config));
    }

    /**
     * Build the problem model if the text is a problem.
     */
    public Optional<ProblemModel> tryProblem(String text) {
        var tree = parseTree(text).tree();
        if (!ProblemModelBuilder.isProblem(tree)) {
            return Optional.empty();
        }
        return Optional.of(ProblemModelBuilder.build(tree, LinePositionResolver.of(text)));
    }

    public static final class Builder {
        private String implicitParameterType = ParserConfig.DEFAULT.implicitParameterType();
        private boolean captureDocumentation = ParserConfig.DEFAULT.captureDocumentation();

        private Builder() {}

        public Builder implicitParameterType(String type) {
            this.implicitParameterType = type;
            return this;
        }

        public Builder captureDocumentation(boolean capture) {
            this.captureDocumentation = capture;
            return this;
        }

        public PddlParser build() {
            return new PddlParser(new ParserConfig(implicitParameterType, captureDocumentation));
        }
    }
}
