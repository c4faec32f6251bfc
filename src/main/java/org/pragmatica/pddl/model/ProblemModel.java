package org.pragmatica.pddl.model;

import org.pragmatica.pddl.tree.SyntaxNode;
import org.pragmatica.pddl.tree.SyntaxTree;

import java.util.List;
import java.util.Optional;

/**
 * Structure of a PDDL problem.
 *
 * @param name          problem name
 * @param domainName    name given in {@code (:domain ...)}
 * @param requirements  requirement keywords
 * @param objects       objects grouped by type
 * @param inits         initial values and timed initial literals
 * @param supplyDemands supply-demand contracts of the initial state
 * @param goal          node of the goal condition
 * @param constraints   problem constraints
 * @param tree          syntax tree the model was built from
 */
public record ProblemModel(
    Optional<String> name,
    Optional<String> domainName,
    List<String> requirements,
    TypeObjectMap objects,
    List<TimedVariableValue> inits,
    List<SupplyDemand> supplyDemands,
    Optional<SyntaxNode> goal,
    List<Constraint> constraints,
    SyntaxTree tree
) {
    public ProblemModel {
        requirements = List.copyOf(requirements);
        inits = List.copyOf(inits);
        supplyDemands = List.copyOf(supplyDemands);
        constraints = List.copyOf(constraints);
    }

    public List<String> objectsOf(String type) {
        return objects.objectsOf(type);
    }

    /**
     * Initial values that hold from the start, without timed initial literals.
     */
    public List<TimedVariableValue> initialValues() {
        return inits.stream()
                    .filter(value -> !value.isTimed())
                    .toList();
    }

    public List<TimedVariableValue> timedInitialLiterals() {
        return inits.stream()
                    .filter(TimedVariableValue::isTimed)
                    .toList();
    }
}
