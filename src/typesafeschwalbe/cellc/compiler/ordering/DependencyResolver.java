package typesafeschwalbe.cellc.compiler.ordering;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.ir.Model;
import typesafeschwalbe.cellc.compiler.ir.Variable;

// ties between ready variables go to the one declared first
public class DependencyResolver {

    public static Error cyclicDependencyError(
        Model model, List<Variable> cycle
    ) {
        List<String> names = new ArrayList<>();
        List<Error.Marking> markings = new ArrayList<>();
        for(Variable variable: cycle) {
            names.add(variable.name());
            variable.source().ifPresent(s -> markings.add(
                Error.Marking.error(s, "part of the cycle")
            ));
        }
        List<String> path = new ArrayList<>(names);
        path.add(names.get(0));
        return new Error(
            Error.Kind.CYCLIC_DEPENDENCY,
            "Cyclic dependency between variables: "
                + String.join(" -> ", path),
            names,
            markings.toArray(Error.Marking[]::new)
        );
    }

    private final Model model;

    public DependencyResolver(Model model) {
        this.model = model;
    }

    public EvaluationOrder resolve() throws ErrorException {
        List<Variable> nodes = new ArrayList<>();
        for(Variable variable: this.model.variables()) {
            if(variable.isComputed()) {
                nodes.add(variable);
            }
        }
        // edges point from a variable to the computed variables it uses
        Map<Variable, List<Variable>> dependencies = new HashMap<>();
        Map<Variable, List<Variable>> dependents = new HashMap<>();
        Map<Variable, Integer> unresolved = new HashMap<>();
        for(Variable node: nodes) {
            dependents.putIfAbsent(node, new ArrayList<>());
            List<Variable> used = new ArrayList<>();
            for(Variable referenced: this.model.references(
                node.definition().get()
            )) {
                if(!referenced.isComputed()) { continue; }
                used.add(referenced);
                dependents.computeIfAbsent(referenced, v -> new ArrayList<>())
                    .add(node);
            }
            dependencies.put(node, used);
            unresolved.put(node, used.size());
        }
        PriorityQueue<Variable> ready = new PriorityQueue<>(
            (a, b) -> Integer.compare(a.index(), b.index())
        );
        for(Variable node: nodes) {
            if(unresolved.get(node) == 0) {
                ready.add(node);
            }
        }
        List<Variable> ordered = new ArrayList<>();
        while(!ready.isEmpty()) {
            Variable next = ready.poll();
            ordered.add(next);
            for(Variable dependent: dependents.get(next)) {
                int remaining = unresolved.get(dependent) - 1;
                unresolved.put(dependent, remaining);
                if(remaining == 0) {
                    ready.add(dependent);
                }
            }
        }
        if(ordered.size() < nodes.size()) {
            Set<Variable> done = new HashSet<>(ordered);
            throw new ErrorException(DependencyResolver.cyclicDependencyError(
                this.model, this.findCycle(nodes, done, dependencies)
            ));
        }
        return new EvaluationOrder(this.model, ordered);
    }

    private List<Variable> findCycle(
        List<Variable> nodes, Set<Variable> done,
        Map<Variable, List<Variable>> dependencies
    ) {
        // every node left over either sits on a cycle or depends on one,
        // so walking unresolved dependencies must revisit a node
        Variable start = null;
        for(Variable node: nodes) {
            if(!done.contains(node)) {
                start = node;
                break;
            }
        }
        List<Variable> path = new ArrayList<>();
        Map<Variable, Integer> positions = new HashMap<>();
        Variable current = start;
        while(!positions.containsKey(current)) {
            positions.put(current, path.size());
            path.add(current);
            Variable next = null;
            for(Variable dependency: dependencies.get(current)) {
                if(!done.contains(dependency)) {
                    next = dependency;
                    break;
                }
            }
            current = next;
        }
        return path.subList(positions.get(current), path.size());
    }

}
