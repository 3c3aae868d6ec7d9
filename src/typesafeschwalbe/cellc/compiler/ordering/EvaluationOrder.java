package typesafeschwalbe.cellc.compiler.ordering;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.ir.Expression;
import typesafeschwalbe.cellc.compiler.ir.Model;
import typesafeschwalbe.cellc.compiler.ir.Variable;

public class EvaluationOrder {

    public static record Selection(
        List<Variable> states,
        List<Variable> externalParameters,
        boolean usesTime,
        List<Variable> computed
    ) {}

    private final Model model;
    private final List<Variable> ordered;

    EvaluationOrder(Model model, List<Variable> ordered) {
        this.model = model;
        this.ordered = List.copyOf(ordered);
    }

    public List<Variable> variables() {
        return this.ordered;
    }

    public Selection select(List<Expression> roots) throws ErrorException {
        Set<Variable> needed = new LinkedHashSet<>();
        List<Variable> pending = new ArrayList<>();
        for(Expression root: roots) {
            pending.addAll(this.model.references(root));
        }
        while(!pending.isEmpty()) {
            Variable current = pending.remove(pending.size() - 1);
            if(!needed.add(current)) { continue; }
            if(current.isComputed()) {
                pending.addAll(
                    this.model.references(current.definition().get())
                );
            }
        }
        List<Variable> states = new ArrayList<>();
        List<Variable> externalParameters = new ArrayList<>();
        boolean usesTime = false;
        for(Variable variable: this.model.variables()) {
            if(!needed.contains(variable)) { continue; }
            switch(variable.role()) {
                case TIME: usesTime = true; break;
                case STATE: states.add(variable); break;
                case PARAMETER: {
                    if(variable.isExternalParameter()) {
                        externalParameters.add(variable);
                    }
                } break;
                default: break;
            }
        }
        List<Variable> computed = new ArrayList<>();
        for(Variable variable: this.ordered) {
            if(needed.contains(variable)) {
                computed.add(variable);
            }
        }
        return new Selection(states, externalParameters, usesTime, computed);
    }

}
