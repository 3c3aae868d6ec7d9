package typesafeschwalbe.cellc.compiler.backend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.Target;
import typesafeschwalbe.cellc.compiler.ir.Model;
import typesafeschwalbe.cellc.compiler.ir.Variable;

public class RoleBindings {

    public static Error missingRoleError(
        Target.RoleRequirement requirement, String targetName
    ) {
        return new Error(
            Error.Kind.MISSING_ROLE,
            "The target '" + targetName + "' requires a variable labelled '"
                + requirement.label() + "'",
            List.of(requirement.label())
        );
    }

    public static RoleBindings bind(Model model, Target target)
            throws ErrorException {
        Map<String, Variable> bound = new HashMap<>();
        for(Target.RoleRequirement requirement: target.requiredRoles()) {
            List<Variable> candidates = model.variablesLabelled(
                requirement.label()
            );
            if(candidates.isEmpty()) {
                throw new ErrorException(RoleBindings.missingRoleError(
                    requirement, target.targetName()
                ));
            }
            if(candidates.size() > 1) {
                List<String> names = new ArrayList<>();
                for(Variable candidate: candidates) {
                    names.add(candidate.name());
                }
                throw new ErrorException(new Error(
                    Error.Kind.AMBIGUOUS_ROLE,
                    "More than one variable is labelled '"
                        + requirement.label() + "'",
                    names
                ));
            }
            Variable variable = candidates.get(0);
            if(!requirement.roles().contains(variable.role())) {
                List<String> allowed = new ArrayList<>();
                for(Variable.Role role: requirement.roles()) {
                    allowed.add(role.description);
                }
                throw new ErrorException(new Error(
                    Error.Kind.MISSING_ROLE,
                    "The variable '" + variable.name() + "' is labelled '"
                        + requirement.label() + "', but is a "
                        + variable.role().description + " and the target '"
                        + target.targetName() + "' needs a "
                        + String.join(" or ", allowed) + " here",
                    List.of(requirement.label(), variable.name())
                ));
            }
            bound.put(requirement.label(), variable);
        }
        if(!bound.containsKey(target.outputRole())) {
            throw new IllegalStateException(
                "The output role of target '" + target.targetName()
                    + "' is not one of its required roles!"
            );
        }
        return new RoleBindings(bound, target.outputRole());
    }

    private final Map<String, Variable> bound;
    private final String outputRole;

    private RoleBindings(Map<String, Variable> bound, String outputRole) {
        this.bound = bound;
        this.outputRole = outputRole;
    }

    public Variable get(String label) {
        Variable variable = this.bound.get(label);
        if(variable == null) {
            throw new IllegalArgumentException(
                "The role '" + label + "' was not bound!"
            );
        }
        return variable;
    }

    public Variable output() {
        return this.get(this.outputRole);
    }

}
