package typesafeschwalbe.cellc.compiler.ir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.Source;

public class Model {

    public static Error unboundReferenceError(
        String variableName, Optional<Source> usage
    ) {
        String message = "Reference to unknown variable '"
            + variableName + "'";
        if(usage.isPresent()) {
            return new Error(
                Error.Kind.UNBOUND_REFERENCE, message, List.of(variableName),
                Error.Marking.error(
                    usage.get(), "no variable with this name exists"
                )
            );
        }
        return new Error(
            Error.Kind.UNBOUND_REFERENCE, message, List.of(variableName)
        );
    }

    public static Error invalidVariableError(
        Variable variable, String problem
    ) {
        String message = "The " + variable.role().description
            + " '" + variable.name() + "' " + problem;
        if(variable.source().isPresent()) {
            return new Error(
                Error.Kind.INVALID_MODEL, message, List.of(variable.name()),
                Error.Marking.error(variable.source().get(), problem)
            );
        }
        return new Error(
            Error.Kind.INVALID_MODEL, message, List.of(variable.name())
        );
    }

    public static class Builder {

        private final String name;
        private final List<Variable> variables;
        private final Map<String, Integer> indices;

        private Builder(String name) {
            this.name = name;
            this.variables = new ArrayList<>();
            this.indices = new HashMap<>();
        }

        public Builder add(
            String name, Variable.Role role,
            Optional<Double> initialValue, Optional<Expression> definition,
            Optional<Source> source
        ) throws ErrorException {
            Integer existing = this.indices.get(name);
            if(existing != null) {
                Variable previous = this.variables.get(existing);
                List<Error.Marking> markings = new ArrayList<>();
                source.ifPresent(s -> markings.add(Error.Marking.error(
                    s, "a variable named '" + name + "' was already declared"
                )));
                previous.source().ifPresent(s -> markings.add(
                    Error.Marking.info(s, "previously declared here")
                ));
                throw new ErrorException(new Error(
                    Error.Kind.INVALID_MODEL,
                    "Duplicate variable '" + name + "'",
                    List.of(name),
                    markings.toArray(Error.Marking[]::new)
                ));
            }
            int index = this.variables.size();
            this.variables.add(new Variable(
                name, role, index, initialValue, definition, Optional.empty(),
                source
            ));
            this.indices.put(name, index);
            return this;
        }

        public Builder time(String name) throws ErrorException {
            return this.add(
                name, Variable.Role.TIME, Optional.empty(), Optional.empty(),
                Optional.empty()
            );
        }

        public Builder state(
            String name, double initialValue, Expression derivative
        ) throws ErrorException {
            return this.add(
                name, Variable.Role.STATE,
                Optional.of(initialValue), Optional.of(derivative),
                Optional.empty()
            );
        }

        public Builder intermediate(
            String name, Expression definition
        ) throws ErrorException {
            return this.add(
                name, Variable.Role.INTERMEDIATE,
                Optional.empty(), Optional.of(definition), Optional.empty()
            );
        }

        public Builder parameter(
            String name, Expression value
        ) throws ErrorException {
            return this.add(
                name, Variable.Role.PARAMETER,
                Optional.empty(), Optional.of(value), Optional.empty()
            );
        }

        public Builder externalParameter(String name) throws ErrorException {
            return this.add(
                name, Variable.Role.PARAMETER,
                Optional.empty(), Optional.empty(), Optional.empty()
            );
        }

        public Builder label(String variableName, String label) {
            Integer index = this.indices.get(variableName);
            if(index == null) {
                throw new IllegalArgumentException(
                    "Cannot label unknown variable '" + variableName + "'!"
                );
            }
            this.variables.set(
                index, this.variables.get(index).withLabel(label)
            );
            return this;
        }

        public Model build() throws ErrorException {
            Model model = new Model(this.name, List.copyOf(this.variables));
            model.validate();
            return model;
        }

    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    private final String name;
    private final List<Variable> variables;
    private final Map<String, Variable> byName;

    private Model(String name, List<Variable> variables) {
        this.name = name;
        this.variables = variables;
        this.byName = new HashMap<>();
        for(Variable variable: variables) {
            this.byName.put(variable.name(), variable);
        }
    }

    private void validate() throws ErrorException {
        for(Variable variable: this.variables) {
            switch(variable.role()) {
                case TIME: {
                    if(variable.definition().isPresent()) {
                        throw new ErrorException(Model.invalidVariableError(
                            variable, "may not have a defining expression"
                        ));
                    }
                } break;
                case STATE: {
                    if(variable.initialValue().isEmpty()) {
                        throw new ErrorException(Model.invalidVariableError(
                            variable, "needs an initial value"
                        ));
                    }
                    if(variable.definition().isEmpty()) {
                        throw new ErrorException(Model.invalidVariableError(
                            variable, "needs a derivative expression"
                        ));
                    }
                } break;
                case INTERMEDIATE: {
                    if(variable.definition().isEmpty()) {
                        throw new ErrorException(Model.invalidVariableError(
                            variable, "needs a defining expression"
                        ));
                    }
                } break;
                case PARAMETER: break;
                default:
                    throw new RuntimeException("unhandled variable role!");
            }
            if(variable.role() != Variable.Role.STATE
                    && variable.initialValue().isPresent()) {
                throw new ErrorException(Model.invalidVariableError(
                    variable, "may not have an initial value"
                ));
            }
        }
        List<Variable> times = this.variablesWith(Variable.Role.TIME);
        if(times.isEmpty()) {
            throw new ErrorException(new Error(
                Error.Kind.MISSING_ROLE,
                "The model '" + this.name + "' has no time variable",
                List.of(Variable.Role.TIME.description)
            ));
        }
        if(times.size() > 1) {
            throw new ErrorException(Model.ambiguousError(
                "The model '" + this.name + "' has more than one time variable",
                times
            ));
        }
        Map<String, List<Variable>> labelled = new HashMap<>();
        for(Variable variable: this.variables) {
            if(variable.label().isEmpty()) { continue; }
            labelled.computeIfAbsent(variable.label().get(), l -> new ArrayList<>())
                .add(variable);
        }
        for(Variable variable: this.variables) {
            if(variable.label().isEmpty()) { continue; }
            List<Variable> carriers = labelled.get(variable.label().get());
            if(carriers.size() > 1) {
                throw new ErrorException(Model.ambiguousError(
                    "The label '" + variable.label().get()
                        + "' is used by more than one variable",
                    carriers
                ));
            }
        }
    }

    private static Error ambiguousError(String message, List<Variable> found) {
        List<String> names = new ArrayList<>();
        List<Error.Marking> markings = new ArrayList<>();
        for(Variable variable: found) {
            names.add(variable.name());
            variable.source().ifPresent(s -> markings.add(
                Error.Marking.error(s, "candidate")
            ));
        }
        return new Error(
            Error.Kind.AMBIGUOUS_ROLE, message, names,
            markings.toArray(Error.Marking[]::new)
        );
    }

    public String name() {
        return this.name;
    }

    public List<Variable> variables() {
        return this.variables;
    }

    public Optional<Variable> variable(String name) {
        return Optional.ofNullable(this.byName.get(name));
    }

    public List<Variable> variablesWith(Variable.Role role) {
        List<Variable> found = new ArrayList<>();
        for(Variable variable: this.variables) {
            if(variable.role() == role) {
                found.add(variable);
            }
        }
        return found;
    }

    public List<Variable> variablesLabelled(String label) {
        List<Variable> found = new ArrayList<>();
        for(Variable variable: this.variables) {
            if(variable.label().isPresent()
                    && variable.label().get().equals(label)) {
                found.add(variable);
            }
        }
        return found;
    }

    public Variable time() {
        return this.variablesWith(Variable.Role.TIME).get(0);
    }

    public List<Variable> states() {
        return this.variablesWith(Variable.Role.STATE);
    }

    public int stateIndex(Variable state) {
        return this.states().indexOf(state);
    }

    public List<Variable> externalParameters() {
        List<Variable> found = new ArrayList<>();
        for(Variable variable: this.variables) {
            if(variable.isExternalParameter()) {
                found.add(variable);
            }
        }
        return found;
    }

    public Set<Variable> references(Expression expression)
            throws ErrorException {
        Set<Variable> found = new LinkedHashSet<>();
        this.collectReferences(expression, found);
        return found;
    }

    private void collectReferences(Expression expression, Set<Variable> found)
            throws ErrorException {
        switch(expression.type) {
            case NUMBER: break;
            case REFERENCE: {
                String name = expression.<Expression.Reference>getValue()
                    .variableName();
                Variable variable = this.byName.get(name);
                if(variable == null) {
                    throw new ErrorException(
                        Model.unboundReferenceError(name, expression.source)
                    );
                }
                found.add(variable);
            } break;
            case UNARY_OPERATION: {
                this.collectReferences(
                    expression.<Expression.UnaryOperation>getValue().operand(),
                    found
                );
            } break;
            case BINARY_OPERATION: {
                Expression.BinaryOperation data = expression.getValue();
                this.collectReferences(data.left(), found);
                this.collectReferences(data.right(), found);
            } break;
            case CALL: {
                for(Expression argument: expression
                        .<Expression.Call>getValue().arguments()) {
                    this.collectReferences(argument, found);
                }
            } break;
            default:
                throw new RuntimeException("unhandled expression type!");
        }
    }

}
