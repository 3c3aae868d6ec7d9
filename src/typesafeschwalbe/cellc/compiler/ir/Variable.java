package typesafeschwalbe.cellc.compiler.ir;

import java.util.Optional;

import typesafeschwalbe.cellc.compiler.Source;

public record Variable(
    String name,
    Role role,
    int index,
    Optional<Double> initialValue,
    Optional<Expression> definition,
    Optional<String> label,
    Optional<Source> source
) {

    public enum Role {
        TIME("time"),
        STATE("state"),
        INTERMEDIATE("intermediate"),
        PARAMETER("parameter");

        public final String description;

        private Role(String description) {
            this.description = description;
        }
    }

    public boolean isComputed() {
        return (this.role == Role.INTERMEDIATE || this.role == Role.PARAMETER)
            && this.definition.isPresent();
    }

    public boolean isExternalParameter() {
        return this.role == Role.PARAMETER && this.definition.isEmpty();
    }

    Variable withLabel(String label) {
        return new Variable(
            this.name, this.role, this.index, this.initialValue,
            this.definition, Optional.of(label), this.source
        );
    }

}
