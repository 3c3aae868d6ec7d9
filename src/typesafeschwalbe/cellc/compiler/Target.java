package typesafeschwalbe.cellc.compiler;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import typesafeschwalbe.cellc.compiler.backend.CodeGen;
import typesafeschwalbe.cellc.compiler.backend.OperatorTable;
import typesafeschwalbe.cellc.compiler.ir.Variable;
import typesafeschwalbe.cellc.compiler.template.Skeleton;

public record Target(
    String targetName,              // name used on the command line
    String fileExtension,
    OperatorTable operators,
    Set<String> reservedWords,
    List<RoleRequirement> requiredRoles,
    String outputRole,
    Skeleton skeleton,
    CodeGen.Constructor codeGen
) {

    public static record RoleRequirement(String label, Set<Variable.Role> roles) {

        public RoleRequirement(String label, Variable.Role first,
                Variable.Role... rest) {
            this(label, Set.copyOf(EnumSet.of(first, rest)));
        }

    }

    public Target {
        reservedWords = Set.copyOf(reservedWords);
        requiredRoles = List.copyOf(requiredRoles);
    }

}
