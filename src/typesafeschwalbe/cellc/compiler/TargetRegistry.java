package typesafeschwalbe.cellc.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import typesafeschwalbe.cellc.compiler.backend.AnsiCCodeGen;
import typesafeschwalbe.cellc.compiler.backend.ChasteCodeGen;
import typesafeschwalbe.cellc.compiler.backend.OperatorTable;
import typesafeschwalbe.cellc.compiler.ir.Variable;
import typesafeschwalbe.cellc.compiler.template.Skeleton;

public class TargetRegistry {

    public static final String CHASTE = "chaste";
    public static final String ANSI_C = "ansic";

    public static Target chaste() {
        return new Target(
            CHASTE, ".hpp", OperatorTable.C, ChasteCodeGen.RESERVED_WORDS,
            List.of(
                new Target.RoleRequirement(
                    ChasteCodeGen.MEMBRANE_POTENTIAL, Variable.Role.STATE
                ),
                new Target.RoleRequirement(
                    ChasteCodeGen.CELLULAR_CURRENT,
                    Variable.Role.INTERMEDIATE, Variable.Role.STATE,
                    Variable.Role.PARAMETER
                )
            ),
            ChasteCodeGen.CELLULAR_CURRENT,
            Skeleton.load(CHASTE, 1, "model.hpp"),
            ChasteCodeGen::new
        );
    }

    public static Target ansiC() {
        return new Target(
            ANSI_C, ".c", OperatorTable.C, AnsiCCodeGen.RESERVED_WORDS,
            List.of(
                new Target.RoleRequirement(
                    AnsiCCodeGen.CELLULAR_CURRENT,
                    Variable.Role.INTERMEDIATE, Variable.Role.STATE,
                    Variable.Role.PARAMETER
                )
            ),
            AnsiCCodeGen.CELLULAR_CURRENT,
            Skeleton.load(ANSI_C, 1, "model.c"),
            AnsiCCodeGen::new
        );
    }

    public static TargetRegistry defaults() {
        return new TargetRegistry(List.of())
            .with(TargetRegistry.chaste())
            .with(TargetRegistry.ansiC());
    }

    private final Map<String, Target> targets;

    private TargetRegistry(List<Target> targets) {
        this.targets = new LinkedHashMap<>();
        for(Target target: targets) {
            this.targets.put(target.targetName(), target);
        }
    }

    public TargetRegistry with(Target target) {
        List<Target> all = new ArrayList<>(this.targets.values());
        all.removeIf(t -> t.targetName().equals(target.targetName()));
        all.add(target);
        return new TargetRegistry(all);
    }

    public Optional<Target> get(String targetName) {
        return Optional.ofNullable(this.targets.get(targetName));
    }

    public Target require(String targetName) throws ErrorException {
        Target target = this.targets.get(targetName);
        if(target == null) {
            throw new ErrorException(new Error(
                Error.Kind.UNKNOWN_TARGET,
                "'" + targetName + "' is not a valid target, expected one of "
                    + String.join(", ", this.targetNames()),
                List.of(targetName)
            ));
        }
        return target;
    }

    public List<String> targetNames() {
        return List.copyOf(this.targets.keySet());
    }

}
