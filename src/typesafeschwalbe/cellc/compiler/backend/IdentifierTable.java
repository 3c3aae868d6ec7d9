package typesafeschwalbe.cellc.compiler.backend;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.ir.Model;
import typesafeschwalbe.cellc.compiler.ir.Variable;

// filled in declaration order on creation, independent of emission order
public class IdentifierTable implements Transpiler.Rewriter {

    public static final String DIGIT_PREFIX = "v_";
    public static final int MAX_SUFFIX = 9999;

    public static String sanitize(String name) {
        StringBuilder out = new StringBuilder();
        for(int charI = 0; charI < name.length(); charI += 1) {
            char c = name.charAt(charI);
            boolean legal = ('0' <= c && c <= '9')
                || ('A' <= c && c <= 'Z')
                || ('a' <= c && c <= 'z')
                || c == '_';
            out.append(legal? c : '_');
        }
        if(out.length() == 0 || ('0' <= out.charAt(0) && out.charAt(0) <= '9')) {
            out.insert(0, DIGIT_PREFIX);
        }
        return out.toString();
    }

    private final Set<String> taken;
    private final Map<String, String> assigned;

    public IdentifierTable(Model model, Set<String> reserved)
            throws ErrorException {
        this.taken = new HashSet<>(reserved);
        this.assigned = new HashMap<>();
        for(Variable variable: model.variables()) {
            this.assign(variable.name());
        }
    }

    private String assign(String name) throws ErrorException {
        String existing = this.assigned.get(name);
        if(existing != null) { return existing; }
        String base = IdentifierTable.sanitize(name);
        String candidate = base;
        int suffix = 2;
        while(this.taken.contains(candidate)) {
            if(suffix > MAX_SUFFIX) {
                throw new ErrorException(new Error(
                    Error.Kind.IDENTIFIER_COLLISION,
                    "Unable to find a free identifier for '" + name + "'",
                    List.of(name)
                ));
            }
            candidate = base + "_" + suffix;
            suffix += 1;
        }
        this.taken.add(candidate);
        this.assigned.put(name, candidate);
        return candidate;
    }

    @Override
    public String rewrite(Variable variable) throws ErrorException {
        return this.assign(variable.name());
    }

    public String get(Variable variable) {
        String identifier = this.assigned.get(variable.name());
        if(identifier == null) {
            throw new IllegalArgumentException(
                "'" + variable.name() + "' is not part of the exported model!"
            );
        }
        return identifier;
    }

}
