package typesafeschwalbe.cellc.compiler.backend;

import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.ir.Expression;
import typesafeschwalbe.cellc.compiler.ir.Variable;
import typesafeschwalbe.cellc.compiler.ordering.EvaluationOrder;

public class Emitter {

    public enum Block {
        DERIVATIVES,
        OUTPUT
    }

    public static interface Syntax {
        void emitTimeLoad(
            Block block, String time, StringBuilder out
        );
        void emitStateLoad(
            Block block, String name, int stateIndex, StringBuilder out
        );
        void emitParameterLoad(
            String name, int parameterIndex, StringBuilder out
        );
        void emitLocal(String name, String value, StringBuilder out);
        void emitDerivative(int stateIndex, String value, StringBuilder out);
        void emitOutput(String value, StringBuilder out);
    }

    public static record Blocks(String derivatives, String output) {}

    public static void emitStringLiteral(String content, StringBuilder out) {
        out.append("\"");
        for(int charI = 0; charI < content.length(); charI += 1) {
            char c = content.charAt(charI);
            switch(c) {
                case '\\': out.append("\\\\"); break;
                case '\n': out.append("\\n"); break;
                case '\r': out.append("\\r"); break;
                case '\t': out.append("\\t"); break;
                case '\"': out.append("\\\""); break;
                case '\0': out.append("\\000"); break;
                default: out.append(c);
            }
        }
        out.append("\"");
    }

    private final RenderContext context;
    private final Syntax syntax;

    public Emitter(RenderContext context, Syntax syntax) {
        this.context = context;
        this.syntax = syntax;
    }

    public Blocks emit(EvaluationOrder order, RoleBindings bindings)
            throws ErrorException {
        List<Variable> states = this.context.model.states();
        List<Expression> derivativeRoots = new ArrayList<>();
        for(Variable state: states) {
            derivativeRoots.add(state.definition().get());
        }
        StringBuilder out = this.context.code();
        this.emitDeclarations(
            Block.DERIVATIVES, order.select(derivativeRoots), out
        );
        for(int stateI = 0; stateI < states.size(); stateI += 1) {
            this.syntax.emitDerivative(
                stateI,
                this.context.transpiler.transpile(
                    states.get(stateI).definition().get()
                ),
                out
            );
        }
        String derivatives = this.context.takeCode();
        Variable output = bindings.output();
        this.emitDeclarations(
            Block.OUTPUT,
            order.select(List.of(Expression.reference(output.name()))),
            out
        );
        this.syntax.emitOutput(this.context.identifiers.get(output), out);
        String outputBlock = this.context.takeCode();
        return new Blocks(derivatives, outputBlock);
    }

    private void emitDeclarations(
        Block block, EvaluationOrder.Selection selection, StringBuilder out
    ) throws ErrorException {
        IdentifierTable identifiers = this.context.identifiers;
        if(selection.usesTime()) {
            this.syntax.emitTimeLoad(
                block, identifiers.get(this.context.model.time()), out
            );
        }
        for(Variable state: selection.states()) {
            this.syntax.emitStateLoad(
                block, identifiers.get(state),
                this.context.model.stateIndex(state), out
            );
        }
        List<Variable> externals = this.context.model.externalParameters();
        for(Variable parameter: selection.externalParameters()) {
            this.syntax.emitParameterLoad(
                identifiers.get(parameter), externals.indexOf(parameter), out
            );
        }
        for(Variable computed: selection.computed()) {
            this.syntax.emitLocal(
                identifiers.get(computed),
                this.context.transpiler.transpile(computed.definition().get()),
                out
            );
        }
    }

}
