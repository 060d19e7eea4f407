package io.templatexform.core.parse.ast;

import java.util.List;

/** A statement or top-level declaration. */
public sealed interface Statement extends SyntaxNode {

    /**
     * An import declaration.
     *
     * @param typeOnly {@code true} for {@code import type ...}
     */
    record Import(
            String source,
            String defaultImport,
            List<String> namedImports,
            String namespaceImport,
            boolean typeOnly,
            int start,
            int end)
            implements Statement {
        public Import {
            namedImports = List.copyOf(namedImports);
        }
    }

    /** {@code export <declaration>} or {@code export { ... }} ({@code declaration} is then null). */
    record ExportNamed(Statement declaration, int start, int end) implements Statement {}

    /** {@code export default ...}; the declaration is a {@link FunctionDeclaration} or an expression. */
    record ExportDefault(SyntaxNode declaration, int start, int end) implements Statement {}

    record FunctionDeclaration(
            String name, List<Parameter> params, TypeAnnotation returnType, Block body, boolean async, int start, int end)
            implements Statement {
        public FunctionDeclaration {
            params = List.copyOf(params);
        }
    }

    /** {@code const}, {@code let} or {@code var} declaration. */
    record Variables(String kind, List<Declarator> declarators, int start, int end) implements Statement {
        public Variables {
            declarators = List.copyOf(declarators);
        }
    }

    /** One binding of a {@link Variables} statement. */
    record Declarator(Pattern id, TypeAnnotation type, Expression init, int start, int end) implements SyntaxNode {}

    record Interface(String name, List<TypeAnnotation.TypeMember> members, int start, int end) implements Statement {
        public Interface {
            members = List.copyOf(members);
        }
    }

    record TypeAlias(String name, TypeAnnotation type, int start, int end) implements Statement {}

    record Return(Expression argument, int start, int end) implements Statement {}

    record ExpressionStatement(Expression expression, int start, int end) implements Statement {}

    record Block(List<Statement> body, int start, int end) implements Statement {
        public Block {
            body = List.copyOf(body);
        }
    }

    record If(Expression test, Statement consequent, Statement alternate, int start, int end) implements Statement {}

    /** Loops, {@code try} and labelled statements: only their nested bodies are kept. */
    record Compound(String keyword, List<Statement> bodies, int start, int end) implements Statement {
        public Compound {
            bodies = List.copyOf(bodies);
        }
    }

    /** A statement the builder never looks inside ({@code class}, {@code enum}, {@code switch}, ...). */
    record Opaque(String keyword, int start, int end) implements Statement {}

    record Empty(int start, int end) implements Statement {}
}
