package io.templatexform.core.parse;

import io.templatexform.core.parse.ast.Expression;
import io.templatexform.core.parse.ast.Program;
import io.templatexform.core.parse.ast.TypeAnnotation;
import java.util.Objects;

/**
 * Default {@link MarkupParser} for TypeScript and JavaScript sources with JSX markup.
 *
 * <p>Covers the language subset that UI components are written in: imports and exports, function
 * and variable declarations, interfaces and type aliases, control-flow statements, the full
 * expression grammar, and JSX. Type annotations are kept as text. Class, enum and switch bodies
 * are parsed only as far as needed to skip them safely.
 */
public final class TsxParser implements MarkupParser {

    @Override
    public Program parse(String source, String sourceFile) {
        Objects.requireNonNull(source, "source must not be null");
        return new SyntaxParser(source, sourceFile, new LineMap(source), 0, source.length()).parseProgram();
    }

    /** Parses a single expression, for example an attribute value held as source text. */
    public Expression parseExpression(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new SyntaxParser(source, null, new LineMap(source), 0, source.length())
                .parseStandaloneExpression();
    }

    /** Parses a type written as source text, such as {@code { id: string }[]}. */
    public TypeAnnotation parseType(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new SyntaxParser(source, null, new LineMap(source), 0, source.length()).parseStandaloneType();
    }
}
