package io.templatexform.core.parse.ast;

import java.util.List;

/**
 * A TypeScript type, kept as source text. Object type literals additionally expose their members so
 * that prop types can be resolved without a type checker.
 *
 * @param text    type source text, whitespace-collapsed
 * @param members members of an object type literal, or {@code null} for any other type
 */
public record TypeAnnotation(String text, List<TypeMember> members, int start, int end) implements SyntaxNode {

    public TypeAnnotation {
        members = members != null ? List.copyOf(members) : null;
    }

    public boolean isTypeLiteral() {
        return members != null;
    }

    /** A property signature {@code name?: type}. Method and index signatures are not kept. */
    public record TypeMember(String name, boolean optional, String type) {}
}
