package io.templatexform.core.parse.ast;

import java.util.List;

/** A parsed source file. */
public record Program(List<Statement> body, String source, String sourceFile) {

    public Program {
        body = List.copyOf(body);
    }
}
