package io.templatexform.core.parse;

/** Lexical categories of the TypeScript/JSX subset. Keywords are lexed as identifiers. */
enum TokenType {
    IDENTIFIER,
    NUMBER,
    STRING,
    TEMPLATE,
    REGEX,
    PUNCTUATOR,
    EOF
}
