package org.pragmatica.astor.tree;

/**
 * Lexical tokens carried as leaf data: literal kinds, operators and the keywords
 * that select statement or declaration flavours.
 */
public enum Token {
    // Literal kinds
    INT("INT"),
    FLOAT("FLOAT"),
    IMAG("IMAG"),
    CHAR("CHAR"),
    STRING("STRING"),

    // Operators
    ADD("+"),
    SUB("-"),
    MUL("*"),
    QUO("/"),
    REM("%"),
    AND("&"),
    OR("|"),
    XOR("^"),
    SHL("<<"),
    SHR(">>"),
    AND_NOT("&^"),

    ADD_ASSIGN("+="),
    SUB_ASSIGN("-="),
    MUL_ASSIGN("*="),
    QUO_ASSIGN("/="),
    REM_ASSIGN("%="),
    AND_ASSIGN("&="),
    OR_ASSIGN("|="),
    XOR_ASSIGN("^="),
    SHL_ASSIGN("<<="),
    SHR_ASSIGN(">>="),
    AND_NOT_ASSIGN("&^="),

    LAND("&&"),
    LOR("||"),
    ARROW("<-"),
    INC("++"),
    DEC("--"),

    EQL("=="),
    LSS("<"),
    GTR(">"),
    ASSIGN("="),
    NOT("!"),
    NEQ("!="),
    LEQ("<="),
    GEQ(">="),
    DEFINE(":="),
    TILDE("~"),

    // Keywords
    BREAK("break"),
    CONTINUE("continue"),
    GOTO("goto"),
    FALLTHROUGH("fallthrough"),
    IMPORT("import"),
    CONST("const"),
    TYPE("type"),
    VAR("var");

    private final String text;

    Token(String text) {
        this.text = text;
    }

    /**
     * Source spelling of the token. Literal kinds return their own name.
     */
    public String text() {
        return text;
    }

    public boolean isLiteral() {
        return ordinal() <= STRING.ordinal();
    }

    public boolean isKeyword() {
        return ordinal() >= BREAK.ordinal();
    }

    @Override
    public String toString() {
        return text;
    }
}
