package org.gopy.source.ast;

public enum Token {

    // operators
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

    // keywords
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

    public String text() {
        return text;
    }

    public static Token fromText(String text) {
        for (Token token : values()) {
            if (token.text.equals(text)) {
                return token;
            }
        }
        throw new IllegalArgumentException("Unknown token: " + text);
    }
}
