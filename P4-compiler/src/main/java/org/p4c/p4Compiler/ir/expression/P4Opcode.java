package org.p4c.p4Compiler.ir.expression;

public enum P4Opcode {
    // Unary
    NEG("-"),
    LNOT("!"),
    CMPL("~"),
    // Binary
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    SHL("<<"),
    SHR(">>"),
    BAND("&"),
    BOR("|"),
    BXOR("^"),
    CONCAT("++"),
    EQ("=="),
    NEQ("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    // Short-circuit; only used by P4LAnd and P4LOr
    LAND("&&"),
    LOR("||");

    private final String text;

    P4Opcode(String text) {
        this.text = text;
    }

    public boolean isUnary() {
        return this == NEG || this == LNOT || this == CMPL;
    }

    @Override
    public String toString() {
        return this.text;
    }
}
