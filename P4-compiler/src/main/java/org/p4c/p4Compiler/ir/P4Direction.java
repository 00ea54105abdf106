package org.p4c.p4Compiler.ir;

/** Direction of a parameter. */
public enum P4Direction {
    /** Compile-time or control-plane value. */
    NONE(""),
    IN("in"),
    OUT("out"),
    INOUT("inout");

    private final String text;

    P4Direction(String text) {
        this.text = text;
    }

    /** True if the callee writes the argument. */
    public boolean isOut() {
        return this == OUT || this == INOUT;
    }

    @Override
    public String toString() {
        return this.text;
    }
}
