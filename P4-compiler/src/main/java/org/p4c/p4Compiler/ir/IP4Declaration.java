package org.p4c.p4Compiler.ir;

/** A node that introduces a name. */
public interface IP4Declaration extends IP4Node {
    String getName();
}
