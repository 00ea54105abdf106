package org.p4c.p4Compiler.ir;

/** A node that may appear as a component of a block or of a parser state:
 * a statement or a local variable/constant declaration. */
public interface IP4StatOrDecl extends IP4Node {}
