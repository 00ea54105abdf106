package org.p4c.p4Compiler.compiler;

/** A component that belongs to a compiler instance and uses its services. */
public interface ICompilerComponent {
    P4Compiler compiler();
}
