package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.ir.IP4Declaration;
import org.p4c.util.IIndentStream;

/** A named type declared at the program level.
 * toString only prints the type name; {@link #declare} prints the declaration. */
public interface IP4TypeDeclaration extends IP4Declaration {
    IIndentStream declare(IIndentStream builder);
}
