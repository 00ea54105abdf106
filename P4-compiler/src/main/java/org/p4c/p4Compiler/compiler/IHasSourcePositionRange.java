package org.p4c.p4Compiler.compiler;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;

public interface IHasSourcePositionRange {
    SourcePositionRange getPositionRange();
}
