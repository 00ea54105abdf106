package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.util.ICastable;

import java.util.function.Function;

public interface IRTransform extends Function<IP4Node, IP4Node>, ICastable {}
