package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.p4Compiler.ir.IP4Node;

import java.util.HashSet;
import java.util.Set;

/** Left-value and compile-time constant flags of expressions, indexed by node id.
 * The type of an expression is stored in the expression itself. */
public class TypeMap {
    final Set<Long> leftValues;
    final Set<Long> constants;

    public TypeMap() {
        this.leftValues = new HashSet<>();
        this.constants = new HashSet<>();
    }

    public void setLeftValue(IP4Node node) {
        this.leftValues.add(node.getId());
    }

    public boolean isLeftValue(IP4Node node) {
        return this.leftValues.contains(node.getId());
    }

    public void setCompileTimeConstant(IP4Node node) {
        this.constants.add(node.getId());
    }

    public boolean isCompileTimeConstant(IP4Node node) {
        return this.constants.contains(node.getId());
    }

    /** Give the node 'to' the same flags as the node 'from'. */
    public void cloneFlags(IP4Node from, IP4Node to) {
        if (this.isLeftValue(from))
            this.setLeftValue(to);
        if (this.isCompileTimeConstant(from))
            this.setCompileTimeConstant(to);
    }

    public void clear() {
        this.leftValues.clear();
        this.constants.clear();
    }

    @Override
    public String toString() {
        return "TypeMap{leftValues=" + this.leftValues + ", constants=" + this.constants + "}";
    }
}
