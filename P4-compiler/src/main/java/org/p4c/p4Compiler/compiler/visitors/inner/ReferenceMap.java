package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.ir.IP4Declaration;
import org.p4c.p4Compiler.ir.expression.P4PathExpression;
import org.p4c.util.FreshName;
import org.p4c.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/** Maps path expressions to their declarations.
 * Also keeps track of all names used in the program, to generate fresh names. */
public class ReferenceMap {
    final Map<P4PathExpression, IP4Declaration> declarations;
    /** Names are never removed from this set. */
    final Set<String> usedNames;
    final FreshName freshName;

    public ReferenceMap() {
        this.declarations = new HashMap<>();
        this.usedNames = new HashSet<>();
        this.freshName = new FreshName(this.usedNames);
    }

    public void declare(P4PathExpression path, IP4Declaration declaration) {
        if (this.declarations.containsKey(path)) {
            IP4Declaration decl = this.declarations.get(path);
            if (decl != declaration)
                throw new InternalCompilerError("Changing declaration of " + path + " from\n" +
                        decl + " to\n" + declaration, path);
            return;
        }
        Utilities.putNew(this.declarations, path, declaration);
    }

    public IP4Declaration getDeclaration(P4PathExpression path) {
        IP4Declaration result = this.declarations.get(path);
        if (result == null)
            throw new InternalCompilerError("Unresolved reference", path);
        return result;
    }

    @Nullable
    public IP4Declaration get(P4PathExpression path) {
        return this.declarations.get(path);
    }

    /** Record a name that appears in the program. */
    public void declareName(String name) {
        this.usedNames.add(name);
    }

    public boolean isUsed(String name) {
        return this.usedNames.contains(name);
    }

    /** Generate a name starting with the prefix that was never used before. */
    public String newName(String prefix) {
        return this.freshName.freshName(prefix, true);
    }

    /** Forget all bindings; the used names are kept. */
    public void clear() {
        this.declarations.clear();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (var kv: this.declarations.entrySet()) {
            builder.append(kv.getKey().toString())
                    .append("(")
                    .append(kv.getKey().id)
                    .append(")=>")
                    .append(kv.getValue().getClass().getSimpleName())
                    .append("(")
                    .append(kv.getValue().getId())
                    .append(")")
                    .append(System.lineSeparator());
        }
        return builder.toString();
    }
}
