package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * A set of nested scopes where names are bound.
 * Each scope is a namespace which can define new bindings, which may
 * shadow bindings in the outer contexts. */
public class Scopes<K, V> {
    protected final List<Substitution<K, V>> stack;

    public Scopes() {
        this.stack = new ArrayList<>();
    }

    public void newContext() {
        this.stack.add(new Substitution<>());
    }

    public void popContext() {
        Utilities.removeLast(this.stack);
    }

    public void substitute(K key, V value) {
        if (this.stack.isEmpty())
            throw new InternalCompilerError("Empty context");
        Utilities.last(this.stack).substitute(key, value);
    }

    /** Bind a key that must not already be bound in the innermost scope. */
    public void substituteNew(K key, V value) {
        if (this.stack.isEmpty())
            throw new InternalCompilerError("Empty context");
        Utilities.last(this.stack).substituteNew(key, value);
    }

    public void mustBeEmpty() {
        if (!this.stack.isEmpty())
            throw new InternalCompilerError("Non-empty context");
    }

    /**
     * The binding for this key.
     * null if there isn't any. */
    @Nullable
    public V get(K name) {
        for (int i = 0; i < this.stack.size(); i++) {
            int index = this.stack.size() - i - 1;
            Substitution<K, V> subst = this.stack.get(index);
            if (subst.containsKey(name))
                return subst.get(name);
        }
        return null;
    }

    void clear() {
        this.stack.clear();
    }

    @Override
    public String toString() {
        return this.stack.toString();
    }
}
