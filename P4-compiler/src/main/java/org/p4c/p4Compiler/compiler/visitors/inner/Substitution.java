package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.util.Utilities;

import java.util.HashMap;
import java.util.Map;

/** One scope: a map from names to values. */
public class Substitution<K, V> extends HashMap<K, V> {
    public Substitution() {}

    public void substitute(K name, V value) {
        this.put(name, value);
    }

    public void substituteNew(K key, V value) {
        Utilities.putNew(this, key, value);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("[");
        for (Map.Entry<K, V> entry: this.entrySet()) {
            builder.append(entry.getKey()).append(",");
        }
        builder.append("]");
        return builder.toString();
    }
}
