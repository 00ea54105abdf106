package org.p4c.util;

import java.util.Set;

/** Generates a fresh name that does not appear in a set of used names.
 * Generated names are the prefix, then the prefix followed by an underscore and a counter. */
public class FreshName {
    final Set<String> used;

    /** @param used Keep track of the used names in this set.  */
    public FreshName(Set<String> used) {
        this.used = used;
    }

    /**
     * Generate a fresh name starting with the specified prefix.
     *
     * @param prefix  Prefix for the new name.
     * @param remember If true, add the generated name to the set of used names. */
    public String freshName(String prefix, boolean remember) {
        String name = prefix;
        long counter = 0;
        while (this.used.contains(name)) {
            name = prefix + "_" + counter;
            counter++;
        }
        if (remember)
            this.used.add(name);
        return name;
    }
}
