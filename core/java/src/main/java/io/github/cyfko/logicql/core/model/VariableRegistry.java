package io.github.cyfko.logicql.core.model;

import java.util.*;

/**
 * Mutable mapping from variable name to its current boolean value, together with the order in
 * which the names were declared.
 * <p>
 * Names are added once and never removed. A registry is not thread-safe: every concurrent
 * evaluation must work on its own {@link #copy()}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class VariableRegistry {

    private final Map<String, Boolean> values;
    private final List<String> order;

    public VariableRegistry() {
        this.values = new HashMap<>();
        this.order = new ArrayList<>();
    }

    private VariableRegistry(Map<String, Boolean> values, List<String> order) {
        this.values = new HashMap<>(values);
        this.order = new ArrayList<>(order);
    }

    /**
     * Creates a registry holding the given names, in order, all set to {@code false}.
     *
     * @param names variable names; duplicates are registered once
     * @return a new registry
     */
    public static VariableRegistry of(Collection<String> names) {
        VariableRegistry registry = new VariableRegistry();
        names.forEach(registry::register);
        return registry;
    }

    /**
     * Merges two registries.
     * <p>
     * Values of {@code first} are copied, then values of {@code second}, which win on shared
     * names. The resulting order is the sorted union of both name sets.
     * </p>
     *
     * @param first  the left registry
     * @param second the right registry
     * @return a new registry
     */
    public static VariableRegistry merge(VariableRegistry first, VariableRegistry second) {
        Map<String, Boolean> merged = new HashMap<>(first.values);
        merged.putAll(second.values);
        return new VariableRegistry(merged, new ArrayList<>(new TreeSet<>(merged.keySet())));
    }

    /**
     * Registers a name with the value {@code false} if it is not known yet.
     *
     * @param name the variable name
     * @return {@code true} if the name was new
     */
    public boolean register(String name) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        if (values.containsKey(name)) {
            return false;
        }
        values.put(name, Boolean.FALSE);
        order.add(name);
        return true;
    }

    /**
     * Returns the current value of a variable.
     *
     * @param name the variable name
     * @return its current value
     * @throws IllegalStateException if the name was never registered
     */
    public boolean get(String name) {
        Boolean value = values.get(name);
        if (value == null) {
            throw new IllegalStateException("Variable '" + name + "' is not registered. Known variables: " + order);
        }
        return value;
    }

    /**
     * Sets the value of a registered variable.
     *
     * @param name  the variable name
     * @param value the new value
     * @throws IllegalArgumentException if the name was never registered
     */
    public void set(String name, boolean value) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("Cannot assign unknown variable '" + name + "'. Known variables: " + order);
        }
        values.put(name, value);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * @return the variable names in declaration order (unmodifiable view)
     */
    public List<String> names() {
        return Collections.unmodifiableList(order);
    }

    public int size() {
        return order.size();
    }

    /**
     * @return the current values keyed by name, in declaration order
     */
    public Map<String, Boolean> snapshot() {
        Map<String, Boolean> snapshot = new LinkedHashMap<>(order.size());
        for (String name : order) {
            snapshot.put(name, values.get(name));
        }
        return snapshot;
    }

    /**
     * @return an independent registry with the same names, order and values
     */
    public VariableRegistry copy() {
        return new VariableRegistry(values, order);
    }

    @Override
    public String toString() {
        return "VariableRegistry" + snapshot();
    }
}
