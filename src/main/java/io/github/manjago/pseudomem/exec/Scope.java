package io.github.manjago.pseudomem.exec;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name-to-variable mapping with a parent link. Lookup is innermost first.
 *
 * <p>Variables declared here are owned by this scope and released with it;
 * aliases (BYREF parameters) are bound here but owned by the caller.
 */
public final class Scope {

    private final String owner;
    private final @Nullable Scope parent;
    private final Map<String, Variable> bindings = new LinkedHashMap<>();
    private final List<Variable> owned = new ArrayList<>();

    Scope(String owner, @Nullable Scope parent) {
        this.owner = owner;
        this.parent = parent;
    }

    public String getOwner() {
        return owner;
    }

    public @Nullable Scope getParent() {
        return parent;
    }

    public boolean isDeclaredHere(String name) {
        return bindings.containsKey(name);
    }

    public @Nullable Variable lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            Variable variable = scope.bindings.get(name);
            if (variable != null) {
                return variable;
            }
        }
        return null;
    }

    /**
     * Names visible from this scope, innermost binding winning.
     */
    public Map<String, Variable> visibleVariables() {
        Map<String, Variable> visible = new LinkedHashMap<>();
        if (parent != null) {
            visible.putAll(parent.visibleVariables());
        }
        visible.putAll(bindings);
        return visible;
    }

    void declare(Variable variable) {
        bindings.put(variable.getName(), variable);
        owned.add(variable);
    }

    void alias(String name, Variable variable) {
        bindings.put(name, variable);
    }

    List<Variable> ownedVariables() {
        return Collections.unmodifiableList(owned);
    }
}
