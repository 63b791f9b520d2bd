package org.retroscript.compiler.frontend.semantics;

import org.retroscript.compiler.model.Span;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Symbols of one analysis run: externally known assets, flows, constants, labels per
 * container (flow or interrupt) and a chain of lexical scopes for local bindings.
 * <p>
 * Every {@code define*} method returns the previous symbol of the same name, if any; the new
 * symbol always replaces it.
 */
public class SymbolTable {

    /**
     * A lexical scope holding let-bindings, loop variables and catch variables.
     */
    public static class Scope {
        private final Scope parent;
        private final List<Scope> children = new ArrayList<>();
        private final Map<String, Symbol> symbols = new HashMap<>();

        public Scope(Scope parent) {
            this.parent = parent;
        }

        public Scope getParent() {
            return parent;
        }

        public List<Scope> getChildren() {
            return children;
        }

        public Map<String, Symbol> getSymbols() {
            return symbols;
        }
    }

    private final Map<String, Symbol> assets = new LinkedHashMap<>();
    private final Map<String, Symbol> flows = new LinkedHashMap<>();
    private final Map<String, Symbol> constants = new LinkedHashMap<>();
    private final Map<String, Map<String, Symbol>> labelsByContainer = new HashMap<>();

    private final Scope rootScope = new Scope(null);
    private Scope currentScope = rootScope;
    private String currentContainer;

    public SymbolTable() {
    }

    public SymbolTable(Collection<String> knownAssets) {
        for (String asset : knownAssets) {
            defineAsset(asset);
        }
    }

    // --- assets

    public void defineAsset(String assetId) {
        assets.put(assetId, new Symbol(assetId, Symbol.Type.ASSET, Span.NONE, null));
    }

    public boolean isKnownAsset(String assetId) {
        return assets.containsKey(assetId);
    }

    public Collection<String> getAssetIds() {
        return Collections.unmodifiableSet(assets.keySet());
    }

    // --- flows and constants

    public Optional<Symbol> defineFlow(Symbol flow) {
        return Optional.ofNullable(flows.put(flow.name(), flow));
    }

    public Optional<Symbol> resolveFlow(String name) {
        return Optional.ofNullable(flows.get(name));
    }

    public Optional<Symbol> defineConstant(Symbol constant) {
        return Optional.ofNullable(constants.put(constant.name(), constant));
    }

    public Optional<Symbol> resolveConstant(String name) {
        return Optional.ofNullable(constants.get(name));
    }

    public Collection<String> getFlowNames() {
        return Collections.unmodifiableSet(flows.keySet());
    }

    public Collection<String> getConstantNames() {
        return Collections.unmodifiableSet(constants.keySet());
    }

    // --- labels

    /**
     * Sets the container (flow or interrupt) that owns subsequently defined and resolved labels.
     * @param containerId a key unique per flow or interrupt declaration.
     */
    public void enterContainer(String containerId) {
        this.currentContainer = containerId;
    }

    public void leaveContainer() {
        this.currentContainer = null;
    }

    public String getCurrentContainer() {
        return currentContainer;
    }

    public Optional<Symbol> defineLabel(Symbol label) {
        Map<String, Symbol> labels = labelsByContainer.computeIfAbsent(String.valueOf(currentContainer), k -> new LinkedHashMap<>());
        return Optional.ofNullable(labels.put(label.name(), label));
    }

    public Optional<Symbol> resolveLabel(String name) {
        Map<String, Symbol> labels = labelsByContainer.get(String.valueOf(currentContainer));
        return labels == null ? Optional.empty() : Optional.ofNullable(labels.get(name));
    }

    // --- lexical scopes

    /**
     * Resets the current scope to the root scope before a new traversal.
     */
    public void resetScope() {
        currentScope = rootScope;
        currentContainer = null;
    }

    public Scope enterScope() {
        Scope scope = new Scope(currentScope);
        currentScope.children.add(scope);
        currentScope = scope;
        return scope;
    }

    public void leaveScope() {
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
        }
    }

    public Scope getCurrentScope() {
        return currentScope;
    }

    public Scope getRootScope() {
        return rootScope;
    }

    /**
     * Collects the names bound in every scope recorded so far, in traversal order.
     * @return local variable names without duplicates.
     */
    public Collection<String> getScopedVariableNames() {
        Set<String> names = new LinkedHashSet<>();
        Deque<Scope> pending = new ArrayDeque<>();
        pending.push(rootScope);
        while (!pending.isEmpty()) {
            Scope scope = pending.pop();
            scope.symbols.keySet().stream().sorted().forEach(names::add);
            for (int i = scope.children.size() - 1; i >= 0; i--) {
                pending.push(scope.children.get(i));
            }
        }
        return names;
    }

    public Optional<Symbol> define(Symbol symbol) {
        return Optional.ofNullable(currentScope.symbols.put(symbol.name(), symbol));
    }

    /**
     * Resolves a name through the scope chain, falling back to constants.
     * @param name the identifier to resolve.
     * @return the symbol, or empty when the name is unknown.
     */
    public Optional<Symbol> resolve(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return resolveConstant(name);
    }
}
