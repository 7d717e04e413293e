package org.demangler.frontend.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Tracks the generic parameter scopes that are open while a type is decoded.
 * <p>
 * Each generic signature opens a scope and declares its archetypes in it. Archetype
 * references count scopes outward from the innermost one. Names are drawn from a counter
 * that runs across the whole decode, so nested signatures never reuse a name.
 */
public class GenericScopes {

    private static final int ALPHABET = 26;

    private final Deque<List<String>> scopes = new ArrayDeque<>();
    private int declared = 0;

    /**
     * Opens a new innermost scope.
     */
    public void enterScope() {
        scopes.push(new ArrayList<>());
    }

    /**
     * Closes the innermost scope.
     * @throws IllegalStateException if no scope is open.
     */
    public void leaveScope() {
        if (scopes.isEmpty()) {
            throw new IllegalStateException("No generic scope is open");
        }
        scopes.pop();
    }

    /**
     * Declares the next archetype in the innermost scope.
     * @return The name assigned to the archetype.
     * @throws IllegalStateException if no scope is open.
     */
    public String declareArchetype() {
        if (scopes.isEmpty()) {
            throw new IllegalStateException("No generic scope is open");
        }
        String name = archetypeName(declared++);
        scopes.peek().add(name);
        return name;
    }

    /**
     * Resolves an archetype reference.
     * @param depth The number of scopes to skip outward from the innermost one.
     * @param index The position of the archetype in that scope.
     * @return The archetype name, or empty if the reference points outside every open scope.
     */
    public Optional<String> resolve(int depth, int index) {
        if (depth < 0 || index < 0 || depth >= scopes.size()) {
            return Optional.empty();
        }
        Iterator<List<String>> it = scopes.iterator();
        for (int i = 0; i < depth; i++) {
            it.next();
        }
        List<String> scope = it.next();
        return index < scope.size() ? Optional.of(scope.get(index)) : Optional.empty();
    }

    public int depth() {
        return scopes.size();
    }

    /**
     * Computes the display name of the n-th archetype of a decode: {@code A} to {@code Z},
     * then {@code A1}, {@code B1} and so on.
     * @param ordinal The zero-based ordinal.
     * @return The name.
     */
    static String archetypeName(int ordinal) {
        char letter = (char) ('A' + ordinal % ALPHABET);
        int round = ordinal / ALPHABET;
        return round == 0 ? String.valueOf(letter) : letter + Integer.toString(round);
    }
}
