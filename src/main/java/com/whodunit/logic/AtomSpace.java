package com.whodunit.logic;

import com.whodunit.contract.AttributeCategory;
import com.whodunit.contract.GameConfiguration;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every atom a game can talk about: one per (person, attribute value) pair
 * across all categories, plus one "is the killer" atom per person.
 *
 * Fully determined by the configuration and never changed after
 * {@link #build(GameConfiguration)}. Ids are allocated person by person in
 * configuration order, categories in declaration order, then the killer
 * atoms.
 */
public final class AtomSpace {

    private static final String KILLER_SUFFIX = "is_killer";

    private final List<String> names;
    private final Map<String, Atom> atoms;

    private AtomSpace(List<String> names, Map<String, Atom> atoms) {
        this.names = List.copyOf(names);
        this.atoms = Collections.unmodifiableMap(atoms);
    }

    public static AtomSpace build(GameConfiguration configuration) {
        Map<String, Atom> atoms = new LinkedHashMap<>();
        int nextId = 1;
        for (String name : configuration.names()) {
            for (AttributeCategory category : AttributeCategory.values()) {
                for (String value : configuration.valuesOf(category)) {
                    nextId = register(atoms, attributeKey(name, value), nextId);
                }
            }
        }
        for (String name : configuration.names()) {
            nextId = register(atoms, killerKey(name), nextId);
        }
        return new AtomSpace(configuration.names(), atoms);
    }

    // a duplicate key would make two facts share one atom
    private static int register(Map<String, Atom> atoms, String key, int id) {
        if (atoms.putIfAbsent(key, new Atom(key, id)) != null) {
            throw new IllegalArgumentException("atom key " + key + " is produced by two different facts");
        }
        return id + 1;
    }

    public static String attributeKey(String person, String value) {
        return person + "_" + value;
    }

    public static String killerKey(String person) {
        return person + "_" + KILLER_SUFFIX;
    }

    public Optional<Atom> find(String key) {
        return Optional.ofNullable(atoms.get(key));
    }

    /** Atom for "person has value", if the pair exists in this space. */
    public Optional<Atom> attribute(String person, String value) {
        return find(attributeKey(person, value));
    }

    /**
     * Atom for "person is the killer".
     *
     * @throws IllegalArgumentException if the person is not part of the game
     */
    public Atom killer(String person) {
        return find(killerKey(person))
            .orElseThrow(() -> new IllegalArgumentException("unknown person: " + person));
    }

    public List<Atom> killerAtoms() {
        return names.stream().map(this::killer).toList();
    }

    public List<String> names() {
        return names;
    }

    public Collection<Atom> atoms() {
        return atoms.values();
    }

    public int size() {
        return atoms.size();
    }
}
