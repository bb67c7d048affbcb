package com.chapterbus.worker;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Matches character names as the planner wrote them to the registered cast.
 *
 * Tries, in order: exact match, a registered name contained in the given name, the
 * given name contained in a registered name, and the given name with any
 * parenthetical annotation stripped. So "Lin Yan (the smith)" resolves to "Lin Yan".
 */
public class CharacterNameResolver {

    private final List<String> registered;

    public CharacterNameResolver(Collection<String> registeredNames) {
        this.registered = List.copyOf(registeredNames);
    }

    public Optional<String> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        if (registered.contains(name)) {
            return Optional.of(name);
        }
        for (String candidate : registered) {
            if (name.contains(candidate)) {
                return Optional.of(candidate);
            }
        }
        for (String candidate : registered) {
            if (candidate.contains(name)) {
                return Optional.of(candidate);
            }
        }
        int paren = name.indexOf('(');
        if (paren > 0) {
            String stripped = name.substring(0, paren).trim();
            if (registered.contains(stripped)) {
                return Optional.of(stripped);
            }
        }
        return Optional.empty();
    }

    public List<String> registered() {
        return registered;
    }
}
