package dev.directives.engine;

import dev.directives.syntax.Lexer;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out module-level identifiers that collide with nothing already declared or allocated.
 */
final class NameAllocator {

    private final Set<String> taken;

    NameAllocator(Set<String> declared) {
        this.taken = new HashSet<>(declared);
    }

    /**
     * The preferred name made into a legal identifier, suffixed with {@code $1}, {@code $2}, ...
     * when it is already in use.
     */
    String allocate(String preferred) {
        String base = sanitize(preferred);
        String candidate = base;
        int suffix = 1;
        while (taken.contains(candidate)) {
            candidate = base + "$" + suffix++;
        }
        taken.add(candidate);
        return candidate;
    }

    static String sanitize(String name) {
        if (name.isEmpty()) {
            return "_";
        }
        var out = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean legal = i == 0 ? Lexer.isIdentifierStart(c)
                : Lexer.isIdentifierPart(c);
            if (legal) {
                out.append(c);
            } else if (i == 0 && Character.isDigit(c)) {
                out.append('_').append(c);
            } else {
                out.append('_');
            }
        }
        return out.toString();
    }
}
