package dev.directives.engine;

import dev.directives.model.IdentityKind;

/**
 * Splits identity strings back into their parts.
 */
public final class IdentityParser {

    private IdentityParser() {}

    /**
     * @param shortName last {@code /} segment of the qualified name; default exports resolve to
     *                  the module's own short name
     */
    public record ParsedIdentity(IdentityKind kind, String modulePath, String qualifiedName, String shortName) {}

    public static ParsedIdentity parse(String identity) {
        if (identity == null) {
            throw new IllegalArgumentException("Identity must not be null");
        }
        String separator = IdentityGenerator.SEPARATOR;
        int first = identity.indexOf(separator);
        int second = first < 0 ? -1 : identity.indexOf(separator, first + separator.length());
        if (first <= 0 || second < 0) {
            throw new IllegalArgumentException("Malformed identity '" + identity + "'");
        }
        IdentityKind kind = IdentityKind.fromPrefix(identity.substring(0, first));
        String modulePath = identity.substring(first + separator.length(), second);
        String qualifiedName = identity.substring(second + separator.length());
        if (modulePath.isEmpty() || qualifiedName.isEmpty()) {
            throw new IllegalArgumentException("Malformed identity '" + identity + "'");
        }
        return new ParsedIdentity(kind, modulePath, qualifiedName, shortName(modulePath, qualifiedName));
    }

    static String shortName(String modulePath, String qualifiedName) {
        String last = qualifiedName.substring(qualifiedName.lastIndexOf('/') + 1);
        if (!last.equals("default") && !last.equals("__default")) {
            return last;
        }
        return moduleShortName(modulePath);
    }

    /**
     * {@code ./src/jobs/order} gives {@code order}; {@code @acme/shared@1.2.0} gives {@code shared}.
     */
    static String moduleShortName(String modulePath) {
        if (modulePath.startsWith("./") || modulePath.startsWith("../")) {
            return modulePath.substring(modulePath.lastIndexOf('/') + 1);
        }
        String name = modulePath;
        int version = name.lastIndexOf('@');
        if (version > 0) {
            name = name.substring(0, version);
        }
        int scope = name.indexOf('/');
        if (name.startsWith("@") && scope > 0) {
            name = name.substring(scope + 1);
        }
        return name;
    }
}
