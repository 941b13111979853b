package org.zeno.compiler.frontend.semantics.rules;

/**
 * Camel-case checks shared by the naming rules. A name passes when its first character has the
 * required case and it contains neither {@code _} nor {@code -}.
 */
final class NamingConventions {

    private NamingConventions() {}

    static boolean isLowerCamelCase(String name) {
        return !name.isEmpty()
                && Character.isLetter(name.charAt(0))
                && Character.isLowerCase(name.charAt(0))
                && hasNoSeparators(name);
    }

    static boolean isUpperCamelCase(String name) {
        return !name.isEmpty()
                && Character.isLetter(name.charAt(0))
                && Character.isUpperCase(name.charAt(0))
                && hasNoSeparators(name);
    }

    private static boolean hasNoSeparators(String name) {
        return name.indexOf('_') < 0 && name.indexOf('-') < 0;
    }
}
