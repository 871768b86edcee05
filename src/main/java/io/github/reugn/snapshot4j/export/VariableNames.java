package io.github.reugn.snapshot4j.export;

import javax.lang.model.SourceVersion;

/**
 * Turns arbitrary text into a valid Java field name.
 *
 * <ul>
 *   <li>characters that cannot appear in an identifier become {@code _}</li>
 *   <li>a leading digit gets a {@code _} prefix</li>
 *   <li>reserved words and literals get a {@code _} suffix: {@code class} → {@code class_}</li>
 *   <li>empty input becomes {@code snapshot}</li>
 * </ul>
 */
public final class VariableNames {

    static final String FALLBACK = "snapshot";

    private VariableNames() {
    }

    /**
     * Sanitizes a variable name.
     *
     * @param name the requested name
     * @return a valid Java identifier; {@code name} itself when it already is one
     */
    public static String sanitize(String name) {
        if (name == null || name.isEmpty()) {
            return FALLBACK;
        }
        StringBuilder sb = new StringBuilder(name.length() + 1);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(Character.isJavaIdentifierPart(c) && !Character.isIdentifierIgnorable(c) ? c : '_');
        }
        if (!Character.isJavaIdentifierStart(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        String result = sb.toString();
        if (SourceVersion.isKeyword(result)) {
            result = result + "_";
        }
        return result;
    }
}
