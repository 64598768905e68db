package org.pragmatica.urlkit.template;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * {@code {name}} placeholder handling for URL templates.
 */
public final class TemplateSubstitution {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z0-9_]+)}");

    private TemplateSubstitution() {}

    /**
     * Replace every {@code {key}} whose key is present in {@code vars}. Unknown placeholders
     * are left untouched. Substitution is a single left-to-right pass, so placeholders that
     * appear inside substituted values are not expanded again.
     */
    public static String substitute(String template, Map<String, String> vars) {
        var result = new StringBuilder(template.length() + 32);
        var i = 0;
        while (i < template.length()) {
            var c = template.charAt(i);
            if (c == '{') {
                var close = template.indexOf('}', i + 1);
                if (close > i) {
                    var value = vars.get(template.substring(i + 1, close));
                    if (value != null) {
                        result.append(value);
                        i = close + 1;
                        continue;
                    }
                }
            }
            result.append(c);
            i++ ;
        }
        return result.toString();
    }

    /**
     * Placeholder names referenced by {@code template} and absent from {@code vars}, sorted
     * and without duplicates.
     */
    public static List<String> missingVariables(String template, Map<String, String> vars) {
        var missing = new TreeSet<String>();
        var matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            var name = matcher.group(1);
            if (!vars.containsKey(name)) {
                missing.add(name);
            }
        }
        return List.copyOf(missing);
    }
}
