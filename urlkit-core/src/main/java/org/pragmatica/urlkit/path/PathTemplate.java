package org.pragmatica.urlkit.path;

import org.pragmatica.urlkit.RoutingError;
import org.pragmatica.urlkit.UrlKitException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compiled route template in {@code :name} syntax.
 *
 * <ul>
 *   <li>{@code :name} is a required parameter, {@code :name?} an optional one.</li>
 *   <li>A {@code /} or {@code .} directly before a parameter belongs to it and is only
 *       emitted together with the parameter value.</li>
 *   <li>{@code \} escapes the next character; a {@code :} not followed by a name character
 *       is literal text.</li>
 * </ul>
 *
 * Values are percent-encoded with {@link PathEscaper#escapeSegment(String)}.
 */
public record PathTemplate(String raw, List<Token> tokens) {

    public sealed interface Token {}

    public record Literal(String text) implements Token {}

    public record Parameter(String name, String prefix, boolean optional) implements Token {}

    public PathTemplate {
        tokens = List.copyOf(tokens);
    }

    public static PathTemplate compile(String raw) {
        var tokens = new ArrayList<Token>();
        var literal = new StringBuilder();
        // index in literal of the last character that came from an escape sequence
        var escapedAt = -1;
        var i = 0;
        while (i < raw.length()) {
            var c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length()) {
                literal.append(raw.charAt(i + 1));
                escapedAt = literal.length() - 1;
                i += 2;
                continue;
            }
            if (c == ':' && i + 1 < raw.length() && isNameChar(raw.charAt(i + 1))) {
                var end = i + 1;
                while (end < raw.length() && isNameChar(raw.charAt(end))) {
                    end++ ;
                }
                var name = raw.substring(i + 1, end);
                var optional = end < raw.length() && raw.charAt(end) == '?';
                var prefix = takePrefix(literal, escapedAt);
                if (literal.length() > 0) {
                    tokens.add(new Literal(literal.toString()));
                    literal.setLength(0);
                }
                escapedAt = -1;
                tokens.add(new Parameter(name, prefix, optional));
                i = optional
                    ? end + 1
                    : end;
                continue;
            }
            literal.append(c);
            i++ ;
        }
        if (literal.length() > 0) {
            tokens.add(new Literal(literal.toString()));
        }
        return new PathTemplate(raw, tokens);
    }

    public List<String> parameterNames() {
        return tokens.stream()
                     .filter(Parameter.class::isInstance)
                     .map(token -> ((Parameter) token).name())
                     .toList();
    }

    /**
     * Produce the concrete path for the given parameter values.
     *
     * @throws UrlKitException with {@link RoutingError.MissingParameter} when a required
     *                         parameter has no value, or {@link RoutingError.InvalidParameter}
     *                         when a supplied value is empty
     */
    public String expand(Map<String, String> params) throws UrlKitException {
        var path = new StringBuilder(raw.length() + 16);
        for (var token : tokens) {
            if (token instanceof Literal literal) {
                path.append(literal.text());
                continue;
            }
            var parameter = (Parameter) token;
            var value = params.get(parameter.name());
            if (value == null) {
                if (parameter.optional()) {
                    continue;
                }
                throw new RoutingError.MissingParameter(raw, parameter.name()).exception();
            }
            if (value.isEmpty()) {
                throw new RoutingError.InvalidParameter(raw, parameter.name(), "value must not be empty").exception();
            }
            path.append(parameter.prefix())
                .append(PathEscaper.escapeSegment(value));
        }
        return path.toString();
    }

    private static String takePrefix(StringBuilder literal, int escapedAt) {
        var last = literal.length() - 1;
        if (last < 0 || last == escapedAt) {
            return "";
        }
        var c = literal.charAt(last);
        if (c != '/' && c != '.') {
            return "";
        }
        literal.setLength(last);
        return String.valueOf(c);
    }

    private static boolean isNameChar(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
