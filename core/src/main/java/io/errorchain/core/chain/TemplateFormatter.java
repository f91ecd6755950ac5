package io.errorchain.core.chain;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills the format string of a template node with arguments. Never throws: a template that
 * rejects its arguments degrades to the raw template followed by the arguments, and a
 * non-template node degrades to the arguments joined with a space. An argument whose
 * {@code toString()} fails is shown as {@code ClassName@hash}.
 */
final class TemplateFormatter {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateFormatter.class);

    private TemplateFormatter() {}

    static String format(ErrorChain node, Object... args) {
        Object[] values = args != null ? args : new Object[0];
        if (!node.isTemplate()) {
            LOG.debug("Arguments applied to non-template error '{}', joining them as text", node.text());
            return Arrays.stream(values).map(TemplateFormatter::safeString).collect(Collectors.joining(" "));
        }
        try {
            return String.format(Locale.ROOT, node.text(), values);
        } catch (RuntimeException e) {
            // IllegalFormatException, or a throwing toString()/formatTo() of an argument.
            String shown = Arrays.stream(values)
                    .map(TemplateFormatter::safeString)
                    .collect(Collectors.joining(", ", "[", "]"));
            LOG.warn("Error template '{}' rejected arguments {}: {}", node.text(), shown, e.toString());
            return node.text() + " " + shown;
        }
    }

    static String safeString(Object value) {
        try {
            return String.valueOf(value);
        } catch (RuntimeException e) {
            return value.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(value));
        }
    }
}
