package io.errorchain.core.chain;

import io.errorchain.core.error.Errors;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders an {@link ErrorChain} as one line.
 *
 * <p>
 * The root-most printable ancestor is separated from the rest with {@code ':'}, intermediate
 * ancestors are separated from each other with {@code ';'} and the node's own message is set off
 * with {@code '>'}. A cause follows the text of the node it belongs to after {@code '<'}, and
 * extras close the line after {@code '+'}:
 *
 * <pre>
 * store: volume; segment &gt; write failed &lt; disk full + fsync failed
 * </pre>
 *
 * <p>
 * Template nodes and nodes with empty text are skipped. Stateless.
 */
final class ChainRenderer {

    static final String CAUSE_SEPARATOR = " < ";
    static final String EXTRA_SEPARATOR = " + ";

    private ChainRenderer() {}

    static String render(ErrorChain node) {
        String message = node.isTemplate() ? "" : node.text();
        if (node.causeRef() != null) {
            message = message + CAUSE_SEPARATOR + node.causeRef().render();
        }

        // Nearest ancestor first.
        List<String> stack = new ArrayList<>();
        for (ErrorChain ancestor = node.unwrap(); ancestor != null; ancestor = ancestor.unwrap()) {
            if (ancestor.isTemplate() || ancestor.text().isEmpty()) {
                continue;
            }
            String entry = ancestor.text();
            if (ancestor.causeRef() != null) {
                entry = entry + CAUSE_SEPARATOR + ancestor.causeRef().render();
            }
            stack.add(entry);
        }

        StringBuilder out = new StringBuilder();
        if (stack.isEmpty()) {
            out.append(message);
        } else if (stack.size() == 1) {
            out.append(stack.get(0));
            if (!message.isEmpty()) {
                out.append(": ").append(message);
            }
        } else {
            int last = stack.size() - 1;
            out.append(stack.get(last)).append(':');
            for (int i = last - 1; i >= 0; i--) {
                out.append(' ').append(stack.get(i));
                if (i > 0) {
                    out.append(';');
                }
            }
            if (!message.isEmpty()) {
                out.append(" > ").append(message);
            }
        }

        for (Throwable extra : node.extras()) {
            out.append(EXTRA_SEPARATOR).append(Errors.describe(extra));
        }
        return out.toString();
    }
}
