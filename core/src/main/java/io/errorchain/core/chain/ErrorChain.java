package io.errorchain.core.chain;

import io.errorchain.core.error.Errors;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An error derived step by step from a base error. Each derivation allocates a new node that
 * keeps a reference to the node it was derived from, so a derived error answers {@link #is} for
 * every one of its ancestors and for everything in their cause chains.
 *
 * <p>
 * Nodes render to a single line (see {@link ChainRenderer}):
 *
 * <pre>{@code
 * static final ErrorChain ERR_STORE = ErrorChain.of("store");
 * static final ErrorChain ERR_WRITE = ERR_STORE.wrap("write failed");
 * static final ErrorChain ERR_SEGMENT = ERR_WRITE.wrapTemplate("segment %d");
 *
 * throw ERR_SEGMENT.wrapCauseWithArgs(ioException, 42);
 * // store: write failed > segment 42 < disk full
 * }</pre>
 *
 * <p>
 * Template nodes ({@link #ofTemplate}, {@link #wrapTemplate}) hold a format string instead of
 * display text. They are skipped when rendering but stay in the chain for identity checks.
 *
 * <p>
 * A node is immutable once built, with one exception: {@link #extra} appends to the node's extra
 * list in place. Extras must be appended by the single owner of the node before it is shared;
 * after that, all operations are read-only and safe to call from any thread.
 */
public final class ErrorChain extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String text;
    private final boolean template;
    private final ErrorChain wrapped;
    private final Cause cause;
    private final transient Object data;
    private final ArrayList<Throwable> extras = new ArrayList<>();

    private ErrorChain(String text, boolean template, ErrorChain wrapped, Cause cause, Object data) {
        super(null, cause != null ? cause.error() : null);
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.template = template;
        this.wrapped = wrapped;
        this.cause = cause;
        this.data = data;
    }

    /**
     * Creates a root error.
     *
     * @param message the display text
     * @return a new root node
     */
    public static ErrorChain of(String message) {
        return new ErrorChain(message, false, null, null, null);
    }

    /**
     * Creates a root template error whose text is a format string for errors derived from it
     * through {@link #withArgs} and the other {@code *WithArgs} methods. Renders as an empty
     * string if never derived from.
     *
     * @param format a {@link java.util.Formatter} format string
     * @return a new root template node
     */
    public static ErrorChain ofTemplate(String format) {
        return new ErrorChain(format, true, null, null, null);
    }

    // ── Derivation ──

    /** Derives a new error with the given display text. */
    public ErrorChain wrap(String message) {
        return new ErrorChain(message, false, this, null, null);
    }

    /**
     * Derives a new template error. The returned node is not rendered; its format string is filled
     * by a later {@link #withArgs}, {@link #wrapCauseWithArgs} or {@link #wrapDataWithArgs}.
     */
    public ErrorChain wrapTemplate(String format) {
        return new ErrorChain(format, true, this, null, null);
    }

    /** Derives a new template error that also carries a data payload. */
    public ErrorChain wrapDataTemplate(String format, Object data) {
        return new ErrorChain(format, true, this, null, data);
    }

    /**
     * Derives a new error whose text is this node's template formatted with {@code args}. On a
     * non-template node the text is the string forms of {@code args} joined with a space.
     */
    public ErrorChain withArgs(Object... args) {
        return new ErrorChain(TemplateFormatter.format(this, args), false, this, null, null);
    }

    /**
     * Derives a new error that carries {@code cause}. The result {@linkplain #is is} every
     * ancestor of this node and every ancestor of the cause.
     *
     * @param message the display text
     * @param cause   the causing error, or {@code null} for none
     */
    public ErrorChain wrapCause(String message, Throwable cause) {
        return new ErrorChain(message, false, this, Cause.of(cause), null);
    }

    /** Combines {@link #withArgs} and {@link #wrapCause}. */
    public ErrorChain wrapCauseWithArgs(Throwable cause, Object... args) {
        return new ErrorChain(TemplateFormatter.format(this, args), false, this, Cause.of(cause), null);
    }

    /** Derives a new error carrying a data payload, retrievable with {@link #data()}. */
    public ErrorChain wrapData(String message, Object data) {
        return new ErrorChain(message, false, this, null, data);
    }

    /** Combines {@link #withArgs} and {@link #wrapData}. */
    public ErrorChain wrapDataWithArgs(Object data, Object... args) {
        return new ErrorChain(TemplateFormatter.format(this, args), false, this, null, data);
    }

    /**
     * Appends an extra error to this node, reported after the node's own message. Extras do not
     * take part in {@link #is}. Mutates this node; not safe once the node is shared.
     *
     * <p>
     * Extras must not render this node again: a node whose extras (or their causes and extras)
     * lead back to it cannot be rendered. Adding a node to itself is rejected.
     *
     * @param error the error to bundle
     * @return this node
     * @throws IllegalArgumentException if {@code error} is this node
     */
    public ErrorChain extra(Throwable error) {
        Objects.requireNonNull(error, "error must not be null");
        if (error == this) {
            throw new IllegalArgumentException("error chain cannot be its own extra");
        }
        extras.add(error);
        return this;
    }

    // ── Identity ──

    /**
     * Returns {@code true} if {@code target} is this very node, any node this one was derived from,
     * or any error in the cause chain of one of those nodes. Comparison is by reference.
     */
    public boolean is(Throwable target) {
        return target != null && Errors.is(this, target);
    }

    /**
     * Finds the first error of the given type, checking each node from this one to the root
     * together with its cause chain.
     */
    public <T extends Throwable> Optional<T> find(Class<T> type) {
        return Errors.find(this, type);
    }

    /** The node this one was derived from, or {@code null} for a root. */
    public ErrorChain unwrap() {
        return wrapped;
    }

    // ── Payload ──

    /** The payload attached to this node, or {@code null}. */
    public Object data() {
        return data;
    }

    /** The first non-null payload found walking from this node to the root, or {@code null}. */
    public Object anyData() {
        for (ErrorChain node = this; node != null; node = node.wrapped) {
            if (node.data != null) {
                return node.data;
            }
        }
        return null;
    }

    /** The first payload of the given type found walking from this node to the root. */
    public <T> Optional<T> anyData(Class<T> type) {
        for (ErrorChain node = this; node != null; node = node.wrapped) {
            if (type.isInstance(node.data)) {
                return Optional.of(type.cast(node.data));
            }
        }
        return Optional.empty();
    }

    // ── Accessors ──

    /** The display text, or the format string of a template node. */
    public String text() {
        return text;
    }

    /** Returns {@code true} if this node holds a format template. */
    public boolean isTemplate() {
        return template;
    }

    /** The error attached as this node's cause, or {@code null}. Same as {@link #getCause()}. */
    public Throwable cause() {
        return cause != null ? cause.error() : null;
    }

    Cause causeRef() {
        return cause;
    }

    /** Extra errors in insertion order (unmodifiable view). */
    public List<Throwable> extras() {
        return Collections.unmodifiableList(extras);
    }

    // ── Rendering ──

    /** Renders this node, its ancestors, causes and extras as a single line. */
    public String render() {
        return ChainRenderer.render(this);
    }

    @Override
    public String getMessage() {
        return render();
    }
}
