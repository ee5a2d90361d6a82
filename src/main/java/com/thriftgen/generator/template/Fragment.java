package com.thriftgen.generator.template;

import java.util.Objects;
import java.util.function.Function;

/**
 * A compiled fragment bound to the transform that turns its domain model into a
 * {@link Dictionary}.
 *
 * @param <M> the model rendered by this fragment (an enum, a struct, a document, ...)
 */
public final class Fragment<M> {

    private final CompiledFragment template;
    private final Function<M, Dictionary> unpacker;

    Fragment(CompiledFragment template, Function<M, Dictionary> unpacker) {
        this.template = Objects.requireNonNull(template, "template");
        this.unpacker = Objects.requireNonNull(unpacker, "unpacker");
    }

    public String render(M model) {
        return template.render(unpacker.apply(model));
    }

    /**
     * The transform alone, for embedding a model's dictionary as one item of a
     * larger dictionary.
     */
    public Function<M, Dictionary> unpacker() {
        return unpacker;
    }

    /** The compiled source, for storing as a partial in another dictionary. */
    public CompiledFragment template() {
        return template;
    }

    public String getName() {
        return template.getName();
    }
}
