package org.atoms.analogCompiler.compiler.frontend.builder;

import java.util.List;

public final class ArgsBuilder extends PragmaBuilder {
    /** May contain duplicates; these are reported by the parser. */
    public final List<String> names;

    ArgsBuilder(Builder parent, List<String> names) {
        super(parent, BuilderNodeKind.ARGS);
        this.names = List.copyOf(names);
    }
}
