package org.atoms.analogCompiler.compiler.frontend.builder;

/** An execution directive.  Directives can be given in any order. */
public abstract class PragmaBuilder extends Builder implements IPragmaTarget {
    protected PragmaBuilder(Builder parent, BuilderNodeKind kind) {
        super(parent, kind);
    }
}
