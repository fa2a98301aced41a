package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.compiler.errors.CompilationError;
import org.atoms.analogCompiler.ir.control.Sequence;
import org.atoms.analogCompiler.ir.register.AtomArrangement;
import org.atoms.analogCompiler.ir.register.Chain;
import org.atoms.analogCompiler.ir.register.ListOfLocations;
import org.atoms.analogCompiler.ir.register.Square;
import org.atoms.analogCompiler.ir.scalar.Scalar;

/** The root of every builder chain: the atoms the program runs on. */
public final class RegisterBuilder extends Builder implements ICouplingTarget, IPragmaTarget {
    public final AtomArrangement register;

    RegisterBuilder(AtomArrangement register) {
        super(null, BuilderNodeKind.REGISTER);
        this.register = register;
    }

    public static RegisterBuilder of(AtomArrangement register) {
        return new RegisterBuilder(register);
    }

    /** An empty list of locations, to be filled with {@link #addPosition}. */
    public static RegisterBuilder start() {
        return new RegisterBuilder(new ListOfLocations());
    }

    public static RegisterBuilder chain(int size, Object spacing) {
        return new RegisterBuilder(new Chain(size, Scalar.cast(spacing)));
    }

    public static RegisterBuilder square(int size, Object spacing) {
        return new RegisterBuilder(new Square(size, Scalar.cast(spacing)));
    }

    /** A new root whose register has one more site. */
    public RegisterBuilder addPosition(Object x, Object y) {
        if (!(this.register instanceof ListOfLocations locations))
            throw new CompilationError("Cannot add a position to " + this.register, this);
        return new RegisterBuilder(locations.addPosition(Scalar.cast(x), Scalar.cast(y)));
    }

    /** Use a sequence built elsewhere instead of describing one with this chain. */
    public SequenceBuilder apply(Sequence sequence) {
        return new SequenceBuilder(this, sequence);
    }
}
