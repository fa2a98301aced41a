package org.atoms.analogCompiler.ir.register;

import org.atoms.analogCompiler.ir.scalar.Scalar;

/** One site of an arrangement.
 * @param x       Horizontal coordinate.
 * @param y       Vertical coordinate.
 * @param filled  True if an atom occupies the site. */
public record LocationInfo(Scalar x, Scalar y, boolean filled) {
    public static LocationInfo filled(Scalar x, Scalar y) {
        return new LocationInfo(x, y, true);
    }
}
