package org.atoms.util;

/** An object with a numeric identity, used for debugging output. */
public interface IHasId {
    long getId();
}
