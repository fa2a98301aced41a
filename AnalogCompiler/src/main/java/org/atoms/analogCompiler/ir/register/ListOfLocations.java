package org.atoms.analogCompiler.ir.register;

import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;
import org.atoms.util.Linq;

import java.util.ArrayList;
import java.util.List;

/** Sites given explicitly by their coordinates. */
public final class ListOfLocations extends AtomArrangement {
    public final List<LocationInfo> locations;

    public ListOfLocations(List<LocationInfo> locations) {
        this.locations = List.copyOf(locations);
    }

    public ListOfLocations() {
        this(new ArrayList<>());
    }

    /** A new arrangement with one more filled site. */
    public ListOfLocations addPosition(Scalar x, Scalar y) {
        return this.addPosition(x, y, true);
    }

    public ListOfLocations addPosition(Scalar x, Scalar y, boolean filled) {
        List<LocationInfo> result = new ArrayList<>(this.locations);
        result.add(new LocationInfo(x, y, filled));
        return new ListOfLocations(result);
    }

    @Override
    public List<LocationInfo> enumerate() {
        return this.locations;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("ListOfLocations([")
                .joinS(", ", Linq.map(this.locations,
                        l -> "(" + l.x() + ", " + l.y() + (l.filled() ? "" : ", vacant") + ")"))
                .append("])");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListOfLocations that)) return false;
        return this.locations.equals(that.locations);
    }

    @Override
    public int hashCode() {
        return this.locations.hashCode();
    }
}
