package com.spreadsheet.engine.models;

import java.util.Objects;

/**
 * What a formula reads: either a single cell or a rectangular range.
 * Ranges are kept as their two corners and only expanded when a traversal needs the members.
 */
public final class Reference {

    public enum Kind {
        SINGLE,
        RANGE
    }

    private final Kind kind;
    private final CellRange range;

    private Reference(Kind kind, CellRange range) {
        this.kind = kind;
        this.range = range;
    }

    public static Reference single(Address address) {
        return new Reference(Kind.SINGLE, new CellRange(address, address));
    }

    public static Reference range(CellRange range) {
        return new Reference(Kind.RANGE, range);
    }

    public static Reference range(Address topLeft, Address bottomRight) {
        return range(new CellRange(topLeft, bottomRight));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSingle() {
        return kind == Kind.SINGLE;
    }

    /**
     * The referenced cell of a SINGLE reference, or the top-left corner of a RANGE.
     */
    public Address getAddress() {
        return range.getTopLeft();
    }

    public CellRange getRange() {
        return range;
    }

    public boolean covers(Address address) {
        return range.contains(address);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Reference)) {
            return false;
        }
        Reference other = (Reference) o;
        return kind == other.kind && range.equals(other.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, range);
    }

    /**
     * Formula text for this reference: "B2" or "A1:C3".
     */
    @Override
    public String toString() {
        return isSingle() ? range.getTopLeft().toString() : range.toString();
    }
}
