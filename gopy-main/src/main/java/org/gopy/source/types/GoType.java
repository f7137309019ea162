package org.gopy.source.types;

/**
 * A resolved Go type. Categories mirror the type checker's: basic, pointer, slice, array, map,
 * channel, signature, interface, struct, named and tuple (multiple results).
 */
public sealed interface GoType
        permits BasicType, PointerType, SliceType, ArrayType, MapType, ChanType,
                SignatureType, InterfaceType, StructType, NamedType, TupleType {

    /**
     * The type this type is defined over; only named types differ from themselves.
     */
    default GoType underlying() {
        return this;
    }
}
