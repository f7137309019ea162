package org.gopy.lowering;

import java.util.List;

import org.gopy.LoweringException;
import org.gopy.source.ast.Position;
import org.gopy.source.types.ArrayType;
import org.gopy.source.types.BasicType;
import org.gopy.source.types.ChanType;
import org.gopy.source.types.GoType;
import org.gopy.source.types.InterfaceType;
import org.gopy.source.types.MapType;
import org.gopy.source.types.NamedType;
import org.gopy.source.types.PointerType;
import org.gopy.source.types.SignatureType;
import org.gopy.source.types.SliceType;
import org.gopy.source.types.StructType;
import org.gopy.target.Py;
import org.gopy.target.PyComprehension;
import org.gopy.target.PyConstant;
import org.gopy.target.PyExpr;
import org.gopy.target.PyListComp;
import org.gopy.target.PyNum;
import org.gopy.target.PyStr;

/**
 * Python expressions for Go zero values. Depends on the type alone, so the same type always
 * yields a structurally equal expression.
 */
public final class ZeroValues {

    private ZeroValues() {
    }

    public static PyExpr of(GoType type) {
        if (type instanceof BasicType basic) {
            return basicZero(basic);
        }
        if (type instanceof NamedType named) {
            GoType underlying = named.underlying();
            if (underlying instanceof StructType || underlying instanceof BasicType
                    || underlying instanceof SliceType || underlying instanceof ArrayType) {
                return Py.call(Py.name(NamingScope.sanitize(named.name())));
            }
            return of(underlying);
        }
        if (type instanceof ArrayType array) {
            return new PyListComp(of(array.elem()),
                    List.of(new PyComprehension(Py.DISCARD, Py.call(Py.RANGE, Py.num(array.length())))));
        }
        if (type instanceof PointerType || type instanceof SliceType || type instanceof MapType
                || type instanceof SignatureType || type instanceof InterfaceType
                || type instanceof StructType || type instanceof ChanType) {
            return PyConstant.NONE;
        }
        throw unknown(type);
    }

    /**
     * True when the zero value builds a new object each time it is evaluated, so it cannot be
     * shared as a parameter default.
     */
    public static boolean isFresh(PyExpr zero) {
        return !(zero instanceof PyNum || zero instanceof PyStr || zero instanceof PyConstant);
    }

    private static PyExpr basicZero(BasicType basic) {
        if (basic.isBoolean()) {
            return PyConstant.FALSE;
        }
        if (basic.isString()) {
            return Py.str("\"\"");
        }
        if (basic.isInteger()) {
            return Py.num(0);
        }
        if (basic.isFloat() || basic.isComplex()) {
            return Py.num("0.0");
        }
        throw unknown(basic);
    }

    private static LoweringException unknown(GoType type) {
        return new LoweringException("unknown zero value for type " + type,
                type == null ? "null" : type.getClass().getSimpleName(), Position.UNKNOWN);
    }
}
