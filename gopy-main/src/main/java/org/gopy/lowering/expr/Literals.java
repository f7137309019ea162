package org.gopy.lowering.expr;

import org.gopy.LoweringException;
import org.gopy.source.ast.BasicLit;
import org.gopy.target.Py;
import org.gopy.target.PyExpr;

/**
 * Go literal spellings to Python ones.
 */
final class Literals {

    private Literals() {
    }

    static PyExpr lower(BasicLit lit) {
        String text = lit.value();
        switch (lit.kind()) {
            case INT:
                return Py.num(intLiteral(text));
            case FLOAT:
                return floatLiteral(text);
            case IMAG:
                return imagLiteral(text);
            case CHAR:
                return Py.num(runeValue(lit));
            case STRING:
                return Py.str(stringLiteral(text));
            default:
                throw new LoweringException("unknown literal kind " + lit.kind(), lit.describe(), lit.position());
        }
    }

    /**
     * Legacy octal {@code 0755} becomes {@code 0o755}; digit separators are dropped.
     */
    static String intLiteral(String text) {
        String digits = text.replace("_", "");
        if (digits.length() > 1 && digits.charAt(0) == '0' && Character.isDigit(digits.charAt(1))) {
            return "0o" + digits.substring(1);
        }
        return digits;
    }

    static PyExpr floatLiteral(String text) {
        String digits = text.replace("_", "");
        if (isPrefixed(digits)) {
            return Py.call(Py.attr(Py.name("float"), "fromhex"), Py.str("'" + digits + "'"));
        }
        return Py.num(digits);
    }

    static PyExpr imagLiteral(String text) {
        String digits = text.replace("_", "");
        digits = digits.substring(0, digits.length() - 1);
        if (isPrefixed(digits)) {
            PyExpr imag = digits.contains("p") || digits.contains("P")
                    ? floatLiteral(digits)
                    : Py.num(digits);
            return Py.call(Py.name("complex"), Py.num(0), imag);
        }
        return Py.num(digits + "j");
    }

    private static boolean isPrefixed(String digits) {
        if (digits.length() < 2 || digits.charAt(0) != '0') {
            return false;
        }
        char base = Character.toLowerCase(digits.charAt(1));
        return base == 'x' || base == 'b' || base == 'o';
    }

    /**
     * The code point of a rune literal, as a decimal string.
     */
    static String runeValue(BasicLit lit) {
        String text = lit.value();
        if (text.length() < 3 || text.charAt(0) != '\'' || text.charAt(text.length() - 1) != '\'') {
            throw new LoweringException("malformed rune literal " + text, lit.describe(), lit.position());
        }
        String body = text.substring(1, text.length() - 1);
        if (body.charAt(0) != '\\') {
            return Integer.toString(body.codePointAt(0));
        }
        char escape = body.charAt(1);
        switch (escape) {
            case 'a':
                return "7";
            case 'b':
                return "8";
            case 'f':
                return "12";
            case 'n':
                return "10";
            case 'r':
                return "13";
            case 't':
                return "9";
            case 'v':
                return "11";
            case '\\':
                return "92";
            case '\'':
                return "39";
            case '"':
                return "34";
            case 'x':
            case 'u':
            case 'U':
                return Integer.toString(Integer.parseInt(body.substring(2), 16));
            default:
                if (escape >= '0' && escape <= '7') {
                    return Integer.toString(Integer.parseInt(body.substring(1), 8));
                }
                throw new LoweringException("unknown escape in rune literal " + text, lit.describe(), lit.position());
        }
    }

    /**
     * Interpreted strings share Python's escape syntax and pass through; raw strings are
     * re-quoted with their backslashes, quotes and newlines escaped.
     */
    static String stringLiteral(String text) {
        if (!text.startsWith("`")) {
            return text;
        }
        String raw = text.substring(1, text.length() - 1).replace("\r", "");
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
