package com.raditha.astcore.dump;

import com.raditha.astcore.model.Token;
import com.raditha.astcore.model.TokenKind;
import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders tokens and token ranges as text for debugging and test expectations.
 */
public class TokenPrinter {

    private TokenPrinter() {
        /* this is only a utility class */
    }

    public static String stringify(Token tok, StringifyOptions options) {
        StringBuilder ret = new StringBuilder();
        if (options.attributes()) {
            if (tok.isUnsigned()) {
                ret.append("unsigned ");
            } else if (tok.isSigned()) {
                ret.append("signed ");
            }
            if (tok.isComplex()) {
                ret.append("_Complex ");
            }
            if (tok.isLong() && tok.kind() != TokenKind.STRING && tok.kind() != TokenKind.CHAR) {
                ret.append("long ");
            }
        }
        if (options.macro() && tok.isExpandedMacro()) {
            ret.append('$');
        }
        String str = tok.str();
        if (tok.isName() && str.indexOf(' ') >= 0) {
            ret.append(str.replace(" ", ""));
        } else if (str.startsWith("\"") && str.indexOf('\0') >= 0) {
            ret.append(str.replace("\0", "\\0"));
        } else {
            ret.append(str);
        }
        if (options.varid() && tok.varId() != 0) {
            ret.append('@').append(options.idtype() ? "var" : "").append(tok.varId());
        } else if (options.exprid() && tok.exprId() != 0) {
            ret.append('@').append(options.idtype() ? "expr" : "");
            if (tok.isUniqueExprId()) {
                ret.append("UNIQUE");
            } else {
                ret.append(tok.exprId());
            }
        }
        return ret.toString();
    }

    /**
     * Render the tokens from {@code first} up to, not including, {@code end}.
     *
     * @param fileNames names for the {@code ##file} headers; indexes are printed when absent
     */
    public static String stringifyList(Token first, StringifyOptions options, @Nullable List<String> fileNames,
                                       @Nullable Token end) {
        if (first == end) {
            return "";
        }
        StringBuilder ret = new StringBuilder();
        int lineNumber = first.lineNumber() - (options.linenumbers() ? 1 : 0);
        int fileIndex = options.files() ? -1 : first.fileIndex();
        Map<Integer, Integer> lineNumbers = new HashMap<>();

        for (Token tok = first; tok != null && tok != end; tok = tok.next()) {
            boolean fileChange = false;
            if (tok.fileIndex() != fileIndex) {
                if (fileIndex != -1) {
                    lineNumbers.put(fileIndex, tok.fileIndex());
                }
                fileIndex = tok.fileIndex();
                if (options.files()) {
                    ret.append("\n\n##file ");
                    if (fileNames != null && fileIndex >= 0 && fileIndex < fileNames.size()) {
                        ret.append(fileNames.get(fileIndex));
                    } else {
                        ret.append(fileIndex);
                    }
                    ret.append('\n');
                }
                lineNumber = lineNumbers.getOrDefault(fileIndex, 0);
                fileChange = true;
            }

            if (options.linebreaks() && (lineNumber != tok.lineNumber() || fileChange)) {
                if (lineNumber + 4 < tok.lineNumber() && fileIndex == tok.fileIndex()) {
                    ret.append('\n').append(lineNumber + 1).append(":\n|\n")
                            .append(tok.lineNumber() - 1).append(":\n")
                            .append(tok.lineNumber()).append(": ");
                } else if (tok == first && options.linenumbers()) {
                    ret.append(tok.lineNumber()).append(": ");
                } else if (lineNumber > tok.lineNumber()) {
                    lineNumber = tok.lineNumber();
                    ret.append('\n');
                    if (options.linenumbers()) {
                        ret.append(lineNumber).append(": ");
                    }
                } else {
                    while (lineNumber < tok.lineNumber()) {
                        ++lineNumber;
                        ret.append('\n');
                        if (options.linenumbers()) {
                            ret.append(lineNumber).append(':');
                            if (lineNumber == tok.lineNumber()) {
                                ret.append(' ');
                            }
                        }
                    }
                }
                lineNumber = tok.lineNumber();
            }

            ret.append(stringify(tok, options));
            Token next = tok.next();
            if (next != end && next != null && (!options.linebreaks()
                    || (next.lineNumber() == tok.lineNumber() && next.fileIndex() == tok.fileIndex()))) {
                ret.append(' ');
            }
        }
        if (options.linebreaks() && (options.files() || options.linenumbers())) {
            ret.append('\n');
        }
        return ret.toString();
    }

    /**
     * Full listing of the sequence from {@code first}, optionally under a title.
     */
    public static String printOut(Token first, @Nullable String title, @Nullable List<String> fileNames) {
        StringBuilder out = new StringBuilder();
        if (title != null && !title.isEmpty()) {
            out.append("\n### ").append(title).append(" ###\n");
        }
        out.append(stringifyList(first, StringifyOptions.forPrintOut(), fileNames, null)).append('\n');
        return out.toString();
    }

    /**
     * The next {@code lines} source lines starting at {@code first}.
     */
    public static String printLines(Token first, int lines) {
        Token end = first;
        while (end != null && end.lineNumber() < lines + first.lineNumber()) {
            end = end.next();
        }
        return stringifyList(first, StringifyOptions.forDebugExprId(), null, end) + "\n";
    }
}
