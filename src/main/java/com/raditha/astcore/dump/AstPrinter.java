package com.raditha.astcore.dump;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.raditha.astcore.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Renders expression trees, either as an indented outline or as XML.
 */
public class AstPrinter {

    private static final XmlMapper mapper = new XmlMapper();

    private AstPrinter() {
        /* this is only a utility class */
    }

    /**
     * One expression tree in the XML dump.
     */
    @JacksonXmlRootElement(localName = "ast")
    public record AstDTO(
            @JacksonXmlProperty(isAttribute = true) String scope,
            @JacksonXmlProperty(isAttribute = true) int fileIndex,
            @JacksonXmlProperty(isAttribute = true) int linenr,
            @JacksonXmlProperty(isAttribute = true) int column,
            @JacksonXmlProperty(localName = "token") AstTokenDTO token) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AstTokenDTO(
            @JacksonXmlProperty(isAttribute = true) String str,
            @JacksonXmlProperty(isAttribute = true) Integer varId,
            @JacksonXmlProperty(isAttribute = true) String variable,
            @JacksonXmlProperty(isAttribute = true) String function,
            @JacksonXmlProperty(isAttribute = true) String values,
            @JacksonXmlElementWrapper(useWrapping = false)
            @JacksonXmlProperty(localName = "token") List<AstTokenDTO> operands) {}

    /**
     * The tree below {@code tok} as an outline, one operator or operand per line.
     */
    public static String astStringVerbose(Token tok) {
        StringBuilder ret = new StringBuilder();
        astStringVerbose(tok, ret, 0, 0);
        return ret.toString();
    }

    private static void astStringVerbose(Token tok, StringBuilder ret, int indent1, int indent2) {
        if (tok.isExpandedMacro()) {
            ret.append('$');
        }
        ret.append(tok.str());
        if (tok.function() != null) {
            ret.append(" f:").append(id(tok.function()));
        }
        ret.append('\n');

        Token op1 = tok.astOperand1();
        Token op2 = tok.astOperand2();
        if (op1 != null) {
            int i1 = indent1;
            if (indent1 == indent2 && op2 == null) {
                i1 += 2;
            }
            indent(ret, indent1, indent2);
            ret.append(op2 != null ? "|-" : "`-");
            astStringVerbose(op1, ret, i1, indent2 + 2);
        }
        if (op2 != null) {
            int i1 = indent1;
            if (indent1 == indent2) {
                i1 += 2;
            }
            indent(ret, indent1, indent2);
            ret.append("`-");
            astStringVerbose(op2, ret, i1, indent2 + 2);
        }
    }

    private static void indent(StringBuilder str, int indent1, int indent2) {
        str.append(" ".repeat(indent1));
        for (int i = indent1; i < indent2; i += 2) {
            str.append("| ");
        }
    }

    /**
     * The tree below {@code tok} as an s-expression, for example {@code (+ a (* b c))}.
     */
    public static String astStringZ3(Token tok) {
        Token op1 = tok.astOperand1();
        if (op1 == null) {
            return tok.str();
        }
        Token op2 = tok.astOperand2();
        if (op2 == null) {
            return "(" + tok.str() + " " + astStringZ3(op1) + ")";
        }
        return "(" + tok.str() + " " + astStringZ3(op1) + " " + astStringZ3(op2) + ")";
    }

    /**
     * Outline of every expression tree whose root lies at or after {@code first}.
     */
    public static String printAst(Token first, List<String> fileNames) {
        StringBuilder out = new StringBuilder("\n\n##AST\n");
        for (Token top : roots(first)) {
            out.append('[').append(fileName(fileNames, top.fileIndex())).append(':')
                    .append(top.lineNumber()).append("]\n")
                    .append(astStringVerbose(top)).append('\n');
        }
        return out.toString();
    }

    /**
     * Every expression tree whose root lies at or after {@code first}, one {@code <ast>} element each.
     */
    public static String printAstXml(Token first) throws JsonProcessingException {
        StringBuilder out = new StringBuilder();
        for (Token top : roots(first)) {
            AstDTO dto = new AstDTO(top.scopeInfo() == null ? "" : top.scopeInfo().toString(),
                    top.fileIndex(), top.lineNumber(), top.column(), toDTO(top));
            out.append(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(dto));
        }
        return out.toString();
    }

    private static List<Token> roots(Token first) {
        List<Token> roots = new ArrayList<>();
        Set<Token> printed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Token tok = first; tok != null; tok = tok.next()) {
            if (tok.astParent() == null && tok.astOperand1() != null && printed.add(tok)) {
                roots.add(tok);
                if (tok.str().equals("(") && tok.link() != null) {
                    tok = tok.link();
                }
            }
        }
        return roots;
    }

    static AstTokenDTO toDTO(Token tok) {
        List<AstTokenDTO> operands = new ArrayList<>();
        if (tok.astOperand1() != null) {
            operands.add(toDTO(tok.astOperand1()));
        }
        if (tok.astOperand2() != null) {
            operands.add(toDTO(tok.astOperand2()));
        }
        return new AstTokenDTO(tok.str(),
                tok.varId() != 0 ? tok.varId() : null,
                tok.variable() != null ? id(tok.variable()) : null,
                tok.function() != null ? id(tok.function()) : null,
                tok.values().isEmpty() ? null : id(tok.values()),
                operands.isEmpty() ? null : operands);
    }

    static String fileName(List<String> fileNames, int fileIndex) {
        if (fileNames != null && fileIndex >= 0 && fileIndex < fileNames.size()) {
            return fileNames.get(fileIndex);
        }
        return String.valueOf(fileIndex);
    }

    /**
     * Opaque identity used in place of a memory address.
     */
    static String id(Object o) {
        return "0x" + Integer.toHexString(System.identityHashCode(o));
    }
}
