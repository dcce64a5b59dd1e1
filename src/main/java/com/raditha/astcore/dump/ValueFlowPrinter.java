package com.raditha.astcore.dump;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.raditha.astcore.model.Token;
import com.raditha.astcore.util.Literals;
import com.raditha.astcore.valueflow.Value;
import com.raditha.astcore.valueflow.ValueKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the facts attached to a token sequence.
 */
public class ValueFlowPrinter {

    private static final XmlMapper mapper = new XmlMapper();

    private ValueFlowPrinter() {
        /* this is only a utility class */
    }

    @JacksonXmlRootElement(localName = "valueflow")
    public record ValueFlowDTO(
            @JacksonXmlElementWrapper(useWrapping = false)
            @JacksonXmlProperty(localName = "values") List<ValuesDTO> values) {}

    public record ValuesDTO(
            @JacksonXmlProperty(isAttribute = true) String id,
            @JacksonXmlElementWrapper(useWrapping = false)
            @JacksonXmlProperty(localName = "value") List<ValueDTO> value) {}

    /**
     * One fact. Only the attributes of its value type are present.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ValueDTO(
            @JacksonXmlProperty(isAttribute = true) String intvalue,
            @JacksonXmlProperty(isAttribute = true) String tokvalue,
            @JacksonXmlProperty(isAttribute = true) String floatvalue,
            @JacksonXmlProperty(isAttribute = true) String movedvalue,
            @JacksonXmlProperty(isAttribute = true) String uninit,
            @JacksonXmlProperty(isAttribute = true, localName = "buffer-size") String bufferSize,
            @JacksonXmlProperty(isAttribute = true, localName = "container-size") String containerSize,
            @JacksonXmlProperty(isAttribute = true, localName = "iterator-start") String iteratorStart,
            @JacksonXmlProperty(isAttribute = true, localName = "iterator-end") String iteratorEnd,
            @JacksonXmlProperty(isAttribute = true) String lifetime,
            @JacksonXmlProperty(isAttribute = true, localName = "lifetime-scope") String lifetimeScope,
            @JacksonXmlProperty(isAttribute = true, localName = "lifetime-kind") String lifetimeKind,
            @JacksonXmlProperty(isAttribute = true) String symbolic,
            @JacksonXmlProperty(isAttribute = true, localName = "symbolic-delta") String symbolicDelta,
            @JacksonXmlProperty(isAttribute = true) String bound,
            @JacksonXmlProperty(isAttribute = true, localName = "condition-line") Integer conditionLine,
            @JacksonXmlProperty(isAttribute = true) Boolean known,
            @JacksonXmlProperty(isAttribute = true) Boolean possible,
            @JacksonXmlProperty(isAttribute = true) Boolean impossible,
            @JacksonXmlProperty(isAttribute = true) Boolean inconclusive,
            @JacksonXmlProperty(isAttribute = true) String path) {}

    /**
     * Facts grouped by file and line, one token per line.
     */
    public static String printValueFlow(Token first, List<String> fileNames) {
        StringBuilder outs = new StringBuilder("\n\n##Value flow\n");
        int fileIndex = -1;
        int line = 0;
        for (Token tok = first; tok != null; tok = tok.next()) {
            List<Value> values = tok.values();
            if (values.isEmpty()) {
                continue;
            }
            if (fileIndex != tok.fileIndex()) {
                outs.append("File ").append(AstPrinter.fileName(fileNames, tok.fileIndex())).append('\n');
                line = 0;
            }
            if (line != tok.lineNumber()) {
                outs.append("Line ").append(tok.lineNumber()).append('\n');
            }
            fileIndex = tok.fileIndex();
            line = tok.lineNumber();

            ValueKind valueKind = values.get(0).getValueKind();
            boolean same = values.stream().allMatch(v -> v.getValueKind() == valueKind);
            outs.append("  ").append(tok.str()).append(' ');
            if (same) {
                outs.append(switch (valueKind) {
                    case IMPOSSIBLE, KNOWN -> "always ";
                    case INCONCLUSIVE -> "inconclusive ";
                    case POSSIBLE -> "possible ";
                });
            }
            if (values.size() > 1) {
                outs.append('{');
            }
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) {
                    outs.append(',');
                }
                outs.append(values.get(i));
            }
            outs.append(values.size() > 1 ? "}\n" : "\n");
        }
        return outs.toString();
    }

    public static String printValueFlowXml(Token first) throws JsonProcessingException {
        List<ValuesDTO> all = new ArrayList<>();
        for (Token tok = first; tok != null; tok = tok.next()) {
            List<Value> values = tok.values();
            if (values.isEmpty()) {
                continue;
            }
            List<ValueDTO> dtos = new ArrayList<>();
            for (Value value : values) {
                dtos.add(toDTO(tok, value));
            }
            all.add(new ValuesDTO(AstPrinter.id(values), dtos));
        }
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(new ValueFlowDTO(all));
    }

    static ValueDTO toDTO(Token tok, Value value) {
        String intvalue = null;
        String tokvalue = null;
        String floatvalue = null;
        String movedvalue = null;
        String uninit = null;
        String bufferSize = null;
        String containerSize = null;
        String iteratorStart = null;
        String iteratorEnd = null;
        String lifetime = null;
        String lifetimeScope = null;
        String lifetimeKind = null;
        String symbolic = null;
        String symbolicDelta = null;
        String number = String.valueOf(value.getIntValue());
        switch (value.getValueType()) {
            case INT -> intvalue = tok.isUnsigned() ? Long.toUnsignedString(value.getIntValue()) : number;
            case TOK -> tokvalue = AstPrinter.id(value.getTokValue());
            case FLOAT -> floatvalue = Literals.formatFloat(value.getFloatValue());
            case MOVED -> movedvalue = value.getMoveKind().label();
            case UNINIT -> uninit = "1";
            case BUFFER_SIZE -> bufferSize = number;
            case CONTAINER_SIZE -> containerSize = number;
            case ITERATOR_START -> iteratorStart = number;
            case ITERATOR_END -> iteratorEnd = number;
            case LIFETIME -> {
                lifetime = AstPrinter.id(value.getTokValue());
                lifetimeScope = value.getLifetimeScope().label();
                lifetimeKind = value.getLifetimeKind().label();
            }
            case SYMBOLIC -> {
                symbolic = AstPrinter.id(value.getTokValue());
                symbolicDelta = number;
            }
        }
        Integer conditionLine = value.getCondition() != null ? value.getCondition().lineNumber() : null;
        return new ValueDTO(intvalue, tokvalue, floatvalue, movedvalue, uninit, bufferSize, containerSize,
                iteratorStart, iteratorEnd, lifetime, lifetimeScope, lifetimeKind, symbolic, symbolicDelta,
                value.getBound().label(), conditionLine,
                value.isKnown() ? Boolean.TRUE : null,
                value.isPossible() ? Boolean.TRUE : null,
                value.isImpossible() ? Boolean.TRUE : null,
                value.isInconclusive() ? Boolean.TRUE : null,
                String.valueOf(value.getPath()));
    }
}
