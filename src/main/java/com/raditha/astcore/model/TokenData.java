package com.raditha.astcore.model;

import com.raditha.astcore.symbols.FunctionSymbol;
import com.raditha.astcore.symbols.TypeSymbol;
import com.raditha.astcore.symbols.VariableSymbol;
import com.raditha.astcore.valueflow.ValueList;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

/**
 * Payload of a token that moves as a unit when two tokens swap or when a
 * token takes over its neighbour's data.
 */
final class TokenData {
    int varId;
    int exprId;
    int fileIndex;
    int lineNumber;
    int column;
    int progressValue;
    int index;

    Token astOperand1;
    Token astOperand2;
    Token astParent;

    ScopeInfo scopeInfo;
    ValueList values;

    String originalName = "";
    String macroName = "";

    VariableSymbol variable;
    FunctionSymbol function;
    TypeSymbol type;

    List<TemplateSimplifierPointer> templateSimplifierPointers;
    EnumMap<RangeAttribute, Long> rangeAttributes;

    List<TemplateSimplifierPointer> templateSimplifierPointers() {
        if (templateSimplifierPointers == null) {
            templateSimplifierPointers = new ArrayList<>();
        }
        return templateSimplifierPointers;
    }
}
