package com.raditha.astcore.dump;

/**
 * What {@link TokenPrinter} renders besides the token text.
 *
 * @param varid       append {@code @varId} to variables
 * @param exprid      append {@code @exprId} to expressions without a varId
 * @param idtype      prefix ids with {@code var} or {@code expr}
 * @param attributes  render signedness, {@code _Complex} and {@code long}
 * @param macro       mark tokens from macro expansions with {@code $}
 * @param linenumbers start every line with its number
 * @param linebreaks  break lines where the source did
 * @param files       emit a {@code ##file} header on every file change
 */
public record StringifyOptions(boolean varid, boolean exprid, boolean idtype, boolean attributes,
                               boolean macro, boolean linenumbers, boolean linebreaks, boolean files) {

    /**
     * Token text only.
     */
    public static StringifyOptions plain() {
        return new StringifyOptions(false, false, false, false, false, false, false, false);
    }

    public static StringifyOptions forDebug() {
        return new StringifyOptions(false, false, false, true, true, true, true, true);
    }

    public static StringifyOptions forDebugVarId() {
        return new StringifyOptions(true, false, false, true, true, true, true, true);
    }

    public static StringifyOptions forDebugExprId() {
        return new StringifyOptions(false, true, false, true, true, true, true, true);
    }

    public static StringifyOptions forPrintOut() {
        return new StringifyOptions(true, true, true, true, true, true, true, true);
    }
}
