package com.radioss.translator.exception;

import com.radioss.translator.parser.BlockKind;

/**
 * A data line could not be read into the shape its block expects.
 * Carries the block kind and the 1-based line number of the offending record.
 */
public class MalformedRecordException extends TranslationException {

    private static final long serialVersionUID = 1L;

    private final BlockKind blockKind;
    private final int lineNumber;

    public MalformedRecordException(BlockKind blockKind, int lineNumber, String detail) {
        super(blockKind + " block, line " + lineNumber + ": " + detail);
        this.blockKind = blockKind;
        this.lineNumber = lineNumber;
    }

    public MalformedRecordException(BlockKind blockKind, int lineNumber, String detail, Throwable cause) {
        super(blockKind + " block, line " + lineNumber + ": " + detail, cause);
        this.blockKind = blockKind;
        this.lineNumber = lineNumber;
    }

    public BlockKind getBlockKind() {
        return blockKind;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
