package com.radioss.translator.parser;

import com.radioss.translator.mapping.ElementTypeTable;

import lombok.Builder;
import lombok.Value;

/**
 * Parsing policies. Both are explicit so callers can see and swap them.
 */
@Value
@Builder(toBuilder = true)
public class ParserOptions {

    @Builder.Default
    MaterialMergePolicy materialMergePolicy = MaterialMergePolicy.LAST_VALUE_WINS;

    @Builder.Default
    ElementTypeTable typeTable = ElementTypeTable.standard();

    public static ParserOptions defaults() {
        return ParserOptions.builder().build();
    }
}
