package com.radioss.translator.model;

import java.util.List;

import com.radioss.translator.mapping.ElementKeyword;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One element record. The target keyword is resolved once, at parse time.
 */
@Value
@Builder
public class Element {
    int id;

    /** Element routine number (e.g. 185) or the raw local type when no ET record exists. */
    int typeCode;

    /** Material attribute from the export, 0 when the record carries none. */
    int materialId;

    @Singular
    List<Integer> nodeIds;

    @NonNull
    ElementKeyword keyword;

    int sourceLine;

    public int getNodeCount() {
        return nodeIds.size();
    }
}
