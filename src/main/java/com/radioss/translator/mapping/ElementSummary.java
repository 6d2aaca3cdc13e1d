package com.radioss.translator.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import com.radioss.translator.model.Element;
import com.radioss.translator.model.MeshModel;

import lombok.Value;

/**
 * Element counts by source type code and by resolved keyword.
 */
@Value
public class ElementSummary {
    Map<Integer, Integer> typeCodeCounts;
    Map<ElementKeyword, Integer> keywordCounts;

    public static ElementSummary of(MeshModel model) {
        Map<Integer, Integer> byCode = new TreeMap<>();
        Map<ElementKeyword, Integer> byKeyword = new LinkedHashMap<>();
        for (Element element : model.getElements()) {
            byCode.merge(element.getTypeCode(), 1, Integer::sum);
            byKeyword.merge(element.getKeyword(), 1, Integer::sum);
        }
        return new ElementSummary(Collections.unmodifiableMap(byCode), Collections.unmodifiableMap(byKeyword));
    }

    public int total() {
        return keywordCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
