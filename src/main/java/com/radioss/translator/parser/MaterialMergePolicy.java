package com.radioss.translator.parser;

import java.util.Map;

/**
 * How a repeated material parameter is merged into the record that already holds it.
 */
public enum MaterialMergePolicy {
    LAST_VALUE_WINS {
        @Override
        public void merge(Map<String, Double> target, String key, double value) {
            target.put(key, value);
        }
    },
    FIRST_VALUE_WINS {
        @Override
        public void merge(Map<String, Double> target, String key, double value) {
            target.putIfAbsent(key, value);
        }
    };

    public abstract void merge(Map<String, Double> target, String key, double value);
}
