package com.radioss.translator.deck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completions accumulated during one assembly, in the order they were made.
 */
public class CompletionReport {
    private static final Logger log = LoggerFactory.getLogger(CompletionReport.class);

    private final List<Completion> completions = new ArrayList<>();

    public void add(CompletionKind kind, int entityId, String detail) {
        Completion completion = new Completion(kind, entityId, detail);
        completions.add(completion);
        log.info("Completed {}", completion);
    }

    public List<Completion> getCompletions() {
        return Collections.unmodifiableList(completions);
    }

    public List<Completion> ofKind(CompletionKind kind) {
        return completions.stream()
                .filter(c -> c.getKind() == kind)
                .toList();
    }

    public boolean isEmpty() {
        return completions.isEmpty();
    }

    public int size() {
        return completions.size();
    }
}
