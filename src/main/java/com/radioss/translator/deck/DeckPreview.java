package com.radioss.translator.deck;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pulls a single card out of a written deck, so what is shown is exactly what was written.
 */
public final class DeckPreview {

    private DeckPreview() {
    }

    /**
     * The first card whose keyword line starts with {@code keywordPrefix}, up to the next keyword.
     * Comment lines inside the card are kept; the {@code #include} line ends it.
     */
    public static Optional<String> extract(String deck, String keywordPrefix) {
        List<String> block = new ArrayList<>();
        boolean capturing = false;
        for (String line : deck.split("\\R")) {
            if (!capturing) {
                if (line.startsWith(keywordPrefix)) {
                    capturing = true;
                    block.add(line);
                }
                continue;
            }
            if (line.startsWith("/") || line.startsWith(AssemblyWriter.INCLUDE)) {
                break;
            }
            block.add(line);
        }
        return capturing ? Optional.of(String.join("\n", block)) : Optional.empty();
    }

    /**
     * Every card whose keyword line starts with {@code keywordPrefix}, in deck order.
     */
    public static List<String> extractAll(String deck, String keywordPrefix) {
        List<String> blocks = new ArrayList<>();
        String remaining = deck;
        while (true) {
            Optional<String> block = extract(remaining, keywordPrefix);
            if (block.isEmpty()) {
                return blocks;
            }
            blocks.add(block.get());
            int at = remaining.indexOf(block.get());
            remaining = remaining.substring(at + block.get().length());
        }
    }
}
