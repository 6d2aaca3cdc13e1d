package com.radioss.translator.deck.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Loads a {@link DeckDefinition} from YAML.
 *
 * Unlike tool settings, a deck definition describes cards the user asked for,
 * so a missing or unreadable file is an error rather than a reason to fall back to defaults.
 */
public class DeckDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(DeckDefinitionLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    private DeckDefinitionLoader() {
    }

    public static DeckDefinition load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Deck definition not found: " + path);
        }
        log.debug("Loading deck definition from: {}", path);
        DeckDefinition definition = parse(Files.readString(path));
        log.info("Loaded deck definition from: {} ({} materials, {} parts, {} boundary conditions, {} contacts, {} loads)",
                path, definition.getMaterials().size(), definition.getParts().size(),
                definition.getBoundaryConditions().size(), definition.getContacts().size(),
                definition.getLoads().size());
        return definition;
    }

    public static DeckDefinition parse(String yaml) throws IOException {
        if (yaml.isBlank()) {
            return DeckDefinition.empty();
        }
        DeckDefinition definition = YAML_MAPPER.readValue(yaml, DeckDefinition.class);
        return definition != null ? definition : DeckDefinition.empty();
    }
}
