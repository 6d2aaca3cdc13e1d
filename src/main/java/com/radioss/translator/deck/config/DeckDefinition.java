package com.radioss.translator.deck.config;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * Cards requested on top of what the export carries.
 * A key left empty in YAML reads as an empty list.
 *
 * <pre>{@code
 * units: SI
 * materials:
 *   - id: 5
 *     law: LAW2
 *     failure: { model: JOHNSON }
 * parts:
 *   - name: wheel
 *     selection: wheel
 *     material: 5
 * boundaryConditions:
 *   - name: clamp
 *     selection: base
 * rigidBodies:
 *   - name: hub
 *     mainNode: 1
 *     selection: hub_nodes
 * timeHistories:
 *   - name: tip
 *     nodes: [12]
 * }</pre>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeckDefinition {

    private String units;
    private ControlSettings control;

    @Singular
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<MaterialDefinition> materials = new ArrayList<>();
    @Singular
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<PropertyDefinition> properties = new ArrayList<>();
    @Singular
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<PartDefinition> parts = new ArrayList<>();
    @Singular
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<BoundaryConditionDefinition> boundaryConditions = new ArrayList<>();
    @Singular
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<ContactDefinition> contacts = new ArrayList<>();
    @Singular
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<LoadDefinition> loads = new ArrayList<>();
    @Singular
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<SensorDefinition> sensors = new ArrayList<>();
    @Singular("box")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<BoxDefinition> boxes = new ArrayList<>();
    @Singular("rigidBody")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<RigidBodyDefinition> rigidBodies = new ArrayList<>();
    @Singular("rbe2Element")
    @JsonProperty("rbe2")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Rbe2Definition> rbe2Elements = new ArrayList<>();
    @Singular("rbe3Element")
    @JsonProperty("rbe3")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Rbe3Definition> rbe3Elements = new ArrayList<>();
    @Singular("timeHistory")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<TimeHistoryDefinition> timeHistories = new ArrayList<>();

    public static DeckDefinition empty() {
        return new DeckDefinition();
    }
}
