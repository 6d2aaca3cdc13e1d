package com.radioss.translator.deck;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.radioss.translator.deck.card.BoundaryCard;
import com.radioss.translator.deck.card.BoxCard;
import com.radioss.translator.deck.card.ContactCard;
import com.radioss.translator.deck.card.FunctionCard;
import com.radioss.translator.deck.card.LoadCard;
import com.radioss.translator.deck.card.NodeGroupCard;
import com.radioss.translator.deck.card.PartCard;
import com.radioss.translator.deck.card.PropertyCard;
import com.radioss.translator.deck.card.Rbe2Card;
import com.radioss.translator.deck.card.Rbe3Card;
import com.radioss.translator.deck.card.RigidBodyCard;
import com.radioss.translator.deck.card.SensorCard;
import com.radioss.translator.deck.card.SubsetCard;
import com.radioss.translator.deck.card.SurfaceCard;
import com.radioss.translator.deck.card.TimeHistoryCard;
import com.radioss.translator.model.MaterialRecord;

import lombok.Getter;

/**
 * Every card of the starter deck with its final identifier. Built completely before anything is written,
 * so a failed assembly never produces partial output.
 */
@Getter
public class DeckPlan {
    private final Map<Integer, MaterialRecord> materials = new LinkedHashMap<>();

    /** Material id to the /FUNCT id of its hardening curve. */
    private final Map<Integer, Integer> materialFunctions = new LinkedHashMap<>();

    private final List<FunctionCard> functions = new ArrayList<>();
    private final List<NodeGroupCard> nodeGroups = new ArrayList<>();
    private final List<BoundaryCard> boundaries = new ArrayList<>();
    private final Map<Integer, PropertyCard> properties = new LinkedHashMap<>();
    private final List<SubsetCard> subsets = new ArrayList<>();
    private final List<PartCard> parts = new ArrayList<>();
    private final List<SurfaceCard> surfaces = new ArrayList<>();
    private final List<ContactCard> contacts = new ArrayList<>();
    private final List<LoadCard> loads = new ArrayList<>();
    private final List<SensorCard> sensors = new ArrayList<>();
    private final List<BoxCard> boxes = new ArrayList<>();
    private final List<RigidBodyCard> rigidBodies = new ArrayList<>();
    private final List<Rbe2Card> rbe2Elements = new ArrayList<>();
    private final List<Rbe3Card> rbe3Elements = new ArrayList<>();
    private final List<TimeHistoryCard> timeHistories = new ArrayList<>();
    private final CompletionReport completions;

    public DeckPlan(CompletionReport completions) {
        this.completions = completions;
    }
}
