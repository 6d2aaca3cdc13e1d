package com.radioss.translator.deck.card;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ContactCard {
    int id;
    String name;
    ContactType type;
    int secondaryNodeGroupId;
    int mainSurfaceId;
    double friction;
    double gap;
}
