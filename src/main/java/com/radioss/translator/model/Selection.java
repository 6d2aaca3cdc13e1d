package com.radioss.translator.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.Getter;
import lombok.ToString;

/**
 * Named node or element group carried over from a CMBLOCK.
 * Membership may be declared across several blocks of the same name, so members accumulate.
 */
@Getter
@ToString(exclude = "members")
public class Selection {

    private final String name;
    private final SelectionKind kind;
    private final int sourceLine;
    private final Set<Integer> members = new LinkedHashSet<>();

    public Selection(String name, SelectionKind kind, int sourceLine) {
        this.name = name;
        this.kind = kind;
        this.sourceLine = sourceLine;
    }

    public void addMember(int id) {
        members.add(id);
    }

    public void addMembers(Collection<Integer> ids) {
        members.addAll(ids);
    }

    public Set<Integer> getMembers() {
        return Collections.unmodifiableSet(members);
    }

    public int size() {
        return members.size();
    }

    /**
     * Numeric names keep their value as the Radioss identifier.
     */
    public boolean hasNumericName() {
        return !name.isEmpty() && name.length() < 10
                && name.chars().allMatch(Character::isDigit)
                && Integer.parseInt(name) > 0;
    }

    public int numericName() {
        return Integer.parseInt(name);
    }
}
