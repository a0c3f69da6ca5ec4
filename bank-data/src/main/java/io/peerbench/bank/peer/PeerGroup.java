package io.peerbench.bank.peer;

import io.peerbench.bank.model.InstitutionIds;

import java.util.List;

/**
 * A named set of comparable institutions. Its composite takes id {@code 90000 + displayOrder}.
 */
public record PeerGroup(String key, String name, String shortName, List<Integer> members, int displayOrder) {
    public PeerGroup {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("peer group key is blank");
        if (displayOrder <= 0) throw new IllegalArgumentException("display order must be positive: " + displayOrder);
        members.forEach(InstitutionIds::requireReal);
        members = List.copyOf(members);
    }

    public int compositeId() {
        return InstitutionIds.compositeId(displayOrder);
    }

    public String compositeName() {
        return "AVG: " + name;
    }

    public boolean contains(int cert) {
        return members.contains(cert);
    }
}
