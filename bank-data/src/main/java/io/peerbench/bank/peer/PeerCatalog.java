package io.peerbench.bank.peer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Peer groups ordered by display order. The first group is the primary one that drives performance flags.
 */
public class PeerCatalog {
    private final List<PeerGroup> groups;

    public PeerCatalog(List<PeerGroup> groups) {
        if (groups.isEmpty()) throw new IllegalArgumentException("at least one peer group is required");
        List<PeerGroup> sorted = new ArrayList<>(groups);
        sorted.sort(Comparator.comparingInt(PeerGroup::displayOrder));
        Set<String> keys = new HashSet<>();
        Set<Integer> orders = new HashSet<>();
        for (PeerGroup g : sorted) {
            if (!keys.add(g.key())) throw new IllegalArgumentException("duplicate peer group key: " + g.key());
            if (!orders.add(g.displayOrder())) throw new IllegalArgumentException("duplicate display order: " + g.displayOrder());
        }
        this.groups = List.copyOf(sorted);
    }

    public static PeerCatalog defaults() {
        return new PeerCatalog(List.of(
                new PeerGroup("Core_Private_Bank", "Core Private Bank Peers", "Core PB",
                        List.of(34221, 33124, 57565), 1),
                new PeerGroup("MS_Family_Plus", "Morgan Stanley + Extended Wealth", "MS+Wealth",
                        List.of(34221, 32992, 33124, 57565, 57450, 17281), 2),
                new PeerGroup("All_Peers", "Full Peer Universe", "Full Peer Set",
                        List.of(34221, 32992, 33124, 57565, 57450, 17281, 628, 3511, 7213, 3510), 3)));
    }

    /**
     * Parses {@code KEY:Name:cert,cert,...}; groups get display orders in the order given.
     */
    public static PeerCatalog parse(List<String> definitions) {
        List<PeerGroup> out = new ArrayList<>();
        int order = 1;
        for (String definition : definitions) {
            String[] parts = definition.split(":", 3);
            if (parts.length != 3) throw new IllegalArgumentException("expected KEY:Name:cert,... but got '" + definition + "'");
            List<Integer> members = new ArrayList<>();
            for (String c : parts[2].split(",")) {
                if (!c.isBlank()) members.add(Integer.parseInt(c.trim()));
            }
            out.add(new PeerGroup(parts[0].trim(), parts[1].trim(), parts[1].trim(), members, order++));
        }
        return new PeerCatalog(out);
    }

    public List<PeerGroup> groups() {
        return groups;
    }

    public PeerGroup primary() {
        return groups.get(0);
    }

    public TreeSet<Integer> allMembers() {
        TreeSet<Integer> out = new TreeSet<>();
        groups.forEach(g -> out.addAll(g.members()));
        return out;
    }
}
