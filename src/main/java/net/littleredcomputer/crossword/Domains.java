package net.littleredcomputer.crossword;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * For each slot, the words still considered feasible. A Domains belongs to one solving
 * session; search takes copies before committing to a value and restores them on
 * backtrack.
 */
public class Domains {
    private final Map<Slot, TreeSet<String>> domains = new LinkedHashMap<>();

    private Domains() {}

    /**
     * @return domains in which every slot of the crossword may take any word of the vocabulary
     */
    public static Domains of(Crossword crossword, Vocabulary vocabulary) {
        Domains d = new Domains();
        for (Slot s : crossword.slots()) d.domains.put(s, new TreeSet<>(vocabulary.words()));
        return d;
    }

    /**
     * @return a read-only view of the slot's current domain, in sorted order
     */
    public Set<String> get(Slot s) {
        return Collections.unmodifiableSet(domain(s));
    }

    public int size(Slot s) { return domain(s).size(); }

    public boolean isEmpty(Slot s) { return domain(s).isEmpty(); }

    public boolean anyEmpty() {
        return domains.values().stream().anyMatch(Set::isEmpty);
    }

    /**
     * @return true if any word was removed
     */
    boolean removeIf(Slot s, Predicate<String> p) {
        return domain(s).removeIf(p);
    }

    /**
     * Reduce the slot's domain to the single word being tried for it.
     */
    void restrict(Slot s, String word) {
        TreeSet<String> d = domain(s);
        d.clear();
        d.add(word);
    }

    Domains copy() {
        Domains d = new Domains();
        domains.forEach((s, ws) -> d.domains.put(s, new TreeSet<>(ws)));
        return d;
    }

    /**
     * Return every domain to its state in the given snapshot. The snapshot is not shared
     * afterward, so it may be restored again.
     */
    void restore(Domains snapshot) {
        snapshot.domains.forEach((s, ws) -> {
            TreeSet<String> d = domain(s);
            d.clear();
            d.addAll(ws);
        });
    }

    private TreeSet<String> domain(Slot s) {
        TreeSet<String> d = domains.get(s);
        if (d == null) throw new IllegalArgumentException("unknown slot: " + s);
        return d;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        domains.forEach((s, ws) -> sb.append(s).append(' ').append(ws.size()).append('\n'));
        return sb.toString();
    }
}
