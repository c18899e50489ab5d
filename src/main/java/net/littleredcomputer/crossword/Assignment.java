package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A mapping from slots to the words chosen for them; partial while search is under way.
 */
public class Assignment {
    private final Map<Slot, String> words = new LinkedHashMap<>();

    public Assignment() {}

    public Assignment(Map<Slot, String> words) {
        this.words.putAll(words);
    }

    public String get(Slot s) { return words.get(s); }

    public boolean contains(Slot s) { return words.containsKey(s); }

    public int size() { return words.size(); }

    public Collection<String> words() { return words.values(); }

    public ImmutableMap<Slot, String> asMap() { return ImmutableMap.copyOf(words); }

    public Assignment put(Slot s, String word) {
        words.put(s, word);
        return this;
    }

    void remove(Slot s) { words.remove(s); }

    /**
     * @return true if every slot of the crossword has a word
     */
    public boolean isComplete(Crossword crossword) {
        return crossword.slots().stream().allMatch(words::containsKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment)) return false;
        return words.equals(((Assignment) o).words);
    }

    @Override
    public int hashCode() { return Objects.hashCode(words); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        words.forEach((s, w) -> sb.append(s).append(' ').append(w).append('\n'));
        return sb.toString();
    }
}
