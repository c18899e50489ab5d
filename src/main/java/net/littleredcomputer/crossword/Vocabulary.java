package net.littleredcomputer.crossword;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.io.CharStreams;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.Iterator;

/**
 * The words available for filling slots. Words are upper-cased and kept sorted, so
 * iteration order is stable from run to run.
 */
public class Vocabulary implements Iterable<String> {
    private static final Splitter lineSplitter = Splitter.onPattern("\r?\n").trimResults().omitEmptyStrings();
    private final ImmutableSortedSet<String> words;

    private Vocabulary(ImmutableSortedSet<String> words) {
        this.words = words;
    }

    public static Vocabulary of(Iterable<String> words) {
        ImmutableSortedSet.Builder<String> b = ImmutableSortedSet.naturalOrder();
        for (String w : words) {
            String u = w.trim().toUpperCase();
            if (!u.isEmpty()) b.add(u);
        }
        return new Vocabulary(b.build());
    }

    public static Vocabulary parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * @param r newline-delimited word list; blank lines are skipped
     * @return the vocabulary
     */
    public static Vocabulary parseFrom(Reader r) {
        try (Reader in = r) {
            return of(lineSplitter.split(CharStreams.toString(in)));
        } catch (IOException e) {
            throw new IllegalArgumentException("Parse error", e);
        }
    }

    public ImmutableSortedSet<String> words() { return words; }

    public int size() { return words.size(); }

    public boolean contains(String word) { return words.contains(word); }

    @Override
    public Iterator<String> iterator() { return words.iterator(); }
}
