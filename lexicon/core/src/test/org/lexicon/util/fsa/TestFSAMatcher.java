package org.lexicon.util.fsa;

import static org.junit.Assert.*;

import static org.lexicon.util.fsa.MatchResult.AUTOMATON_HAS_PREFIX;
import static org.lexicon.util.fsa.MatchResult.EXACT_MATCH;
import static org.lexicon.util.fsa.MatchResult.NO_MATCH;
import static org.lexicon.util.fsa.MatchResult.SEQUENCE_IS_A_PREFIX;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.lucene.util.BytesRef;
import org.lexicon.LexiconTestBase;
import org.lexicon.util.fsa.FSAFixtures.Format;
import org.junit.Test;

public class TestFSAMatcher extends LexiconTestBase {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] toArray(BytesRef ref) {
        return Arrays.copyOfRange(ref.bytes, ref.offset, ref.offset + ref.length);
    }

    @Test
    public void testMatchKinds() throws IOException {
        for (Format format : Format.values()) {
            final FSA fsa = FSAFixtures.build(format, false, "abc", "abd", "x");
            final FSAMatcher matcher = new FSAMatcher(fsa);

            MatchResult m = matcher.match(bytes("abc"));
            assertEquals(EXACT_MATCH, m.kind);
            assertEquals(2, m.index);

            m = matcher.match(bytes("ab"));
            assertEquals(SEQUENCE_IS_A_PREFIX, m.kind);
            assertEquals(2, fsa.getArcCount(m.node));

            m = matcher.match(bytes("abcx"));
            assertEquals(AUTOMATON_HAS_PREFIX, m.kind);
            assertEquals(3, m.index);

            m = matcher.match(bytes("abx"));
            assertEquals(AUTOMATON_HAS_PREFIX, m.kind);
            assertEquals(2, m.index);

            m = matcher.match(bytes("y"));
            assertEquals(NO_MATCH, m.kind);
            assertEquals(0, m.index);

            m = matcher.match(bytes("abc"), 0);
            assertEquals(NO_MATCH, m.kind);
        }
    }

    @Test
    public void testMatchWithOffsetAndReuse() throws IOException {
        final FSA fsa = FSAFixtures.build(randomFrom(Format.values()), false, "abc", "bcd");
        final FSAMatcher matcher = new FSAMatcher(fsa);
        final MatchResult reuse = new MatchResult();
        final byte[] input = bytes("__bcd__");

        assertSame(reuse, matcher.match(reuse, input, 2, 3, fsa.getRootNode()));
        assertEquals(EXACT_MATCH, reuse.kind);
        assertEquals(4, reuse.index);

        matcher.match(reuse, input, 2, 2, fsa.getRootNode());
        assertEquals(SEQUENCE_IS_A_PREFIX, reuse.kind);

        matcher.match(reuse, input, 1, 3, fsa.getRootNode());
        assertEquals(NO_MATCH, reuse.kind);
        assertEquals(1, reuse.index);
    }

    @Test
    public void testMatchIsTotal() throws IOException {
        final List<BytesRef> input = randomSequences(atLeast(50), 8);
        final Set<BytesRef> stored = new HashSet<>(input);
        for (Format format : Format.values()) {
            final FSA fsa = FSAFixtures.build(format, randomBoolean(), input);
            final FSAMatcher matcher = new FSAMatcher(fsa);

            for (BytesRef seq : input) {
                final byte[] s = toArray(seq);
                final MatchResult exact = matcher.match(s);
                assertEquals(EXACT_MATCH, exact.kind);
                assertEquals(s.length - 1, exact.index);

                for (int len = 1; len < s.length; len++) {
                    final MatchResult prefix = matcher.match(s, 0, len, fsa.getRootNode());
                    if (stored.contains(new BytesRef(s, 0, len))) {
                        assertEquals(EXACT_MATCH, prefix.kind);
                    } else {
                        assertEquals(SEQUENCE_IS_A_PREFIX, prefix.kind);
                    }
                }

                // 'z' is outside the alphabet of stored sequences.
                final byte[] extended = Arrays.copyOf(s, s.length + 1);
                extended[s.length] = 'z';
                final MatchResult longer = matcher.match(extended);
                assertEquals(AUTOMATON_HAS_PREFIX, longer.kind);
                assertEquals(s.length, longer.index);
            }

            assertEquals(NO_MATCH, matcher.match(bytes("zzz")).kind);
        }
    }

    @Test
    public void testPerfectHashIsDenseRank() throws IOException {
        final List<BytesRef> input = randomSequences(atLeast(50), 10);
        for (Format format : Format.values()) {
            final FSA fsa = FSAFixtures.build(format, true, input);
            final FSAMatcher matcher = new FSAMatcher(fsa);
            for (int i = 0; i < input.size(); i++) {
                assertEquals(i, matcher.perfectHash(toArray(input.get(i))));
            }
        }
    }

    @Test
    public void testPerfectHashOfMissingSequences() throws IOException {
        for (Format format : Format.values()) {
            final FSA fsa = FSAFixtures.build(format, true, "abc", "abd", "b");
            final FSAMatcher matcher = new FSAMatcher(fsa);
            assertEquals(0, matcher.perfectHash(bytes("abc")));
            assertEquals(1, matcher.perfectHash(bytes("abd")));
            assertEquals(2, matcher.perfectHash(bytes("b")));

            assertEquals(SEQUENCE_IS_A_PREFIX, matcher.perfectHash(bytes("ab")));
            assertEquals(AUTOMATON_HAS_PREFIX, matcher.perfectHash(bytes("bx")));
            assertEquals(AUTOMATON_HAS_PREFIX, matcher.perfectHash(bytes("abx")));
            assertEquals(NO_MATCH, matcher.perfectHash(bytes("x")));

            assertEquals(SEQUENCE_IS_A_PREFIX, matcher.perfectHash(new byte[0]));
            assertEquals(SEQUENCE_IS_A_PREFIX, matcher.match(new byte[0]).kind);
        }
    }

    @Test
    public void testPerfectHashWithStoredPrefixes() throws IOException {
        final FSA fsa = FSAFixtures.build(Format.VINT, true, "a", "ab", "abc", "b");
        final FSAMatcher matcher = new FSAMatcher(fsa);
        assertEquals(0, matcher.perfectHash(bytes("a")));
        assertEquals(1, matcher.perfectHash(bytes("ab")));
        assertEquals(2, matcher.perfectHash(bytes("abc")));
        assertEquals(3, matcher.perfectHash(bytes("b")));
    }
}
