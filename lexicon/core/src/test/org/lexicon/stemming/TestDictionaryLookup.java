package org.lexicon.stemming;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.lexicon.LexiconTestBase;
import org.lexicon.util.fsa.FSAFixtures;
import org.lexicon.util.fsa.FSAFixtures.Format;
import org.junit.Test;

public class TestDictionaryLookup extends LexiconTestBase {

    private static final String[][] ROWS = {
        {"foo", "foo", "noun"},
        {"foobar", "foo", "verb"},
        {"bars", "bar", "plural"},
        {"bars", "bar", "verb:3sg"},
        {"ab", "x", null},
        {"nieduży", "duży", "adj:neg"},
        {"żółwie", "żółw", "subst:pl"},
        {"aillent", "aller", "verb:subj"},
    };

    private static List<String> stemsAndTags(List<WordData> rows) {
        final List<String> result = new ArrayList<>();
        for (WordData wd : rows) {
            result.add(wd.getStem() + "/" + wd.getTag());
        }
        return result;
    }

    @Test
    public void testLookupWithAllEncodersAndFormats() throws IOException {
        for (EncoderType encoder : EncoderType.values()) {
            for (Format format : Format.values()) {
                final DictionaryLookup lookup =
                        new DictionaryLookup(DictionaryFixtures.build(format, DictionaryFixtures.metadata(encoder), ROWS));
                final String context = encoder + "/" + format;

                assertEquals(context, Arrays.asList("foo/noun"), stemsAndTags(lookup.lookup("foo")));
                assertEquals(context, Arrays.asList("foo/verb"), stemsAndTags(lookup.lookup("foobar")));
                assertEquals(context, Arrays.asList("bar/plural", "bar/verb:3sg"), stemsAndTags(lookup.lookup("bars")));
                assertEquals(context, Arrays.asList("x/null"), stemsAndTags(lookup.lookup("ab")));
                assertEquals(context, Arrays.asList("duży/adj:neg"), stemsAndTags(lookup.lookup("nieduży")));
                assertEquals(context, Arrays.asList("żółw/subst:pl"), stemsAndTags(lookup.lookup("żółwie")));
                assertEquals(context, Arrays.asList("aller/verb:subj"), stemsAndTags(lookup.lookup("aillent")));

                assertEquals("bars", lookup.lookup("bars").get(1).getWord().toString());
            }
        }
    }

    @Test
    public void testUnknownWords() throws IOException {
        final DictionaryLookup lookup = new DictionaryLookup(
                DictionaryFixtures.build(randomFrom(Format.values()), DictionaryFixtures.metadata(EncoderType.SUFFIX), ROWS));
        assertTrue(lookup.lookup("fo").isEmpty());
        assertTrue(lookup.lookup("foob").isEmpty());
        assertTrue(lookup.lookup("zzz").isEmpty());
        assertTrue(lookup.lookup("").isEmpty());
        assertTrue(lookup.lookup("foobarbaz").isEmpty());
    }

    @Test
    public void testSeparatorInQuery() throws IOException {
        final DictionaryLookup lookup = new DictionaryLookup(
                DictionaryFixtures.build(randomFrom(Format.values()), DictionaryFixtures.metadata(EncoderType.SUFFIX), ROWS));
        assertEquals('+', lookup.getSeparatorChar());
        assertTrue(lookup.lookup("foo+").isEmpty());
        assertTrue(lookup.lookup("foo+Afoo").isEmpty());
        assertTrue(lookup.lookup("+").isEmpty());
        assertFalse(lookup.lookup("foo").isEmpty());
    }

    @Test
    public void testSeparatorIntroducedByInputConversion() throws IOException {
        final Map<String, String> conversion = new LinkedHashMap<>();
        conversion.put("#", "+");
        final DictionaryMetadata metadata = DictionaryMetadata.builder()
                .separator('+')
                .encoding(StandardCharsets.UTF_8)
                .encoder(EncoderType.SUFFIX)
                .withInputConversionPairs(conversion)
                .build();
        final DictionaryLookup lookup = new DictionaryLookup(DictionaryFixtures.build(Format.VINT, metadata, ROWS));
        assertTrue(lookup.lookup("foo#").isEmpty());
        assertFalse(lookup.lookup("foo").isEmpty());
    }

    @Test
    public void testUnmappableInput() throws IOException {
        final DictionaryMetadata metadata = DictionaryMetadata.builder()
                .separator('+')
                .encoding(StandardCharsets.ISO_8859_1)
                .encoder(EncoderType.SUFFIX)
                .build();
        final String[][] rows = {{"café", "café", "noun"}, {"foo", "foo", "noun"}};
        final DictionaryLookup lookup = new DictionaryLookup(DictionaryFixtures.build(Format.COMPACT, metadata, rows));

        assertTrue(lookup.lookup("łódź").isEmpty());
        assertEquals(Arrays.asList("café/noun"), stemsAndTags(lookup.lookup("café")));
        // The lookup is still usable after a failed encoding.
        assertEquals(Arrays.asList("foo/noun"), stemsAndTags(lookup.lookup("foo")));
    }

    @Test
    public void testLookupIsIdempotent() throws IOException {
        final DictionaryLookup lookup = new DictionaryLookup(
                DictionaryFixtures.build(randomFrom(Format.values()), DictionaryFixtures.metadata(randomFrom(EncoderType.values())), ROWS));
        for (String[] row : ROWS) {
            final List<String> first = stemsAndTags(lookup.lookup(row[0]));
            lookup.lookup(randomFrom(ROWS)[0]);
            assertEquals(first, stemsAndTags(lookup.lookup(row[0])));
        }
    }

    @Test
    public void testManyRowsGrowPool() throws IOException {
        final int count = atLeast(20);
        final String[][] rows = new String[count][];
        for (int i = 0; i < count; i++) {
            rows[i] = new String[] {"word", "stem", String.format(Locale.ROOT, "tag%03d", i)};
        }
        final DictionaryLookup lookup = new DictionaryLookup(
                DictionaryFixtures.build(randomFrom(Format.values()), DictionaryFixtures.metadata(EncoderType.INFIX), rows));

        final List<WordData> result = lookup.lookup("word");
        assertEquals(count, result.size());
        assertTrue(lookup.formsCapacity() >= count);
        for (int i = 0; i < count; i++) {
            assertEquals("stem", result.get(i).getStem().toString());
            assertEquals(rows[i][2], result.get(i).getTag().toString());
        }
        assertThrows(UnsupportedOperationException.class, () -> result.add(result.get(0)));
    }

    @Test
    public void testConversions() throws IOException {
        final Map<String, String> input = new LinkedHashMap<>();
        input.put("fi", "ﬁ");
        final Map<String, String> output = new LinkedHashMap<>();
        output.put("ﬁ", "fi");
        final DictionaryMetadata metadata = DictionaryMetadata.builder()
                .separator('+')
                .encoding(StandardCharsets.UTF_8)
                .encoder(EncoderType.SUFFIX)
                .withInputConversionPairs(input)
                .withOutputConversionPairs(output)
                .build();
        final String[][] rows = {{"ﬁlut", "ﬁlut", "subst"}};
        final DictionaryLookup lookup = new DictionaryLookup(DictionaryFixtures.build(Format.FIXED, metadata, rows));

        final List<WordData> result = lookup.lookup("filut");
        assertEquals(1, result.size());
        assertEquals("filut", result.get(0).getWord().toString());
        assertEquals("ﬁlut", result.get(0).getStem().toString());
        assertEquals("ﬁlut", utf8ToString(result.get(0).getWordBytes(new BytesRefBuilder())));
    }

    @Test
    public void testApplyReplacements() {
        final Map<String, String> conversion = new LinkedHashMap<>();
        conversion.put("'", "`");
        conversion.put("fi", "ﬁ");
        conversion.put("\\a", "ą");
        conversion.put("Barack", "George");
        conversion.put("_", "xx");

        assertEquals("ﬁlut", DictionaryLookup.applyReplacements("filut", conversion));
        assertEquals("ﬁzdrygałką", DictionaryLookup.applyReplacements("fizdrygałk\\a", conversion));
        assertEquals("George Bush", DictionaryLookup.applyReplacements("Barack Bush", conversion));
        assertEquals("xxxxxxxx", DictionaryLookup.applyReplacements("____", conversion));
        assertEquals("it`s", DictionaryLookup.applyReplacements("it's", conversion));
        assertEquals("", DictionaryLookup.applyReplacements("", conversion));
    }

    @Test
    public void testApplyReplacementsDoesNotRescanReplacedText() {
        assertEquals("abb", DictionaryLookup.applyReplacements("ab", Collections.singletonMap("b", "bb")));
        assertEquals("aaaa", DictionaryLookup.applyReplacements("aa", Collections.singletonMap("a", "aa")));
    }

    @Test
    public void testExactMatchWithoutSeparator() throws IOException {
        final DictionaryMetadata metadata = DictionaryFixtures.metadata(EncoderType.SUFFIX);
        for (Format format : Format.values()) {
            final Dictionary dictionary = new Dictionary(
                    FSAFixtures.build(format, false, "foo", "foobar+Afoobar+t"), metadata);
            final DictionaryLookup lookup = new DictionaryLookup(dictionary);
            assertTrue(lookup.lookup("foo").isEmpty());
            assertEquals(1, lookup.lookup("foobar").size());
        }
    }

    @Test
    public void testFinalSeparatorArc() throws IOException {
        final DictionaryMetadata metadata = DictionaryFixtures.metadata(EncoderType.SUFFIX);
        for (Format format : Format.values()) {
            final DictionaryLookup onlySeparator =
                    new DictionaryLookup(new Dictionary(FSAFixtures.build(format, false, "foo+"), metadata));
            assertTrue(onlySeparator.lookup("foo").isEmpty());

            final DictionaryLookup finalAndMore =
                    new DictionaryLookup(new Dictionary(FSAFixtures.build(format, false, "foo+", "foo+A+t"), metadata));
            assertTrue(finalAndMore.lookup("foo").isEmpty());
        }
    }

    @Test
    public void testIterateDictionary() throws IOException {
        final Dictionary dictionary = DictionaryFixtures.build(
                randomFrom(Format.values()), DictionaryFixtures.metadata(randomFrom(EncoderType.values())), ROWS);
        final Set<String> expected = new HashSet<>();
        for (String[] row : ROWS) {
            expected.add(row[0] + "/" + row[1] + "/" + row[2]);
        }

        final Set<String> actual = new HashSet<>();
        for (WordData wd : new DictionaryLookup(dictionary)) {
            actual.add(wd.getWord() + "/" + wd.getStem() + "/" + wd.getTag());
        }
        assertEquals(expected, actual);
    }

    @Test
    public void testIterateEncodedStems() throws IOException {
        final DictionaryMetadata metadata = DictionaryFixtures.metadata(EncoderType.SUFFIX);
        final Dictionary dictionary = DictionaryFixtures.build(Format.VINT, metadata, new String[] {"foo", "foobar", "t"});
        final Iterator<WordData> it = new DictionaryIterator(dictionary, false);
        assertTrue(it.hasNext());
        final WordData wd = it.next();
        assertEquals("foo", wd.getWord().toString());
        assertEquals("Abar", wd.getStem().toString());
        assertEquals("t", wd.getTag().toString());
        assertFalse(it.hasNext());
    }

    @Test
    public void testIterateMissingSeparator() throws IOException {
        final Dictionary dictionary = new Dictionary(
                FSAFixtures.build(Format.FIXED, false, "foo"), DictionaryFixtures.metadata(EncoderType.SUFFIX));
        final Iterator<WordData> it = new DictionaryIterator(dictionary, true);
        assertThrows(IllegalStateException.class, it::next);
    }

    @Test
    public void testWordDataClone() throws IOException {
        final DictionaryLookup lookup = new DictionaryLookup(
                DictionaryFixtures.build(Format.VINT, DictionaryFixtures.metadata(EncoderType.PREFIX), ROWS));
        final WordData original = lookup.lookup("nieduży").get(0);
        final WordData clone = original.clone();
        lookup.lookup("foo");

        assertEquals("nieduży", clone.getWord().toString());
        assertEquals("duży", clone.getStem().toString());
        assertEquals("adj:neg", clone.getTag().toString());
        assertEquals(new BytesRef("duży"), clone.getStemBytes(new BytesRefBuilder()));
        assertEquals(new BytesRef("adj:neg"), clone.getTagBytes(new BytesRefBuilder()));
        assertEquals(new BytesRef("nieduży"), clone.getWordBytes(new BytesRefBuilder()));
        assertTrue(clone.toString(), clone.toString().contains("duży"));
    }

    @Test
    public void testWordDataNotForCollections() {
        final WordData wd = new WordData("a", "b", null, StandardCharsets.UTF_8);
        assertNull(wd.getTag());
        assertEquals("b", wd.getStem().toString());
        assertThrows(UnsupportedOperationException.class, wd::hashCode);
        assertThrows(UnsupportedOperationException.class, () -> wd.equals(wd));
    }
}
