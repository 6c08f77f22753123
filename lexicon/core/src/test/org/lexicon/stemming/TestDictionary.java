package org.lexicon.stemming;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.lexicon.LexiconTestBase;
import org.lexicon.util.fsa.FSAFixtures.Format;
import org.lexicon.util.fsa.VIntFSA;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestDictionary extends LexiconTestBase {

    private static final String[][] ROWS = {
        {"cats", "cat", "noun:pl"},
        {"went", "go", "verb:past"},
    };

    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    @Test
    public void testReadFromPath() throws IOException {
        final Format format = randomFrom(Format.values());
        final Path dict = DictionaryFixtures.write(
                temp.getRoot().toPath(), "english", format, DictionaryFixtures.metadata(EncoderType.SUFFIX), ROWS);
        assertTrue(Files.exists(temp.getRoot().toPath().resolve("english.info")));

        final Dictionary dictionary = Dictionary.read(dict);
        assertEquals(EncoderType.SUFFIX, dictionary.getMetadata().getSequenceEncoderType());
        final DictionaryLookup lookup = new DictionaryLookup(dictionary);
        assertEquals("cat", lookup.lookup("cats").get(0).getStem().toString());
        assertEquals("go", lookup.lookup("went").get(0).getStem().toString());
        assertEquals("verb:past", lookup.lookup("went").get(0).getTag().toString());
    }

    @Test
    public void testReadFromURL() throws IOException {
        final Path dict = DictionaryFixtures.write(
                temp.getRoot().toPath(), "english", Format.VINT, DictionaryFixtures.metadata(EncoderType.INFIX), ROWS);

        final Dictionary dictionary = Dictionary.read(dict.toUri().toURL());
        assertTrue(dictionary.getFSA() instanceof VIntFSA);
        assertEquals(EncoderType.INFIX, dictionary.getMetadata().getSequenceEncoderType());
        assertEquals("cat", new DictionaryLookup(dictionary).lookup("cats").get(0).getStem().toString());
        assertTrue(dictionary.toString(), dictionary.toString().contains("INFIX"));
    }

    @Test
    public void testMissingMetadata() throws IOException {
        final Path dict = DictionaryFixtures.write(
                temp.getRoot().toPath(), "english", Format.FIXED, DictionaryFixtures.metadata(EncoderType.NONE), ROWS);
        Files.delete(DictionaryMetadata.getExpectedMetadataLocation(dict));
        assertThrows(NoSuchFileException.class, () -> Dictionary.read(dict));
    }
}
