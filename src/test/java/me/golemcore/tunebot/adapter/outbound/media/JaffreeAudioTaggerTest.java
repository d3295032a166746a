package me.golemcore.tunebot.adapter.outbound.media;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class JaffreeAudioTaggerTest {

    private final JaffreeAudioTagger tagger = new JaffreeAudioTagger();

    @Test
    void shouldKeepExtensionAndBaseNameForScratchFile() {
        Path audio = Paths.get("/work", "One More Time abc12345.m4a");

        Path scratch = JaffreeAudioTagger.scratchFileFor(audio);

        assertEquals(Paths.get("/work", "One More Time abc12345.tagging.m4a"), scratch);
    }

    @Test
    void shouldHandleFilesWithoutExtension() {
        assertEquals(Paths.get("/work", "track.tagging.tmp"),
                JaffreeAudioTagger.scratchFileFor(Paths.get("/work", "track")));
    }

    @Test
    void shouldSupportCoverOnlyInContainersWithPictureStreams() {
        assertTrue(tagger.supportsCover("m4a"));
        assertTrue(tagger.supportsCover("MP3"));
        assertTrue(tagger.supportsCover("flac"));
        assertFalse(tagger.supportsCover("opus"));
        assertFalse(tagger.supportsCover("webm"));
        assertFalse(tagger.supportsCover(null));
    }
}
