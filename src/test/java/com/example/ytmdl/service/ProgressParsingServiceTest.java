package com.example.ytmdl.service;

import com.example.ytmdl.utils.model.DownloadStage;
import com.example.ytmdl.utils.model.JobMetadata;
import com.example.ytmdl.utils.model.Progress;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProgressParsingServiceTest {
    private final ProgressParsingService parser = new ProgressParsingService();

    @Test
    void downloadPercentage() {
        Progress progress = parser.parse("[download]  45.2% of 3.45MiB at 1.23MiB/s ETA 00:02").orElseThrow();

        assertEquals(DownloadStage.DOWNLOADING_AUDIO, progress.getStage());
        assertEquals(45.2f, progress.getPercentage());
    }

    @Test
    void ansiColoursAreStripped() {
        Progress progress = parser.parse("\u001b[0;94m[download]\u001b[0m 100% of 3.45MiB in 00:15").orElseThrow();

        assertEquals(100f, progress.getPercentage());
        assertEquals("[download] 100% of 3.45MiB in 00:15", progress.getCurrentStep());
    }

    @Test
    void stepCounters() {
        Progress step = parser.parse("Step 2 of 3: Remuxing file").orElseThrow();
        assertEquals(2, step.getCurrentStepIndex());
        assertEquals(3, step.getTotalSteps());
        assertEquals(66.67f, step.getPercentage());
        assertEquals(DownloadStage.REMUXING, step.getStage());

        Progress bracket = parser.parse("[1/4] Fetching metadata").orElseThrow();
        assertEquals(25f, bracket.getPercentage());
        assertEquals(DownloadStage.FETCHING_METADATA, bracket.getStage());
    }

    @Test
    void stepCounterPastTotalStaysWithinHundredPercent() {
        Progress progress = parser.parse("[7/5] Downloading").orElseThrow();

        assertEquals(100f, progress.getPercentage());
        assertEquals(7, progress.getCurrentStepIndex());
    }

    @Test
    void stageIndicators() {
        assertStage("Initializing gytmdl", DownloadStage.INITIALIZING);
        assertStage("Extracting video data", DownloadStage.FETCHING_METADATA);
        assertStage("[download] Destination: song.m4a", DownloadStage.DOWNLOADING_AUDIO);
        assertStage("Merging formats into output", DownloadStage.REMUXING);
        assertStage("Writing tags to file", DownloadStage.APPLYING_TAGS);
        assertStage("Done", DownloadStage.FINALIZING);
    }

    @Test
    void keywordFallback() {
        assertStage("getting audio stream", DownloadStage.DOWNLOADING_AUDIO);
        assertStage("cover tag embedded", DownloadStage.APPLYING_TAGS);
    }

    @Test
    void unrelatedAndBlankLinesYieldNothing() {
        assertEquals(Optional.empty(), parser.parse("   "));
        assertEquals(Optional.empty(), parser.parse(null));
        assertEquals(Optional.empty(), parser.parse("[youtube] aaaaaaaaaaa: Requesting player"));
    }

    @Test
    void errorLines() {
        assertTrue(parser.isErrorLine("ERROR: [youtube] Video unavailable"));
        assertTrue(parser.isErrorLine("Traceback (most recent call last):"));
        assertTrue(parser.isErrorLine("fatal: cannot continue"));
        assertFalse(parser.isErrorLine("[download] 10% of 1.00MiB"));
    }

    @Test
    void completionLines() {
        assertTrue(parser.isCompletionLine("Download completed"));
        assertTrue(parser.isCompletionLine("[download] 100% of 3.45MiB"));
        assertFalse(parser.isCompletionLine("[download] 99% of 3.45MiB"));
    }

    @Test
    void metadataLines() {
        JobMetadata metadata = new JobMetadata();

        assertTrue(parser.collectMetadata("[gytmdl] Title: Never Gonna Give You Up", metadata));
        assertTrue(parser.collectMetadata("[gytmdl] Album: Whenever You Need Somebody", metadata));
        assertFalse(parser.collectMetadata("[gytmdl] Downloading track", metadata));

        assertEquals("Never Gonna Give You Up", metadata.getTitle());
        assertEquals("Whenever You Need Somebody", metadata.getAlbum());
        assertNull(metadata.getArtist());
    }

    private void assertStage(String line, DownloadStage expected) {
        assertEquals(expected, parser.parse(line).map(Progress::getStage).orElse(null), line);
    }
}
