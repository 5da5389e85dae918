package work.pollochang.thumbnail.image;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.awt.*;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static work.pollochang.thumbnail.image.TestImages.createTestImage;
import static work.pollochang.thumbnail.image.TestImages.writeImage;

class ExecuteTest {

    @Test
    void testRun_ShouldCreateThumbnailsAndReport(@TempDir Path tempDir) throws IOException {
        Path inputDir = Files.createDirectories(tempDir.resolve("producer"));
        Path outputDir = tempDir.resolve("consumer");
        Path reportFile = tempDir.resolve("summary.json");
        writeImage(inputDir.resolve("photo.png"), createTestImage(640, 480, Color.BLUE), "png");

        int exitCode = new CommandLine(new Execute()).execute(
                "-i", inputDir.toString(),
                "-o", outputDir.toString(),
                "--width", "64",
                "--height", "64",
                "-r", reportFile.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.exists(outputDir.resolve("photo-thumbnail.jpg")));
        assertTrue(Files.exists(reportFile));
    }

    @Test
    void testInvalidWidth_ShouldFail(@TempDir Path tempDir) {
        int exitCode = new CommandLine(new Execute()).execute(
                "-i", tempDir.resolve("in").toString(),
                "-o", tempDir.resolve("out").toString(),
                "--width", "0");

        assertNotEquals(0, exitCode);
    }

    @Test
    void testUnknownOption_ShouldFail() {
        assertNotEquals(0, new CommandLine(new Execute()).execute("--no-such-option"));
    }
}
