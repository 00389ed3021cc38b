package work.pollochang.palette;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecuteTest {

    @Test
    void testColorCountOutOfRange_ShouldFail(@TempDir Path tempDir) throws IOException {
        Path fileList = Files.writeString(tempDir.resolve("files.txt"), "");

        int exitCode = new CommandLine(new Execute()).execute(
                "-f", fileList.toString(), "-o", tempDir.resolve("out").toString(), "-c", "17", "--no-cache");

        assertNotEquals(0, exitCode);
        assertFalse(Files.exists(tempDir.resolve("out")));
    }

    @Test
    void testMissingRequiredOptions_ShouldFail() {
        assertNotEquals(0, new CommandLine(new Execute()).execute());
    }

    @Test
    void testValidRun_ShouldWriteReports(@TempDir Path tempDir) throws IOException {
        BufferedImage image = new BufferedImage(20, 20, BufferedImage.TYPE_INT_RGB);
        Path input = tempDir.resolve("black.png");
        ImageIO.write(image, "png", input.toFile());
        Path fileList = Files.write(tempDir.resolve("files.txt"), List.of(input.toString()));
        Path outputDir = tempDir.resolve("out");

        int exitCode = new CommandLine(new Execute()).execute(
                "-f", fileList.toString(), "-o", outputDir.toString(), "-c", "2", "--suggestions", "--no-cache");

        assertEquals(0, exitCode);
        assertTrue(Files.exists(outputDir.resolve("black.palette.json")));
    }
}
