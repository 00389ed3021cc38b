package work.pollochang.palette;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.palette.core.ExtractionOutcome;
import work.pollochang.palette.report.ExtractionParams;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PaletteBatchTest {

    private Path createTestImage(Path dir, String fileName, Color color) throws IOException {
        BufferedImage image = new BufferedImage(40, 40, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setPaint(color);
            g.fillRect(0, 0, 40, 40);
        } finally {
            g.dispose();
        }
        Path file = dir.resolve(fileName);
        ImageIO.write(image, "png", file.toFile());
        return file;
    }

    private PaletteBatch createBatch(Path fileList, Path outputDir, Path cachePath) {
        PaletteBatch batch = new PaletteBatch();
        batch.setFileListPath(fileList.toString());
        batch.setSaveDir(outputDir.toString());
        batch.setExtractionParams(new ExtractionParams(4, false, false));
        batch.setTimeOutHr(1);
        batch.setH2CachePath(cachePath);
        return batch;
    }

    /**
     * 第二次執行時應由 H2 快取取得結果
     */
    @Test
    void testExecute_ShouldCountOutcomesAndReuseCache(@TempDir Path tempDir) throws IOException {
        Path red = createTestImage(tempDir, "red.png", Color.RED);
        Path blue = createTestImage(tempDir, "blue.png", Color.BLUE);
        Path fileList = tempDir.resolve("files.txt");
        Files.write(fileList, List.of(red.toString(), "", blue.toString(), tempDir.resolve("missing.png").toString()));
        Path outputDir = tempDir.resolve("out");
        Path cachePath = tempDir.resolve("cache");

        Map<ExtractionOutcome, Long> first = createBatch(fileList, outputDir, cachePath).execute();

        assertEquals(2L, first.get(ExtractionOutcome.SUCCESS));
        assertEquals(1L, first.get(ExtractionOutcome.SKIPPED_NOT_FOUND));
        assertTrue(Files.exists(outputDir.resolve("red.palette.json")));
        assertTrue(Files.exists(outputDir.resolve("blue.palette.json")));

        Map<ExtractionOutcome, Long> second = createBatch(fileList, outputDir, cachePath).execute();

        assertEquals(0L, second.get(ExtractionOutcome.SUCCESS));
        assertEquals(2L, second.get(ExtractionOutcome.CACHE_HIT));
    }

    @Test
    void testExecute_WithoutCache(@TempDir Path tempDir) throws IOException {
        Path red = createTestImage(tempDir, "red.png", Color.RED);
        Path fileList = tempDir.resolve("files.txt");
        Files.write(fileList, List.of(red.toString()));

        Map<ExtractionOutcome, Long> counts = createBatch(fileList, tempDir.resolve("out"), null).execute();

        assertEquals(1L, counts.get(ExtractionOutcome.SUCCESS));
    }

    @Test
    void testExecute_MissingFileList_ShouldReturnZeroCounts(@TempDir Path tempDir) {
        Map<ExtractionOutcome, Long> counts = createBatch(tempDir.resolve("nope.txt"), tempDir.resolve("out"), null).execute();

        for (long count : counts.values()) {
            assertEquals(0L, count);
        }
    }

    /**
     * 檔案列表含有非 UTF-8 的路徑 (Big5 檔名) 時，不得中斷整批作業，
     * 已提交的任務仍須完成並寫回快取
     */
    @Test
    void testExecute_NonUtf8FileList_ShouldFinishSubmittedTasksAndSaveCache(@TempDir Path tempDir) throws IOException {
        Path red = createTestImage(tempDir, "red.png", Color.RED);
        Path fileList = tempDir.resolve("files.txt");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write((red + "\n").getBytes(StandardCharsets.UTF_8));
        // 空白列會被略過，用來讓第一段緩衝區只含有效內容
        bytes.write((" ".repeat(10_000) + "\n").getBytes(StandardCharsets.UTF_8));
        bytes.write(new byte[]{(byte) 0xA4, (byte) 0xA4, '.', 'p', 'n', 'g', '\n'});
        Files.write(fileList, bytes.toByteArray());
        Path outputDir = tempDir.resolve("out");
        Path cachePath = tempDir.resolve("cache");

        Map<ExtractionOutcome, Long> first = assertDoesNotThrow(
                () -> createBatch(fileList, outputDir, cachePath).execute());

        assertEquals(ExtractionOutcome.values().length, first.size());
        assertEquals(1L, first.get(ExtractionOutcome.SUCCESS));
        assertTrue(Files.exists(outputDir.resolve("red.palette.json")));

        Path validList = tempDir.resolve("valid.txt");
        Files.write(validList, List.of(red.toString()));
        Map<ExtractionOutcome, Long> second = createBatch(validList, outputDir, cachePath).execute();

        assertEquals(1L, second.get(ExtractionOutcome.CACHE_HIT));
    }
}
