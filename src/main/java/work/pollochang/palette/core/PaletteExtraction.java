package work.pollochang.palette.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.palette.cache.PaletteCacheKey;
import work.pollochang.palette.exception.EmptyImageException;
import work.pollochang.palette.json.PaletteJson;
import work.pollochang.palette.model.Color;
import work.pollochang.palette.model.ExtractionOptions;
import work.pollochang.palette.model.ExtractionResult;
import work.pollochang.palette.report.ExtractionParams;
import work.pollochang.palette.report.ExtractionReport;
import work.pollochang.palette.report.PaletteReport;
import work.pollochang.palette.suggest.GradientGenerator;
import work.pollochang.palette.suggest.HarmonyGenerator;
import work.pollochang.palette.suggest.PaletteAdvisor;
import work.pollochang.palette.tools.CacheTools;
import work.pollochang.palette.tools.FileTools;
import work.pollochang.palette.tools.ImageTools;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.spi.IIORegistry;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 單一圖片檔案的萃取流程：讀檔、查快取、解碼、萃取、輸出 JSON 報告。
 */
@Slf4j
public final class PaletteExtraction {

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作，避免 I/O 瓶頸。
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    /**
     * 解碼時的目標最長邊。取樣器最後只看約 200x200 的網格，不需要完整解析度。
     */
    static final int PREFERRED_MAX_DIM = 2048;

    static final String REPORT_SUFFIX = ".palette.json";

    private PaletteExtraction() {}

    /**
     * 處理單一圖片。任何錯誤都轉為 {@link ExtractionOutcome}，不會往外拋出。
     * @param inputPath 圖片路徑
     * @param outputDir 報告輸出目錄 (需已存在)
     * @param params    萃取參數
     * @param cache     共用的萃取結果快取，可跨執行緒存取
     * @return 處理結果
     */
    public static ExtractionReport processImage(
            Path inputPath,
            Path outputDir,
            ExtractionParams params,
            Map<PaletteCacheKey, ExtractionResult> cache
    ) {
        if (!Files.exists(inputPath) || !Files.isReadable(inputPath)) {
            log.warn("{} - 檔案不存在或不可讀，跳過", inputPath);
            return new ExtractionReport(ExtractionOutcome.SKIPPED_NOT_FOUND, 0);
        }

        try {
            byte[] content = Files.readAllBytes(inputPath);
            ExtractionOptions options = params.toOptions();
            PaletteCacheKey key = CacheTools.createKey(content, options);

            ExtractionOutcome outcome;
            ExtractionResult result = cache.get(key);
            if (result != null) {
                log.debug("{} - 快取命中 {}", inputPath, key.contentHash());
                outcome = ExtractionOutcome.CACHE_HIT;
            } else {
                BufferedImage image = decodeImageWithSubsampling(inputPath, content);
                if (image == null) {
                    return new ExtractionReport(ExtractionOutcome.FAILED_UNSUPPORTED_FORMAT, 0);
                }
                try {
                    byte[] rgba = ImageTools.toRgbaBuffer(image);
                    result = ColorExtractor.extractColors(rgba, image.getWidth(), image.getHeight(), options);
                } finally {
                    image.flush();
                }
                cache.put(key, result);
                outcome = ExtractionOutcome.SUCCESS;
            }

            Path outputFile = outputDir.resolve(FileTools.baseName(inputPath) + REPORT_SUFFIX);
            PaletteJson.mapper().writeValue(outputFile.toFile(), buildReport(inputPath, result, params));

            log.info("{} - 處理成功 -> {} (大小: {}, 顏色: {}, 主色: {}, 耗時: {} ms)",
                    inputPath, outputFile, FileTools.formatFileSize(content.length),
                    result.colors().size(), result.dominantColor().hex(), result.processingTime());
            return new ExtractionReport(outcome, result.colors().size());

        } catch (EmptyImageException e) {
            log.warn("{} - {}", inputPath, e.getMessage());
            return new ExtractionReport(ExtractionOutcome.FAILED_EMPTY_IMAGE, 0);
        } catch (IOException e) {
            log.warn("{} - 處理圖片時發生 I/O 錯誤 (可能非支援格式或檔案損毀)", inputPath, e);
            return new ExtractionReport(ExtractionOutcome.FAILED_IO_ERROR, 0);
        } catch (OutOfMemoryError e) {
            log.error("{} - 處理檔案時發生記憶體溢位錯誤 (圖片可能過大或格式有問題)", inputPath, e);
            return new ExtractionReport(ExtractionOutcome.FAILED_OUT_OF_MEMORY, 0);
        } catch (Exception e) {
            log.error("{} - 處理檔案時發生未知錯誤", inputPath, e);
            return new ExtractionReport(ExtractionOutcome.FAILED_UNKNOWN, 0);
        }
    }

    static PaletteReport buildReport(Path inputPath, ExtractionResult result, ExtractionParams params) {
        String source = inputPath.toString();
        if (!params.includeSuggestions()) {
            return PaletteReport.withoutSuggestions(source, result);
        }
        List<Color> colors = result.colors();
        return new PaletteReport(
                source,
                result,
                HarmonyGenerator.getHarmonySuggestions(result.dominantColor()),
                PaletteAdvisor.getPaletteCompletionSuggestions(colors),
                GradientGenerator.getGradientSuggestions(colors)
        );
    }

    /**
     * 解碼圖片，過大的圖片以 2 的冪次二次取樣降低記憶體用量。
     * @return 解碼後的圖片，找不到對應的讀取器時為 null
     */
    private static BufferedImage decodeImageWithSubsampling(Path inputPath, byte[] content) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(content))) {
            if (in == null) {
                log.warn("{} - 無法建立圖片輸入流，跳過", inputPath);
                return null;
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                log.warn("{} - 找不到對應的圖片讀取器，跳過", inputPath);
                return null;
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);

                ImageReadParam param = reader.getDefaultReadParam();
                int subsampling = subsamplingFor(width, height);
                if (subsampling > 1) {
                    log.debug("{} - 對圖片應用二次取樣，比率: {}", inputPath.getFileName(), subsampling);
                    param.setSourceSubsampling(subsampling, subsampling, 0, 0);
                }
                return reader.read(0, param);
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     * 讓最長邊接近 {@link #PREFERRED_MAX_DIM} 的取樣率，一律取 2 的冪，對 JPG 解碼器較友好。
     */
    static int subsamplingFor(int width, int height) {
        int maxDim = Math.max(width, height);
        if (maxDim <= PREFERRED_MAX_DIM) {
            return 1;
        }
        return Integer.highestOneBit(maxDim / PREFERRED_MAX_DIM);
    }
}
