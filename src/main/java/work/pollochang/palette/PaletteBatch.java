package work.pollochang.palette;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.palette.cache.H2PaletteCache;
import work.pollochang.palette.cache.PaletteCacheKey;
import work.pollochang.palette.core.ExtractionOutcome;
import work.pollochang.palette.core.PaletteExtraction;
import work.pollochang.palette.model.ExtractionResult;
import work.pollochang.palette.report.ExtractionParams;
import work.pollochang.palette.report.ExtractionReport;
import work.pollochang.palette.tools.FileTools;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * 進行批次萃取
 */
@Setter
@Slf4j
public class PaletteBatch {

    private String fileListPath;
    private String saveDir;
    private ExtractionParams extractionParams;
    private long timeOutHr;
    private Path h2CachePath;

    /**
     * 執行批次萃取並回傳各結果的計數，方便呼叫端檢查。
     */
    public Map<ExtractionOutcome, Long> execute() {
        Path outputDir = Paths.get(saveDir);
        Path inputListFile = Paths.get(fileListPath);

        FileTools.ensureDirectoryExists(outputDir);

        H2PaletteCache h2Cache = null;
        final Map<PaletteCacheKey, ExtractionResult> paletteCache;
        if (h2CachePath != null) {
            h2Cache = new H2PaletteCache(h2CachePath);
            h2Cache.initSchema();
            paletteCache = h2Cache.loadAllToMap();
        } else {
            log.info("未指定快取資料庫，將使用空的記憶體快取。");
            paletteCache = new ConcurrentHashMap<>();
        }

        // 使用 EnumMap 和 AtomicLong 進行線程安全的計數
        Map<ExtractionOutcome, AtomicLong> counters = new EnumMap<>(ExtractionOutcome.class);
        for (ExtractionOutcome outcome : ExtractionOutcome.values()) {
            counters.put(outcome, new AtomicLong(0));
        }
        AtomicLong totalFiles = new AtomicLong(0);
        AtomicLong totalColors = new AtomicLong(0);

        try {
            int coreCount = Math.max(1, Runtime.getRuntime().availableProcessors());
            log.info("偵測到 {} 個 CPU 核心，建立固定大小為 {} 的執行緒池。", coreCount, coreCount);
            ExecutorService executor = Executors.newFixedThreadPool(coreCount);

            try {
                submitAll(inputListFile, executor, outputDir, paletteCache, counters, totalFiles, totalColors);
                log.info("所有任務已提交，等待處理完成...");
            } finally {
                // 列表讀取失敗時，已提交的任務仍需完成，快取才會完整寫回
                executor.shutdown();
                awaitCompletion(executor);
            }

            log.info("萃取快取最終大小: {}", paletteCache.size());
            if (h2Cache != null) {
                h2Cache.saveAllFromMap(paletteCache);
            }
        } finally {
            if (h2Cache != null) {
                h2Cache.close();
            }
        }

        log.info("所有圖片處理完成！");
        long successCount = counters.get(ExtractionOutcome.SUCCESS).get();
        long cacheHitCount = counters.get(ExtractionOutcome.CACHE_HIT).get();
        long skippedCount = counters.get(ExtractionOutcome.SKIPPED_NOT_FOUND).get();
        long failedCount = totalFiles.get() - successCount - cacheHitCount - skippedCount;

        log.info("處理結果 -> 總計: {}, 成功萃取: {}, 快取命中: {}, 跳過: {}, 失敗: {}",
                totalFiles.get(),
                successCount,
                cacheHitCount,
                skippedCount,
                failedCount);

        log.info("========================================萃取統計報告========================================");
        long succeeded = 0;
        for (ExtractionOutcome outcome : ExtractionOutcome.values()) {
            long count = counters.get(outcome).get();
            if (count > 0) {
                log.info(" {}: {}", outcome.getDescription(), count);
            }
            if (outcome.isSuccess()) {
                succeeded += count;
            }
        }
        log.info(" 平均每張顏色數: {}", succeeded == 0 ? 0.0 : (double) totalColors.get() / succeeded);
        log.info("========================================萃取統計報告========================================");

        return snapshot(counters);
    }

    private void submitAll(Path inputListFile,
                           ExecutorService executor,
                           Path outputDir,
                           Map<PaletteCacheKey, ExtractionResult> paletteCache,
                           Map<ExtractionOutcome, AtomicLong> counters,
                           AtomicLong totalFiles,
                           AtomicLong totalColors) {
        // 使用 Stream API 逐行讀取檔案，避免一次性將整個列表載入記憶體
        // 非 UTF-8 的列在解碼時拋出 UncheckedIOException
        try (Stream<String> lines = Files.lines(inputListFile)) {
            lines.forEach(line -> {
                if (line == null || line.trim().isEmpty()) {
                    return;
                }
                totalFiles.incrementAndGet();
                Path inputPath;
                try {
                    inputPath = Paths.get(line.trim());
                } catch (InvalidPathException e) {
                    log.warn("無效的檔案路徑，略過: {}", line, e);
                    counters.get(ExtractionOutcome.SKIPPED_NOT_FOUND).incrementAndGet();
                    return;
                }
                executor.submit(() -> {
                    ExtractionReport report = PaletteExtraction.processImage(
                            inputPath,
                            outputDir,
                            extractionParams,
                            paletteCache
                    );
                    counters.get(report.outcome()).incrementAndGet();
                    totalColors.addAndGet(report.colorCount());
                });
            });
        } catch (IOException | UncheckedIOException e) {
            log.error("讀取檔案列表失敗: {}", fileListPath, e);
        }
    }

    private void awaitCompletion(ExecutorService executor) {
        try {
            // 等待所有任務完成，最多等待數小時
            if (!executor.awaitTermination(timeOutHr, TimeUnit.HOURS)) {
                log.warn("執行緒池等待逾時，部分任務可能未完成。");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("執行緒池被中斷。", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt(); // 恢復中斷狀態
        }
    }

    private static Map<ExtractionOutcome, Long> snapshot(Map<ExtractionOutcome, AtomicLong> counters) {
        Map<ExtractionOutcome, Long> result = new EnumMap<>(ExtractionOutcome.class);
        counters.forEach((outcome, count) -> result.put(outcome, count.get()));
        return result;
    }
}
