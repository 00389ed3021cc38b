package work.pollochang.palette.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.palette.json.PaletteJson;
import work.pollochang.palette.model.Color;
import work.pollochang.palette.model.ExtractionResult;

import java.nio.file.Path;
import java.sql.*;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * H2 萃取結果快取管理器。
 * 負責所有與 H2 資料庫的底層互動，包括連線、資料表初始化、讀取與批次儲存。
 * 顏色列表以 JSON 字串存放於 CLOB 欄位。
 */
@Slf4j
public class H2PaletteCache implements AutoCloseable {

    private static final TypeReference<List<Color>> COLOR_LIST = new TypeReference<>() {};

    // 使用 MERGE 陳述式來實現 upsert
    private static final String MERGE_SQL = "MERGE INTO EXTRACTED_PALETTE_CACHE (CONTENT_HASH, COLOR_COUNT, INCLUDE_TRANSPARENT, COLORS_JSON, PROCESSING_TIME) " +
            "KEY(CONTENT_HASH, COLOR_COUNT, INCLUDE_TRANSPARENT) VALUES (?, ?, ?, ?, ?)";

    private static final int MAX_BATCH_SIZE = 500;

    private final Connection connection;

    /**
     * @param dbPath H2 資料庫檔案的路徑，可含或不含 .mv.db 副檔名
     */
    public H2PaletteCache(Path dbPath) {
        String pathStr = dbPath.toAbsolutePath().toString().replace(".mv.db", "");
        // AUTO_SERVER=TRUE 允許多個進程安全地存取同一個資料庫
        String jdbcUrl = String.format("jdbc:h2:%s;AUTO_SERVER=TRUE", pathStr);
        try {
            this.connection = DriverManager.getConnection(jdbcUrl, "sa", "");
            log.info("成功連線至 H2 資料庫: {}", dbPath);
        } catch (SQLException e) {
            throw new RuntimeException("無法建立 H2 資料庫連線: " + jdbcUrl, e);
        }
    }

    /**
     * 資料表不存在時建立。
     */
    public void initSchema() {
        String createTableSql = "CREATE TABLE IF NOT EXISTS EXTRACTED_PALETTE_CACHE (" +
                "CONTENT_HASH VARCHAR(64), " +
                "COLOR_COUNT INT, " +
                "INCLUDE_TRANSPARENT BOOLEAN, " +
                "COLORS_JSON CLOB, " +
                "PROCESSING_TIME BIGINT, " +
                "PRIMARY KEY (CONTENT_HASH, COLOR_COUNT, INCLUDE_TRANSPARENT)" +
                ")";
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            log.debug("H2 資料表 'EXTRACTED_PALETTE_CACHE' 已確認存在。");
        } catch (SQLException e) {
            throw new RuntimeException("無法初始化 H2 資料庫 Schema", e);
        }
    }

    /**
     * 讀取所有快取紀錄。無法解析的單筆紀錄會被略過。
     * @return 包含所有快取資料的 ConcurrentHashMap，讀取失敗時為空
     */
    public Map<PaletteCacheKey, ExtractionResult> loadAllToMap() {
        Map<PaletteCacheKey, ExtractionResult> cache = new ConcurrentHashMap<>();
        String selectSql = "SELECT CONTENT_HASH, COLOR_COUNT, INCLUDE_TRANSPARENT, COLORS_JSON, PROCESSING_TIME FROM EXTRACTED_PALETTE_CACHE";

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(selectSql)) {

            while (rs.next()) {
                PaletteCacheKey key = new PaletteCacheKey(
                        rs.getString("CONTENT_HASH"),
                        rs.getInt("COLOR_COUNT"),
                        rs.getBoolean("INCLUDE_TRANSPARENT")
                );
                try {
                    List<Color> colors = PaletteJson.mapper().readValue(rs.getString("COLORS_JSON"), COLOR_LIST);
                    if (!colors.isEmpty()) {
                        cache.put(key, ExtractionResult.of(colors, rs.getLong("PROCESSING_TIME")));
                    }
                } catch (JsonProcessingException e) {
                    log.warn("{} - 快取紀錄無法解析，略過", key.contentHash(), e);
                }
            }
        } catch (SQLException e) {
            log.error("從 H2 載入快取時發生錯誤", e);
            // 即使載入失敗，也返回已讀取的部分，讓程式可以繼續執行
        }
        log.info("從 H2 資料庫成功載入 {} 筆萃取快取紀錄。", cache.size());
        return cache;
    }

    /**
     * 將記憶體中的快取批次寫回 H2，整批在同一個交易中完成，失敗時回滾。
     * @param cache 要儲存的快取 Map
     */
    public void saveAllFromMap(Map<PaletteCacheKey, ExtractionResult> cache) {
        if (cache == null || cache.isEmpty()) {
            log.info("記憶體快取為空，無需儲存至 H2。");
            return;
        }

        log.info("準備將 {} 筆快取紀錄批次寫入 H2 資料庫...", cache.size());
        int batchSize = 0;

        try (PreparedStatement ps = connection.prepareStatement(MERGE_SQL)) {
            connection.setAutoCommit(false);

            for (Map.Entry<PaletteCacheKey, ExtractionResult> entry : cache.entrySet()) {
                PaletteCacheKey key = entry.getKey();
                String colorsJson;
                try {
                    colorsJson = PaletteJson.compactWriter().writeValueAsString(entry.getValue().colors());
                } catch (JsonProcessingException e) {
                    log.warn("{} - 無法序列化快取紀錄，略過", key.contentHash(), e);
                    continue;
                }

                ps.setString(1, key.contentHash());
                ps.setInt(2, key.colorCount());
                ps.setBoolean(3, key.includeTransparent());
                ps.setString(4, colorsJson);
                ps.setLong(5, entry.getValue().processingTime());
                ps.addBatch();
                batchSize++;

                if (batchSize % MAX_BATCH_SIZE == 0) {
                    ps.executeBatch();
                    log.debug("已提交 {} 筆紀錄至 H2...", batchSize);
                }
            }

            if (batchSize % MAX_BATCH_SIZE != 0) {
                ps.executeBatch();
            }

            connection.commit();
            log.info("成功將 {} 筆紀錄儲存/更新至 H2 資料庫。", batchSize);

        } catch (SQLException e) {
            log.error("批次儲存快取至 H2 時發生錯誤", e);
            try {
                connection.rollback();
                log.warn("H2 交易已回滾。");
            } catch (SQLException ex) {
                log.error("回滾 H2 交易失敗", ex);
            }
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                log.error("無法恢復 H2 連線的自動提交模式", e);
            }
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
            log.info("H2 資料庫連線已關閉。");
        } catch (SQLException e) {
            log.error("關閉 H2 資料庫連線時發生錯誤。", e);
        }
    }
}
