package work.pollochang.palette.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * 共用的 {@link ObjectMapper}。設定完成後不再修改，可跨執行緒共用。
 */
public final class PaletteJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new ColorJsonModule())
            .enable(SerializationFeature.INDENT_OUTPUT); // 報告檔以縮排輸出，方便閱讀

    private PaletteJson() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * 不縮排的 writer，用於寫入快取資料庫。
     */
    public static ObjectWriter compactWriter() {
        return MAPPER.writer().without(SerializationFeature.INDENT_OUTPUT);
    }
}
