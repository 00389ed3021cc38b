package work.pollochang.palette.core;

public enum ExtractionOutcome {
    SUCCESS("成功萃取"),
    CACHE_HIT("快取命中"),
    SKIPPED_NOT_FOUND("來源檔案不存在"),
    FAILED_EMPTY_IMAGE("沒有可用像素"),
    FAILED_UNSUPPORTED_FORMAT("格式不支援"),
    FAILED_IO_ERROR("IO錯誤"),
    FAILED_OUT_OF_MEMORY("記憶體溢位"),
    FAILED_UNKNOWN("未知錯誤");

    private final String description;
    ExtractionOutcome(String description) { this.description = description; }
    public String getDescription() { return description; }

    public boolean isSuccess() {
        return this == SUCCESS || this == CACHE_HIT;
    }
}
