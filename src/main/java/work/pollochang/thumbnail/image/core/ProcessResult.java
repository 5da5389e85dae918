package work.pollochang.thumbnail.image.core;

public enum ProcessResult {
    TRANSFORMED("成功建立縮圖"),
    SAVED("成功儲存縮圖"),
    FAILED_UNSUPPORTED_FORMAT("格式不支援"),
    FAILED_DECODE("解碼失敗"),
    FAILED_ENCODE("編碼失敗"),
    FAILED_IO_ERROR("IO錯誤");

    private final String description;
    ProcessResult(String description) { this.description = description; }
    public String getDescription() { return description; }

    public boolean isFailure() {
        return this != TRANSFORMED && this != SAVED;
    }
}
