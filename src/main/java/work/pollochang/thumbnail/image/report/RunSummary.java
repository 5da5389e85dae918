package work.pollochang.thumbnail.image.report;

/**
 * 執行結果摘要。
 *
 * @param processedCount 生產者成功轉換的數量
 * @param savedCount     消費者成功儲存的數量
 * @param decodeFailures 無法解碼而略過的數量
 * @param saveFailures   無法寫入而略過的數量
 * @param thumbnailCount 輸出目錄中實際找到的縮圖數量 (含先前執行留下的檔案)
 */
public record RunSummary(
        String inputDir,
        String outputDir,
        int processedCount,
        int savedCount,
        int decodeFailures,
        int saveFailures,
        long thumbnailCount,
        long elapsedMillis
) {
}
