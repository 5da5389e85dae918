package work.pollochang.thumbnail.image.report;

import work.pollochang.thumbnail.image.core.ProcessResult;

import java.awt.image.BufferedImage;

/**
 * 單一檔案轉換結果。成功時帶有縮圖，失敗時帶有原因說明。
 */
public record TransformReport(ProcessResult result, BufferedImage image, String detail) {

    public static TransformReport transformed(BufferedImage image) {
        return new TransformReport(ProcessResult.TRANSFORMED, image, null);
    }

    public static TransformReport failed(ProcessResult result, String detail) {
        return new TransformReport(result, null, detail);
    }
}
