package work.pollochang.thumbnail.image.core;

import work.pollochang.thumbnail.image.report.TransformReport;

import java.nio.file.Path;

/**
 * 將單一圖片檔轉為縮圖。
 * <p>
 * 解碼失敗以 {@link TransformReport} 回傳，不拋出例外；呼叫端必須依結果分支處理。
 */
public interface ImageTransformer {

    TransformReport transform(Path file, ThumbnailSize size);
}
