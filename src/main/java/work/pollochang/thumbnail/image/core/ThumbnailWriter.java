package work.pollochang.thumbnail.image.core;

import work.pollochang.thumbnail.image.channel.WorkItem;
import work.pollochang.thumbnail.image.report.SaveReport;

import java.nio.file.Path;

/**
 * 將縮圖寫入輸出目錄。寫入失敗以 {@link SaveReport} 回傳。
 */
public interface ThumbnailWriter {

    SaveReport write(WorkItem item, Path outputDir);
}
