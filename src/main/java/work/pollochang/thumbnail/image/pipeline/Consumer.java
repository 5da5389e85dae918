package work.pollochang.thumbnail.image.pipeline;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.thumbnail.image.channel.ChannelMessage;
import work.pollochang.thumbnail.image.channel.WorkChannel;
import work.pollochang.thumbnail.image.channel.WorkItem;
import work.pollochang.thumbnail.image.core.ThumbnailWriter;
import work.pollochang.thumbnail.image.report.SaveReport;
import work.pollochang.thumbnail.image.tools.FileTools;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * 消費者: 從佇列取出縮圖並寫入輸出目錄，直到收到結束訊號。
 * <p>
 * 結束訊號是唯一的停止條件。寫入失敗只記錄並略過。
 */
@Slf4j
@RequiredArgsConstructor
public class Consumer implements Callable<StageReport> {

    private final WorkChannel channel;
    private final ThumbnailWriter writer;
    private final Path outputDir;

    @Getter
    private volatile ConsumerState state = ConsumerState.RUNNING;

    @Override
    public StageReport call() throws InterruptedException {
        FileTools.ensureDirectoryExists(outputDir);
        log.info("[Consumer] 開始，儲存至: {}", outputDir);

        int savedCount = 0;
        int failedCount = 0;
        while (state == ConsumerState.RUNNING) {
            ChannelMessage message = channel.take();

            if (message instanceof ChannelMessage.End) {
                log.info("[Consumer] 收到結束訊號");
                state = ConsumerState.DONE;
            } else if (message instanceof ChannelMessage.Item item) {
                if (save(item.workItem())) {
                    savedCount++;
                } else {
                    failedCount++;
                }
            }
        }

        log.info("[Consumer] 完成！共儲存 {} 張縮圖，失敗 {} 張", savedCount, failedCount);
        return new StageReport(savedCount, failedCount);
    }

    private boolean save(WorkItem item) {
        try {
            SaveReport report = writer.write(item, outputDir);
            switch (report.result()) {
                case SAVED:
                    log.info("[Consumer] 已儲存: {} ({})", report.outputFile().getFileName(),
                            FileTools.formatFileSize(report.size()));
                    return true;
                case FAILED_ENCODE:
                case FAILED_IO_ERROR:
                    log.warn("[Consumer] {} - {}，跳過: {}", item.name(), report.result().getDescription(), report.detail());
                    return false;
                default:
                    throw new IllegalStateException("非預期的儲存結果: " + report.result());
            }
        } finally {
            item.image().flush();
        }
    }
}
