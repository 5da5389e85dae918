package work.pollochang.thumbnail.image.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.thumbnail.image.channel.WorkChannel;
import work.pollochang.thumbnail.image.channel.WorkItem;
import work.pollochang.thumbnail.image.core.ImageTransformer;
import work.pollochang.thumbnail.image.core.ThumbnailSize;
import work.pollochang.thumbnail.image.exception.DirectoryException;
import work.pollochang.thumbnail.image.report.TransformReport;
import work.pollochang.thumbnail.image.source.ImageSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * 生產者: 依序轉換輸入目錄中的圖片並放入佇列，最後送出一次結束訊號。
 * <p>
 * 單一檔案轉換失敗只會記錄並略過，不會中止整個流程。
 * 無論成功或失敗幾張，結束訊號都會送出；只有被中斷 (取消) 時不送。
 */
@Slf4j
@RequiredArgsConstructor
public class Producer implements Callable<StageReport> {

    private final ImageSource imageSource;
    private final ImageTransformer transformer;
    private final WorkChannel channel;
    private final Path inputDir;
    private final ThumbnailSize size;

    @Override
    public StageReport call() throws InterruptedException {
        log.info("[Producer] 開始，讀取目錄: {}", inputDir);
        try {
            return produce();
        } finally {
            if (!Thread.currentThread().isInterrupted()) {
                channel.complete();
                log.debug("[Producer] 已送出結束訊號");
            }
        }
    }

    private StageReport produce() throws InterruptedException {
        List<String> fileNames;
        try {
            fileNames = imageSource.list(inputDir);
        } catch (IOException e) {
            throw new DirectoryException("無法列出輸入目錄: " + inputDir, e);
        }
        log.info("[Producer] 找到 {} 個圖片檔待處理", fileNames.size());

        int processedCount = 0;
        int failedCount = 0;
        for (String fileName : fileNames) {
            TransformReport report = transformer.transform(inputDir.resolve(fileName), size);
            switch (report.result()) {
                case TRANSFORMED:
                    enqueue(new WorkItem(fileName, report.image()));
                    processedCount++;
                    log.info("[Producer] 已處理: {}", fileName);
                    break;
                case FAILED_UNSUPPORTED_FORMAT:
                case FAILED_DECODE:
                    failedCount++;
                    log.warn("[Producer] {} - {}，跳過: {}", fileName, report.result().getDescription(), report.detail());
                    break;
                default:
                    throw new IllegalStateException("非預期的轉換結果: " + report.result());
            }
        }

        log.info("[Producer] 完成！共處理 {} 張圖片，失敗 {} 張", processedCount, failedCount);
        return new StageReport(processedCount, failedCount);
    }

    private void enqueue(WorkItem item) throws InterruptedException {
        try {
            channel.put(item);
        } catch (InterruptedException e) {
            log.warn("[Producer] 等待佇列空間時被中斷: {}", item.name());
            // 保留中斷狀態，結束訊號不再送出
            Thread.currentThread().interrupt();
            throw e;
        }
    }
}
