package work.pollochang.thumbnail.image;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.thumbnail.image.channel.WorkChannel;
import work.pollochang.thumbnail.image.core.ImageTransformer;
import work.pollochang.thumbnail.image.core.JpegThumbnailWriter;
import work.pollochang.thumbnail.image.core.ThumbnailTransformer;
import work.pollochang.thumbnail.image.core.ThumbnailWriter;
import work.pollochang.thumbnail.image.exception.DirectoryException;
import work.pollochang.thumbnail.image.exception.PipelineException;
import work.pollochang.thumbnail.image.pipeline.Consumer;
import work.pollochang.thumbnail.image.pipeline.Producer;
import work.pollochang.thumbnail.image.pipeline.StageReport;
import work.pollochang.thumbnail.image.report.RunReportWriter;
import work.pollochang.thumbnail.image.report.RunSummary;
import work.pollochang.thumbnail.image.report.ThumbnailParams;
import work.pollochang.thumbnail.image.source.DirectoryImageSource;
import work.pollochang.thumbnail.image.source.ImageSource;
import work.pollochang.thumbnail.image.tools.FileTools;

import java.nio.file.Path;
import java.time.Duration;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 進行批次縮圖
 * <p>
 * 建立一個交換佇列，讓一個生產者與一個消費者在各自的執行緒上同時執行，
 * 等待兩者結束後統計輸出目錄中的縮圖數量。
 * 任一方異常終止時會中斷另一方，並以例外回報。
 */
@Setter
@Slf4j
public class ThumbnailPipeline {

    private Path inputDir;
    private Path outputDir;
    private ThumbnailParams params = ThumbnailParams.defaults();
    private Duration timeOut = Duration.ofHours(24);
    private Path reportPath;

    private ImageSource imageSource = new DirectoryImageSource();
    private ImageTransformer transformer = new ThumbnailTransformer();
    private ThumbnailWriter thumbnailWriter;

    public RunSummary execute() {
        Objects.requireNonNull(inputDir, "inputDir must not be null");
        Objects.requireNonNull(outputDir, "outputDir must not be null");
        long startNanos = System.nanoTime();

        FileTools.ensureDirectoryExists(inputDir);
        FileTools.ensureDirectoryExists(outputDir);

        WorkChannel channel = new WorkChannel(params.channelCapacity());
        Producer producer = new Producer(imageSource, transformer, channel, inputDir, params.size());
        Consumer consumer = new Consumer(channel, resolveThumbnailWriter(), outputDir);
        log.info("初始化交換佇列，容量: {}", channel.getCapacity() == 0 ? "不限制" : channel.getCapacity());

        StageReport produced;
        StageReport consumed;
        ExecutorService executor = Executors.newFixedThreadPool(2, namedThreadFactory());
        try {
            CompletionService<StageReport> completionService = new ExecutorCompletionService<>(executor);
            Map<Future<StageReport>, String> stages = new IdentityHashMap<>();
            Future<StageReport> producerFuture = completionService.submit(producer);
            stages.put(producerFuture, "Producer");
            Future<StageReport> consumerFuture = completionService.submit(consumer);
            stages.put(consumerFuture, "Consumer");

            log.info("生產者與消費者已啟動，等待處理完成...");
            awaitStages(completionService, stages);

            produced = producerFuture.get();
            consumed = consumerFuture.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt(); // 恢復中斷狀態
            throw new PipelineException("等待生產者與消費者時被中斷", e);
        } catch (ExecutionException e) {
            // awaitStages 已檢查過兩個階段皆成功結束
            throw new PipelineException("無法取得執行結果", e.getCause());
        } finally {
            executor.shutdownNow();
        }

        long thumbnailCount = FileTools.countThumbnails(outputDir);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        RunSummary summary = new RunSummary(
                inputDir.toString(),
                outputDir.toString(),
                produced.succeeded(),
                consumed.succeeded(),
                produced.failed(),
                consumed.failed(),
                thumbnailCount,
                elapsedMillis
        );
        logSummary(summary);

        if (reportPath != null) {
            new RunReportWriter().write(reportPath, summary);
        }
        return summary;
    }

    /**
     * 依完成順序等待兩個階段。任一方失敗時立即中斷另一方，避免對方卡在佇列上。
     */
    private void awaitStages(CompletionService<StageReport> completionService,
                             Map<Future<StageReport>, String> stages) throws InterruptedException {
        long deadline = System.nanoTime() + timeOut.toNanos();
        for (int i = 0; i < stages.size(); i++) {
            Future<StageReport> done = completionService.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
            if (done == null) {
                log.warn("執行逾時 ({})，中斷生產者與消費者。", timeOut);
                throw new PipelineException("執行逾時: " + timeOut);
            }
            try {
                done.get();
                log.debug("[{}] 已結束", stages.get(done));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                log.error("[{}] 執行失敗，中止流程", stages.get(done), cause);
                if (cause instanceof DirectoryException) {
                    throw (DirectoryException) cause;
                }
                throw new PipelineException(stages.get(done) + " 執行失敗", cause);
            }
        }
    }

    private ThumbnailWriter resolveThumbnailWriter() {
        return thumbnailWriter != null ? thumbnailWriter : new JpegThumbnailWriter(params.quality());
    }

    private static ThreadFactory namedThreadFactory() {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> new Thread(runnable, "thumbnail-stage-" + counter.incrementAndGet());
    }

    private void logSummary(RunSummary summary) {
        log.info("========================================縮圖處理結果========================================");
        log.info(" 成功轉換: {} 張，解碼失敗: {} 張", summary.processedCount(), summary.decodeFailures());
        log.info(" 成功儲存: {} 張，寫入失敗: {} 張", summary.savedCount(), summary.saveFailures());
        log.info(" 輸出目錄中的縮圖總數: {}", summary.thumbnailCount());
        log.info(" 縮圖儲存於: {}", summary.outputDir());
        log.info(" 執行時間: {} ms", summary.elapsedMillis());
        log.info("========================================縮圖處理結果========================================");
    }
}
