package work.pollochang.thumbnail.image;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import work.pollochang.thumbnail.image.core.ThumbnailSize;
import work.pollochang.thumbnail.image.report.RunSummary;
import work.pollochang.thumbnail.image.report.ThumbnailParams;

import java.io.File;
import java.time.Duration;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "image-thumbnail",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "批次縮圖工具 (生產者 / 消費者)")
public class Execute implements Callable<Integer> {

    @Option(names = {"-i", "--input-dir"}, defaultValue = "producer", description = "原始圖片目錄，不存在時會自動建立 (預設: producer)。")
    private File inputDir;

    @Option(names = {"-o", "--output-dir"}, defaultValue = "consumer", description = "縮圖儲存目錄，不存在時會自動建立 (預設: consumer)。")
    private File outputDir;

    @Option(names = {"--width"}, defaultValue = "200", description = "縮圖最大寬度 (預設: 200)。")
    private int width;

    @Option(names = {"--height"}, defaultValue = "200", description = "縮圖最大高度 (預設: 200)。")
    private int height;

    @Option(names = {"-q", "--quality"}, defaultValue = "0.75", description = "JPEG 壓縮品質，範圍從 0.0 到 1.0 (預設: 0.75)。")
    private float quality;

    @Option(names = {"-c", "--capacity"}, defaultValue = "16", description = "生產者與消費者之間的佇列容量，0 表示不限制 (預設: 16)。")
    private int capacity;

    @Option(names = {"--timeOut"}, defaultValue = "24", description = "設定執行時間超時(小時) (預設: 24 小時)。")
    private long timeOutHr;

    @Option(names = {"-r", "--report"}, description = "將執行摘要以 JSON 格式輸出至此檔案。")
    private File reportFile;

    @Override
    public Integer call() throws Exception {

        log.info("========================================縮圖程式參數設定========================================");
        log.info("縮圖任務開始");
        log.info("來源目錄: {}", inputDir.getAbsolutePath());
        log.info("輸出目錄: {}", outputDir.getAbsolutePath());
        log.info("縮圖尺寸上限: {}x{}", width, height);
        log.info("JPEG 壓縮品質: {}", quality);
        log.info("佇列容量: {}", capacity == 0 ? "不限制" : capacity);
        log.info("設定超時執行時間: {} 小時", timeOutHr);
        if (reportFile != null) {
            log.info("執行報告: {}", reportFile.getAbsolutePath());
        }
        log.info("========================================縮圖程式參數設定========================================");

        // 使用 record 封裝參數
        ThumbnailParams params = new ThumbnailParams(
                new ThumbnailSize(width, height),
                quality,
                capacity
        );

        ThumbnailPipeline pipeline = new ThumbnailPipeline();
        pipeline.setInputDir(inputDir.toPath());
        pipeline.setOutputDir(outputDir.toPath());
        pipeline.setParams(params);
        pipeline.setTimeOut(Duration.ofHours(timeOutHr));
        pipeline.setReportPath(reportFile != null ? reportFile.toPath() : null);
        RunSummary summary = pipeline.execute();

        log.info("✓ 成功轉換的圖片總數: {}", summary.thumbnailCount());
        log.info("所有任務執行完畢");
        return 0; // 成功時返回 0
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }
}
