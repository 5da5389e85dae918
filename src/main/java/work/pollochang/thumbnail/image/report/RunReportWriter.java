package work.pollochang.thumbnail.image.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

@Slf4j
public class RunReportWriter {

    private final ObjectMapper mapper;

    public RunReportWriter() {
        this.mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀
    }

    /**
     * 將執行摘要以 JSON 格式寫入指定檔案。寫入失敗只記錄錯誤，不影響執行結果。
     * @param path 報告檔案路徑
     * @param summary 執行摘要
     */
    public void write(Path path, RunSummary summary) {
        try {
            mapper.writeValue(path.toFile(), summary);
            log.info("執行報告已儲存至 {}", path);
        } catch (IOException e) {
            log.error("儲存執行報告至檔案 {} 時發生錯誤。", path, e);
        }
    }

    public RunSummary read(Path path) throws IOException {
        return mapper.readValue(path.toFile(), RunSummary.class);
    }
}
