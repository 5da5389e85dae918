package work.pollochang.thumbnail.image.pipeline;

/**
 * 單一階段 (生產者或消費者) 自行統計的成功與失敗數量。
 */
public record StageReport(int succeeded, int failed) {
}
