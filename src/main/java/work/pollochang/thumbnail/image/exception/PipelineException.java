package work.pollochang.thumbnail.image.exception;

/**
 * 生產者或消費者執行緒異常終止、被中斷或逾時。
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
