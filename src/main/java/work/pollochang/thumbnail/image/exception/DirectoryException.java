package work.pollochang.thumbnail.image.exception;

/**
 * 輸入或輸出目錄無法建立或存取。整個執行會因此中止。
 */
public class DirectoryException extends RuntimeException {

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
