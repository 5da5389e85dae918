package work.pollochang.thumbnail.image.tools;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.thumbnail.image.core.ThumbnailNaming;
import work.pollochang.thumbnail.image.exception.DirectoryException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.util.stream.Stream;

@Slf4j
public class FileTools {

    private FileTools() {}

    /**
     * 確保指定的目錄存在，如果不存在則建立它。已存在的目錄不會被更動。
     * @param directoryPath 要檢查或建立的目錄路徑
     * @throws DirectoryException 無法建立目錄，或該路徑已存在但不是目錄
     */
    public static void ensureDirectoryExists(Path directoryPath) {
        if (Files.isDirectory(directoryPath)) {
            log.debug("{} - 目錄已存在", directoryPath);
            return;
        }
        try {
            Files.createDirectories(directoryPath);
            log.info("{} - 目錄已建立", directoryPath);
        } catch (IOException e) {
            // 拋出 DirectoryException 使上層能夠捕獲並中止程式
            throw new DirectoryException("無法建立目錄: " + directoryPath, e);
        }
    }

    /**
     * 計算目錄中符合縮圖命名規則 ({@code *-thumbnail.jpg}) 的檔案數量。
     * @param directoryPath 輸出目錄
     * @return 縮圖數量
     */
    public static long countThumbnails(Path directoryPath) {
        try (Stream<Path> files = Files.list(directoryPath)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> ThumbnailNaming.isThumbnailName(file.getFileName().toString()))
                    .count();
        } catch (IOException e) {
            throw new DirectoryException("無法列出目錄: " + directoryPath, e);
        }
    }

    public static String formatFileSize(long size) {
        if (size <= 0) return "0 B";
        final String[] units = new String[]{"B", "KB", "MB", "GB", "TB"};
        int digitGroups = (int) (Math.log10(size) / Math.log10(1024));
        return new DecimalFormat("#,##0.#").format(size / Math.pow(1024, digitGroups)) + " " + units[digitGroups];
    }

}
