package work.pollochang.thumbnail.image.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 列出目錄中要處理的圖片檔名。同一次執行中順序固定。
 */
public interface ImageSource {

    List<String> list(Path directory) throws IOException;
}
