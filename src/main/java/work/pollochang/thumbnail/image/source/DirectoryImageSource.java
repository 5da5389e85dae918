package work.pollochang.thumbnail.image.source;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 列出目錄 (不含子目錄) 中副檔名為 jpg、jpeg、png、bmp、gif 的檔案，依檔名排序。
 * 副檔名不分大小寫，其他檔案直接略過。
 */
@Slf4j
public class DirectoryImageSource implements ImageSource {

    public static final Set<String> IMAGE_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".bmp", ".gif");

    @Override
    public List<String> list(Path directory) throws IOException {
        try (Stream<Path> paths = Files.list(directory)) {
            List<String> names = paths
                    .filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(DirectoryImageSource::isImageFile)
                    .sorted()
                    .collect(Collectors.toList());
            log.debug("{} - 找到 {} 個圖片檔", directory, names.size());
            return names;
        }
    }

    static boolean isImageFile(String fileName) {
        String name = fileName.toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}
