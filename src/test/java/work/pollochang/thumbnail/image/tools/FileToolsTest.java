package work.pollochang.thumbnail.image.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.thumbnail.image.exception.DirectoryException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    @Test
    void testEnsureDirectoryExists_ShouldCreateNestedDirectories(@TempDir Path tempDir) {
        Path target = tempDir.resolve("a").resolve("b");

        FileTools.ensureDirectoryExists(target);

        assertTrue(Files.isDirectory(target));
    }

    /**
     * 已存在的目錄不應報錯，也不應刪除裡面的檔案
     */
    @Test
    void testEnsureDirectoryExists_ExistingDirectory_ShouldKeepContent(@TempDir Path tempDir) throws IOException {
        Path existing = Files.writeString(tempDir.resolve("notes.txt"), "keep me");

        FileTools.ensureDirectoryExists(tempDir);
        FileTools.ensureDirectoryExists(tempDir);

        assertEquals("keep me", Files.readString(existing));
    }

    @Test
    void testEnsureDirectoryExists_PathIsFile_ShouldThrow(@TempDir Path tempDir) throws IOException {
        Path file = Files.writeString(tempDir.resolve("not-a-dir"), "x");

        assertThrows(DirectoryException.class, () -> FileTools.ensureDirectoryExists(file));
    }

    @Test
    void testCountThumbnails_ShouldOnlyCountThumbnailNames(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("a-thumbnail.jpg"), "");
        Files.writeString(tempDir.resolve("b-thumbnail.jpg"), "");
        Files.writeString(tempDir.resolve("c.jpg"), "");
        Files.writeString(tempDir.resolve("d-thumbnail.png"), "");
        Files.createDirectory(tempDir.resolve("e-thumbnail.jpg"));

        assertEquals(2, FileTools.countThumbnails(tempDir));
    }

    @Test
    void testFormatFileSize() {
        assertEquals("0 B", FileTools.formatFileSize(0));
        assertEquals("512 B", FileTools.formatFileSize(512));
        assertEquals("2 KB", FileTools.formatFileSize(2048));
    }
}
