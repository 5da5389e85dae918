package work.pollochang.thumbnail.image.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.thumbnail.image.channel.WorkChannel;
import work.pollochang.thumbnail.image.channel.WorkItem;
import work.pollochang.thumbnail.image.core.JpegThumbnailWriter;
import work.pollochang.thumbnail.image.core.ProcessResult;
import work.pollochang.thumbnail.image.core.ThumbnailWriter;
import work.pollochang.thumbnail.image.report.SaveReport;

import java.awt.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static work.pollochang.thumbnail.image.TestImages.createTestImage;

class ConsumerTest {

    private static WorkItem item(String name) {
        return new WorkItem(name, createTestImage(8, 8, Color.BLUE));
    }

    /**
     * 只記錄名稱的假寫入器，名稱為 failing 的項目回傳寫入失敗
     */
    private static class RecordingWriter implements ThumbnailWriter {
        private final List<String> written = new CopyOnWriteArrayList<>();
        private final String failing;

        RecordingWriter(String failing) {
            this.failing = failing;
        }

        @Override
        public SaveReport write(WorkItem item, Path outputDir) {
            Path target = outputDir.resolve(item.name());
            if (item.name().equals(failing)) {
                return SaveReport.failed(ProcessResult.FAILED_IO_ERROR, target, "disk full");
            }
            written.add(item.name());
            return SaveReport.saved(target, 1);
        }
    }

    @Test
    void testConsumeUntilEnd_ShouldSaveInOrder(@TempDir Path tempDir) throws InterruptedException {
        WorkChannel channel = WorkChannel.unbounded();
        channel.put(item("a.jpg"));
        channel.put(item("b.jpg"));
        channel.put(item("c.jpg"));
        channel.complete();
        RecordingWriter writer = new RecordingWriter(null);
        Consumer consumer = new Consumer(channel, writer, tempDir);

        StageReport report = consumer.call();

        assertEquals(new StageReport(3, 0), report);
        assertEquals(List.of("a.jpg", "b.jpg", "c.jpg"), writer.written);
        assertEquals(ConsumerState.DONE, consumer.getState());
    }

    /**
     * 寫入失敗只跳過該項目，繼續處理後續項目
     */
    @Test
    void testWriteFailure_ShouldSkipAndContinue(@TempDir Path tempDir) throws InterruptedException {
        WorkChannel channel = WorkChannel.unbounded();
        channel.put(item("a.jpg"));
        channel.put(item("broken.jpg"));
        channel.put(item("c.jpg"));
        channel.complete();
        RecordingWriter writer = new RecordingWriter("broken.jpg");

        StageReport report = new Consumer(channel, writer, tempDir).call();

        assertEquals(new StageReport(2, 1), report);
        assertEquals(List.of("a.jpg", "c.jpg"), writer.written);
    }

    @Test
    void testOnlyEnd_ShouldFinishWithZeroCount(@TempDir Path tempDir) throws InterruptedException {
        WorkChannel channel = WorkChannel.unbounded();
        channel.complete();

        assertEquals(new StageReport(0, 0), new Consumer(channel, new RecordingWriter(null), tempDir).call());
    }

    /**
     * 佇列暫時為空時不可提前結束，只有收到結束訊號才停止
     */
    @Test
    void testEmptyChannel_ShouldWaitForEnd(@TempDir Path tempDir) throws Exception {
        WorkChannel channel = new WorkChannel(2);
        RecordingWriter writer = new RecordingWriter(null);
        Consumer consumer = new Consumer(channel, writer, tempDir);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<StageReport> future = executor.submit(consumer);
            channel.put(item("a.jpg"));

            Thread.sleep(300);
            assertFalse(future.isDone());
            assertEquals(ConsumerState.RUNNING, consumer.getState());

            channel.put(item("b.jpg"));
            channel.complete();

            assertEquals(new StageReport(2, 0), future.get(5, TimeUnit.SECONDS));
            assertEquals(ConsumerState.DONE, consumer.getState());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testMissingOutputDir_ShouldBeCreated(@TempDir Path tempDir) throws InterruptedException {
        Path outputDir = tempDir.resolve("nested").resolve("consumer");
        WorkChannel channel = WorkChannel.unbounded();
        channel.put(item("photo.png"));
        channel.complete();

        StageReport report = new Consumer(channel, new JpegThumbnailWriter(0.75f), outputDir).call();

        assertEquals(new StageReport(1, 0), report);
        assertTrue(Files.isRegularFile(outputDir.resolve("photo-thumbnail.jpg")));
    }

    @Test
    void testInterrupted_ShouldStopWithInterruptedException(@TempDir Path tempDir) throws Exception {
        WorkChannel channel = WorkChannel.unbounded();
        Consumer consumer = new Consumer(channel, new RecordingWriter(null), tempDir);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<StageReport> future = executor.submit(consumer);
            Thread.sleep(100);

            executor.shutdownNow();

            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
            assertTrue(future.isDone());
            assertEquals(ConsumerState.RUNNING, consumer.getState());
        } finally {
            executor.shutdownNow();
        }
    }
}
