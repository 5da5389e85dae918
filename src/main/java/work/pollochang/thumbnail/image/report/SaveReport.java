package work.pollochang.thumbnail.image.report;

import work.pollochang.thumbnail.image.core.ProcessResult;

import java.nio.file.Path;

public record SaveReport(ProcessResult result, Path outputFile, long size, String detail) {

    public static SaveReport saved(Path outputFile, long size) {
        return new SaveReport(ProcessResult.SAVED, outputFile, size, null);
    }

    public static SaveReport failed(ProcessResult result, Path outputFile, String detail) {
        return new SaveReport(result, outputFile, 0, detail);
    }
}
