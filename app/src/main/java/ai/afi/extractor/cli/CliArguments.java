package ai.afi.extractor.cli;

import ai.afi.extractor.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "afi-extractor", mixinStandardHelpOptions = true,
        version = "afi-extractor 0.1.0",
        description = "Extracts Areas for Improvement and their recommendations from .docx/.pdf reports into a workbook")
public class CliArguments {

    @CommandLine.Option(names = "--input-dir", description = "Directory scanned for .docx and .pdf documents", paramLabel = "DIR")
    private Path inputDirectory;

    @CommandLine.Option(names = "--output", description = "Workbook the rows are appended to", paramLabel = "XLSX")
    private Path outputWorkbook;

    @CommandLine.Option(names = "--sheet", description = "Sheet name inside the workbook", paramLabel = "NAME")
    private String sheetName;

    @CommandLine.Option(names = "--fail-fast", description = "Abort the whole run on the first unreadable document")
    private boolean failFast;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path inputDirectory() {
        return inputDirectory;
    }

    public Path outputWorkbook() {
        return outputWorkbook;
    }

    public String sheetName() {
        return sheetName;
    }

    public boolean failFast() {
        return failFast;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
