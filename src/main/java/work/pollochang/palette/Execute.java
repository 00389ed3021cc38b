package work.pollochang.palette;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import work.pollochang.palette.report.ExtractionParams;

import java.io.File;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "palette-extractor",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "批次圖片主色調萃取工具")
public class Execute implements Callable<Integer> {

    static final int MAX_COLOR_COUNT = 16;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-f", "--file-list"}, required = true, description = "包含圖片路徑的文字檔案。")
    private File fileList;

    @Option(names = {"-o", "--output-dir"}, required = true, description = "萃取報告 (JSON) 的儲存目錄。")
    private File saveDir;

    @Option(names = {"-c", "--color-count"}, defaultValue = "6", description = "每張圖片萃取的顏色數量，範圍 1 到 16 (預設: 6)。")
    private int colorCount;

    @Option(names = {"--include-transparent"}, defaultValue = "false", description = "納入半透明像素 (預設: false)。")
    private boolean includeTransparent;

    @Option(names = {"--suggestions"}, defaultValue = "false", description = "報告中附上和諧配色、補色與漸層建議 (預設: false)。")
    private boolean includeSuggestions;

    @Option(names = {"--timeOut"}, defaultValue = "24", description = "設定執行時間超時(小時) (預設: 24 小時)。")
    private long timeOutHr;

    @Option(names = {"--cache-db"}, defaultValue = "palette-extraction-cache", description = "H2 萃取快取資料庫的檔案路徑。")
    private File h2DbFile;

    @Option(names = {"--no-cache"}, defaultValue = "false", description = "停用 H2 萃取快取。")
    private boolean noCache;

    @Override
    public Integer call() throws Exception {
        if (colorCount < 1 || colorCount > MAX_COLOR_COUNT) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    String.format("--color-count 必須介於 1 到 %d 之間: %d", MAX_COLOR_COUNT, colorCount));
        }

        log.info("========================================萃取程式參數設定========================================");
        log.info("萃取任務開始");
        log.info("來源列表: {}", fileList.getAbsolutePath());
        log.info("輸出目錄: {}", saveDir.getAbsolutePath());
        log.info("萃取顏色數量: {}", colorCount);
        log.info("納入透明像素: {}", includeTransparent);
        log.info("附上配色建議: {}", includeSuggestions);
        log.info("設定超時執行時間: {} 小時", timeOutHr);
        log.info("萃取快取資料庫: {}", noCache ? "停用" : h2DbFile.getAbsolutePath());
        log.info("========================================萃取程式參數設定========================================");

        ExtractionParams params = new ExtractionParams(colorCount, includeTransparent, includeSuggestions);

        PaletteBatch paletteBatch = new PaletteBatch();
        paletteBatch.setFileListPath(fileList.getAbsolutePath());
        paletteBatch.setSaveDir(saveDir.getAbsolutePath());
        paletteBatch.setExtractionParams(params);
        paletteBatch.setTimeOutHr(timeOutHr);
        paletteBatch.setH2CachePath(noCache ? null : h2DbFile.toPath());
        paletteBatch.execute();

        log.info("所有任務執行完畢");
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }
}
