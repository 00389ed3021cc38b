package work.pollochang.palette.exception;

/**
 * HEX 色碼格式錯誤。訊息中一律帶有原始輸入字串。
 */
public class InvalidColorFormatException extends IllegalArgumentException {

    private final String input;

    public InvalidColorFormatException(String input) {
        super("無效的 HEX 色碼: " + input);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
