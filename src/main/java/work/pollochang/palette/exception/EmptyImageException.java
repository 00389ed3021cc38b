package work.pollochang.palette.exception;

/**
 * 取樣與 alpha 過濾後沒有任何可用像素，無法進行萃取。
 */
public class EmptyImageException extends RuntimeException {

    private final int width;
    private final int height;

    public EmptyImageException(int width, int height) {
        super(String.format("圖片 %dx%d 中找不到可用的像素", width, height));
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }
}
