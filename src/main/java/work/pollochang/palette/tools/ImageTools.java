package work.pollochang.palette.tools;

import java.awt.image.BufferedImage;

public class ImageTools {

    /**
     * 將圖片轉為每像素 4 bytes (R, G, B, A) 的緩衝區，逐列由左至右排列。
     * 沒有 Alpha 通道的圖片一律視為不透明。
     */
    public static byte[] toRgbaBuffer(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);

        byte[] rgba = new byte[width * height * 4];
        for (int i = 0; i < argb.length; i++) {
            int pixel = argb[i];
            int offset = i * 4;
            rgba[offset] = (byte) (pixel >> 16);
            rgba[offset + 1] = (byte) (pixel >> 8);
            rgba[offset + 2] = (byte) pixel;
            rgba[offset + 3] = (byte) (pixel >>> 24);
        }
        return rgba;
    }
}
