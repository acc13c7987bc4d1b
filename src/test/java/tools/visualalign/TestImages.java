package tools.visualalign;

import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Random;
import tools.visualalign.domain.image.GrayscaleImage;

/**
 * Synthetic page images for tests.
 */
public final class TestImages {
  private TestImages() {}

  public static GrayscaleImage blank(int width, int height) {
    return GrayscaleImage.filled(width, height, GrayscaleImage.WHITE);
  }

  /**
   * @return A white page with a black square whose top-left corner is at {@code (x, y)}.
   */
  public static GrayscaleImage square(int width, int height, int x, int y, int side) {
    BufferedImage image = whiteCanvas(width, height);
    Graphics2D graphics = image.createGraphics();
    graphics.setColor(Color.BLACK);
    graphics.fillRect(x, y, side, side);
    graphics.dispose();

    return GrayscaleImage.fromBufferedImage(image);
  }

  /**
   * A busy page of text lines and shapes, drawn with every element offset by {@code (dx, dy)}.
   * The same seed always yields the same layout.
   */
  public static GrayscaleImage page(int width, int height, int dx, int dy, long seed) {
    BufferedImage image = whiteCanvas(width, height);
    Graphics2D graphics = image.createGraphics();
    graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING,
        RenderingHints.VALUE_ANTIALIAS_OFF);
    graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING,
        RenderingHints.VALUE_TEXT_ANTIALIAS_OFF);
    graphics.translate(dx, dy);
    graphics.setColor(Color.BLACK);

    Random random = new Random(seed);
    int margin = Math.max(4, Math.min(40, Math.min(width, height) / 10));
    int xRange = Math.max(1, width - 2 * margin - 60);
    int yRange = Math.max(1, height - 2 * margin - 60);
    for (int i = 0; i < 25; i++) {
      int x = margin + random.nextInt(xRange);
      int y = margin + random.nextInt(yRange);
      int w = 8 + random.nextInt(50);
      int h = 8 + random.nextInt(50);
      switch (random.nextInt(3)) {
        case 0:
          graphics.fillRect(x, y, w, h);
          break;
        case 1:
          graphics.fillOval(x, y, w, h);
          break;
        default:
          graphics.drawLine(x, y, x + w, y + h);
          break;
      }
    }

    graphics.setFont(new Font(Font.SERIF, Font.BOLD, 18));
    for (int line = 0; line < 12; line++) {
      StringBuilder text = new StringBuilder();
      for (int c = 0; c < 20; c++) {
        text.append((char) ('A' + random.nextInt(26)));
      }
      graphics.drawString(text.toString(), margin, margin + 20 + line * 28);
    }
    graphics.dispose();

    return GrayscaleImage.fromBufferedImage(image);
  }

  /**
   * @return A page whose content is a filled rectangle and nothing else.
   */
  public static GrayscaleImage rectangle(int width, int height, int x, int y, int w, int h) {
    BufferedImage image = whiteCanvas(width, height);
    Graphics2D graphics = image.createGraphics();
    graphics.setColor(Color.BLACK);
    graphics.fillRect(x, y, w, h);
    graphics.dispose();

    return GrayscaleImage.fromBufferedImage(image);
  }

  /**
   * @return The same samples stored as a three-channel RGB image.
   */
  public static BufferedImage toRgb(GrayscaleImage image) {
    BufferedImage rgb =
        new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
    for (int y = 0; y < image.getHeight(); y++) {
      for (int x = 0; x < image.getWidth(); x++) {
        int v = image.get(x, y);
        rgb.setRGB(x, y, (v << 16) | (v << 8) | v);
      }
    }
    return rgb;
  }

  private static BufferedImage whiteCanvas(int width, int height) {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
    Graphics2D graphics = image.createGraphics();
    graphics.setColor(Color.WHITE);
    graphics.fillRect(0, 0, width, height);
    graphics.dispose();

    return image;
  }
}
