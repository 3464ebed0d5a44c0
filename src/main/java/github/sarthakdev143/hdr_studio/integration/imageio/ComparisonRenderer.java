package github.sarthakdev143.hdr_studio.integration.imageio;

import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer8;
import org.springframework.stereotype.Component;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.font.TextLayout;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

@Component
public class ComparisonRenderer {

    static final int SEPARATOR_WIDTH = 10;
    static final String ORIGINAL_LABEL = "ORIGINAL (8-bit)";
    static final String GRADED_LABEL = "GRADED (16-bit)";

    private static final int LABEL_MARGIN_X = 30;
    private static final int LABEL_BASELINE_Y = 60;
    private static final int MIN_FONT_SIZE = 12;
    private static final int MAX_FONT_SIZE = 48;
    private static final float OUTLINE_WIDTH = 3.0f;

    public BufferedImage render(RasterBuffer8 original, RasterBuffer8 graded) {
        int width = original.width();
        int height = original.height();
        BufferedImage comparison = new BufferedImage(width * 2 + SEPARATOR_WIDTH, height, BufferedImage.TYPE_INT_RGB);

        Graphics2D graphics = comparison.createGraphics();
        try {
            graphics.setColor(Color.BLACK);
            graphics.fillRect(0, 0, comparison.getWidth(), height);
            graphics.drawImage(RasterImages.toBufferedImage(original), 0, 0, null);

            // Graded half is always scaled to the original's size.
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(RasterImages.toBufferedImage(graded), width + SEPARATOR_WIDTH, 0, width, height, null);

            graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            Font font = new Font(Font.SANS_SERIF, Font.BOLD, fontSizeFor(width));
            drawOutlinedLabel(graphics, font, ORIGINAL_LABEL, LABEL_MARGIN_X, LABEL_BASELINE_Y);
            drawOutlinedLabel(graphics, font, GRADED_LABEL, width + SEPARATOR_WIDTH + LABEL_MARGIN_X, LABEL_BASELINE_Y);
        } finally {
            graphics.dispose();
        }
        return comparison;
    }

    private void drawOutlinedLabel(Graphics2D graphics, Font font, String text, int x, int baselineY) {
        TextLayout layout = new TextLayout(text, font, graphics.getFontRenderContext());
        Shape outline = layout.getOutline(AffineTransform.getTranslateInstance(x, baselineY));
        graphics.setStroke(new BasicStroke(OUTLINE_WIDTH, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
        graphics.setColor(Color.WHITE);
        graphics.draw(outline);
        graphics.setColor(Color.BLACK);
        graphics.fill(outline);
    }

    private int fontSizeFor(int halfWidth) {
        return Math.max(MIN_FONT_SIZE, Math.min(MAX_FONT_SIZE, halfWidth / 16));
    }
}
