package net.littleredcomputer.crossword;

import com.google.common.base.Strings;
import com.google.common.io.Files;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

/**
 * Draws an assignment on the crossword's grid, as text or as an image.
 */
public class CrosswordRenderer {
    static final char BLOCK = '█';
    static final int CELL_SIZE = 100;
    static final int CELL_BORDER = 2;
    private static final int INTERIOR_SIZE = CELL_SIZE - 2 * CELL_BORDER;

    private final Crossword crossword;

    public CrosswordRenderer(Crossword crossword) {
        this.crossword = crossword;
    }

    /**
     * @return the letter at each cell, or null where the assignment places none
     */
    public Character[][] letterGrid(Assignment assignment) {
        Character[][] letters = new Character[crossword.height()][crossword.width()];
        assignment.asMap().forEach((s, w) -> {
            for (int k = 0; k < w.length(); ++k) {
                int[] c = s.cell(k);
                letters[c[0]][c[1]] = w.charAt(k);
            }
        });
        return letters;
    }

    /**
     * @return one line per row: blocked cells as a solid block, empty fillable cells as a space
     */
    public String toText(Assignment assignment) {
        Character[][] letters = letterGrid(assignment);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < crossword.height(); ++i) {
            for (int j = 0; j < crossword.width(); ++j) {
                if (!crossword.isFillable(i, j)) sb.append(BLOCK);
                else sb.append(letters[i][j] == null ? ' ' : letters[i][j]);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public BufferedImage toImage(Assignment assignment) {
        Character[][] letters = letterGrid(assignment);
        BufferedImage img = new BufferedImage(crossword.width() * CELL_SIZE, crossword.height() * CELL_SIZE,
                BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, img.getWidth(), img.getHeight());
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 80));
            for (int i = 0; i < crossword.height(); ++i) {
                for (int j = 0; j < crossword.width(); ++j) {
                    if (!crossword.isFillable(i, j)) continue;
                    int x = j * CELL_SIZE + CELL_BORDER;
                    int y = i * CELL_SIZE + CELL_BORDER;
                    g.setColor(Color.WHITE);
                    g.fillRect(x, y, INTERIOR_SIZE, INTERIOR_SIZE);
                    if (letters[i][j] == null) continue;
                    String letter = String.valueOf(letters[i][j]);
                    FontMetrics fm = g.getFontMetrics();
                    g.setColor(Color.BLACK);
                    g.drawString(letter,
                            x + (INTERIOR_SIZE - fm.stringWidth(letter)) / 2,
                            y + (INTERIOR_SIZE - fm.getHeight()) / 2 + fm.getAscent());
                }
            }
        } finally {
            g.dispose();
        }
        return img;
    }

    /**
     * Save the image of an assignment. The format follows the file's extension (png if none).
     */
    public void writeImage(Assignment assignment, File file) throws IOException {
        String format = Strings.emptyToNull(Files.getFileExtension(file.getName()));
        if (format == null) format = "png";
        if (!ImageIO.write(toImage(assignment), format, file)) {
            throw new IllegalArgumentException("unsupported image format: " + format);
        }
    }
}
