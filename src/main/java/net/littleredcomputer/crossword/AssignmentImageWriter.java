// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Draws a filled crossword as a PNG image: open cells are white squares on a black
 * background, each holding its letter.
 */
public class AssignmentImageWriter {
    private static final int cellSize = 100;
    private static final int cellBorder = 2;
    private static final int interiorSize = cellSize - 2 * cellBorder;

    private final Crossword crossword;
    private final Assignment assignment;

    public AssignmentImageWriter(Crossword crossword, Assignment assignment) {
        this.crossword = crossword;
        this.assignment = assignment;
    }

    BufferedImage render() {
        BufferedImage image = new BufferedImage(
                crossword.width() * cellSize, crossword.height() * cellSize, BufferedImage.TYPE_INT_RGB);
        char[][] letters = assignment.letterGrid(crossword);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 80));
            FontMetrics fm = g.getFontMetrics();
            for (int i = 0; i < crossword.height(); ++i) {
                for (int j = 0; j < crossword.width(); ++j) {
                    if (!crossword.isOpen(i, j)) continue;
                    final int x = j * cellSize + cellBorder;
                    final int y = i * cellSize + cellBorder;
                    g.setColor(Color.WHITE);
                    g.fillRect(x, y, interiorSize, interiorSize);
                    if (letters[i][j] == 0) continue;
                    String letter = String.valueOf(letters[i][j]);
                    g.setColor(Color.BLACK);
                    g.drawString(letter,
                            x + (interiorSize - fm.stringWidth(letter)) / 2,
                            y + (interiorSize - fm.getHeight()) / 2 + fm.getAscent());
                }
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    public void write(Path file) throws IOException {
        if (!ImageIO.write(render(), "png", file.toFile())) {
            throw new IOException("no PNG writer available");
        }
    }
}
