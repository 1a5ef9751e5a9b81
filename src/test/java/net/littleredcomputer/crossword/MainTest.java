// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertThat;

public class MainTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(bytes, true);

    private String file(String name, String contents) throws IOException {
        File f = folder.newFile(name);
        Files.write(f.toPath(), contents.getBytes(StandardCharsets.UTF_8));
        return f.getPath();
    }

    private String output() {
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void solves() throws IOException {
        String structure = file("structure.txt", "____\n_##_\n____\n");
        String words = file("words.txt", "snow\nsoak\nnext\nsoap\nten\nsun\npet\n");
        assertThat(Main.run(new String[]{"-structure", structure, "-words", words}, out), is(Main.SOLVED));
        assertThat(output(), is("SOAP\nU##E\nNEXT\n"));
    }

    private int runWithImage(String image) throws IOException {
        String structure = file("structure.txt", "____\n_##_\n____\n");
        String words = file("words.txt", "snow\nsoak\nnext\nsoap\nten\nsun\npet\n");
        try {
            return Main.run(new String[]{"-structure", structure, "-words", words, "-output", image}, out);
        } catch (RuntimeException | Error e) {
            // Text rendering needs fonts, which a bare headless JRE may not have.
            Assume.assumeNoException(e);
            throw e;
        }
    }

    @Test
    public void writesImage() throws IOException {
        File image = new File(folder.getRoot(), "solution.png");
        assertThat(runWithImage(image.getPath()), is(Main.SOLVED));
        assertThat(output(), is("SOAP\nU##E\nNEXT\n"));
        BufferedImage png = ImageIO.read(image);
        assertThat(png.getWidth(), is(400));
        assertThat(png.getHeight(), is(300));
    }

    @Test
    public void unwritableImageStillSolved() throws IOException {
        File image = new File(new File(folder.getRoot(), "nodir"), "solution.png");
        assertThat(runWithImage(image.getPath()), is(Main.SOLVED));
        assertThat(output(), startsWith("SOAP\nU##E\nNEXT\n"));
        assertThat(output(), containsString("Could not save image"));
        assertThat(image.exists(), is(false));
    }

    @Test
    public void noSolution() throws IOException {
        String structure = file("structure.txt", "#_#\n___\n#_#\n");
        String words = file("words.txt", "cat\ndog\n");
        assertThat(Main.run(new String[]{"-structure", structure, "-words", words}, out), is(Main.NO_SOLUTION));
        assertThat(output(), startsWith("No solution found"));
    }

    @Test
    public void searchLimit() throws IOException {
        String structure = file("structure.txt", "____\n_##_\n____\n");
        String words = file("words.txt", "snow\nsoak\nnext\nsoap\nten\nsun\npet\n");
        assertThat(Main.run(new String[]{"-structure", structure, "-words", words, "-steplimit", "2"}, out),
                is(Main.LIMIT_REACHED));
    }

    @Test
    public void missingFile() throws IOException {
        String words = file("words.txt", "cat\n");
        String missing = new File(folder.getRoot(), "nope.txt").getPath();
        assertThat(Main.run(new String[]{"-structure", missing, "-words", words}, out), is(Main.INVALID_INPUT));
        assertThat(output(), startsWith("Invalid input"));
    }

    @Test
    public void raggedStructure() throws IOException {
        String structure = file("structure.txt", "___\n__\n");
        String words = file("words.txt", "cat\n");
        assertThat(Main.run(new String[]{"-structure", structure, "-words", words}, out), is(Main.INVALID_INPUT));
    }

    @Test
    public void missingOption() {
        assertThat(Main.run(new String[]{"-words", "words.txt"}, out), is(Main.INVALID_INPUT));
    }

    @Test
    public void badDuration() throws IOException {
        String structure = file("structure.txt", "___\n");
        String words = file("words.txt", "cat\n");
        assertThat(Main.run(new String[]{"-structure", structure, "-words", words, "-timelimit", "soon"}, out),
                is(Main.INVALID_INPUT));
    }
}
