package net.littleredcomputer.crossword;

import com.google.common.base.Charsets;
import com.google.common.io.Files;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class MainTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream stdout;
    private File structure;
    private File words;

    @Before
    public void setUp() throws IOException {
        stdout = System.out;
        System.setOut(new PrintStream(out, true, "UTF-8"));
        structure = folder.newFile("structure.txt");
        Files.asCharSink(structure, Charsets.UTF_8).write("___\n##_\n##_\n");
        words = folder.newFile("words.txt");
        Files.asCharSink(words, Charsets.UTF_8).write("cat\ndog\nand\n");
    }

    @After
    public void tearDown() {
        System.setOut(stdout);
    }

    @Test
    public void printsSolution() throws Exception {
        assertThat(Main.run(new String[]{"-structure", structure.getPath(), "-words", words.getPath()}), is(0));
        assertThat(new String(out.toByteArray(), Charsets.UTF_8), is("AND\n██O\n██G\n"));
    }

    @Test
    public void fullPropagation() throws Exception {
        Main.run(new String[]{"-structure", structure.getPath(), "-words", words.getPath(),
                "-propagation", "full", "-loginterval", "PT0.5S"});
        assertThat(new String(out.toByteArray(), Charsets.UTF_8), is("AND\n██O\n██G\n"));
    }

    @Test
    public void noSolution() throws Exception {
        File corner = folder.newFile("corner.txt");
        Files.asCharSink(corner, Charsets.UTF_8).write(Puzzles.CORNER);
        File catDog = folder.newFile("catdog.txt");
        Files.asCharSink(catDog, Charsets.UTF_8).write("cat\ndog\n");
        assertThat(Main.run(new String[]{"-structure", corner.getPath(), "-words", catDog.getPath()}), is(1));
        assertThat(new String(out.toByteArray(), Charsets.UTF_8), is("No solution." + System.lineSeparator()));
    }

    @Test
    public void writesImage() throws Exception {
        File image = new File(folder.getRoot(), "out.png");
        assertThat(Main.run(new String[]{"-structure", structure.getPath(), "-words", words.getPath(),
                "-output", image.getPath()}), is(0));
        BufferedImage img = ImageIO.read(image);
        assertThat(img.getWidth(), is(3 * CrosswordRenderer.CELL_SIZE));
        assertThat(img.getHeight(), is(3 * CrosswordRenderer.CELL_SIZE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void structureIsRequired() throws Exception {
        Main.run(new String[]{"-words", words.getPath()});
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownPropagation() throws Exception {
        Main.run(new String[]{"-structure", structure.getPath(), "-words", words.getPath(), "-propagation", "sideways"});
    }
}
