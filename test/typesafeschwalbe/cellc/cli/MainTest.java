package typesafeschwalbe.cellc.cli;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/** Tests the command line front end end to end */
public class MainTest {

    private static final String TOY = ""
        + "model \"Toy Model\";\n"
        + "time t;\n"
        + "param C_m = 1.0;\n"
        + "param g_ext;\n"
        + "var I_ion = g_ext * (V + 80) label cellular_current;\n"
        + "state V = -85.0 : -I_ion / C_m label membrane_potential;\n";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @Before
    public void setUp() {
        this.out = new ByteArrayOutputStream();
        this.err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return Main.run(
            args,
            new PrintStream(this.out, true, StandardCharsets.UTF_8),
            new PrintStream(this.err, true, StandardCharsets.UTF_8)
        );
    }

    private String errors() {
        return this.err.toString(StandardCharsets.UTF_8);
    }

    private File write(String name, String content) throws IOException {
        File file = this.folder.newFile(name);
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testExport() throws IOException {
        File model = this.write("toy.cell", TOY);
        File output = new File(this.folder.getRoot(), "ToyCell.hpp");
        int status = this.run(
            "-t", "chaste", "-c", "ToyCell", "-o", output.getPath(),
            model.getPath()
        );
        Assert.assertEquals(this.errors(), 0, status);
        String code = new String(
            Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8
        );
        Assert.assertTrue(code.contains("class ToyCell : public AbstractCardiacCell"));
        Assert.assertTrue(code.contains("        const double I_ion = g_ext * (V + 80.0);\n"));
        Assert.assertTrue(code.contains("this->mSystemName = \"Toy Model\";"));
    }

    @Test
    public void testDisplayNameOverride() throws IOException {
        File model = this.write("toy.cell", TOY);
        File output = new File(this.folder.getRoot(), "toy.c");
        int status = this.run(
            "--target", "ansic", "--class", "toy", "--output", output.getPath(),
            "--name", "Renamed", model.getPath()
        );
        Assert.assertEquals(this.errors(), 0, status);
        String code = new String(
            Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8
        );
        Assert.assertTrue(code.contains(" * Model: Renamed\n"));
    }

    @Test
    public void testReportsModelErrors() throws IOException {
        File model = this.write("broken.cell", "time t;\nvar x = ;\n");
        File output = new File(this.folder.getRoot(), "out.hpp");
        int status = this.run(
            "-t", "chaste", "-c", "Out", "-o", output.getPath(), "--nocolor",
            model.getPath()
        );
        Assert.assertEquals(1, status);
        Assert.assertTrue(this.errors().startsWith("error[syntax]: "));
        Assert.assertTrue(this.errors().contains("broken.cell:2:9"));
        Assert.assertFalse(output.exists());
    }

    @Test
    public void testReportsExportErrors() throws IOException {
        File model = this.write("toy.cell", TOY.replace(
            " label membrane_potential", ""
        ));
        File output = new File(this.folder.getRoot(), "out.hpp");
        int status = this.run(
            "-t", "chaste", "-c", "Out", "-o", output.getPath(), "-p",
            model.getPath()
        );
        Assert.assertEquals(1, status);
        Assert.assertTrue(this.errors().startsWith("error[missing-role]: "));
        Assert.assertTrue(this.errors().contains("  in model 'Toy Model'\n"));
        Assert.assertFalse(output.exists());
    }

    @Test
    public void testUnknownTargetAndMissingFile() throws IOException {
        File model = this.write("toy.cell", TOY);
        Assert.assertEquals(1, this.run(
            "-t", "fortran", "-c", "X", "-o", "x.f", "-p", model.getPath()
        ));
        Assert.assertTrue(this.errors().startsWith("error[unknown-target]: "));
        this.err.reset();
        Assert.assertEquals(1, this.run(
            "-t", "chaste", "-c", "X", "-o", "x.hpp", "-p",
            new File(this.folder.getRoot(), "absent.cell").getPath()
        ));
        Assert.assertTrue(this.errors().startsWith("error[io]: "));
        this.err.reset();
        Assert.assertEquals(1, this.run("-t", "chaste", "-c", "X", "-o", "x"));
        Assert.assertTrue(this.errors().contains("error[invalid-argument]: "));
    }

    @Test
    public void testHelp() {
        Assert.assertEquals(0, this.run("--help"));
        Assert.assertTrue(
            this.out.toString(StandardCharsets.UTF_8).contains("--target")
        );
    }

}
