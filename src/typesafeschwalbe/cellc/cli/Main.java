package typesafeschwalbe.cellc.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.Exporter;
import typesafeschwalbe.cellc.compiler.Result;
import typesafeschwalbe.cellc.compiler.Target;
import typesafeschwalbe.cellc.compiler.TargetRegistry;
import typesafeschwalbe.cellc.compiler.frontend.ModelParser;
import typesafeschwalbe.cellc.compiler.ir.Model;

public class Main {

    private static final TargetRegistry TARGETS = TargetRegistry.defaults();

    static final Cli.RequiredArgument TARGET = new Cli.RequiredArgument(
        't', "target", "specifies the target to export for",
        String.join(
            " / ",
            TARGETS.targetNames().stream()
                .map(t -> "'" + t + "'")
                .toArray(String[]::new)
        )
    );
    static final Cli.RequiredArgument CLASS_NAME = new Cli.RequiredArgument(
        'c', "class", "specifies the name of the generated class",
        "class name"
    );
    static final Cli.RequiredArgument OUTPUT = new Cli.RequiredArgument(
        'o', "output", "specifies the output file path",
        "output file path"
    );
    static final Cli.OptionalArgument MODEL_NAME = new Cli.OptionalArgument(
        'n', "name",
        "specifies the display name of the model (defaults to its own name)",
        "display name"
    );
    static final Cli.Flag NO_COLOR = new Cli.Flag(
        'p', "nocolor", "disables colored output"
    );

    public static void main(String[] args) {
        int status = Main.run(args, System.out, System.err);
        if(status != 0) {
            System.exit(status);
        }
    }

    static Cli createCli() {
        return new Cli()
            .add(TARGET).add(CLASS_NAME).add(OUTPUT).add(MODEL_NAME)
            .add(NO_COLOR);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        // color is always disabled if we think we are on Windows
        boolean onWindows = System.getProperty("os.name")
            .toLowerCase().contains("win");
        // parse CLI arguments
        Cli cli = Main.createCli();
        Result<Cli.Values> cliParseResult = cli.parse(args);
        if(cliParseResult.isError()) {
            return Main.reportErrors(
                cliParseResult.getError(), new HashMap<>(), !onWindows, err
            );
        }
        Cli.Values cliValues = cliParseResult.getValue();
        if(cliValues.helpRequested()) {
            out.print(cli.usage());
            return 0;
        }
        boolean colored = !cliValues.get(NO_COLOR) && !onWindows;
        Map<String, String> files = new HashMap<>();
        if(cliValues.free().size() != 1) {
            return Main.reportErrors(
                List.of(new Error(
                    Error.Kind.INVALID_ARGUMENT,
                    "Expected exactly one model file, but got "
                        + cliValues.free().size(),
                    cliValues.free()
                )),
                files, colored, err
            );
        }
        String fileName = cliValues.free().get(0);
        try {
            // read the model
            String fileContent = Main.readFile(fileName);
            files.put(fileName, fileContent);
            Model model = ModelParser.parse(fileName, fileContent);
            // find the target and export
            Target target = TARGETS.require(cliValues.get(TARGET));
            Result<Exporter.Output> exported = Exporter.export(
                model, target, cliValues.get(CLASS_NAME),
                cliValues.get(MODEL_NAME).orElse(model.name())
            );
            if(exported.isError()) {
                return Main.reportErrors(
                    exported.getError(), files, colored, err
                );
            }
            Main.writeFile(exported.getValue().code(), cliValues.get(OUTPUT));
        } catch(ErrorException e) {
            return Main.reportErrors(List.of(e.error), files, colored, err);
        }
        return 0;
    }

    private static String readFile(String path) throws ErrorException {
        try {
            byte[] fileBytes = Files.readAllBytes(Paths.get(path));
            return new String(fileBytes, StandardCharsets.UTF_8);
        } catch(IOException e) {
            throw new ErrorException(new Error(
                Error.Kind.IO,
                "Unable to read file '" + path + "': "
                    + "'" + e.getMessage() + "'",
                List.of(path)
            ));
        }
    }

    private static void writeFile(String content, String path)
            throws ErrorException {
        byte[] contentBytes = content.getBytes(StandardCharsets.UTF_8);
        try {
            Files.write(Paths.get(path), contentBytes);
        } catch(IOException e) {
            throw new ErrorException(new Error(
                Error.Kind.IO,
                "Unable to write to file '" + path + "': "
                    + "'" + e.getMessage() + "'",
                List.of(path)
            ));
        }
    }

    private static int reportErrors(
        List<Error> errors, Map<String, String> files, boolean colored,
        PrintStream err
    ) {
        for(Error error: errors) {
            err.print(error.render(files, colored));
        }
        return 1;
    }

}
