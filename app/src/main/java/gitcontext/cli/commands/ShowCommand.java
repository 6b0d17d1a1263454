package gitcontext.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import gitcontext.cli.mixins.GlobalOptionsMixin;
import gitcontext.cli.mixins.RepositoryMixin;
import gitcontext.cli.utils.ColorOutput;
import gitcontext.cli.utils.ContextValues;
import gitcontext.core.repository.GitRepositoryReader;

@Command(name = "show", description = "Print the commit hash, branch, author, date, message, parents and tags of HEAD", mixinStandardHelpOptions = true, header = "Display repository metadata for HEAD", footer = {
        "",
        "Examples:",
        "  git-context show                                  Human-readable listing",
        "  git-context show --strict                         Fail if anything cannot be read",
        "  git-context show --format properties              git.* properties on stdout",
        "  git-context show --format properties -o out.txt   git.* properties written to a file"
})
public class ShowCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ShowCommand.class);

    public enum Format {
        TEXT, PROPERTIES
    }

    @Spec
    private CommandSpec spec;

    @Mixin
    private GlobalOptionsMixin globalOptions;

    @Mixin
    private RepositoryMixin repositoryMixin;

    @Option(names = {
            "--format" }, paramLabel = "<format>", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})", defaultValue = "TEXT")
    private Format format;

    @Option(names = { "-o", "--output" }, paramLabel = "<file>", description = "Write to <file> instead of standard output")
    private Path output;

    @Override
    public Integer call() throws Exception {
        globalOptions.configureLogging();
        ColorOutput.setColorEnabled(globalOptions.isColorEnabled() && output == null && format == Format.TEXT);

        GitRepositoryReader reader = repositoryMixin.getReader();
        if (reader.getGitDirectory().isEmpty() && !globalOptions.isQuiet()) {
            spec.commandLine().getErr().println("warning: not a git repository (or any of the parent directories): .git");
        }

        ContextValues values = ContextValues.read(reader);
        String rendered = format == Format.PROPERTIES ? renderProperties(values) : renderText(values);

        if (output != null) {
            Files.write(output, rendered.getBytes(StandardCharsets.UTF_8));
            logger.info("Wrote repository metadata to {}", output);
        } else {
            PrintWriter out = spec.commandLine().getOut();
            out.print(rendered);
            out.flush();
        }
        return 0;
    }

    private String renderText(ContextValues values) {
        StringBuilder text = new StringBuilder();
        for (Map.Entry<String, String> entry : values.toDisplayMap().entrySet()) {
            text.append(ColorOutput.bold(entry.getKey() + ":"))
                    .append(' ')
                    .append(colorFor(entry.getKey(), entry.getValue()))
                    .append(System.lineSeparator());
        }
        return text.toString();
    }

    private String colorFor(String label, String value) {
        switch (label) {
            case "Hash":
            case "Parents":
                return ColorOutput.yellow(value);
            case "Branch":
                return ColorOutput.green(value);
            case "Tags":
                return ColorOutput.cyan(value);
            default:
                return value;
        }
    }

    private String renderProperties(ContextValues values) throws IOException {
        Writer writer = new StringWriter();
        values.toProperties().store(writer, "Generated by git-context");
        return writer.toString();
    }
}
