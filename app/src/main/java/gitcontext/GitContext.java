package gitcontext;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import gitcontext.cli.commands.ShowCommand;
import gitcontext.cli.exceptions.GitExecutionExceptionHandler;
import gitcontext.cli.exceptions.GitParameterExceptionHandler;
import gitcontext.cli.mixins.GlobalOptionsMixin;
import gitcontext.cli.mixins.VersionProvider;

@Command(name = "git-context", description = "Read commit, branch and tag metadata straight from a .git directory", versionProvider = VersionProvider.class, mixinStandardHelpOptions = true, subcommands = {
                ShowCommand.class,
                CommandLine.HelpCommand.class
}, footer = {
                "",
                "Examples:",
                "  git-context show                           Print metadata for the current repository",
                "  git-context show -C path/to/checkout       Start looking for .git from another directory",
                "  git-context show --format properties -o git.properties",
                "                                             Write the values as build-time properties",
                "  git-context --version                      Show version information"
})
public class GitContext implements Runnable {
        @Mixin
        private GlobalOptionsMixin globalOptions;

        public static void main(String[] args) {
                System.exit(newCommandLine().execute(args));
        }

        static CommandLine newCommandLine() {
                CommandLine commandLine = new CommandLine(new GitContext())
                                .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO))
                                .setExecutionExceptionHandler(new GitExecutionExceptionHandler())
                                .setParameterExceptionHandler(new GitParameterExceptionHandler())
                                .setUsageHelpAutoWidth(true);

                commandLine.setAbbreviatedSubcommandsAllowed(true);
                commandLine.setCaseInsensitiveEnumValuesAllowed(true);
                return commandLine;
        }

        @Override
        public void run() {
                // When no subcommand is specified, show help
                CommandLine.usage(this, System.out);
        }
}
