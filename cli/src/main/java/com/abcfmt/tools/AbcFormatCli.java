package com.abcfmt.tools;

import com.abcfmt.Version;
import com.abcfmt.format.AbcFormatter;
import com.abcfmt.format.FormatterOptions;
import com.abcfmt.loader.AbcLoader;
import com.abcfmt.loader.LoaderException;
import com.abcfmt.loader.LoaderMessage;
import com.abcfmt.loader.LoaderResult;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line front end: formats ABC files to stdout, in place with {@code --write}, or reports
 * the files that are not formatted with {@code --check}.
 */
public final class AbcFormatCli {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "Usage: abcfmt [--check] [--write] [--no-align] [--system-comments] file...";

    private AbcFormatCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean check = false;
        boolean write = false;
        FormatterOptions.Builder options;
        try {
            options = FormatterOptions.load().toBuilder();
        } catch (IllegalArgumentException ex) {
            err.println("abcfmt: " + ex.getMessage());
            return EXIT_USAGE;
        }
        List<Path> files = new ArrayList<>();
        for (String arg : args) {
            switch (arg) {
                case "--check":
                    check = true;
                    break;
                case "--write":
                    write = true;
                    break;
                case "--no-align":
                    options.align(false);
                    break;
                case "--system-comments":
                    options.systemComments(true);
                    break;
                case "--version":
                    out.println(Version.banner());
                    return EXIT_OK;
                case "--help":
                    out.println(USAGE);
                    return EXIT_OK;
                default:
                    if (arg.startsWith("--")) {
                        err.println("abcfmt: unknown option " + arg);
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    files.add(Path.of(arg));
            }
        }
        if (files.isEmpty() || (check && write)) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        AbcFormatter formatter = new AbcFormatter(options.build());
        AbcLoader loader = new AbcLoader();
        int status = EXIT_OK;
        for (Path file : files) {
            try {
                String original = Files.readString(file, StandardCharsets.UTF_8);
                LoaderResult result = loader.load(file.toString(), original);
                for (LoaderMessage message : result.getMessages()) {
                    if (message.isReportable()) {
                        err.println(message);
                    }
                }
                String formatted = formatter.format(result.getFile(), result.getAnalysis());
                if (check) {
                    if (!formatted.equals(original)) {
                        out.println(file);
                        status = EXIT_FAILURE;
                    }
                } else if (write) {
                    if (!formatted.equals(original)) {
                        Files.writeString(file, formatted, StandardCharsets.UTF_8);
                    }
                } else {
                    out.print(formatted);
                }
            } catch (LoaderException | IOException ex) {
                err.println("abcfmt: " + ex.getMessage());
                status = EXIT_FAILURE;
            }
        }
        return status;
    }
}
