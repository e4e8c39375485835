package lox.lang;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class Lox {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 64;
    static final int EXIT_DATA_ERROR = 65;
    static final int EXIT_NO_INPUT = 66;
    static final int EXIT_SOFTWARE = 70;

    public static void main(String[] args) {
        var lox = new Lox(System.in, System.out, System.err);
        System.exit(lox.execute(args));
    }

    private final @NonNull InputStream in;
    private final @NonNull PrintStream out;
    private final @NonNull PrintStream err;

    int execute(String... args) {
        if (args.length == 0) {
            try {
                return runPrompt();
            } catch (IOException ex) {
                err.println("Failed to read input: " + ex.getMessage());
                return EXIT_NO_INPUT;
            }
        }
        if (args.length != 2) {
            err.println("Usage: lox [tokenize|parse|evaluate <file>]");
            return EXIT_USAGE;
        }

        String source;
        try {
            source = readSource(args[1]);
        } catch (IOException ex) {
            err.println("Failed to read file " + args[1] + ": " + ex.getMessage());
            return EXIT_NO_INPUT;
        }

        switch (args[0]) {
            case "tokenize":
                return tokenize(source);
            case "parse":
                return parse(source);
            case "evaluate":
                return evaluate(source);
            default:
                err.println("Unknown command: " + args[0]);
                return EXIT_USAGE;
        }
    }

    private String readSource(String path) throws IOException {
        byte[] bytes;
        if ("-".equals(path)) {
            bytes = in.readAllBytes();
        } else {
            bytes = Files.readAllBytes(Paths.get(path));
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    int tokenize(String source) {
        var reporter = new Reporter();
        var tokens = new Scanner(source, reporter).getTokens();
        tokens.forEach(out::println);
        return report(reporter);
    }

    int parse(String source) {
        var reporter = new Reporter();
        var tokens = new Scanner(source, reporter).getTokens();
        var expr = new Parser(tokens, reporter).parse();
        if (reporter.hadError()) {
            return report(reporter);
        }
        out.println(new AstPrinter().print(expr));
        return EXIT_OK;
    }

    int evaluate(String source) {
        return run(source, new Flags());
    }

    private int runPrompt() throws IOException {
        var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        var flags = new Flags();
        for (;;) {
            out.print("> ");
            out.flush();
            var line = reader.readLine();

            if (line == null || ":q".equals(line)) {
                break;
            } else if (line.startsWith(":tok")) {
                var arg = line.substring(4).trim();
                if (!arg.isBlank()) {
                    flags.printTokens = Boolean.parseBoolean(arg);
                }
                out.println("print tokens: " + flags.printTokens);
            } else if (line.startsWith(":ast")) {
                var arg = line.substring(4).trim();
                if (!arg.isBlank()) {
                    flags.printAst = Boolean.parseBoolean(arg);
                }
                out.println("print ast: " + flags.printAst);
            } else if (!line.isBlank()) {
                // every line gets a fresh pipeline
                run(line, flags);
            }
        }
        return EXIT_OK;
    }

    private int run(String source, Flags flags) {
        var reporter = new Reporter();
        var tokens = new Scanner(source, reporter).getTokens();

        if (flags.printTokens) {
            tokens.forEach(out::println);
        }

        var expr = new Parser(tokens, reporter).parse();
        if (reporter.hadError()) {
            return report(reporter);
        }

        if (flags.printAst) {
            out.println(new AstPrinter().print(expr));
        }

        var interpreter = new Interpreter();
        var value = interpreter.evaluate(expr);
        out.println(value.map(Value::display).orElse(""));

        if (interpreter.hasErrors()) {
            interpreter.getErrors().forEach(err::println);
            return EXIT_SOFTWARE;
        }
        return EXIT_OK;
    }

    private int report(Reporter reporter) {
        reporter.getErrors().forEach(err::println);
        return reporter.hadError() ? EXIT_DATA_ERROR : EXIT_OK;
    }

    private static class Flags {
        boolean printTokens = false;
        boolean printAst = false;
    }
}
