package com.fixcraft.qrtransfer.cli;

import com.fixcraft.qrtransfer.ChunkCipher;
import com.fixcraft.qrtransfer.ChunkFiles;
import com.fixcraft.qrtransfer.Constants;
import com.fixcraft.qrtransfer.OutputExistsException;
import com.fixcraft.qrtransfer.PasswordPolicy;
import com.fixcraft.qrtransfer.PasswordSource;
import com.fixcraft.qrtransfer.Reassembler;
import com.fixcraft.qrtransfer.ReassemblyReport;
import com.fixcraft.qrtransfer.RuntimeLog;
import com.fixcraft.qrtransfer.ScanSession;
import com.fixcraft.qrtransfer.SymbolOptions;
import com.fixcraft.qrtransfer.TransferConfig;
import com.fixcraft.qrtransfer.TransferEncoder;
import com.fixcraft.qrtransfer.ZxingSymbolCodec;

import java.io.Console;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public final class QrTransferCli {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private QrTransferCli() {}

    /** Interactive input. Either method returns {@code null} when no terminal is attached. */
    interface Prompter {
        char[] readPassword(String prompt);

        String readLine(String prompt);
    }

    private static final class ConsolePrompter implements Prompter {
        @Override
        public char[] readPassword(String prompt) {
            Console console = System.console();
            return console == null ? null : console.readPassword("%s", prompt);
        }

        @Override
        public String readLine(String prompt) {
            Console console = System.console();
            return console == null ? null : console.readLine("%s", prompt);
        }
    }

    private static final class UsageException extends IllegalArgumentException {
        UsageException(String message) {
            super(message);
        }
    }

    private static final class GlobalOptions {
        final boolean verbose;
        final boolean noLog;
        final String[] args;

        GlobalOptions(boolean verbose, boolean noLog, String[] args) {
            this.verbose = verbose;
            this.noLog = noLog;
            this.args = args;
        }
    }

    private static final class EncodeArgs {
        Path input;
        Path output;
        boolean encrypt;
        boolean text;
        boolean noImages;
        boolean force;
        boolean noParallel;
        String passwordEnv;
        SymbolOptions symbols = SymbolOptions.defaults();
    }

    private static final class RebuildArgs {
        Path input;
        Path output;
        boolean overwrite;
        boolean verifyOnly;
        boolean rebuild;
        String passwordEnv;
    }

    public static void main(String[] args) {
        int code = run(args, new ConsolePrompter(), System.out);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, Prompter prompter, PrintStream out) {
        if (args == null || args.length == 0) {
            usage(out);
            return EXIT_USAGE;
        }
        GlobalOptions globals = parseGlobalOptions(args);
        RuntimeLog.configureFromCli(globals.verbose, globals.noLog);
        args = globals.args;
        if (args.length == 0) {
            usage(out);
            return EXIT_USAGE;
        }
        String command = args[0];
        try {
            switch (command) {
                case "encode":
                    return encode(parseEncodeArgs(args, 1), prompter, out);
                case "rebuild":
                    return rebuild(parseRebuildArgs(args, 1, false), prompter, out);
                case "scan":
                    return scan(parseRebuildArgs(args, 1, true), prompter, out);
                case "help":
                case "--help":
                case "-h":
                    usage(out);
                    return EXIT_OK;
                default:
                    throw new UsageException("Unknown command '" + command + "'");
            }
        } catch (UsageException exc) {
            RuntimeLog.error(exc.getMessage());
            usage(out);
            return EXIT_USAGE;
        } catch (RuntimeException exc) {
            RuntimeLog.error(exc.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int encode(EncodeArgs parsed, Prompter prompter, PrintStream out) {
        TransferConfig config = TransferConfig.fromEnvironment().withSymbolOptions(parsed.symbols);
        if (parsed.noParallel) {
            config = config.withWorkers(1);
        }
        boolean writeImages = !parsed.noImages;
        boolean writeText = parsed.text || parsed.noImages;
        TransferEncoder encoder = new TransferEncoder(config, new ZxingSymbolCodec());
        TransferEncoder.CapacityCheck check = parsed.force
            ? TransferEncoder.ALWAYS
            : (chunks, threshold) -> confirm(prompter,
                chunks + " symbols will be generated (more than " + threshold + "). Continue? [y/N]: ");

        TransferEncoder.Result result;
        if (parsed.encrypt) {
            char[] password = encryptionPassword(parsed.passwordEnv, prompter);
            try (ChunkCipher cipher = config.newCipher(password)) {
                RuntimeLog.debug("Crypto backend: " + cipher.backend().name());
                result = encoder.encodeFile(parsed.input, parsed.output, cipher, writeText, writeImages, check);
            } finally {
                Arrays.fill(password, '\0');
            }
        } else {
            result = encoder.encodeFile(parsed.input, parsed.output, null, writeText, writeImages, check);
        }
        for (Path path : result.symbolFiles) {
            out.println(path);
        }
        for (Path path : result.chunkFiles) {
            out.println(path);
        }
        return EXIT_OK;
    }

    private static int rebuild(RebuildArgs parsed, Prompter prompter, PrintStream out) {
        TransferConfig config = TransferConfig.fromEnvironment();
        Path target = parsed.output != null ? parsed.output : parsed.input;
        try (Reassembler reassembler = config.newReassembler(passwordSource(parsed.passwordEnv, prompter))) {
            ChunkFiles.load(parsed.input, reassembler);
            if (reassembler.sets().isEmpty()) {
                RuntimeLog.error("No valid chunk files in " + parsed.input);
                return EXIT_FAILURE;
            }
            ReassemblyReport report = parsed.verifyOnly
                ? reassembler.verifyAll()
                : reassembler.rebuildAll(target, parsed.overwrite);
            return report(report, out);
        }
    }

    private static int scan(RebuildArgs parsed, Prompter prompter, PrintStream out) {
        TransferConfig config = TransferConfig.fromEnvironment();
        try (Reassembler reassembler = config.newReassembler(passwordSource(parsed.passwordEnv, prompter))) {
            ScanSession session = new ScanSession(new ZxingSymbolCodec(), reassembler);
            session.scanDirectory(parsed.input);
            RuntimeLog.info("Scan: " + session.summary());
            if (session.validChunks() == 0) {
                RuntimeLog.error("No valid chunks found in " + parsed.input);
                return EXIT_FAILURE;
            }
            for (Path path : session.saveChunks(parsed.output)) {
                out.println(path);
            }
            if (!parsed.rebuild) {
                return EXIT_OK;
            }
            return report(session.rebuild(parsed.output, parsed.overwrite), out);
        }
    }

    private static int report(ReassemblyReport report, PrintStream out) {
        for (ReassemblyReport.Outcome outcome : report.outcomes()) {
            if (outcome.status == ReassemblyReport.Status.WRITTEN) {
                out.println(outcome.output);
            } else if (outcome.status == ReassemblyReport.Status.VERIFIED) {
                out.println(outcome.filename + ": OK");
            } else if (outcome.error instanceof OutputExistsException) {
                RuntimeLog.info("Use --overwrite to replace " + ((OutputExistsException) outcome.error).target());
            }
        }
        RuntimeLog.info(report.summary());
        return report.isSuccess() ? EXIT_OK : EXIT_FAILURE;
    }

    private static char[] encryptionPassword(String envName, Prompter prompter) {
        if (envName != null) {
            char[] password = envPassword(envName);
            PasswordPolicy.requireValid(password);
            return password;
        }
        char[] first = prompter.readPassword("Enter encryption password: ");
        if (first == null) {
            throw new IllegalStateException("No terminal for the password prompt; use --password-env");
        }
        char[] second = prompter.readPassword("Confirm encryption password: ");
        try {
            PasswordPolicy.requireConfirmed(first, second);
            return first.clone();
        } finally {
            Arrays.fill(first, '\0');
            if (second != null) {
                Arrays.fill(second, '\0');
            }
        }
    }

    private static PasswordSource passwordSource(String envName, Prompter prompter) {
        if (envName != null) {
            return (filename, attempt) -> attempt == 1 ? envPassword(envName) : null;
        }
        return (filename, attempt) -> prompter.readPassword(
            attempt == 1 ? "Enter decryption password for " + filename + ": " : "Password again: ");
    }

    private static char[] envPassword(String envName) {
        String value = System.getenv(envName);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Environment variable " + envName + " is not set");
        }
        return value.toCharArray();
    }

    private static boolean confirm(Prompter prompter, String question) {
        String answer = prompter.readLine(question);
        if (answer == null) {
            RuntimeLog.warn("No terminal to confirm; use --force");
            return false;
        }
        String value = answer.trim().toLowerCase(Locale.US);
        return "y".equals(value) || "yes".equals(value);
    }

    private static GlobalOptions parseGlobalOptions(String[] args) {
        boolean verbose = false;
        boolean noLog = false;
        List<String> cleaned = new ArrayList<String>(args.length);
        for (String arg : args) {
            if ("--verbose".equals(arg) || "-v".equals(arg)) {
                verbose = true;
                continue;
            }
            if ("--no-log".equals(arg)) {
                noLog = true;
                continue;
            }
            cleaned.add(arg);
        }
        return new GlobalOptions(verbose, noLog, cleaned.toArray(new String[0]));
    }

    private static EncodeArgs parseEncodeArgs(String[] args, int startIndex) {
        EncodeArgs parsed = new EncodeArgs();
        List<String> positional = new ArrayList<>();
        for (int i = startIndex; i < args.length; i++) {
            String arg = args[i];
            if ("--encrypt".equals(arg)) {
                parsed.encrypt = true;
                continue;
            }
            if ("--text".equals(arg)) {
                parsed.text = true;
                continue;
            }
            if ("--no-images".equals(arg)) {
                parsed.noImages = true;
                continue;
            }
            if ("--force".equals(arg)) {
                parsed.force = true;
                continue;
            }
            if ("--no-parallel".equals(arg)) {
                parsed.noParallel = true;
                continue;
            }
            if ("--box-size".equals(arg)) {
                int size = intValue(args, ++i, arg);
                try {
                    parsed.symbols = parsed.symbols.withBoxSize(size);
                } catch (IllegalArgumentException exc) {
                    throw new UsageException(exc.getMessage());
                }
                continue;
            }
            if ("--border".equals(arg)) {
                int border = intValue(args, ++i, arg);
                try {
                    parsed.symbols = parsed.symbols.withBorder(border);
                } catch (IllegalArgumentException exc) {
                    throw new UsageException(exc.getMessage());
                }
                continue;
            }
            if ("--ec".equals(arg)) {
                String level = value(args, ++i, arg);
                try {
                    parsed.symbols = parsed.symbols.withErrorCorrection(SymbolOptions.ErrorCorrection.parse(level));
                } catch (IllegalArgumentException exc) {
                    throw new UsageException(exc.getMessage());
                }
                continue;
            }
            if ("--password-env".equals(arg)) {
                parsed.passwordEnv = value(args, ++i, arg);
                continue;
            }
            if (arg.startsWith("--")) {
                throw new UsageException("Unknown option " + arg);
            }
            positional.add(arg);
        }
        if (positional.size() != 2) {
            throw new UsageException("encode expects <file> <outDir>");
        }
        parsed.input = Paths.get(positional.get(0));
        parsed.output = Paths.get(positional.get(1));
        return parsed;
    }

    private static RebuildArgs parseRebuildArgs(String[] args, int startIndex, boolean scan) {
        RebuildArgs parsed = new RebuildArgs();
        List<String> positional = new ArrayList<>();
        for (int i = startIndex; i < args.length; i++) {
            String arg = args[i];
            if ("--overwrite".equals(arg)) {
                parsed.overwrite = true;
                continue;
            }
            if (!scan && "--verify-only".equals(arg)) {
                parsed.verifyOnly = true;
                continue;
            }
            if (scan && "--rebuild".equals(arg)) {
                parsed.rebuild = true;
                continue;
            }
            if ("--password-env".equals(arg)) {
                parsed.passwordEnv = value(args, ++i, arg);
                continue;
            }
            if (arg.startsWith("--")) {
                throw new UsageException("Unknown option " + arg);
            }
            positional.add(arg);
        }
        if (scan ? positional.size() != 2 : (positional.isEmpty() || positional.size() > 2)) {
            throw new UsageException(scan ? "scan expects <imageDir> <outDir>" : "rebuild expects <chunkDir> [outDir]");
        }
        parsed.input = Paths.get(positional.get(0));
        parsed.output = positional.size() > 1 ? Paths.get(positional.get(1)) : null;
        return parsed;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new UsageException("Missing value for " + option);
        }
        return args[index];
    }

    private static int intValue(String[] args, int index, String option) {
        String raw = value(args, index, option);
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException exc) {
            throw new UsageException(option + " expects a number, got '" + raw + "'");
        }
    }

    private static void usage(PrintStream out) {
        out.println("qrtransfer: move a file across an air gap as QR symbols");
        out.println("  [global] --verbose|-v --no-log");
        out.println("  encode <file> <outDir> [--encrypt] [--text] [--no-images] [--force] [--no-parallel]");
        out.println("         [--box-size N] [--border N] [--ec L|M|Q|H] [--password-env VAR]");
        out.println("  rebuild <chunkDir> [outDir] [--overwrite] [--verify-only] [--password-env VAR]");
        out.println("  scan <imageDir> <outDir> [--rebuild] [--overwrite] [--password-env VAR]");
        out.println("  env: " + Constants.ENV_MAX_SYMBOL_BYTES + " " + Constants.ENV_SAFETY_MARGIN_PCT + " "
            + Constants.ENV_CAPACITY_WARN + " " + Constants.ENV_WORKERS + " " + Constants.ENV_FORCE_SINGLE_THREAD);
        out.println("       " + Constants.ENV_PARALLEL_THRESHOLD + " " + Constants.ENV_KDF_ITERS + " "
            + Constants.ENV_CRYPTO_BACKEND);
    }
}
