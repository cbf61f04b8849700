package com.pmatrix.encoder.cli;

import com.pmatrix.common.codec.RecordCodec;
import com.pmatrix.common.emit.RecordEmitter;
import com.pmatrix.common.exception.InvalidInputException;
import com.pmatrix.common.exception.RecordDecodeException;
import com.pmatrix.common.invariant.InvariantValidator;
import com.pmatrix.common.invariant.StreamValidationResult;
import com.pmatrix.common.invariant.ValidationReport;
import com.pmatrix.common.schema.RuntimeStateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * One-shot command mode.
 *
 * <pre>
 * emit --baseline=0.25 --norm=0.70 --stability=0.30 --meta-control=0.20 [--timestamp=1707500000]
 * validate          &lt; record.json
 * validate-stream   &lt; records.json   (JSON array, emission order)
 * </pre>
 *
 * <p>Exit codes: {@value #EXIT_OK} success, {@value #EXIT_FAILED} invariant
 * violation or rejected input, {@value #EXIT_UNDECODABLE} input that could not
 * be decoded, {@value #EXIT_USAGE} bad command line.
 *
 * <p>Does nothing when started without a command (HTTP service mode).
 */
@Component
public class EncoderCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(EncoderCommandRunner.class);

    public static final int EXIT_OK          = 0;
    public static final int EXIT_FAILED      = 1;
    public static final int EXIT_UNDECODABLE = 2;
    public static final int EXIT_USAGE       = 3;

    static final String CMD_EMIT            = "emit";
    static final String CMD_VALIDATE        = "validate";
    static final String CMD_VALIDATE_STREAM = "validate-stream";

    private static final List<String> COMMANDS = List.of(CMD_EMIT, CMD_VALIDATE, CMD_VALIDATE_STREAM);

    private static final String USAGE = String.join("\n",
        "Usage:",
        "  emit --baseline=<v> --norm=<v> --stability=<v> --meta-control=<v> [--timestamp=<unix seconds>]",
        "  validate          (record JSON on stdin)",
        "  validate-stream   (JSON array of records on stdin)");

    private final RecordEmitter emitter;
    private final RecordCodec codec;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public EncoderCommandRunner(RecordEmitter emitter, RecordCodec codec) {
        this(emitter, codec, System.in, System.out, System.err);
    }

    EncoderCommandRunner(RecordEmitter emitter, RecordCodec codec,
                         InputStream in, PrintStream out, PrintStream err) {
        this.emitter = emitter;
        this.codec = codec;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    /** True when the first argument is a command word rather than an option. */
    public static boolean isCommand(String[] args) {
        return args.length > 0 && !args[0].startsWith("--");
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            return;
        }
        String command = positional.get(0);
        log.debug("Running command. command={}", command);

        if (positional.size() > 1 || !COMMANDS.contains(command)) {
            err.println("Error: unknown command '" + String.join(" ", positional) + "'");
            err.println(USAGE);
            exitCode = EXIT_USAGE;
            return;
        }

        switch (command) {
            case CMD_EMIT            -> exitCode = emit(args);
            case CMD_VALIDATE        -> exitCode = validate();
            case CMD_VALIDATE_STREAM -> exitCode = validateStream();
            default                  -> exitCode = EXIT_USAGE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // ── emit ───────────────────────────────────────────────────────

    private int emit(ApplicationArguments args) {
        double baseline, norm, stability, metaControl;
        Long timestamp;
        try {
            baseline    = requiredDouble(args, "baseline");
            norm        = requiredDouble(args, "norm");
            stability   = requiredDouble(args, "stability");
            metaControl = requiredDouble(args, "meta-control");
            timestamp   = optionalLong(args, "timestamp");
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            RuntimeStateRecord record = emitter.emit(baseline, norm, stability, metaControl, timestamp);
            out.println(codec.encodePretty(record));
            return EXIT_OK;
        } catch (InvalidInputException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    // ── validate ───────────────────────────────────────────────────

    private int validate() {
        RuntimeStateRecord record;
        try {
            record = codec.decode(readStdin());
        } catch (IOException e) {
            err.println("Error reading stdin: " + e.getMessage());
            return EXIT_FAILED;
        } catch (RecordDecodeException e) {
            err.println("JSON parse error: " + e.getMessage());
            err.println("The input must be a valid P-MATRIX runtime state record.");
            return EXIT_UNDECODABLE;
        }

        ValidationReport report = InvariantValidator.validate(record);
        out.println(report.render());
        return report.conforming() ? EXIT_OK : EXIT_FAILED;
    }

    private int validateStream() {
        List<RuntimeStateRecord> records;
        try {
            records = codec.decodeStream(readStdin());
        } catch (IOException e) {
            err.println("Error reading stdin: " + e.getMessage());
            return EXIT_FAILED;
        } catch (RecordDecodeException e) {
            err.println("JSON parse error: " + e.getMessage());
            err.println("The input must be a JSON array of P-MATRIX runtime state records.");
            return EXIT_UNDECODABLE;
        }

        boolean allConform = true;
        for (int i = 0; i < records.size(); i++) {
            ValidationReport report = InvariantValidator.validate(records.get(i));
            allConform &= report.conforming();
            out.println("Record " + i + ":");
            out.println(report.render());
            out.println();
        }

        StreamValidationResult stream = InvariantValidator.validateStream(records);
        out.println(stream.toLine());
        out.println();
        boolean ok = allConform && stream.passed();
        out.println(ok
            ? "Result: STREAM CONFORMING - " + records.size() + " record(s)."
            : "Result: STREAM VIOLATION(S) DETECTED.");
        return ok ? EXIT_OK : EXIT_FAILED;
    }

    // ── helpers ────────────────────────────────────────────────────

    private String readStdin() throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    private static double requiredDouble(ApplicationArguments args, String name) {
        String raw = single(args, name);
        if (raw == null) {
            throw new IllegalArgumentException("missing required option --" + name);
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " is not a number: '" + raw + "'");
        }
    }

    private static Long optionalLong(ApplicationArguments args, String name) {
        String raw = single(args, name);
        if (raw == null) {
            return null;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " is not an integer: '" + raw + "'");
        }
    }

    private static String single(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return null;
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.size() != 1) {
            throw new IllegalArgumentException("--" + name + " requires exactly one value");
        }
        return values.get(0);
    }
}
