package com.globalnewsbrief.service;

import com.globalnewsbrief.core.bus.EventBus;
import com.globalnewsbrief.core.model.BulletinWrapper;
import com.globalnewsbrief.core.model.Period;
import com.globalnewsbrief.core.model.Region;
import com.globalnewsbrief.core.validation.ValidationException;
import com.globalnewsbrief.formatter.BulletinFormatter;
import com.globalnewsbrief.formatter.api.LlmResponse;
import com.globalnewsbrief.formatter.config.FormatterSettings;
import com.globalnewsbrief.formatter.extract.EmptyContentException;
import com.globalnewsbrief.formatter.extract.MalformedContentException;
import com.globalnewsbrief.service.config.ConfigLoader;
import com.globalnewsbrief.service.logging.LoggingSetup;
import com.globalnewsbrief.service.retry.RetriesExhaustedException;
import com.globalnewsbrief.service.retry.RetryExecutor;
import com.globalnewsbrief.service.retry.RetrySettings;
import com.globalnewsbrief.service.retry.Sleeper;
import com.globalnewsbrief.service.store.BulletinCodec;
import com.globalnewsbrief.service.store.ResponseReader;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@code format-bulletin <response.json> <region> <period> [date] [workflowRunId]}: formats a saved
 * upstream response and prints the bulletin wrapper JSON to stdout.
 */
public final class Main {
    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_EMPTY_CONTENT = 2;
    public static final int EXIT_MALFORMED_CONTENT = 3;
    public static final int EXIT_INVALID = 4;

    static final String USAGE = "Usage: format-bulletin <response.json> <usa|india|world> <morning|evening> [YYYY-MM-DD] [workflowRunId]";

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) {
        Map<String, String> env = System.getenv();
        LoggingSetup.configure(
                LoggingSetup.parseLevel(env.get("LOG_LEVEL"), Level.INFO),
                "json".equalsIgnoreCase(env.getOrDefault("LOG_FORMAT", "text"))
        );
        Path configDir = Path.of(env.getOrDefault("CONFIG_DIR", "config"));
        System.exit(run(args, configDir, Sleeper.SYSTEM, System.out, System.err));
    }

    static int run(String[] args, Path configDir, Sleeper sleeper, PrintStream out, PrintStream err) {
        if (args.length < 3 || args.length > 5) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        Path responseFile = Path.of(args[0]);
        Region region;
        Period period;
        try {
            region = Region.fromValue(args[1]);
            period = Period.fromValue(args[2]);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String date = args.length > 3 ? args[3] : null;
        String workflowRunId = args.length > 4 ? args[4] : null;
        if (!Files.isRegularFile(responseFile)) {
            err.println("Response file not found: " + responseFile);
            return EXIT_USAGE;
        }

        FormatterSettings formatterSettings;
        RetrySettings retrySettings;
        try {
            formatterSettings = ConfigLoader.loadFormatter(configDir);
            retrySettings = ConfigLoader.loadRetry(configDir);
        } catch (IllegalStateException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        EventBus eventBus = new EventBus();
        eventBus.subscribeAll(event -> LOGGER.log(Level.FINE, "Pipeline event {0}", event));
        RetryExecutor retry = new RetryExecutor(retrySettings, Set.of(IOException.class), sleeper, eventBus);
        BulletinFormatter formatter = new BulletinFormatter(formatterSettings, Clock.systemUTC(), eventBus);

        LlmResponse response;
        try {
            response = retry.call("read " + responseFile.getFileName(), () -> ResponseReader.read(responseFile));
        } catch (RetriesExhaustedException | UncheckedIOException | IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        try {
            BulletinWrapper wrapper = formatter.format(response, region, period, date, workflowRunId);
            out.println(BulletinCodec.toJson(wrapper));
            return EXIT_OK;
        } catch (EmptyContentException e) {
            err.println(e.getMessage());
            return EXIT_EMPTY_CONTENT;
        } catch (MalformedContentException e) {
            err.println(e.getMessage());
            return EXIT_MALFORMED_CONTENT;
        } catch (ValidationException e) {
            LOGGER.fine(() -> "Violations: " + e.violations());
            err.println(e.getMessage());
            return EXIT_INVALID;
        }
    }
}
