package ai.docsite.reviewer.cli;

import ai.docsite.reviewer.config.Config;
import ai.docsite.reviewer.config.ConfigLoader;
import ai.docsite.reviewer.config.EnvironmentReader;
import ai.docsite.reviewer.config.SummarizerConfig;
import ai.docsite.reviewer.git.GitGateway;
import ai.docsite.reviewer.git.GitGatewayException;
import ai.docsite.reviewer.git.JGitGateway;
import ai.docsite.reviewer.history.ChangeIndexer;
import ai.docsite.reviewer.history.CommitLogParseException;
import ai.docsite.reviewer.history.DocumentTypeFilter;
import ai.docsite.reviewer.logging.LoggingConfigurator;
import ai.docsite.reviewer.review.ReviewReport;
import ai.docsite.reviewer.review.ReviewRequest;
import ai.docsite.reviewer.review.ReviewService;
import ai.docsite.reviewer.review.ReviewWindow;
import ai.docsite.reviewer.summary.ChangeSummarizer;
import ai.docsite.reviewer.summary.ChatModelSummarizer;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and review pass.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG_ERROR = 1;
    static final int EXIT_REVIEW_FAILED = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final Function<Path, GitGateway> gatewayFactory;
    private final Function<SummarizerConfig, ChangeSummarizer> summarizerFactory;
    private final PrintStream out;
    private final Clock clock;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), JGitGateway::new, CliApplication::createSummarizer,
                System.out, Clock.systemDefaultZone());
    }

    CliApplication(ConfigLoader configLoader,
                   Function<Path, GitGateway> gatewayFactory,
                   Function<SummarizerConfig, ChangeSummarizer> summarizerFactory,
                   PrintStream out,
                   Clock clock) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.gatewayFactory = Objects.requireNonNull(gatewayFactory, "gatewayFactory");
        this.summarizerFactory = Objects.requireNonNull(summarizerFactory, "summarizerFactory");
        this.out = Objects.requireNonNull(out, "out");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }
        if (cliArguments.markReviewed()) {
            return markReviewed();
        }

        Config config;
        ChangeSummarizer summarizer;
        try {
            config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat());
            summarizer = config.summarizerConfig().enabled()
                    ? summarizerFactory.apply(config.summarizerConfig())
                    : ChangeSummarizer.disabled();
        } catch (IllegalArgumentException | IllegalStateException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            commandLine.getErr().println(ex.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        OffsetDateTime since = ReviewWindow.resolveSince(config.lastReviewed(), config.defaultWeekday(),
                config.defaultTime(), config.weeksBack(), clock);
        LOGGER.info("Reviewing {} since {} (filters={}, extensions={})",
                config.projectRoot(), since, config.pathFilters(), config.documentExtensions());

        try (GitGateway gateway = gatewayFactory.apply(config.projectRoot())) {
            ReviewService reviewService = new ReviewService(gateway,
                    new ChangeIndexer(new DocumentTypeFilter(config.documentExtensions())));
            if (config.sync()) {
                reviewService.sync();
            }
            ReviewReport report = reviewService.review(ReviewRequest.from(config, since));
            new ReportPrinter(out, summarizer, config.splitDiff()).print(report);
            return EXIT_OK;
        } catch (GitGatewayException | CommitLogParseException ex) {
            LOGGER.error("Review pass failed", ex);
            commandLine.getErr().println("Review failed: " + ex.getMessage());
            return EXIT_REVIEW_FAILED;
        }
    }

    /** Prints the assignment that makes the next pass start now; the caller stores it in its environment. */
    private int markReviewed() {
        OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        out.println(ConfigLoader.ENV_LAST_RUN + "=" + now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        LOGGER.info("Marked reviewed at {}", now);
        return EXIT_OK;
    }

    static ChangeSummarizer createSummarizer(SummarizerConfig summarizerConfig) {
        ChatModel chatModel = switch (summarizerConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(summarizerConfig);
            case GEMINI -> createGeminiChatModel(summarizerConfig);
        };
        return new ChatModelSummarizer(chatModel, summarizerConfig.provider().name(), summarizerConfig.modelName());
    }

    private static ChatModel createOllamaChatModel(SummarizerConfig summarizerConfig) {
        String baseUrl = summarizerConfig.baseUrl()
                .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
        try {
            LOGGER.info("Using Ollama model '{}' via {}", summarizerConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(summarizerConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(SummarizerConfig summarizerConfig) {
        String apiKey = summarizerConfig.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", summarizerConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(summarizerConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
