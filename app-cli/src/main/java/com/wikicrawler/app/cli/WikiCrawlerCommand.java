package com.wikicrawler.app.cli;

import com.wikicrawler.app.logging.LogSetup;
import com.wikicrawler.core.crawler.CrawlException;
import com.wikicrawler.core.crawler.WikiCrawler;
import com.wikicrawler.core.model.CrawlConfig;
import com.wikicrawler.core.model.CrawlOutcome;
import com.wikicrawler.core.report.CrawlReport;
import com.wikicrawler.core.report.JsonReportWriter;
import com.wikicrawler.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

/** CLI 진입점: 인자 파싱 → 크롤 → 경로를 공백으로 이어 stdout 출력. */
@Command(name = "wikicrawler", mixinStandardHelpOptions = true, version = "wikicrawler 0.1.0",
        description = "Finds a path of article links from START to TARGET by concurrent crawling.")
public class WikiCrawlerCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(WikiCrawlerCommand.class);

    static final int EXIT_FOUND = 0;
    static final int EXIT_NO_PATH = 1;
    static final int EXIT_START_NOT_FETCHABLE = 3;
    static final int EXIT_FAILURE = 4;

    @Parameters(index = "0", arity = "0..1", paramLabel = "START", description = "Start article URL")
    String start;

    @Parameters(index = "1", arity = "0..1", paramLabel = "TARGET", description = "Target article URL")
    String target;

    @Option(names = {"-c", "--concurrent"}, description = "Max simultaneous page fetches (default 25)")
    Integer concurrent;

    @Option(names = {"-w", "--workers"}, description = "Worker count (default: same as --concurrent)")
    Integer workers;

    @Option(names = {"-k", "--keywords"}, description = "Keyword to prioritize links by; repeat in priority order")
    List<String> keywords;

    @Option(names = "--config", description = "crawl.yml to load before applying options (default: ./crawl.yml if present)")
    Path configFile;

    @Option(names = "--report", description = "Write a JSON run report to this file")
    Path reportFile;

    @Option(names = "--timeout-ms", description = "Per-request timeout in milliseconds")
    Long timeoutMs;

    @Option(names = "--log-level", defaultValue = "${sys:wc.log.level:-INFO}",
            description = "Log level (TRACE|DEBUG|INFO|WARN|ERROR), default ${DEFAULT-VALUE}")
    String logLevel;

    @Option(names = "--log-dir", description = "Also write rolling log files to this directory")
    Path logDir;

    @Spec
    CommandSpec spec;

    // --config 가 없을 때 crawl.yml 을 찾는 위치 (테스트에서 교체)
    Path workDir = Path.of("");

    // 테스트에서 가짜 fetcher 주입용
    Function<CrawlConfig, WikiCrawler> crawlerFactory = WikiCrawler::new;

    @Override
    public Integer call() {
        LogSetup.init(logDir, LogSetup.levelOf(logLevel));
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CrawlConfig cfg;
        try {
            cfg = buildConfig();
        } catch (IOException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }

        try (WikiCrawler crawler = crawlerFactory.apply(cfg)) {
            List<String> path = crawler.findPath();
            out.println(String.join(" ", path));
            out.flush();
            writeReport(crawler, err);
            return exitCodeOf(crawler.getOutcome());
        } catch (CrawlException e) {
            LOG.error("Crawl failed", e);
            err.println("Crawl failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /** --config 파일(없으면 ./crawl.yml, 그것도 없으면 기본값) 위에 CLI 값을 덮어써 최종 설정을 만든다. */
    CrawlConfig buildConfig() throws IOException {
        CrawlConfig cfg = (configFile != null)
                ? YamlConfigLoader.load(configFile)
                : YamlConfigLoader.loadDefault(workDir);

        if (start != null) cfg.setStart(start);
        if (target != null) cfg.setTarget(target);
        if (concurrent != null) cfg.setConcurrency(concurrent);
        if (workers != null) cfg.setWorkers(workers);
        if (keywords != null && !keywords.isEmpty()) cfg.setKeywords(keywords);
        if (timeoutMs != null) cfg.setTimeoutMs(timeoutMs);

        if (cfg.getStart() == null || cfg.getTarget() == null) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "START and TARGET are required (as arguments or in --config)");
        }
        try {
            cfg.validate();
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
        return cfg;
    }

    private void writeReport(WikiCrawler crawler, PrintWriter err) {
        if (reportFile == null) return;
        try {
            new JsonReportWriter().write(CrawlReport.of(crawler), reportFile);
            LOG.info("Report written: {}", reportFile.toAbsolutePath());
        } catch (IOException e) {
            // 리포트 실패는 경로 결과에 영향 없음
            LOG.warn("Report write failed: {}", e.toString());
            err.println("Could not write report " + reportFile + ": " + e.getMessage());
        }
    }

    static int exitCodeOf(CrawlOutcome outcome) {
        if (outcome == null) return EXIT_FAILURE;
        switch (outcome) {
            case FOUND: return EXIT_FOUND;
            case START_NOT_FETCHABLE: return EXIT_START_NOT_FETCHABLE;
            default: return EXIT_NO_PATH;
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new WikiCrawlerCommand()).execute(args));
    }
}
