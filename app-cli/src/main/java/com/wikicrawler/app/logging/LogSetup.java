package com.wikicrawler.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 (SLF4J는 slf4j-jdk14 바인딩으로 여기로 흐른다).
 * - 콘솔(stderr): 항상. stdout은 경로 출력 전용으로 남겨둔다.
 * - 파일: logDir 지정 시 logDir/crawl-%g.log, 사이즈 롤링(기본 2MB x 5)
 * System props:
 *  -Dwc.log.sizeMb=2
 *  -Dwc.log.files=5
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init(Path logDir, Level level) {
        if (initialized) {
            setLevel(level);
            return;
        }
        initialized = true;

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);
        root.setLevel(level);

        if (logDir == null) return;
        try {
            Files.createDirectories(logDir);
            int sizeMb  = parseInt(System.getProperty("wc.log.sizeMb"), 2);
            int fileCnt = parseInt(System.getProperty("wc.log.files"), 5);

            String pattern = logDir.resolve("crawl-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);

            Logger.getLogger(LogSetup.class.getName()).fine(
                    () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
        } catch (IOException e) {
            // 파일 핸들러 실패 → 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "Log file setup failed: " + e.getMessage(), e);
        }
    }

    /** 런타임에 루트/핸들러 레벨 변경 */
    public static void setLevel(Level level) {
        if (level == null) level = Level.INFO;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
        }
    }

    /**
     * 문자열을 Level로(실패 시 INFO).
     * JUL 이름 외에 SLF4J식 DEBUG/TRACE/WARN/ERROR 도 받는다.
     */
    public static Level levelOf(String name) {
        String s = String.valueOf(name).trim().toUpperCase(Locale.ROOT);
        switch (s) {
            case "TRACE": return Level.FINEST;
            case "DEBUG": return Level.FINE;
            case "WARN":  return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try { return Level.parse(s); }
                catch (IllegalArgumentException e) { return Level.INFO; }
        }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
