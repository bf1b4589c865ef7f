package com.wikicrawler.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * JSON 라인 기반 구조화 로거 (진단 싱크).
 * SLF4J 위에 얹혀 있으므로 바인딩/핸들러 설정은 실행 측(CLI LogSetup) 몫.
 * 사용: SLOG.info("page-expanded", "url", url, "links", n)
 */
public final class StructuredLog {
    private final Logger log;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.log = LoggerFactory.getLogger(cls);
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) {
        if (log.isDebugEnabled()) log.debug(buildJson("DEBUG", event, null, kvs));
    }

    public void info(String event, Object... kvs) {
        if (log.isInfoEnabled()) log.info(buildJson("INFO", event, null, kvs));
    }

    public void warn(String event, Object... kvs) {
        if (log.isWarnEnabled()) log.warn(buildJson("WARN", event, null, kvs));
    }

    public void error(String event, Throwable t, Object... kvs) {
        if (!log.isErrorEnabled()) return;
        String line = buildJson("ERROR", event, t, kvs);
        if (t == null) log.error(line); else log.error(line, t);
    }

    String buildJson(String lvl, String event, Throwable t, Object... kvs) {
        StringBuilder sb = new StringBuilder(128);
        sb.append('{');
        kv(sb, "ts", Instant.now().toString());
        kv(sb, "lvl", lvl);
        kv(sb, "comp", comp);
        kv(sb, "thread", Thread.currentThread().getName());
        kv(sb, "event", event);

        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                kv(sb, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) kv(sb, "_kv_mismatch", true);
        }
        if (t != null) {
            kv(sb, "error", t.getClass().getSimpleName());
            kv(sb, "message", t.getMessage());
        }
        // 마지막 콤마 제거
        if (sb.charAt(sb.length() - 1) == ',') sb.setLength(sb.length() - 1);
        sb.append('}');
        return sb.toString();
    }

    private static void kv(StringBuilder sb, String k, Object v) {
        sb.append('"').append(esc(k)).append('"').append(':');
        if (v == null) {
            sb.append("null");
        } else if (v instanceof Number || v instanceof Boolean) {
            sb.append(v);
        } else {
            sb.append('"').append(esc(String.valueOf(v))).append('"');
        }
        sb.append(',');
    }

    private static String esc(String s) {
        StringBuilder r = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':  r.append("\\\""); break;
                case '\\': r.append("\\\\"); break;
                case '\n': r.append("\\n");  break;
                case '\r': r.append("\\r");  break;
                case '\t': r.append("\\t");  break;
                default:
                    if (c < 0x20) r.append(String.format("\\u%04x", (int) c));
                    else r.append(c);
            }
        }
        return r.toString();
    }
}
