package com.wikicrawler.core.util;

import com.wikicrawler.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml을 읽어 CrawlConfig로 변환.
 *
 * 예상 YAML 키:
 * start: "https://en.wikipedia.org/wiki/Potato"
 * target: "https://en.wikipedia.org/wiki/Physics"
 * concurrency: 25
 * workers: 25
 * keywords: ["physics", "science"]   # 또는 "physics,science"
 * timeoutMs: 10000
 * followRedirects: true
 * http:
 *   userAgent: "WikiCrawler/0.1"
 * scope:
 *   articlePrefix: "/wiki/"
 *
 * start/target 검증은 하지 않는다. CLI 인자로 채워질 수 있으므로 호출 측에서 validate().
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static final String DEFAULT_FILE = "crawl.yml";

    /** dir/crawl.yml 이 있으면 읽고, 없으면 defaults */
    public static CrawlConfig loadDefault(Path dir) throws IOException {
        Path p = Objects.requireNonNull(dir, "dir").resolve(DEFAULT_FILE);
        return Files.exists(p) ? load(p) : CrawlConfig.defaults();
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            CrawlConfig cfg = CrawlConfig.defaults();
            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                return cfg;
            }

            // 1) 평면 키
            setString(map, "start", cfg::setStart);
            setString(map, "target", cfg::setTarget);
            setInt(map, "concurrency", cfg::setConcurrency);
            setInt(map, "workers", cfg::setWorkers);
            setStringList(map, "keywords", cfg::setKeywords);
            setLong(map, "timeoutMs", cfg::setTimeoutMs);
            setBoolean(map, "followRedirects", cfg::setFollowRedirects);

            // 2) http.*
            Map<String, Object> http = getMap(map, "http");
            if (http != null) {
                setString(http, "userAgent", cfg::setUserAgent);
            }

            // 3) scope.*
            Map<String, Object> scope = getMap(map, "scope");
            if (scope != null) {
                setString(scope, "articlePrefix", cfg::setArticlePrefix);
            }
            return cfg;
        } catch (RuntimeException e) {
            // YAML 문법 오류, 숫자 파싱 실패 등
            throw new IOException("invalid crawl config " + yamlPath + ": " + e.getMessage(), e);
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) {
                if (!p.isEmpty()) out.add(p);
            }
        }
        setter.accept(out);
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }
}
