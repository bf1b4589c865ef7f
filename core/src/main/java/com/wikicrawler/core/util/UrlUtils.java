package com.wikicrawler.core.util;

import java.net.URI;

/**
 * 링크 해석 유틸.
 * 노드 식별은 "기준 페이지에 대해 해석한 뒤의 문자열 동일성"뿐이다.
 * 대소문자/끝 슬래시/fragment 정규화는 하지 않는다.
 */
public final class UrlUtils {
    private UrlUtils() {}

    /**
     * href를 base에 대해 해석해 절대 URL 문자열로 반환.
     * 해석할 수 없는(문법 오류) 경우 null.
     */
    public static String resolve(String base, String href) {
        if (base == null || href == null) return null;
        try {
            return URI.create(base).resolve(href.trim()).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** http/https 절대 URL 인지 */
    public static boolean isHttpLike(String url) {
        if (url == null) return false;
        try {
            URI u = URI.create(url);
            String s = u.getScheme();
            return u.isAbsolute() && s != null
                    && (s.equalsIgnoreCase("http") || s.equalsIgnoreCase("https"));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
