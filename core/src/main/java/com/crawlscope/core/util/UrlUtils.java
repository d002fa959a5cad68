package com.crawlscope.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** 요청 URL 문자열 정리 + 절대 http(s) URL 판정 유틸 */
public final class UrlUtils {
    private UrlUtils() {}

    /** 백틱 제거 + 앞뒤 공백 제거 */
    public static String clean(String raw) {
        if (raw == null) return "";
        return raw.replace("`", "").trim();
    }

    /** 스킴이 없으면 https:// 를 붙인다 */
    public static String withDefaultScheme(String s) {
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) return s;
        return "https://" + s;
    }

    /**
     * 절대 http(s) URI 로 파싱. host 가 없거나 문법이 틀리면 URISyntaxException.
     */
    public static URI parseHttpUrl(String s) throws URISyntaxException {
        URI u = new URI(s);
        String scheme = u.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new URISyntaxException(s, "unsupported scheme");
        }
        if (u.getHost() == null || u.getHost().isBlank()) {
            throw new URISyntaxException(s, "missing host");
        }
        return u;
    }

    /**
     * 방문 집합 키: scheme/host 소문자, 빈 path → "/", fragment 제거, 기본 포트 제거.
     * https://A.test, https://a.test/, https://a.test/#top 은 같은 키.
     */
    public static String visitKey(URI u) {
        String scheme = (u.getScheme() == null) ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        String host = (u.getHost() == null) ? "" : u.getHost().toLowerCase(Locale.ROOT);
        int port = u.getPort();
        boolean defaultPort = (port == 80 && scheme.equals("http")) || (port == 443 && scheme.equals("https"));
        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();

        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        if (port != -1 && !defaultPort) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        return sb.toString();
    }

    /** jsoup absUrl 결과 등 절대 URL 문자열을 http(s) URI 로. 아니면 null */
    public static URI toHttpUri(String abs) {
        if (abs == null || abs.isBlank()) return null;
        try {
            return parseHttpUrl(abs.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
