package com.feedwarden.gate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Known-good browser fingerprints. Every header in a template travels with the others;
 * never mix fields between templates or generate headers ad hoc.
 */
public enum BrowserTemplate {

    CHROME_WINDOWS("chrome", "windows", headers(
            "sec-ch-ua", "\"Not_A Brand\";v=\"8\", \"Chromium\";v=\"120\", \"Google Chrome\";v=\"120\"",
            "sec-ch-ua-mobile", "?0",
            "sec-ch-ua-platform", "\"Windows\"",
            "Upgrade-Insecure-Requests", "1",
            "User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,image/apng,*/*;q=0.8,application/signed-exchange;v=b3;q=0.7",
            "Sec-Fetch-Site", "none",
            "Sec-Fetch-Mode", "navigate",
            "Sec-Fetch-User", "?1",
            "Sec-Fetch-Dest", "document",
            "Accept-Language", "en-US,en;q=0.9")),

    FIREFOX_MACOS("firefox", "macos", headers(
            "User-Agent", "Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:121.0) Gecko/20100101 Firefox/121.0",
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.5",
            "Upgrade-Insecure-Requests", "1",
            "Sec-Fetch-Dest", "document",
            "Sec-Fetch-Mode", "navigate",
            "Sec-Fetch-Site", "none",
            "Sec-Fetch-User", "?1",
            "DNT", "1")),

    SAFARI_MACOS("safari", "macos", headers(
            "User-Agent", "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.2 Safari/605.1.15",
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
            "Accept-Language", "en-GB,en;q=0.9",
            "Sec-Fetch-Dest", "document",
            "Sec-Fetch-Mode", "navigate",
            "Sec-Fetch-Site", "none"));

    private final String browserFamily;
    private final String osFamily;
    private final Map<String, String> headers;

    BrowserTemplate(String browserFamily, String osFamily, Map<String, String> headers) {
        this.browserFamily = browserFamily;
        this.osFamily = osFamily;
        this.headers = headers;
    }

    public String browserFamily() {
        return browserFamily;
    }

    public String osFamily() {
        return osFamily;
    }

    /** Insertion-ordered and unmodifiable. */
    public Map<String, String> headers() {
        return headers;
    }

    private static Map<String, String> headers(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
