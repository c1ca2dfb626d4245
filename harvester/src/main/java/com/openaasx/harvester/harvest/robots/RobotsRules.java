package com.openaasx.harvester.harvest.robots;

import com.openaasx.harvester.harvest.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rules of the wildcard user-agent group plus every {@code Sitemap:} line of a robots.txt.
 */
public final class RobotsRules {
    private final List<Rule> rules;
    private final List<String> sitemapUrls;

    private RobotsRules(List<Rule> rules, List<String> sitemapUrls) {
        this.rules = List.copyOf(rules);
        this.sitemapUrls = List.copyOf(sitemapUrls);
    }

    public static RobotsRules allowAll() {
        return new RobotsRules(List.of(), List.of());
    }

    public List<String> sitemapUrls() {
        return sitemapUrls;
    }

    public boolean allowsUrl(String url) {
        return isAllowed(UrlUtils.pathAndQuery(url));
    }

    public boolean isAllowed(String pathAndQuery) {
        String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
        Rule best = null;
        for (Rule rule : rules) {
            if (!rule.matches(subject)) {
                continue;
            }
            // longest match wins, allow wins a tie
            if (best == null
                || rule.path().length() > best.path().length()
                || (rule.path().length() == best.path().length() && rule.allow() && !best.allow())) {
                best = rule;
            }
        }
        return best == null || best.allow();
    }

    /**
     * Parses robots.txt text. Relative sitemap locations are resolved against {@code siteUrl}.
     */
    public static RobotsRules parse(String robotsText, String siteUrl) {
        if (robotsText == null || robotsText.isBlank()) {
            return allowAll();
        }
        URI base = UrlUtils.parse(siteUrl);
        List<String> sitemaps = new ArrayList<>();
        List<Rule> parsed = new ArrayList<>();
        boolean wildcardGroup = false;
        boolean inAgentLines = false;

        for (String rawLine : robotsText.split("\\R")) {
            int hash = rawLine.indexOf('#');
            String line = (hash >= 0 ? rawLine.substring(0, hash) : rawLine).trim();
            int colon = line.indexOf(':');
            if (line.isEmpty() || colon <= 0) {
                continue;
            }
            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            switch (key) {
                case "user-agent" -> {
                    boolean wildcard = value.equals("*");
                    wildcardGroup = inAgentLines ? wildcardGroup || wildcard : wildcard;
                    inAgentLines = true;
                }
                case "sitemap" -> {
                    inAgentLines = false;
                    String resolved = resolve(base, value);
                    if (resolved != null) {
                        sitemaps.add(resolved);
                    }
                }
                case "allow", "disallow" -> {
                    inAgentLines = false;
                    if (wildcardGroup && !value.isEmpty()) {
                        parsed.add(new Rule(value, key.equals("allow")));
                    }
                }
                default -> inAgentLines = false;
            }
        }
        return new RobotsRules(parsed, sitemaps);
    }

    private static String resolve(URI base, String location) {
        if (location.isBlank()) {
            return null;
        }
        if (UrlUtils.parse(location) != null) {
            return location;
        }
        if (base == null) {
            return null;
        }
        try {
            return base.resolve(location).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    record Rule(String path, boolean allow) {
        boolean matches(String subject) {
            String normalized = path.startsWith("/") ? path : "/" + path;
            if (normalized.indexOf('*') < 0 && normalized.indexOf('$') < 0) {
                return subject.startsWith(normalized);
            }
            StringBuilder regex = new StringBuilder("^");
            for (char c : normalized.toCharArray()) {
                if (c == '*') {
                    regex.append(".*");
                } else if (c == '$') {
                    regex.append('$');
                } else {
                    regex.append(Pattern.quote(String.valueOf(c)));
                }
            }
            return Pattern.compile(regex.toString()).matcher(subject).find();
        }
    }
}
