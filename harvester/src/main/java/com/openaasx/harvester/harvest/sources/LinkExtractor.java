package com.openaasx.harvester.harvest.sources;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

@Component
public class LinkExtractor {
    private final HarvesterProperties properties;

    public LinkExtractor(HarvesterProperties properties) {
        this.properties = properties;
    }

    public List<String> extractTargetLinks(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document doc = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        TreeSet<String> links = new TreeSet<>();
        for (Element element : doc.select("[href]")) {
            String raw = element.attr("href");
            if (!UrlUtils.hasExtension(raw, properties.getTargetExtension())) {
                continue;
            }
            String absolute = element.attr("abs:href");
            if (absolute == null || absolute.isBlank() || UrlUtils.parse(absolute) == null) {
                continue;
            }
            links.add(absolute);
        }
        return new ArrayList<>(links);
    }
}
