package com.purchasingpower.fanout.query;

import com.purchasingpower.fanout.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Categorizes by host and path keywords. First matching rule wins.
 */
@Slf4j
@Component
public class DomainHeuristicCategorizer implements ResultCategorizer {

    private static final Map<String, List<String>> HOST_RULES = new LinkedHashMap<>();
    private static final Map<String, List<String>> PATH_RULES = new LinkedHashMap<>();

    static {
        HOST_RULES.put("corporate_registry", List.of("opencorporates.com", "companieshouse.gov.uk",
                "find-and-update.company-information.service.gov.uk", "northdata.com", "handelsregister.de",
                "sec.gov", "bizapedia.com", "dnb.com"));
        HOST_RULES.put("social_media", List.of("twitter.com", "x.com", "facebook.com", "instagram.com",
                "linkedin.com", "tiktok.com", "youtube.com", "vk.com", "t.me"));
        HOST_RULES.put("news", List.of("reuters.com", "bbc.co.uk", "bbc.com", "nytimes.com", "theguardian.com",
                "bloomberg.com", "apnews.com", "ft.com", "wsj.com", "cnn.com", "spiegel.de"));
        HOST_RULES.put("blog", List.of("medium.com", "substack.com", "wordpress.com", "blogspot.com",
                "tumblr.com", "ghost.io"));
        HOST_RULES.put("academic", List.of("arxiv.org", "ncbi.nlm.nih.gov", "semanticscholar.org",
                "researchgate.net", "jstor.org", "doi.org", "scholar.google.com"));
        HOST_RULES.put("forum", List.of("reddit.com", "stackexchange.com", "stackoverflow.com", "quora.com"));

        PATH_RULES.put("news", List.of("/news/", "/press/", "/article/"));
        PATH_RULES.put("blog", List.of("/blog/", "/posts/"));
        PATH_RULES.put("forum", List.of("/forum/", "/thread/", "/viewtopic"));
    }

    @Override
    public String categorize(SearchResult result) {
        URI uri = URI.create(result.getUrl());
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);

        for (Map.Entry<String, List<String>> rule : HOST_RULES.entrySet()) {
            for (String domain : rule.getValue()) {
                if (host.equals(domain) || host.endsWith("." + domain)) {
                    return rule.getKey();
                }
            }
        }
        if (host.endsWith(".edu") || host.contains(".ac.")) {
            return "academic";
        }
        if (host.startsWith("blog.")) {
            return "blog";
        }
        if (host.startsWith("news.")) {
            return "news";
        }
        if (host.startsWith("forum.") || host.startsWith("forums.")) {
            return "forum";
        }
        for (Map.Entry<String, List<String>> rule : PATH_RULES.entrySet()) {
            if (rule.getValue().stream().anyMatch(path::contains)) {
                return rule.getKey();
            }
        }
        return UNCATEGORIZED;
    }
}
