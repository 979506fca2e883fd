package dev.refhook.infrastructure.url;

import dev.refhook.config.UrlProperties;
import dev.refhook.webhook.UrlProvider;
import org.springframework.stereotype.Component;

@Component
public class ConfiguredUrlProvider implements UrlProvider {
    private final String gitBaseUrl;

    public ConfiguredUrlProvider(UrlProperties properties) {
        String base = properties.gitBaseUrl();
        this.gitBaseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public String gitCloneUrl(String repoPath) {
        return gitBaseUrl + "/" + repoPath + ".git";
    }
}
