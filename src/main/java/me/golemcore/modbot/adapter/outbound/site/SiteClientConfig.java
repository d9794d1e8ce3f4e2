package me.golemcore.modbot.adapter.outbound.site;

import me.golemcore.modbot.infrastructure.config.BotProperties;
import me.golemcore.modbot.infrastructure.http.FeignClientFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the authorized {@link SiteApi} client from {@code bot.site.*}.
 */
@Configuration
public class SiteClientConfig {

    @Bean
    public SiteApi siteApi(FeignClientFactory feignClientFactory, BotProperties properties) {
        BotProperties.SiteProperties site = properties.getSite();
        return feignClientFactory.createAuthorized(SiteApi.class, site.getBaseUrl(), "Token " + site.getToken());
    }
}
