package me.golemcore.modbot.adapter.outbound.gateway;

import me.golemcore.modbot.infrastructure.config.BotProperties;
import me.golemcore.modbot.infrastructure.http.FeignClientFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GatewayClientConfig {

    @Bean
    public GatewayBridgeApi gatewayBridgeApi(FeignClientFactory feignClientFactory, BotProperties properties) {
        BotProperties.GatewayProperties gateway = properties.getGateway();
        return feignClientFactory.createAuthorized(GatewayBridgeApi.class, gateway.getBaseUrl(),
                "Bearer " + gateway.getToken());
    }
}
