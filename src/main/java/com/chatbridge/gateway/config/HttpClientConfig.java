package com.chatbridge.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 上游 HttpClient 配置
 * <p>
 * 连接超时、代理设置
 */
@Configuration
public class HttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfig.class);

    @Bean
    public HttpClient upstreamHttpClient(AppProperties properties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getUpstream().getConnectTimeoutSeconds()))
                .version(HttpClient.Version.HTTP_1_1);

        AppProperties.ProxyConfig proxy = properties.getProxy();
        if (proxy.isEnabled() && proxy.getUrl() != null && !proxy.getUrl().isEmpty()) {
            try {
                URI uri = URI.create(proxy.getUrl());
                String host = uri.getHost();
                int port = uri.getPort() > 0 ? uri.getPort() : 8080;
                builder.proxy(ProxySelector.of(new InetSocketAddress(host, port)));
                log.info("HTTP 代理已配置: {}:{}", host, port);
            } catch (IllegalArgumentException e) {
                log.warn("代理 URL 解析失败: {}, 将不使用代理", proxy.getUrl());
            }
        }

        return builder.build();
    }
}
