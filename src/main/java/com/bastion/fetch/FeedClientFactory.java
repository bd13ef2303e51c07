package com.bastion.fetch;

import com.bastion.domain.DataSource;
import com.bastion.settings.ProxySettings;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

import javax.net.ssl.SSLException;
import java.time.Duration;

/**
 * Builds the WebClient used for a single feed request.
 *
 * TLS verification bypass and proxy routing are per-request concerns: a
 * source with ignoreCertificateErrors gets a client that trusts any
 * certificate, and only that request uses it.
 */
@Component
public class FeedClientFactory {

    private static final Logger log = LoggerFactory.getLogger(FeedClientFactory.class);

    private final Duration responseTimeout;
    private final int maxBodySize;
    private final SslContext insecureSslContext;

    public FeedClientFactory(@Value("${bastion.fetch.timeout:120s}") Duration responseTimeout,
                             @Value("${bastion.fetch.max-body-size:67108864}") int maxBodySize) {
        this.responseTimeout = responseTimeout;
        this.maxBodySize = maxBodySize;
        this.insecureSslContext = buildInsecureSslContext();
    }

    public WebClient create(DataSource source, ProxySettings proxy) {
        HttpClient httpClient = HttpClient.create()
            .responseTimeout(responseTimeout)
            .followRedirect(true);

        if (source.isIgnoreCertificateErrors()) {
            if (insecureSslContext == null) {
                log.warn("Insecure TLS context unavailable; verifying certificates for {}", source.getName());
            } else {
                httpClient = httpClient.secure(spec -> spec.sslContext(insecureSslContext));
            }
        }

        if (proxy != null && proxy.isUsable()) {
            httpClient = httpClient.proxy(spec -> {
                ProxyProvider.Builder builder = spec.type(ProxyProvider.Proxy.HTTP)
                    .host(proxy.getHost())
                    .port(proxy.getPort());
                if (proxy.hasCredentials()) {
                    builder.username(proxy.getUsername())
                        .password(user -> proxy.getPassword());
                }
            });
        }

        ExchangeStrategies strategies = ExchangeStrategies.builder()
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxBodySize))
            .build();

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .exchangeStrategies(strategies)
            .build();
    }

    public int getMaxBodySize() {
        return maxBodySize;
    }

    private static SslContext buildInsecureSslContext() {
        try {
            return SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();
        } catch (SSLException e) {
            log.error("Failed to build insecure TLS context", e);
            return null;
        }
    }
}
