package com.vcdcli.client;

import com.vcdcli.config.VcdCliProperties;
import com.vcdcli.exception.ErrorKind;
import com.vcdcli.exception.VcdCliException;
import com.vcdcli.model.Profile;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;

/**
 * Builds a {@link VcdClient} bound to the endpoint, API version and token of a login profile.
 */
@Component
@Slf4j
public class VcdClientFactory {

    private final WebClient.Builder webClientBuilder;
    private final VcdCliProperties properties;

    public VcdClientFactory(WebClient.Builder vcdWebClientBuilder, VcdCliProperties properties) {
        this.webClientBuilder = vcdWebClientBuilder;
        this.properties = properties;
    }

    /**
     * Creates a client for the given profile.
     * <p>
     * When the profile disables certificate verification, the connector trusts every
     * certificate; this is meant for lab installations with self-signed certificates.
     *
     * @param profile The restored login profile.
     * @return A client that sends the profile's token with every request.
     */
    public VcdClient create(Profile profile) {
        String apiVersion = profile.getApiVersion() != null ? profile.getApiVersion() : properties.getApiVersion();
        String baseUrl = "https://" + profile.getHost() + (profile.getPort() == 443 ? "" : ":" + profile.getPort());
        log.debug("Creating vCloud client for {} (api version {}, verifySsl={})", baseUrl, apiVersion, profile.isVerifySsl());

        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, "application/*+json;version=" + apiVersion)
                .defaultHeader(VcdClient.AUTH_HEADER, profile.getToken());

        if (!profile.isVerifySsl()) {
            log.warn("SSL certificate verification is disabled for {}", profile.getHost());
            try {
                SslContext sslContext = SslContextBuilder.forClient()
                        .trustManager(InsecureTrustManagerFactory.INSTANCE)
                        .build();
                HttpClient httpClient = HttpClient.create().secure(spec -> spec.sslContext(sslContext));
                builder.clientConnector(new ReactorClientHttpConnector(httpClient));
            } catch (SSLException e) {
                throw new VcdCliException(ErrorKind.INTERNAL, "Failed to configure insecure SSL context: " + e.getMessage(), e);
            }
        }
        return new VcdClient(builder.build(), properties.getListPageSize());
    }
}
