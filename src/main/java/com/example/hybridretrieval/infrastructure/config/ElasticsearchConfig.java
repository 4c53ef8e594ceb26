package com.example.hybridretrieval.infrastructure.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import java.net.URI;
import java.security.GeneralSecurityException;
import javax.net.ssl.SSLContext;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.ssl.SSLContextBuilder;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ElasticsearchConfig {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchConfig.class);

    @Bean(destroyMethod = "close")
    public RestClient elasticRestClient(
            @Value("${hybridretrieval.elasticsearch.url}") String url,
            @Value("${hybridretrieval.elasticsearch.username:}") String username,
            @Value("${hybridretrieval.elasticsearch.password:}") String password,
            @Value("${hybridretrieval.elasticsearch.verify-certs:true}") boolean verifyCerts,
            @Value("${hybridretrieval.elasticsearch.connect-timeout-ms}") int connectTimeoutMs,
            @Value("${hybridretrieval.elasticsearch.socket-timeout-ms}") int socketTimeoutMs
    ) {
        URI uri = URI.create(url);
        HttpHost host = new HttpHost(uri.getHost(), uri.getPort(), uri.getScheme());
        boolean basicAuth = username != null && !username.isBlank();

        log.info("event=elasticsearch_client_config url={} basicAuth={} verifyCerts={} connectTimeoutMs={} socketTimeoutMs={}",
                url, basicAuth, verifyCerts, connectTimeoutMs, socketTimeoutMs);

        RestClientBuilder builder = RestClient.builder(host)
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(connectTimeoutMs)
                        .setConnectionRequestTimeout(connectTimeoutMs)
                        .setSocketTimeout(socketTimeoutMs));

        if (basicAuth || !verifyCerts) {
            SSLContext trustAll = verifyCerts ? null : trustAllContext();
            builder.setHttpClientConfigCallback(hcb -> {
                if (basicAuth) {
                    BasicCredentialsProvider credentials = new BasicCredentialsProvider();
                    credentials.setCredentials(AuthScope.ANY, new UsernamePasswordCredentials(username, password));
                    hcb.setDefaultCredentialsProvider(credentials);
                }
                if (trustAll != null) {
                    // self-signed development clusters only
                    hcb.setSSLContext(trustAll).setSSLHostnameVerifier(NoopHostnameVerifier.INSTANCE);
                }
                return hcb;
            });
        }

        return builder.build();
    }

    @Bean
    public ElasticsearchClient elasticsearchClient(RestClient restClient) {
        ElasticsearchTransport transport = new RestClientTransport(restClient, new JacksonJsonpMapper());
        return new ElasticsearchClient(transport);
    }

    private static SSLContext trustAllContext() {
        try {
            return SSLContextBuilder.create()
                    .loadTrustMaterial(null, (chain, authType) -> true)
                    .build();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to build trust-all SSL context", e);
        }
    }
}
