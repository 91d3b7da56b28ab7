package com.flamingo.ai.guidelines.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import co.elastic.clients.transport.rest5_client.low_level.Rest5ClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Knowledge store connection over the Elasticsearch Rest5 transport. An API key, when set, is sent
 * with every request.
 */
@Configuration
@Slf4j
public class ElasticsearchConfig {

  @Value("${elasticsearch.host:localhost}")
  private String host;

  @Value("${elasticsearch.port:9200}")
  private int port;

  @Value("${elasticsearch.scheme:http}")
  private String scheme;

  @Value("${elasticsearch.api-key:}")
  private String apiKey;

  @Bean(destroyMethod = "close")
  public Rest5Client rest5Client() {
    Rest5ClientBuilder builder = Rest5Client.builder(new HttpHost(scheme, host, port));
    if (apiKey != null && !apiKey.isBlank()) {
      Header authorization = new BasicHeader("Authorization", "ApiKey " + apiKey);
      builder.setDefaultHeaders(new Header[] {authorization});
    }
    log.info("Knowledge store at {}://{}:{}", scheme, host, port);
    return builder.build();
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(Rest5Client rest5Client) {
    ElasticsearchTransport transport =
        new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper());
    return new ElasticsearchClient(transport);
  }
}
