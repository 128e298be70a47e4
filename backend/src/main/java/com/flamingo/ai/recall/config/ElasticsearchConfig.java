package com.flamingo.ai.recall.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import org.apache.hc.core5.http.HttpHost;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Elasticsearch client using Apache HttpComponents 5 (ES 9.0+).
 *
 * <p>Only active when the index backend is {@code elasticsearch}.
 */
@Configuration
@ConditionalOnProperty(name = "recall.index.backend", havingValue = "elasticsearch")
public class ElasticsearchConfig {

  @Bean
  public Rest5Client rest5Client(RecallConfig recallConfig) {
    RecallConfig.Index.Elasticsearch es = recallConfig.getIndex().getElasticsearch();
    HttpHost httpHost = new HttpHost(es.getScheme(), es.getHost(), es.getPort());
    return Rest5Client.builder(httpHost).build();
  }

  @Bean
  public ElasticsearchTransport elasticsearchTransport(Rest5Client rest5Client) {
    return new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper());
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport transport) {
    return new ElasticsearchClient(transport);
  }
}
