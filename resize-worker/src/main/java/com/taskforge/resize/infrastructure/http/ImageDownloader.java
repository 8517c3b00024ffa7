package com.taskforge.resize.infrastructure.http;

import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;

@Component
public class ImageDownloader {
  private final RestClient client;

  public ImageDownloader(RestClient.Builder builder) {
    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(Duration.ofSeconds(10));
    factory.setReadTimeout(Duration.ofSeconds(30));
    this.client = builder.requestFactory(factory).build();
  }

  /**
   * @throws RestClientException on connection errors and non-2xx responses
   */
  public byte[] download(String url) {
    byte[] body = client.get().uri(url).retrieve().body(byte[].class);
    if (body == null || body.length == 0) throw new RestClientException("empty response body from " + url);
    return body;
  }
}
