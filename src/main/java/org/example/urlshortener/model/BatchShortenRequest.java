package org.example.urlshortener.model;

/** One item of a batch shortening request, tagged with a caller-chosen correlation id. */
public class BatchShortenRequest {

  public String correlationId;

  public String originalUrl;

  public BatchShortenRequest() {}

  public BatchShortenRequest(String correlationId, String originalUrl) {
    this.correlationId = correlationId;
    this.originalUrl = originalUrl;
  }
}
