package org.example.urlshortener.model;

/** Result for one item of a batch, carrying back the correlation id of the request item. */
public class BatchShortenResponse {

  public String correlationId;

  public String shortUrl;

  public BatchShortenResponse() {}

  public BatchShortenResponse(String correlationId, String shortUrl) {
    this.correlationId = correlationId;
    this.shortUrl = shortUrl;
  }

  @Override
  public String toString() {
    return correlationId + " -> " + shortUrl;
  }
}
