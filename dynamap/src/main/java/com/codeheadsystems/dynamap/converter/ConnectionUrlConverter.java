package com.codeheadsystems.dynamap.converter;

import com.codeheadsystems.dynamap.model.Configuration;
import com.codeheadsystems.dynamap.model.ImmutableConfiguration;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a configuration from a connection url, {@code ddb:///table[/index][?prefix=..&suffix=..&strict=true]}.
 */
@Singleton
public class ConnectionUrlConverter {

  /**
   * The constant SCHEME.
   */
  public static final String SCHEME = "ddb";

  private static final Logger log = LoggerFactory.getLogger(ConnectionUrlConverter.class);

  /**
   * Instantiates a new Connection url converter.
   */
  @Inject
  public ConnectionUrlConverter() {
    log.info("ConnectionUrlConverter()");
  }

  /**
   * Converts a url to a configuration.
   *
   * @param url the url
   * @return the configuration
   * @throws IllegalArgumentException if the url is not a ddb url naming a table
   */
  public Configuration convert(final String url) {
    log.trace("convert({})", url);
    final URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException | NullPointerException e) {
      throw new IllegalArgumentException("Invalid connection url: " + url, e);
    }
    if (!SCHEME.equalsIgnoreCase(uri.getScheme())) {
      throw new IllegalArgumentException("Unsupported scheme in connection url: " + url);
    }
    final List<String> path = uri.getPath() == null ? List.of() : Arrays.stream(uri.getPath().split("/"))
        .filter(segment -> !segment.isEmpty())
        .toList();
    if (path.isEmpty() || path.size() > 2) {
      throw new IllegalArgumentException("Connection url must name a table and an optional index: " + url);
    }
    final ImmutableConfiguration.Builder builder = ImmutableConfiguration.builder().table(path.get(0));
    if (path.size() == 2) {
      builder.index(path.get(1));
    }
    if (uri.getRawQuery() != null) {
      for (String parameter : uri.getRawQuery().split("&")) {
        if (parameter.isEmpty()) {
          continue;
        }
        final int eq = parameter.indexOf('=');
        final String name = eq < 0 ? parameter : parameter.substring(0, eq);
        final String value = eq < 0 ? "" : URLDecoder.decode(parameter.substring(eq + 1), StandardCharsets.UTF_8);
        switch (name) {
          case "prefix" -> builder.hashKey(value);
          case "suffix" -> builder.sortKey(value);
          case "strict" -> builder.strictType(Boolean.parseBoolean(value));
          default -> throw new IllegalArgumentException("Unknown parameter '" + name + "' in connection url: " + url);
        }
      }
    }
    try {
      return builder.build();
    } catch (IllegalStateException e) {
      throw new IllegalArgumentException("Invalid connection url: " + url, e);
    }
  }
}
