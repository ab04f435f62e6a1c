package com.databricks.grpcbase;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Connection parameters parsed from a gRPC URI.
 *
 * <p>The URI must have the following format:
 *
 * <pre>
 * grpc://hostname[:port][?ssl=&lt;bool&gt;]
 * </pre>
 *
 * <ul>
 *   <li>Any other component (path, fragment, user info) is rejected.
 *   <li>If the port is omitted, the default port is used.
 *   <li>If a query parameter is passed many times, the last value is used.
 *   <li>The only supported query parameter is {@code ssl}, a boolean that defaults to the default
 *       SSL setting. Accepted values (case-insensitive) are {@code true}, {@code 1}, {@code on},
 *       {@code false}, {@code 0} and {@code off}.
 * </ul>
 */
public final class ChannelUri {

  /** Port used when the URI does not specify one. */
  public static final int DEFAULT_PORT = 9090;

  /** Whether channels are encrypted when the URI does not say otherwise. */
  public static final boolean DEFAULT_SSL = true;

  private static final String SCHEME = "grpc";
  private static final String SSL_PARAMETER = "ssl";

  private final String host;
  private final int port;
  private final boolean ssl;

  ChannelUri(@Nonnull String host, int port, boolean ssl) {
    this.host = host;
    this.port = port;
    this.ssl = ssl;
  }

  /**
   * Parses a URI using {@link #DEFAULT_PORT} and {@link #DEFAULT_SSL}.
   *
   * @param uri the URI to parse
   * @return the connection parameters
   * @throws IllegalArgumentException if the URI is invalid or has unexpected components
   */
  @Nonnull
  public static ChannelUri parse(@Nonnull String uri) {
    return parse(uri, DEFAULT_PORT, DEFAULT_SSL);
  }

  /**
   * Parses a URI.
   *
   * @param uri the URI to parse
   * @param defaultPort the port to use if the URI does not specify one
   * @param defaultSsl the SSL setting to use if the URI does not specify one
   * @return the connection parameters
   * @throws IllegalArgumentException if the URI is invalid or has unexpected components
   */
  @Nonnull
  public static ChannelUri parse(@Nonnull String uri, int defaultPort, boolean defaultSsl) {
    Objects.requireNonNull(uri, "uri cannot be null");
    URI parsed;
    try {
      parsed = new URI(uri);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid URI '" + uri + "': " + e.getMessage(), e);
    }

    String scheme = parsed.getScheme() == null ? "" : parsed.getScheme().toLowerCase(Locale.ROOT);
    if (!SCHEME.equals(scheme)) {
      throw new IllegalArgumentException(
          "Invalid scheme '" + scheme + "' in the URI, expected '" + SCHEME + "'");
    }
    if (parsed.getHost() == null || parsed.getHost().isEmpty()) {
      throw new IllegalArgumentException("Host name is missing in URI '" + uri + "'");
    }
    rejectComponent("path", parsed.getRawPath(), uri);
    rejectComponent("fragment", parsed.getRawFragment(), uri);
    rejectComponent("user info", parsed.getRawUserInfo(), uri);

    Map<String, String> options = parseQuery(parsed.getRawQuery());
    String sslOption = options.remove(SSL_PARAMETER);
    boolean ssl = sslOption != null ? parseBoolean(sslOption) : defaultSsl;
    if (!options.isEmpty()) {
      throw new IllegalArgumentException(
          "Unexpected query parameters " + options + " in the URI '" + uri + "'");
    }

    int port = parsed.getPort() >= 0 ? parsed.getPort() : defaultPort;
    return new ChannelUri(parsed.getHost(), port, ssl);
  }

  @Nonnull
  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public boolean isSsl() {
    return ssl;
  }

  /** Returns the {@code host:port} target for a channel builder. */
  @Nonnull
  public String getTarget() {
    return host + ":" + port;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ChannelUri)) {
      return false;
    }
    ChannelUri other = (ChannelUri) o;
    return port == other.port && ssl == other.ssl && host.equals(other.host);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, port, ssl);
  }

  @Override
  public String toString() {
    return "grpc://" + host + ":" + port + "?ssl=" + ssl;
  }

  private static void rejectComponent(String name, String value, String uri) {
    if (value != null && !value.isEmpty()) {
      throw new IllegalArgumentException(
          "Unexpected " + name + " '" + value + "' in the URI '" + uri + "'");
    }
  }

  // Pairs without a value are ignored; repeated keys keep the last value.
  private static Map<String, String> parseQuery(String rawQuery) {
    Map<String, String> options = new LinkedHashMap<>();
    if (rawQuery == null || rawQuery.isEmpty()) {
      return options;
    }
    for (String pair : rawQuery.split("&")) {
      int eq = pair.indexOf('=');
      if (eq < 0 || eq == pair.length() - 1) {
        continue;
      }
      String key = URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8);
      String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
      options.remove(key);
      options.put(key, value);
    }
    return options;
  }

  private static boolean parseBoolean(String value) {
    switch (value.toLowerCase(Locale.ROOT)) {
      case "true":
      case "on":
      case "1":
        return true;
      case "false":
      case "off":
      case "0":
        return false;
      default:
        throw new IllegalArgumentException("Invalid boolean value '" + value + "'");
    }
  }
}
