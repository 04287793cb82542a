package com.signalkit.metrics;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/**
 * Connection target parsed from {@code scheme://[user[:password]@]host[:port]/database}. The
 * database is the path with its leading slashes removed.
 */
@Value.Immutable
public abstract class BackendConfig {
  private static final Pattern REGISTRY_HOST = Pattern.compile("[^:@\\[\\]]+(:\\d{1,5})?");

  public abstract String scheme();

  public abstract Optional<String> username();

  @Value.Redacted
  public abstract Optional<String> password();

  /** Host, with {@code :port} when the URL names one. */
  public abstract String host();

  public abstract String database();

  /** {@code scheme://host[:port]}, the root that backend routes resolve against. */
  @Value.Derived
  public URI baseUri() {
    return URI.create(scheme() + "://" + host());
  }

  public static BackendConfig parse(@Nullable String config) throws BackendConfigException {
    if (config == null) {
      throw new UnparseableUrlException("null");
    }

    final URI uri;
    try {
      uri = new URI(config);
    } catch (URISyntaxException exception) {
      throw new UnparseableUrlException(config, exception);
    }

    // java.net.URI accepts any bare token as a relative path; a URL must at least have a scheme
    // or start at a root.
    if (uri.getScheme() == null && !config.startsWith("/")) {
      throw new UnparseableUrlException(config);
    }
    if (!uri.isAbsolute() || uri.isOpaque() || uri.getAuthority() == null) {
      throw new NotAbsoluteUrlException(config);
    }

    final String userInfo;
    final String host;
    if (uri.getHost() != null) {
      userInfo = uri.getUserInfo();
      host = uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    } else {
      // Host names that are not RFC 2396 hostnames, such as "influx_db", leave java.net.URI with a
      // registry-based authority.
      final String authority = uri.getAuthority();
      final int userInfoEnd = authority.lastIndexOf('@');
      userInfo = userInfoEnd == -1 ? null : authority.substring(0, userInfoEnd);
      host = authority.substring(userInfoEnd + 1);
      if (!REGISTRY_HOST.matcher(host).matches()) {
        throw new NotAbsoluteUrlException(config);
      }
    }

    final ImmutableBackendConfig.Builder builder =
        ImmutableBackendConfig.builder()
            .scheme(uri.getScheme())
            .host(host)
            .database(stripLeadingSlashes(Optional.ofNullable(uri.getPath()).orElse("")));

    if (userInfo != null) {
      final int separator = userInfo.indexOf(':');
      if (separator == -1) {
        builder.username(userInfo);
      } else {
        builder.username(userInfo.substring(0, separator));
        builder.password(userInfo.substring(separator + 1));
      }
    }
    return builder.build();
  }

  private static String stripLeadingSlashes(String path) {
    int start = 0;
    while (start < path.length() && path.charAt(start) == '/') {
      start++;
    }
    return path.substring(start);
  }
}
