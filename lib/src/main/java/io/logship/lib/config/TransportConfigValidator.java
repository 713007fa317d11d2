/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.logship.lib.config;

import static com.google.common.base.Preconditions.checkArgument;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import org.apache.commons.lang3.StringUtils;

public class TransportConfigValidator {

  public void validateConfig(TransportConfig config) {
    checkArgument(config != null, "transport config is required");
    validateUrl(config.getUrl());
    checkArgument(StringUtils.isNotBlank(config.getChannel()), "channel must not be blank");
    checkArgument(
        config.getBatchSize() > 0,
        "batch_size must be positive, but was: %s",
        config.getBatchSize());
    checkPositive("flush_interval", config.getFlushInterval());
    checkPositive("timeout", config.getTimeout());
    checkPositive("poll_interval", config.getPollInterval());
    checkPositive("shutdown_timeout", config.getShutdownTimeout());
  }

  private static void validateUrl(String url) {
    checkArgument(StringUtils.isNotBlank(url), "url must not be blank");
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("invalid url: " + url, e);
    }
    String scheme = uri.getScheme();
    checkArgument(
        scheme != null && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")),
        "url must use http or https: %s",
        url);
    checkArgument(uri.getHost() != null, "url has no host: %s", url);
  }

  private static void checkPositive(String name, Duration duration) {
    checkArgument(
        !duration.isNegative() && !duration.isZero(),
        "%s must be positive, but was: %s",
        name,
        duration);
  }
}
