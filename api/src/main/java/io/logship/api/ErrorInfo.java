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
package io.logship.api;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.NonNull;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

/** Exception context attached to an entry, rendered as {@code {type, message, traceback?}}. */
@Value
public class ErrorInfo {
  @NonNull String type;
  String message;
  String traceback;

  public static ErrorInfo of(String type, String message) {
    return new ErrorInfo(type, message, null);
  }

  public static ErrorInfo fromThrowable(@NonNull Throwable throwable) {
    return new ErrorInfo(
        StringUtils.defaultIfEmpty(
            throwable.getClass().getSimpleName(), throwable.getClass().getName()),
        throwable.getMessage(),
        ExceptionUtils.getStackTrace(throwable));
  }

  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", type);
    payload.put("message", message);
    if (traceback != null) {
      payload.put("traceback", traceback);
    }
    return payload;
  }
}
