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
package io.logship.lib.transport;

/**
 * Outcome of one batch delivery attempt. The transport never surfaces it to callers; it exists so
 * the best-effort policy is observable in logs, counters and tests.
 *
 * @param status SUCCESS, FAILURE, or SKIPPED for an empty batch
 * @param entryCount number of entries in the attempted batch
 * @param statusCode HTTP status when a response was received, otherwise null
 * @param errorMessage failure reason, null unless status is FAILURE
 */
public record SendResult(Status status, int entryCount, Integer statusCode, String errorMessage) {

  public enum Status {
    SUCCESS,
    FAILURE,
    SKIPPED
  }

  public static SendResult success(int entryCount, int statusCode) {
    return new SendResult(Status.SUCCESS, entryCount, statusCode, null);
  }

  public static SendResult failure(int entryCount, Integer statusCode, String errorMessage) {
    return new SendResult(Status.FAILURE, entryCount, statusCode, errorMessage);
  }

  public static SendResult skipped() {
    return new SendResult(Status.SKIPPED, 0, null, null);
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }

  public boolean isFailure() {
    return status == Status.FAILURE;
  }
}
