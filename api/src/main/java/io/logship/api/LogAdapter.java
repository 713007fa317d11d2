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

/**
 * Translates one front-end's native log event into a canonical entry and hands it to a {@link
 * LogSink}. All framework-specific level and field translation lives in the implementation.
 *
 * @param <E> the front-end's event type
 */
public interface LogAdapter<E> {
  void publish(E event);
}
