/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.eventsourcing.codec;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Converts aggregate snapshot states to and from JSON text. */
public final class SnapshotSerializer {
  private final ObjectMapper objectMapper;

  public SnapshotSerializer() {
    this(JacksonEventCodec.defaultObjectMapper());
  }

  public SnapshotSerializer(final ObjectMapper objectMapper) {
    this.objectMapper = throwIllegalArgumentIfNull(objectMapper, "Object mapper");
  }

  /**
   * @param state to serialize
   * @return JSON text of the state
   * @throws CodecException if the state cannot be serialized
   */
  public String serialize(final Object state) {
    try {
      return objectMapper.writeValueAsString(throwIllegalArgumentIfNull(state, "Snapshot state"));
    } catch (JsonProcessingException e) {
      throw new CodecException(
          "Failed to serialize snapshot state '%s'".formatted(state.getClass().getName()), e);
    }
  }

  /**
   * @param json text produced by {@link #serialize(Object)}
   * @param stateType to restore
   * @param <S> is the type of the state
   * @return restored state
   * @throws CodecException if the text cannot be converted to the given type
   */
  public <S> S deserialize(final String json, final Class<S> stateType) {
    final Class<S> nonNullStateType = throwIllegalArgumentIfNull(stateType, "Snapshot state type");

    final String nonBlankJson = throwIllegalArgumentIfBlank(json, "Snapshot JSON");

    try {
      return objectMapper.readValue(nonBlankJson, nonNullStateType);
    } catch (JsonProcessingException e) {
      throw new CodecException(
          "Failed to deserialize snapshot state '%s'".formatted(nonNullStateType.getName()), e);
    }
  }
}
