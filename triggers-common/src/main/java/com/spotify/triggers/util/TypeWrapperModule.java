/*-
 * -\-\-
 * Dataflow Triggers Common
 * --
 * Copyright (C) 2026 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.triggers.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.util.function.Function;

/**
 * A Jackson module that binds types to a JSON tree form of their own, for types that convert
 * themselves to and from JSON rather than being annotated.
 */
public class TypeWrapperModule extends SimpleModule {

  public TypeWrapperModule() {
    super("TreeWrapperModule");
  }

  public <T> TypeWrapperModule setupWrapping(
      Class<T> valueClass,
      Function<? super T, ? extends JsonNode> wrapper,
      Function<? super JsonNode, ? extends T> unwrapper) {
    super.addSerializer(valueClass, new TreeSerializer<>(valueClass, wrapper));
    super.addDeserializer(valueClass, new TreeDeserializer<>(valueClass, unwrapper));

    return this;
  }

  private static class TreeSerializer<T> extends StdSerializer<T> {

    private final Function<? super T, ? extends JsonNode> wrapper;

    private TreeSerializer(Class<T> valueClass, Function<? super T, ? extends JsonNode> wrapper) {
      super(valueClass);
      this.wrapper = wrapper;
    }

    @Override
    public void serialize(T value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeTree(wrapper.apply(value));
    }
  }

  private static class TreeDeserializer<T> extends StdDeserializer<T> {

    private final Function<? super JsonNode, ? extends T> unwrapper;

    private TreeDeserializer(Class<T> valueClass,
        Function<? super JsonNode, ? extends T> unwrapper) {
      super(valueClass);
      this.unwrapper = unwrapper;
    }

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      return unwrapper.apply(ctxt.readTree(p));
    }
  }
}
