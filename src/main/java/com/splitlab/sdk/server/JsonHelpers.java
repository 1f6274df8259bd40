package com.splitlab.sdk.server;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import com.splitlab.sdk.server.subsystems.DatafileException;

import java.io.IOException;

abstract class JsonHelpers {
  private JsonHelpers() {}

  private static final Gson gson = new GsonBuilder().create();

  /**
   * Returns a shared instance of Gson with default configuration.
   */
  static Gson gsonInstance() {
    return gson;
  }

  /**
   * Deserializes an object from JSON. We should use this helper method instead of directly calling
   * gson.fromJson() to minimize reliance on details of the framework we're using, and to ensure that we
   * consistently use our wrapper exception.
   *
   * @param json the serialized JSON string
   * @param objectClass class of object to create
   * @return the deserialized object
   * @throws DatafileException if Gson throws an exception
   */
  static <T> T deserialize(String json, Class<T> objectClass) throws DatafileException {
    try {
      return gsonInstance().fromJson(json, objectClass);
    } catch (Exception e) {
      throw new DatafileException(e);
    }
  }

  /**
   * Parses a JSON string into a generic tree. Used for legacy audience conditions, which the datafile
   * carries as a JSON document embedded in a string property.
   *
   * @param json the JSON string
   * @return the parsed tree
   * @throws DatafileException if the string is not valid JSON
   */
  static JsonElement parseTree(String json) throws DatafileException {
    try {
      return JsonParser.parseString(json);
    } catch (Exception e) {
      throw new DatafileException(e);
    }
  }

  /**
   * Implement this interface on any internal class that needs to do some kind of post-processing after
   * being unmarshaled from JSON. You must also add the annotation {@code JsonAdapter(JsonHelpers.PostProcessingDeserializableTypeAdapterFactory)}
   * to the class for this to work.
   */
  static interface PostProcessingDeserializable {
    void afterDeserialized();
  }

  static class PostProcessingDeserializableTypeAdapterFactory implements TypeAdapterFactory {
    @Override
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
      return new PostProcessingDeserializableTypeAdapter<>(gson.getDelegateAdapter(this, type));
    }
  }

  private static class PostProcessingDeserializableTypeAdapter<T> extends TypeAdapter<T> {
    private final TypeAdapter<T> baseAdapter;

    PostProcessingDeserializableTypeAdapter(TypeAdapter<T> baseAdapter) {
      this.baseAdapter = baseAdapter;
    }

    @Override
    public void write(JsonWriter out, T value) throws IOException {
      baseAdapter.write(out, value);
    }

    @Override
    public T read(JsonReader in) throws IOException {
      T instance = baseAdapter.read(in);
      if (instance instanceof PostProcessingDeserializable) {
        ((PostProcessingDeserializable)instance).afterDeserialized();
      }
      return instance;
    }
  }
}
