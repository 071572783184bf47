package com.codeheadsystems.secret.jackson;

import com.codeheadsystems.secret.SecretApi;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;

/**
 * Writes a secret as its placeholder or hashed tag. Never reads the value.
 */
public class SecretSerializer extends StdSerializer<SecretApi<?>> {

  private final TagMode tagMode;

  /**
   * Instantiates a new Secret serializer.
   *
   * @param tagMode the tag mode
   */
  public SecretSerializer(final TagMode tagMode) {
    super(SecretApi.class, false);
    this.tagMode = tagMode;
  }

  @Override
  public void serialize(SecretApi<?> secret, JsonGenerator gen, SerializerProvider provider) throws IOException {
    switch (tagMode) {
      case HASHED -> gen.writeString(secret.hashed().toString());
      case PLACEHOLDER -> gen.writeString(SecretApi.PLACEHOLDER);
      default -> throw new IllegalStateException("Unknown tag mode: " + tagMode);
    }
  }
}
