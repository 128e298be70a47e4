package com.flamingo.ai.recall.domain.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** JPA converter for persisting a {@code float[]} as a little-endian float32 BLOB. */
@Converter
public class FloatVectorConverter implements AttributeConverter<float[], byte[]> {

  @Override
  public byte[] convertToDatabaseColumn(float[] attribute) {
    if (attribute == null) {
      return null;
    }
    ByteBuffer buffer =
        ByteBuffer.allocate(attribute.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    for (float value : attribute) {
      buffer.putFloat(value);
    }
    return buffer.array();
  }

  @Override
  public float[] convertToEntityAttribute(byte[] dbData) {
    if (dbData == null) {
      return null;
    }
    if (dbData.length % Float.BYTES != 0) {
      throw new IllegalArgumentException(
          "Vector blob length " + dbData.length + " is not a multiple of " + Float.BYTES);
    }
    ByteBuffer buffer = ByteBuffer.wrap(dbData).order(ByteOrder.LITTLE_ENDIAN);
    float[] vector = new float[dbData.length / Float.BYTES];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = buffer.getFloat();
    }
    return vector;
  }
}
