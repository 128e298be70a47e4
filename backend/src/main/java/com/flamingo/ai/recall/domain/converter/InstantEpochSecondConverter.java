package com.flamingo.ai.recall.domain.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.time.Instant;

/**
 * JPA converter storing an {@link Instant} as whole epoch seconds in an INTEGER column.
 *
 * <p>SQLite has no native timestamp type; integer seconds keep range filters and ordering
 * numeric.
 */
@Converter
public class InstantEpochSecondConverter implements AttributeConverter<Instant, Long> {

  @Override
  public Long convertToDatabaseColumn(Instant attribute) {
    return attribute == null ? null : attribute.getEpochSecond();
  }

  @Override
  public Instant convertToEntityAttribute(Long dbData) {
    return dbData == null ? null : Instant.ofEpochSecond(dbData);
  }
}
